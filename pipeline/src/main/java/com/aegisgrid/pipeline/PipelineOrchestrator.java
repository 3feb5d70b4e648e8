/*
 * Copyright 2025 The AegisGRID Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.aegisgrid.pipeline;

import static com.aegisgrid.CommonUtils.checkArgument;
import static com.aegisgrid.CommonUtils.checkNotNull;
import static com.aegisgrid.CommonUtils.checkState;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.function.Supplier;

import lombok.Builder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.aegisgrid.exception.CorruptArtifactException;
import com.aegisgrid.exception.PipelineException;
import com.aegisgrid.fusion.FusionPolicy;
import com.aegisgrid.returntypes.AlertRecord;
import com.aegisgrid.returntypes.ScoreResult;
import com.aegisgrid.sample.PointSample;
import com.aegisgrid.sample.SampleSource;
import com.aegisgrid.sample.SequenceSample;
import com.aegisgrid.sample.TelemetrySample;
import com.aegisgrid.scorer.AnomalyScorer;
import com.aegisgrid.scorer.PointAnomalyScorer;
import com.aegisgrid.scorer.SequenceAnomalyScorer;
import com.aegisgrid.simulator.GridTelemetrySimulator;
import com.aegisgrid.store.ArtifactStore;
import com.aegisgrid.store.FileArtifactStore;
import com.aegisgrid.util.SequenceWindow;

/**
 * Wires the point scorer, the sequence scorer and the fusion policy into a
 * live monitoring loop.
 *
 * {@link #initialize()} loads each scorer from the artifact store, or trains
 * and saves it when no usable artifact exists. {@link #run(CancellationToken)}
 * then turns the live sample source into a stream of {@link AlertRecord}s.
 * Both are meant to be driven from a single thread; only {@link #getState()}
 * may be read from elsewhere.
 */
public class PipelineOrchestrator {

    private static final Logger LOG = LogManager.getLogger(PipelineOrchestrator.class);

    public static final String POINT_ARTIFACT = "scada_model.json";
    public static final String SEQUENCE_ARTIFACT = "pmu_model.json";
    static final String POINT_LABEL = "SCADA";
    static final String SEQUENCE_LABEL = "PMU";

    private final AnomalyScorer<PointSample, PointSample> pointScorer;
    private final AnomalyScorer<SequenceSample, List<SequenceSample>> sequenceScorer;
    private final FusionPolicy fusionPolicy;
    private final ArtifactStore artifactStore;
    private final SampleSource liveSource;
    private final Supplier<? extends SampleSource> trainingSourceFactory;
    private final int trainingCorpusSize;
    private final Duration cadence;
    private final List<StatusSink> statusSinks;
    private final SequenceWindow<SequenceSample> window;

    private volatile PipelineState state;
    private boolean runStarted;

    /**
     * @param pointScorer           scores single SCADA readings
     * @param sequenceScorer        scores windows of PMU readings
     * @param fusionPolicy          combines the two verdicts; defaults to
     *                              {@link FusionPolicy#FusionPolicy()}
     * @param artifactStore         where fitted scorers are kept
     * @param liveSource            the monitored telemetry
     * @param trainingSourceFactory creates a clean source whenever a scorer
     *                              must be trained
     * @param statusSink            receives progress messages; may be null
     * @param timesteps             the window length given to the sequence
     *                              scorer; taken from a
     *                              {@link SequenceAnomalyScorer} when absent,
     *                              and must match it when present
     * @param trainingCorpusSize    how many samples to train on; defaults to
     *                              {@link PipelineConfig#DEFAULT_TRAINING_CORPUS_SIZE}
     * @param cadence               the pause between iterations; defaults to
     *                              one second
     */
    @Builder
    private PipelineOrchestrator(AnomalyScorer<PointSample, PointSample> pointScorer,
            AnomalyScorer<SequenceSample, List<SequenceSample>> sequenceScorer, FusionPolicy fusionPolicy,
            ArtifactStore artifactStore, SampleSource liveSource,
            Supplier<? extends SampleSource> trainingSourceFactory, StatusSink statusSink, Integer timesteps,
            Integer trainingCorpusSize, Duration cadence) {
        this.pointScorer = checkNotNull(pointScorer, "pointScorer must not be null");
        this.sequenceScorer = checkNotNull(sequenceScorer, "sequenceScorer must not be null");
        this.fusionPolicy = (fusionPolicy != null) ? fusionPolicy : new FusionPolicy();
        this.artifactStore = checkNotNull(artifactStore, "artifactStore must not be null");
        this.liveSource = checkNotNull(liveSource, "liveSource must not be null");
        this.trainingSourceFactory = checkNotNull(trainingSourceFactory, "trainingSourceFactory must not be null");
        this.trainingCorpusSize = (trainingCorpusSize != null) ? trainingCorpusSize
                : PipelineConfig.DEFAULT_TRAINING_CORPUS_SIZE;
        this.cadence = (cadence != null) ? cadence : PipelineConfig.DEFAULT_CADENCE;
        int windowLength = windowLength(sequenceScorer, timesteps);
        checkArgument(this.trainingCorpusSize > 0, "trainingCorpusSize must be greater than 0");
        checkArgument(!this.cadence.isNegative(), "cadence must not be negative");
        this.window = new SequenceWindow<>(windowLength);
        this.statusSinks = new CopyOnWriteArrayList<>();
        if (statusSink != null) {
            statusSinks.add(statusSink);
        }
        this.state = PipelineState.UNINITIALIZED;
    }

    private static int windowLength(AnomalyScorer<SequenceSample, List<SequenceSample>> sequenceScorer,
            Integer timesteps) {
        if (sequenceScorer instanceof SequenceAnomalyScorer) {
            int fitted = ((SequenceAnomalyScorer) sequenceScorer).getTimesteps();
            checkArgument(timesteps == null || timesteps == fitted, String.format(
                    "timesteps %d does not match the sequence scorer's window of %d", timesteps, fitted));
            return fitted;
        }
        int length = (timesteps != null) ? timesteps : SequenceAnomalyScorer.DEFAULT_TIMESTEPS;
        checkArgument(length > 0, "timesteps must be greater than 0");
        return length;
    }

    /**
     * Builds a pipeline over the synthetic grid simulator with
     * file-backed artifacts.
     *
     * @param config     the pipeline settings
     * @param statusSink receives progress messages; may be null
     * @return an uninitialized orchestrator
     */
    public static PipelineOrchestrator fromConfig(PipelineConfig config, StatusSink statusSink) {
        checkNotNull(config, "config must not be null");
        config.validate();
        long seed = config.getRandomSeed();
        return PipelineOrchestrator.builder().pointScorer(new PointAnomalyScorer())
                .sequenceScorer(new SequenceAnomalyScorer(config.getTimesteps()))
                .fusionPolicy(new FusionPolicy(config.getPointWeight(), config.getSequenceWeight(),
                        config.getAlertThreshold()))
                .artifactStore(new FileArtifactStore(Paths.get(config.getModelDirectory())))
                .liveSource(GridTelemetrySimulator.builder().randomSeed(seed)
                        .highAnomalyMode(config.isHighAnomalyMode()).build())
                .trainingSourceFactory(() -> GridTelemetrySimulator.builder().randomSeed(seed + 1)
                        .anomalyInjectionEnabled(false).build())
                .statusSink(statusSink).timesteps(config.getTimesteps())
                .trainingCorpusSize(config.getTrainingCorpusSize()).cadence(config.getCadence()).build();
    }

    public PipelineState getState() {
        return state;
    }

    /**
     * Adds another receiver of progress messages.
     *
     * @param statusSink the receiver
     */
    public void addStatusSink(StatusSink statusSink) {
        statusSinks.add(checkNotNull(statusSink, "statusSink must not be null"));
    }

    /**
     * Loads or trains both scorers. Training pulls one corpus from a fresh
     * training source and shares it between the scorers; nothing is pulled
     * when both scorers load.
     *
     * @throws IllegalStateException if the pipeline was already initialized
     */
    public synchronized void initialize() {
        checkState(state == PipelineState.UNINITIALIZED, "cannot initialize a pipeline in state " + state);
        state = PipelineState.INITIALIZING;
        try {
            report("Initializing backend modules...");
            TrainingCorpus corpus = new TrainingCorpus();
            loadOrTrain(pointScorer, POINT_LABEL, POINT_ARTIFACT, corpus, TelemetrySample::getPoint);
            loadOrTrain(sequenceScorer, SEQUENCE_LABEL, SEQUENCE_ARTIFACT, corpus, TelemetrySample::getSequence);
            report("Initialization complete. Starting real-time monitoring.");
            state = PipelineState.RUNNING;
            LOG.info("Pipeline initialized");
        } catch (RuntimeException e) {
            LOG.error("Pipeline initialization failed", e);
            report("Initialization failed: " + describe(e));
            state = PipelineState.ERROR;
            throw e;
        }
    }

    /**
     * Starts the live loop. The returned iterator is lazy: each
     * {@code next()} pulls and scores one sample, and every {@code hasNext()}
     * after the first waits one cadence interval or until {@code token} is
     * cancelled.
     *
     * @param token stops the loop when cancelled
     * @return a single-use stream of alert records
     * @throws IllegalStateException if the pipeline is not running or the
     *                               loop was already started
     */
    public synchronized Iterator<AlertRecord> run(CancellationToken token) {
        checkNotNull(token, "token must not be null");
        checkState(state == PipelineState.RUNNING, "cannot run a pipeline in state " + state);
        checkState(!runStarted, "the monitoring loop can only be started once");
        runStarted = true;
        return new AlertIterator(token);
    }

    /**
     * Runs the whole lifecycle on {@code executor}, publishing status messages
     * and alert records to {@code channel}.
     *
     * @param executor where the pipeline runs
     * @param channel  receives every event
     * @param token    stops the loop when cancelled
     * @return completes when the loop stops; fails with the cause of an error
     */
    public Future<Void> start(ExecutorService executor, EventChannel channel, CancellationToken token) {
        return start(executor, channel, token, 0);
    }

    /**
     * @param maxIterations cancels {@code token} after this many records; 0
     *                      means no limit
     * @see #start(ExecutorService, EventChannel, CancellationToken)
     */
    public Future<Void> start(ExecutorService executor, EventChannel channel, CancellationToken token,
            long maxIterations) {
        checkNotNull(executor, "executor must not be null");
        addStatusSink(checkNotNull(channel, "channel must not be null"));
        return executor.submit(new PipelineWorker(this, channel, token, maxIterations));
    }

    private <S> void loadOrTrain(AnomalyScorer<S, ?> scorer, String label, String artifact, TrainingCorpus corpus,
            Function<TelemetrySample, S> part) {
        if (artifactStore.exists(artifact)) {
            report("Loading pre-trained " + label + " model...");
            try {
                scorer.load(artifactStore, artifact);
                LOG.info("Loaded {} scorer from {}", label, artifact);
                return;
            } catch (CorruptArtifactException e) {
                LOG.warn("Discarding unreadable {} artifact {}", label, artifact, e);
                report("Stored " + label + " model is unreadable (" + describe(e) + "). Training new model...");
            }
        } else {
            report("No pre-trained " + label + " model found. Training new model...");
        }
        scorer.train(corpus.project(part));
        report("Saving new " + label + " model...");
        scorer.save(artifactStore, artifact);
        report(label + " model saved.");
    }

    private void report(String message) {
        for (StatusSink sink : statusSinks) {
            try {
                sink.report(message);
            } catch (RuntimeException e) {
                LOG.warn("Status sink {} rejected message '{}'", sink, message, e);
            }
        }
    }

    private static String describe(Throwable e) {
        return (e.getMessage() != null) ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * The training samples, pulled on first use.
     */
    private class TrainingCorpus {
        private List<TelemetrySample> samples;

        <S> List<S> project(Function<TelemetrySample, S> part) {
            if (samples == null) {
                SampleSource source = checkNotNull(trainingSourceFactory.get(), "training source must not be null");
                List<TelemetrySample> pulled = new ArrayList<>(trainingCorpusSize);
                for (int i = 0; i < trainingCorpusSize; i++) {
                    pulled.add(source.getNextSample());
                }
                samples = Collections.unmodifiableList(pulled);
                LOG.info("Pulled {} training samples", trainingCorpusSize);
            }
            List<S> result = new ArrayList<>(samples.size());
            for (TelemetrySample sample : samples) {
                result.add(part.apply(sample));
            }
            return result;
        }
    }

    private class AlertIterator implements Iterator<AlertRecord> {
        private final CancellationToken token;
        private boolean first = true;
        private boolean ready = false;
        private boolean done = false;
        private boolean previousAlert = false;

        AlertIterator(CancellationToken token) {
            this.token = token;
        }

        @Override
        public boolean hasNext() {
            if (done) {
                return false;
            }
            if (ready) {
                return true;
            }
            if (cancelledBeforeNextIteration()) {
                done = true;
                state = PipelineState.STOPPED;
                LOG.info("Monitoring loop stopped");
                report("Monitoring loop has stopped.");
                return false;
            }
            ready = true;
            return true;
        }

        @Override
        public AlertRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException("the monitoring loop has ended");
            }
            ready = false;
            first = false;
            try {
                return evaluate();
            } catch (RuntimeException e) {
                done = true;
                LOG.error("Monitoring loop failed", e);
                report("Monitoring loop failed: " + describe(e));
                state = PipelineState.ERROR;
                throw new PipelineException("monitoring iteration failed", e);
            }
        }

        private boolean cancelledBeforeNextIteration() {
            if (first) {
                return token.isCancelled();
            }
            try {
                return token.awaitCancellation(cadence);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for the next iteration, stopping");
                return true;
            }
        }

        private AlertRecord evaluate() {
            TelemetrySample sample = checkNotNull(liveSource.getNextSample(), "the live source returned no sample");
            ScoreResult point = pointScorer.analyze(sample.getPoint());
            window.append(sample.getSequence());
            ScoreResult sequence = sequenceScorer.analyze(window.toList());
            AlertRecord fused = fusionPolicy.fuse(point, sequence);
            boolean newAlert = fused.isAegisAlert() && !previousAlert;
            previousAlert = fused.isAegisAlert();
            return fused.toBuilder().location(sample.getLocation()).timestamp(sample.getTimestamp())
                    .groundTruthAnomaly(sample.isGroundTruthAnomaly()).newAlert(newAlert).build();
        }
    }
}
