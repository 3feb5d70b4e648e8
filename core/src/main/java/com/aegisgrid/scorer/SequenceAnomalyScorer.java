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

package com.aegisgrid.scorer;

import static com.aegisgrid.CommonUtils.checkArgument;
import static com.aegisgrid.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.aegisgrid.exception.CorruptArtifactException;
import com.aegisgrid.exception.InsufficientDataException;
import com.aegisgrid.exception.NotTrainedException;
import com.aegisgrid.model.PrincipalComponentReconstructionModel;
import com.aegisgrid.model.ReconstructionModel;
import com.aegisgrid.preprocessor.StandardScaler;
import com.aegisgrid.returntypes.ScoreResult;
import com.aegisgrid.sample.SequenceSample;
import com.aegisgrid.state.ScorerStateSerDe;
import com.aegisgrid.state.scorer.SequenceAnomalyScorerMapper;
import com.aegisgrid.state.scorer.SequenceAnomalyScorerState;
import com.aegisgrid.store.ArtifactStore;

/**
 * Scores fixed-length windows of PMU readings by how badly a reconstruction
 * model reproduces them.
 *
 * Training builds the stride-one windows of the scaled corpus, fits the model
 * on them and sets the threshold to {@value #THRESHOLD_MARGIN} times the worst
 * mean absolute error seen on those windows. A window is anomalous when its
 * error exceeds the threshold; its confidence is the error divided by twice
 * the threshold, capped at 1. Windows shorter or longer than
 * {@link #getTimesteps()} are never anomalous.
 */
public class SequenceAnomalyScorer implements AnomalyScorer<SequenceSample, List<SequenceSample>> {

    private static final Logger LOG = LogManager.getLogger(SequenceAnomalyScorer.class);

    public static final int DEFAULT_TIMESTEPS = 10;
    public static final double THRESHOLD_MARGIN = 1.2;

    private final int timesteps;
    private final Supplier<? extends ReconstructionModel> modelFactory;
    private final ScorerStateSerDe serDe;
    private Fitted fitted;

    public SequenceAnomalyScorer() {
        this(DEFAULT_TIMESTEPS);
    }

    public SequenceAnomalyScorer(int timesteps) {
        this(timesteps, PrincipalComponentReconstructionModel::new);
    }

    /**
     * @param timesteps    the window length
     * @param modelFactory creates an unfitted model for every training pass
     */
    public SequenceAnomalyScorer(int timesteps, Supplier<? extends ReconstructionModel> modelFactory) {
        checkArgument(timesteps > 0, "timesteps must be greater than 0");
        this.timesteps = timesteps;
        this.modelFactory = checkNotNull(modelFactory, "modelFactory must not be null");
        this.serDe = new ScorerStateSerDe();
    }

    /**
     * Creates a scorer from restored state.
     *
     * @param timesteps the window length the state was fitted for
     * @param scaler    the fitted scaler
     * @param model     the fitted model
     * @param threshold the reconstruction error threshold
     */
    public SequenceAnomalyScorer(int timesteps, StandardScaler scaler, ReconstructionModel model,
            double threshold) {
        this(timesteps);
        checkNotNull(scaler, "scaler must not be null");
        checkNotNull(model, "model must not be null");
        checkArgument(threshold >= 0 && Double.isFinite(threshold), "threshold must be non-negative and finite");
        this.fitted = new Fitted(scaler, model, threshold);
    }

    @Override
    public void train(List<SequenceSample> corpus) {
        checkNotNull(corpus, "corpus must not be null");
        if (corpus.size() <= timesteps) {
            throw new InsufficientDataException(timesteps + 1, corpus.size());
        }
        double[][] raw = new double[corpus.size()][];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = corpus.get(i).toFeatures();
        }
        StandardScaler scaler = StandardScaler.fit(raw);
        double[][] scaled = scaler.transform(raw);

        List<double[][]> windows = new ArrayList<>(scaled.length - timesteps);
        for (int start = 0; start < scaled.length - timesteps; start++) {
            windows.add(Arrays.copyOfRange(scaled, start, start + timesteps));
        }

        ReconstructionModel model = modelFactory.get();
        model.fit(windows);

        double worst = 0;
        for (double[][] window : windows) {
            worst = Math.max(worst, model.score(window));
        }
        fitted = new Fitted(scaler, model, worst * THRESHOLD_MARGIN);
        LOG.info("Fitted sequence scorer on {} windows, threshold {}", windows.size(), fitted.threshold);
    }

    @Override
    public ScoreResult analyze(List<SequenceSample> window) {
        checkNotNull(window, "window must not be null");
        if (window.size() != timesteps) {
            return ScoreResult.NO_ANOMALY;
        }
        Fitted current = requireFitted();
        double[][] raw = new double[timesteps][];
        for (int i = 0; i < timesteps; i++) {
            raw[i] = window.get(i).toFeatures();
        }
        double error = current.model.score(current.scaler.transform(raw));
        boolean anomaly = error > current.threshold;
        double confidence;
        if (current.threshold > 0) {
            confidence = Math.min(error / (current.threshold * 2), 1.0);
        } else {
            confidence = (error > 0) ? 1.0 : 0.0;
        }
        return new ScoreResult(anomaly, confidence);
    }

    @Override
    public boolean isTrained() {
        return fitted != null;
    }

    @Override
    public void save(ArtifactStore store, String name) {
        checkNotNull(store, "store must not be null");
        requireFitted();
        String handle = store.save(name, serDe.toBytes(new SequenceAnomalyScorerMapper().toState(this)));
        LOG.info("Saved sequence scorer to {}", handle);
    }

    @Override
    public void load(ArtifactStore store, String name) {
        checkNotNull(store, "store must not be null");
        byte[] blob = store.load(name).orElseThrow(() -> new CorruptArtifactException("no artifact named " + name));
        SequenceAnomalyScorerState state = serDe.fromBytes(blob, SequenceAnomalyScorerState.class);
        SequenceAnomalyScorer restored = new SequenceAnomalyScorerMapper().toModel(state);
        if (restored.timesteps != timesteps) {
            throw new CorruptArtifactException(String.format("artifact %s was fitted for %d timesteps, expected %d",
                    name, restored.timesteps, timesteps));
        }
        fitted = restored.fitted;
        LOG.info("Loaded sequence scorer from {}", name);
    }

    public int getTimesteps() {
        return timesteps;
    }

    public StandardScaler getScaler() {
        return requireFitted().scaler;
    }

    public ReconstructionModel getModel() {
        return requireFitted().model;
    }

    public double getThreshold() {
        return requireFitted().threshold;
    }

    private Fitted requireFitted() {
        if (fitted == null) {
            throw new NotTrainedException("the sequence scorer has not been trained or loaded");
        }
        return fitted;
    }

    private static final class Fitted {
        private final StandardScaler scaler;
        private final ReconstructionModel model;
        private final double threshold;

        Fitted(StandardScaler scaler, ReconstructionModel model, double threshold) {
            this.scaler = scaler;
            this.model = model;
            this.threshold = threshold;
        }
    }
}
