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

import static com.aegisgrid.pipeline.PipelineOrchestrator.POINT_ARTIFACT;
import static com.aegisgrid.pipeline.PipelineOrchestrator.SEQUENCE_ARTIFACT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aegisgrid.exception.CorruptArtifactException;
import com.aegisgrid.exception.InsufficientDataException;
import com.aegisgrid.exception.NotTrainedException;
import com.aegisgrid.exception.PipelineException;
import com.aegisgrid.fusion.FusionPolicy;
import com.aegisgrid.returntypes.AlertRecord;
import com.aegisgrid.returntypes.ScoreResult;
import com.aegisgrid.sample.PointSample;
import com.aegisgrid.sample.SampleSource;
import com.aegisgrid.sample.SequenceSample;
import com.aegisgrid.sample.TelemetrySample;
import com.aegisgrid.scorer.SequenceAnomalyScorer;
import com.aegisgrid.simulator.GridTelemetrySimulator;
import com.aegisgrid.store.ArtifactStore;
import com.aegisgrid.store.InMemoryArtifactStore;

@ExtendWith(MockitoExtension.class)
public class PipelineOrchestratorTest {

    private static final int TIMESTEPS = 3;
    private static final int CORPUS_SIZE = 50;
    private static final long SEED = 17L;

    @Mock
    private AnomalyScorerStubs.PointScorer pointScorer;
    @Mock
    private AnomalyScorerStubs.SequenceScorer sequenceScorer;
    @Mock
    private FusionPolicy fusionPolicy;

    private InMemoryArtifactStore store;
    private List<String> messages;
    private AtomicInteger trainingSourcesCreated;
    private CancellationToken token;
    private ScheduledExecutorService scheduler;

    @BeforeEach
    public void setUp() {
        store = new InMemoryArtifactStore();
        messages = new ArrayList<>();
        trainingSourcesCreated = new AtomicInteger();
        token = new CancellationToken();
    }

    @AfterEach
    public void tearDown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    private PipelineOrchestrator.PipelineOrchestratorBuilder builder() {
        return PipelineOrchestrator.builder().pointScorer(pointScorer).sequenceScorer(sequenceScorer)
                .fusionPolicy(fusionPolicy).artifactStore(store)
                .liveSource(GridTelemetrySimulator.builder().randomSeed(SEED).startTimestamp(0L).build())
                .trainingSourceFactory(() -> {
                    trainingSourcesCreated.incrementAndGet();
                    return GridTelemetrySimulator.builder().randomSeed(SEED).anomalyInjectionEnabled(false).build();
                }).statusSink(messages::add).timesteps(TIMESTEPS).trainingCorpusSize(CORPUS_SIZE)
                .cadence(Duration.ZERO);
    }

    private void storeBothArtifacts() {
        store.save(POINT_ARTIFACT, "{}".getBytes(StandardCharsets.UTF_8));
        store.save(SEQUENCE_ARTIFACT, "{}".getBytes(StandardCharsets.UTF_8));
    }

    private PipelineOrchestrator initialized() {
        storeBothArtifacts();
        PipelineOrchestrator orchestrator = builder().build();
        orchestrator.initialize();
        messages.clear();
        return orchestrator;
    }

    private void stubNominalScores() {
        lenient().when(pointScorer.analyze(any())).thenReturn(ScoreResult.NO_ANOMALY);
        lenient().when(sequenceScorer.analyze(anyList())).thenReturn(ScoreResult.NO_ANOMALY);
    }

    private static AlertRecord fused(boolean alert) {
        return AlertRecord.builder().aegisAlert(alert).combinedConfidence(alert ? 0.9 : 0.1)
                .reason(alert ? FusionPolicy.REASON_COORDINATED : FusionPolicy.REASON_NOMINAL).build();
    }

    @Test
    public void testInitializeTrainsAndSavesWhenArtifactsAreMissing() {
        PipelineOrchestrator orchestrator = builder().build();
        assertEquals(PipelineState.UNINITIALIZED, orchestrator.getState());

        orchestrator.initialize();

        assertEquals(PipelineState.RUNNING, orchestrator.getState());
        verify(pointScorer).train(argThat(corpus -> corpus.size() == CORPUS_SIZE));
        verify(sequenceScorer).train(argThat(corpus -> corpus.size() == CORPUS_SIZE));
        verify(pointScorer).save(store, POINT_ARTIFACT);
        verify(sequenceScorer).save(store, SEQUENCE_ARTIFACT);
        verify(pointScorer, never()).load(any(), any());
        assertEquals(1, trainingSourcesCreated.get());
        assertEquals(List.of("Initializing backend modules...",
                "No pre-trained SCADA model found. Training new model...", "Saving new SCADA model...",
                "SCADA model saved.", "No pre-trained PMU model found. Training new model...",
                "Saving new PMU model...", "PMU model saved.",
                "Initialization complete. Starting real-time monitoring."), messages);
    }

    @Test
    public void testTrainingCorpusComesFromTheTrainingSource() {
        builder().build().initialize();

        List<TelemetrySample> expected = GridTelemetrySimulator.builder().randomSeed(SEED)
                .anomalyInjectionEnabled(false).build().generate(CORPUS_SIZE);
        ArgumentCaptor<List<PointSample>> points = ArgumentCaptor.forClass(List.class);
        verify(pointScorer).train(points.capture());
        for (int i = 0; i < CORPUS_SIZE; i++) {
            assertEquals(expected.get(i).getPoint().getVoltage(), points.getValue().get(i).getVoltage());
        }
    }

    @Test
    public void testInitializeLoadsExistingArtifacts() {
        storeBothArtifacts();
        PipelineOrchestrator orchestrator = builder().build();

        orchestrator.initialize();

        assertEquals(PipelineState.RUNNING, orchestrator.getState());
        verify(pointScorer).load(store, POINT_ARTIFACT);
        verify(sequenceScorer).load(store, SEQUENCE_ARTIFACT);
        verify(pointScorer, never()).train(anyList());
        verify(sequenceScorer, never()).train(anyList());
        assertEquals(0, trainingSourcesCreated.get());
        assertEquals(List.of("Initializing backend modules...", "Loading pre-trained SCADA model...",
                "Loading pre-trained PMU model...", "Initialization complete. Starting real-time monitoring."),
                messages);
    }

    @Test
    public void testCorruptArtifactIsRetrained() {
        storeBothArtifacts();
        doThrow(new CorruptArtifactException("bad bytes")).when(pointScorer).load(store, POINT_ARTIFACT);
        PipelineOrchestrator orchestrator = builder().build();

        orchestrator.initialize();

        assertEquals(PipelineState.RUNNING, orchestrator.getState());
        verify(pointScorer).train(anyList());
        verify(pointScorer).save(store, POINT_ARTIFACT);
        verify(sequenceScorer, never()).train(anyList());
        assertTrue(messages.contains("Stored SCADA model is unreadable (bad bytes). Training new model..."));
        assertTrue(messages.contains("SCADA model saved."));
    }

    @Test
    public void testInsufficientTrainingDataEndsInError() {
        doThrow(new InsufficientDataException(TIMESTEPS + 1, 2)).when(sequenceScorer).train(anyList());
        PipelineOrchestrator orchestrator = builder().build();

        assertThrows(InsufficientDataException.class, orchestrator::initialize);

        assertEquals(PipelineState.ERROR, orchestrator.getState());
        assertTrue(messages.get(messages.size() - 1).startsWith("Initialization failed: "));
        verify(sequenceScorer, never()).save(any(), any());
        assertThrows(IllegalStateException.class, () -> orchestrator.run(token));
    }

    @Test
    public void testInitializeOnlyOnce() {
        PipelineOrchestrator orchestrator = initialized();
        assertThrows(IllegalStateException.class, orchestrator::initialize);
        assertEquals(PipelineState.RUNNING, orchestrator.getState());
    }

    @Test
    public void testRunRequiresRunningPipeline() {
        PipelineOrchestrator orchestrator = builder().build();
        assertThrows(IllegalStateException.class, () -> orchestrator.run(token));
        verifyNoInteractions(pointScorer, sequenceScorer);
    }

    @Test
    public void testRunOnlyOnce() {
        PipelineOrchestrator orchestrator = initialized();
        orchestrator.run(token);
        assertThrows(IllegalStateException.class, () -> orchestrator.run(token));
    }

    @Test
    public void testAlertEdges() {
        PipelineOrchestrator orchestrator = initialized();
        stubNominalScores();
        when(fusionPolicy.fuse(any(), any())).thenReturn(fused(false), fused(false), fused(true), fused(true),
                fused(false), fused(true));

        Iterator<AlertRecord> records = orchestrator.run(token);
        List<Boolean> edges = new ArrayList<>();
        List<AlertRecord> produced = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            assertTrue(records.hasNext());
            AlertRecord record = records.next();
            produced.add(record);
            edges.add(record.isNewAlert());
        }

        assertEquals(List.of(false, false, true, false, false, true), edges);

        List<TelemetrySample> samples = GridTelemetrySimulator.builder().randomSeed(SEED).startTimestamp(0L).build()
                .generate(6);
        for (int i = 0; i < 6; i++) {
            assertEquals(samples.get(i).getLocation(), produced.get(i).getLocation());
            assertEquals(samples.get(i).getTimestamp(), produced.get(i).getTimestamp());
            assertEquals(samples.get(i).isGroundTruthAnomaly(), produced.get(i).isGroundTruthAnomaly());
        }
    }

    @Test
    public void testWindowGrowsToTimesteps() {
        PipelineOrchestrator orchestrator = initialized();
        stubNominalScores();
        when(fusionPolicy.fuse(any(), any())).thenReturn(fused(false));

        Iterator<AlertRecord> records = orchestrator.run(token);
        for (int i = 0; i < 5; i++) {
            records.next();
        }

        ArgumentCaptor<List<SequenceSample>> windows = ArgumentCaptor.forClass(List.class);
        verify(sequenceScorer, times(5)).analyze(windows.capture());
        List<Integer> sizes = new ArrayList<>();
        for (List<SequenceSample> window : windows.getAllValues()) {
            sizes.add(window.size());
        }
        assertEquals(List.of(1, 2, 3, 3, 3), sizes);

        List<TelemetrySample> samples = GridTelemetrySimulator.builder().randomSeed(SEED).startTimestamp(0L).build()
                .generate(5);
        List<SequenceSample> last = windows.getAllValues().get(4);
        for (int i = 0; i < TIMESTEPS; i++) {
            assertEquals(samples.get(2 + i).getSequence(), last.get(i));
        }
    }

    @Test
    public void testWindowLengthFollowsTheSequenceScorer() {
        storeBothArtifacts();
        List<Integer> sizes = new ArrayList<>();
        SequenceAnomalyScorer recording = new SequenceAnomalyScorer(5) {
            @Override
            public void load(ArtifactStore store, String name) {
            }

            @Override
            public ScoreResult analyze(List<SequenceSample> window) {
                sizes.add(window.size());
                return ScoreResult.NO_ANOMALY;
            }
        };
        PipelineOrchestrator orchestrator = PipelineOrchestrator.builder().pointScorer(pointScorer)
                .sequenceScorer(recording).fusionPolicy(fusionPolicy).artifactStore(store)
                .liveSource(GridTelemetrySimulator.builder().randomSeed(SEED).build())
                .trainingSourceFactory(() -> GridTelemetrySimulator.builder().randomSeed(SEED).build())
                .cadence(Duration.ZERO).build();
        orchestrator.initialize();
        when(pointScorer.analyze(any())).thenReturn(ScoreResult.NO_ANOMALY);
        when(fusionPolicy.fuse(any(), any())).thenReturn(fused(false));

        Iterator<AlertRecord> records = orchestrator.run(token);
        for (int i = 0; i < 8; i++) {
            records.next();
        }

        assertEquals(List.of(1, 2, 3, 4, 5, 5, 5, 5), sizes);
    }

    @Test
    public void testTimestepsMustMatchTheSequenceScorer() {
        assertThrows(IllegalArgumentException.class,
                () -> builder().sequenceScorer(new SequenceAnomalyScorer(5)).timesteps(10).build());
        builder().sequenceScorer(new SequenceAnomalyScorer(TIMESTEPS)).build();
    }

    @Test
    public void testCancellationStopsTheLoop() {
        PipelineOrchestrator orchestrator = initialized();
        stubNominalScores();
        when(fusionPolicy.fuse(any(), any())).thenReturn(fused(false));

        Iterator<AlertRecord> records = orchestrator.run(token);
        records.next();
        token.cancel();

        assertFalse(records.hasNext());
        assertFalse(records.hasNext());
        assertEquals(PipelineState.STOPPED, orchestrator.getState());
        assertEquals(List.of("Monitoring loop has stopped."), messages);
        assertThrows(NoSuchElementException.class, records::next);
    }

    @Test
    public void testCancelledBeforeFirstIteration(@Mock SampleSource liveSource) {
        storeBothArtifacts();
        PipelineOrchestrator orchestrator = builder().liveSource(liveSource).build();
        orchestrator.initialize();
        token.cancel();

        assertFalse(orchestrator.run(token).hasNext());
        assertEquals(PipelineState.STOPPED, orchestrator.getState());
        verifyNoInteractions(liveSource);
    }

    @Test
    public void testCancellationInterruptsTheCadenceWait() {
        storeBothArtifacts();
        PipelineOrchestrator orchestrator = builder().cadence(Duration.ofMinutes(10)).build();
        orchestrator.initialize();
        stubNominalScores();
        when(fusionPolicy.fuse(any(), any())).thenReturn(fused(false));

        Iterator<AlertRecord> records = orchestrator.run(token);
        records.next();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.schedule(token::cancel, 100, TimeUnit.MILLISECONDS);

        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> assertFalse(records.hasNext()));
        assertEquals(PipelineState.STOPPED, orchestrator.getState());
    }

    @Test
    public void testIterationFailureEndsInError() {
        PipelineOrchestrator orchestrator = initialized();
        NotTrainedException cause = new NotTrainedException("boom");
        when(pointScorer.analyze(any())).thenThrow(cause);

        Iterator<AlertRecord> records = orchestrator.run(token);
        PipelineException e = assertThrows(PipelineException.class, records::next);

        assertSame(cause, e.getCause());
        assertEquals(PipelineState.ERROR, orchestrator.getState());
        assertEquals(List.of("Monitoring loop failed: boom"), messages);
        assertFalse(records.hasNext());
        verify(fusionPolicy, never()).fuse(any(), any());
    }

    @Test
    public void testStatusSinkFailuresDoNotStopInitialization() {
        storeBothArtifacts();
        PipelineOrchestrator orchestrator = builder().statusSink(message -> {
            throw new IllegalStateException("sink closed");
        }).build();
        orchestrator.addStatusSink(messages::add);

        orchestrator.initialize();

        assertEquals(PipelineState.RUNNING, orchestrator.getState());
        assertEquals(4, messages.size());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(NullPointerException.class, () -> builder().pointScorer(null).build());
        assertThrows(NullPointerException.class, () -> builder().artifactStore(null).build());
        assertThrows(IllegalArgumentException.class, () -> builder().cadence(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class, () -> builder().timesteps(0).build());
        assertThrows(NullPointerException.class, () -> initialized().run(null));
    }
}
