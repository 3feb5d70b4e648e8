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

import static com.aegisgrid.CommonUtils.checkNotNull;
import static com.aegisgrid.CommonUtils.clip;

import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.aegisgrid.exception.CorruptArtifactException;
import com.aegisgrid.exception.InsufficientDataException;
import com.aegisgrid.exception.NotTrainedException;
import com.aegisgrid.model.OutlierModel;
import com.aegisgrid.model.RandomCutForestOutlierModel;
import com.aegisgrid.preprocessor.StandardScaler;
import com.aegisgrid.returntypes.ScoreResult;
import com.aegisgrid.sample.PointSample;
import com.aegisgrid.state.ScorerStateSerDe;
import com.aegisgrid.state.scorer.PointAnomalyScorerMapper;
import com.aegisgrid.state.scorer.PointAnomalyScorerState;
import com.aegisgrid.store.ArtifactStore;

/**
 * Scores individual SCADA readings with an outlier model fitted on
 * standardized historical readings.
 *
 * The model's outlier score is clipped to [-1, 0] and negated, so that
 * confidence is 0 for the most ordinary points and 1 for the most isolated
 * ones. The anomaly flag is the model's own classification and is independent
 * of the confidence.
 */
public class PointAnomalyScorer implements AnomalyScorer<PointSample, PointSample> {

    private static final Logger LOG = LogManager.getLogger(PointAnomalyScorer.class);

    private final Supplier<? extends OutlierModel> modelFactory;
    private final ScorerStateSerDe serDe;
    private Fitted fitted;

    public PointAnomalyScorer() {
        this(RandomCutForestOutlierModel::new);
    }

    /**
     * @param modelFactory creates an unfitted model for every training pass
     */
    public PointAnomalyScorer(Supplier<? extends OutlierModel> modelFactory) {
        this.modelFactory = checkNotNull(modelFactory, "modelFactory must not be null");
        this.serDe = new ScorerStateSerDe();
    }

    /**
     * Creates a scorer from restored state.
     *
     * @param scaler the fitted scaler
     * @param model  the fitted model
     */
    public PointAnomalyScorer(StandardScaler scaler, OutlierModel model) {
        this();
        checkNotNull(scaler, "scaler must not be null");
        checkNotNull(model, "model must not be null");
        this.fitted = new Fitted(scaler, model);
    }

    @Override
    public void train(List<PointSample> corpus) {
        checkNotNull(corpus, "corpus must not be null");
        if (corpus.isEmpty()) {
            throw new InsufficientDataException(1, 0);
        }
        double[][] raw = new double[corpus.size()][];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = corpus.get(i).toFeatures();
        }
        StandardScaler scaler = StandardScaler.fit(raw);
        OutlierModel model = modelFactory.get();
        model.fit(Arrays.asList(scaler.transform(raw)));
        fitted = new Fitted(scaler, model);
        LOG.info("Fitted point scorer on {} samples", corpus.size());
    }

    @Override
    public ScoreResult analyze(PointSample sample) {
        checkNotNull(sample, "sample must not be null");
        Fitted current = requireFitted();
        double[] point = current.scaler.transform(sample.toFeatures());
        double outlierScore = current.model.score(point);
        double confidence = 1 - (clip(outlierScore, -1.0, 0.0) + 1);
        return new ScoreResult(current.model.isOutlier(point), confidence);
    }

    @Override
    public boolean isTrained() {
        return fitted != null;
    }

    @Override
    public void save(ArtifactStore store, String name) {
        checkNotNull(store, "store must not be null");
        requireFitted();
        String handle = store.save(name, serDe.toBytes(new PointAnomalyScorerMapper().toState(this)));
        LOG.info("Saved point scorer to {}", handle);
    }

    @Override
    public void load(ArtifactStore store, String name) {
        checkNotNull(store, "store must not be null");
        byte[] blob = store.load(name).orElseThrow(() -> new CorruptArtifactException("no artifact named " + name));
        PointAnomalyScorerState state = serDe.fromBytes(blob, PointAnomalyScorerState.class);
        PointAnomalyScorer restored = new PointAnomalyScorerMapper().toModel(state);
        fitted = restored.fitted;
        LOG.info("Loaded point scorer from {}", name);
    }

    public StandardScaler getScaler() {
        return requireFitted().scaler;
    }

    public OutlierModel getModel() {
        return requireFitted().model;
    }

    private Fitted requireFitted() {
        if (fitted == null) {
            throw new NotTrainedException("the point scorer has not been trained or loaded");
        }
        return fitted;
    }

    private static final class Fitted {
        private final StandardScaler scaler;
        private final OutlierModel model;

        Fitted(StandardScaler scaler, OutlierModel model) {
            this.scaler = scaler;
            this.model = model;
        }
    }
}
