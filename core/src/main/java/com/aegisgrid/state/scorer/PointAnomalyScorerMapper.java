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

package com.aegisgrid.state.scorer;

import static com.aegisgrid.CommonUtils.checkState;
import static com.aegisgrid.state.Version.V1_0;

import com.aegisgrid.exception.CorruptArtifactException;
import com.aegisgrid.model.OutlierModel;
import com.aegisgrid.model.RandomCutForestOutlierModel;
import com.aegisgrid.preprocessor.StandardScaler;
import com.aegisgrid.sample.PointSample;
import com.aegisgrid.scorer.PointAnomalyScorer;
import com.aegisgrid.state.IStateMapper;
import com.aegisgrid.state.model.RandomCutForestOutlierModelMapper;
import com.aegisgrid.state.preprocessor.StandardScalerMapper;

/**
 * Only scorers backed by a {@link RandomCutForestOutlierModel} can be
 * converted to a state.
 */
public class PointAnomalyScorerMapper implements IStateMapper<PointAnomalyScorer, PointAnomalyScorerState> {

    @Override
    public PointAnomalyScorerState toState(PointAnomalyScorer model) {
        OutlierModel outlierModel = model.getModel();
        checkState(outlierModel instanceof RandomCutForestOutlierModel,
                "cannot persist outlier model of type " + outlierModel.getClass().getName());
        PointAnomalyScorerState state = new PointAnomalyScorerState();
        state.setScalerState(new StandardScalerMapper().toState(model.getScaler()));
        state.setOutlierModelState(
                new RandomCutForestOutlierModelMapper().toState((RandomCutForestOutlierModel) outlierModel));
        return state;
    }

    @Override
    public PointAnomalyScorer toModel(PointAnomalyScorerState state) {
        if (!V1_0.equals(state.getVersion())) {
            throw new CorruptArtifactException("unsupported point scorer state version " + state.getVersion());
        }
        if (state.getScalerState() == null) {
            throw new CorruptArtifactException("point scorer artifact has no scaler");
        }
        if (state.getOutlierModelState() == null) {
            throw new CorruptArtifactException("point scorer artifact has no outlier model");
        }
        try {
            StandardScaler scaler = new StandardScalerMapper().toModel(state.getScalerState());
            if (scaler.getDimensions() != PointSample.FEATURES.size()) {
                throw new CorruptArtifactException("point scorer artifact has a scaler for " + scaler.getDimensions()
                        + " features, expected " + PointSample.FEATURES.size());
            }
            RandomCutForestOutlierModel outlierModel = new RandomCutForestOutlierModelMapper()
                    .toModel(state.getOutlierModelState());
            return new PointAnomalyScorer(scaler, outlierModel);
        } catch (CorruptArtifactException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CorruptArtifactException("point scorer artifact is invalid: " + e.getMessage(), e);
        }
    }
}
