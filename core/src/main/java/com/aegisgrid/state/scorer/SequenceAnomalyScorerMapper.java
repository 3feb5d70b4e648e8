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
import com.aegisgrid.model.PrincipalComponentReconstructionModel;
import com.aegisgrid.model.ReconstructionModel;
import com.aegisgrid.preprocessor.StandardScaler;
import com.aegisgrid.sample.SequenceSample;
import com.aegisgrid.scorer.SequenceAnomalyScorer;
import com.aegisgrid.state.IStateMapper;
import com.aegisgrid.state.model.PrincipalComponentModelMapper;
import com.aegisgrid.state.preprocessor.StandardScalerMapper;

/**
 * Only scorers backed by a {@link PrincipalComponentReconstructionModel} can
 * be converted to a state. Restoring requires the scaler, the model and the
 * threshold to all be present.
 */
public class SequenceAnomalyScorerMapper implements IStateMapper<SequenceAnomalyScorer, SequenceAnomalyScorerState> {

    @Override
    public SequenceAnomalyScorerState toState(SequenceAnomalyScorer model) {
        ReconstructionModel reconstructionModel = model.getModel();
        checkState(reconstructionModel instanceof PrincipalComponentReconstructionModel,
                "cannot persist reconstruction model of type " + reconstructionModel.getClass().getName());
        SequenceAnomalyScorerState state = new SequenceAnomalyScorerState();
        state.setTimesteps(model.getTimesteps());
        state.setThreshold(model.getThreshold());
        state.setScalerState(new StandardScalerMapper().toState(model.getScaler()));
        state.setReconstructionModelState(
                new PrincipalComponentModelMapper().toState((PrincipalComponentReconstructionModel) reconstructionModel));
        return state;
    }

    @Override
    public SequenceAnomalyScorer toModel(SequenceAnomalyScorerState state) {
        if (!V1_0.equals(state.getVersion())) {
            throw new CorruptArtifactException("unsupported sequence scorer state version " + state.getVersion());
        }
        if (state.getScalerState() == null) {
            throw new CorruptArtifactException("sequence scorer artifact has no scaler");
        }
        if (state.getReconstructionModelState() == null) {
            throw new CorruptArtifactException("sequence scorer artifact has no reconstruction model");
        }
        if (state.getThreshold() == null) {
            throw new CorruptArtifactException("sequence scorer artifact has no threshold");
        }
        try {
            StandardScaler scaler = new StandardScalerMapper().toModel(state.getScalerState());
            if (scaler.getDimensions() != SequenceSample.FEATURES.size()) {
                throw new CorruptArtifactException("sequence scorer artifact has a scaler for "
                        + scaler.getDimensions() + " features, expected " + SequenceSample.FEATURES.size());
            }
            PrincipalComponentReconstructionModel reconstructionModel = new PrincipalComponentModelMapper()
                    .toModel(state.getReconstructionModelState());
            if (reconstructionModel.getTimesteps() != state.getTimesteps()) {
                throw new CorruptArtifactException("sequence scorer artifact has a model for "
                        + reconstructionModel.getTimesteps() + " timesteps but declares " + state.getTimesteps());
            }
            return new SequenceAnomalyScorer(state.getTimesteps(), scaler, reconstructionModel, state.getThreshold());
        } catch (CorruptArtifactException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CorruptArtifactException("sequence scorer artifact is invalid: " + e.getMessage(), e);
        }
    }
}
