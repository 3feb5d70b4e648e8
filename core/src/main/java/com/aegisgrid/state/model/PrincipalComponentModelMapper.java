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

package com.aegisgrid.state.model;

import static com.aegisgrid.CommonUtils.checkArgument;

import com.aegisgrid.model.PrincipalComponentReconstructionModel;
import com.aegisgrid.state.IStateMapper;

public class PrincipalComponentModelMapper
        implements IStateMapper<PrincipalComponentReconstructionModel, PrincipalComponentModelState> {

    @Override
    public PrincipalComponentModelState toState(PrincipalComponentReconstructionModel model) {
        checkArgument(model.isFitted(), "only a fitted model can be converted to a state");
        PrincipalComponentModelState state = new PrincipalComponentModelState();
        state.setLatentDimension(model.getLatentDimension());
        state.setTimesteps(model.getTimesteps());
        state.setMean(model.getMean());
        state.setComponents(model.getComponents());
        return state;
    }

    @Override
    public PrincipalComponentReconstructionModel toModel(PrincipalComponentModelState state) {
        return new PrincipalComponentReconstructionModel(state.getLatentDimension(), state.getTimesteps(),
                state.getMean(), state.getComponents());
    }
}
