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

package com.aegisgrid.state.preprocessor;

import com.aegisgrid.preprocessor.StandardScaler;
import com.aegisgrid.state.IStateMapper;

public class StandardScalerMapper implements IStateMapper<StandardScaler, StandardScalerState> {

    @Override
    public StandardScalerState toState(StandardScaler model) {
        StandardScalerState state = new StandardScalerState();
        state.setMean(model.getMean());
        state.setScale(model.getScale());
        return state;
    }

    @Override
    public StandardScaler toModel(StandardScalerState state) {
        return new StandardScaler(state.getMean(), state.getScale());
    }
}
