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

import lombok.Getter;

import com.aegisgrid.model.RandomCutForestOutlierModel;
import com.aegisgrid.state.IStateMapper;
import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;

/**
 * Tree state is saved along with the samplers so that a restored forest
 * produces the same scores as the original.
 */
@Getter
public class RandomCutForestOutlierModelMapper
        implements IStateMapper<RandomCutForestOutlierModel, RandomCutForestOutlierModelState> {

    private final RandomCutForestMapper forestMapper;

    public RandomCutForestOutlierModelMapper() {
        forestMapper = new RandomCutForestMapper();
        forestMapper.setSaveTreeStateEnabled(true);
        forestMapper.setSaveExecutorContextEnabled(true);
    }

    @Override
    public RandomCutForestOutlierModelState toState(RandomCutForestOutlierModel model) {
        checkArgument(model.isFitted(), "only a fitted model can be converted to a state");
        RandomCutForestOutlierModelState state = new RandomCutForestOutlierModelState();
        state.setRandomSeed(model.getRandomSeed());
        state.setOutlierScoreCutoff(model.getOutlierScoreCutoff());
        state.setForestState(forestMapper.toState(model.getForest()));
        return state;
    }

    @Override
    public RandomCutForestOutlierModel toModel(RandomCutForestOutlierModelState state) {
        checkArgument(state.getForestState() != null, "forest state is missing");
        RandomCutForest forest = forestMapper.toModel(state.getForestState());
        return new RandomCutForestOutlierModel(forest, state.getRandomSeed(), state.getOutlierScoreCutoff());
    }
}
