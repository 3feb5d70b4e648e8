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

package com.aegisgrid.state;

/**
 * Converts between a model object and a plain state object that can be
 * serialized.
 *
 * @param <Model> the model type
 * @param <State> the state type
 */
public interface IStateMapper<Model, State> {

    /**
     * Create a state object from the given model.
     *
     * @param model a model object
     * @return a state object representing the given model
     */
    State toState(Model model);

    /**
     * Create a new model from the given state object.
     *
     * @param state a state object
     * @return a model object corresponding to the given state
     */
    Model toModel(State state);
}
