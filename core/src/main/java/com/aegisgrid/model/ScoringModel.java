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

package com.aegisgrid.model;

import java.util.List;

/**
 * A pluggable numerical backend for a scorer. The scorers own scaling,
 * thresholds and the mapping to confidences; a model only learns from
 * preprocessed inputs and reports a raw anomaly signal for new ones.
 *
 * @param <T> the preprocessed input type
 */
public interface ScoringModel<T> {

    /**
     * Fits the model from scratch on the given inputs.
     *
     * @param corpus the training inputs; must not be empty
     */
    void fit(List<T> corpus);

    /**
     * @return true once {@link #fit(List)} has completed or the model was
     *         restored from a persisted state
     */
    boolean isFitted();

    /**
     * Computes the raw anomaly signal for one input, on the model's native
     * scale.
     *
     * @param input a preprocessed input
     * @return the raw anomaly signal
     */
    double score(T input);
}
