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

import static com.aegisgrid.CommonUtils.meanAbsoluteError;

/**
 * A model trained to reproduce its own input windows. Windows are indexed
 * {@code [timestep][feature]}. The raw anomaly signal is the mean absolute
 * reconstruction error.
 */
public interface ReconstructionModel extends ScoringModel<double[][]> {

    /**
     * @param window a scaled window
     * @return the model's reproduction of {@code window}, with the same shape
     */
    double[][] reconstruct(double[][] window);

    @Override
    default double score(double[][] window) {
        return meanAbsoluteError(window, reconstruct(window));
    }
}
