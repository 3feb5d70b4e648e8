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

package com.aegisgrid.sample;

/**
 * A measurement that can be presented to a scorer as a fixed-order vector of
 * numeric features.
 */
public interface FeatureVector {

    /**
     * @return a new array with this measurement's feature values, in the order
     *         given by the implementing type's feature list
     */
    double[] toFeatures();
}
