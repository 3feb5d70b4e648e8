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

/**
 * An unsupervised outlier model over standardized feature vectors.
 *
 * {@link #score(Object)} follows the outlier-score convention: values lie in
 * [-1, 0] and the more negative a score, the more anomalous the point.
 */
public interface OutlierModel extends ScoringModel<double[]> {

    /**
     * The model's own binary classification of a point.
     *
     * @param point a standardized feature vector
     * @return true if the point is an outlier
     */
    boolean isOutlier(double[] point);
}
