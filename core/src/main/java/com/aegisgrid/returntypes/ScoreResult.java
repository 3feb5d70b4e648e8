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

package com.aegisgrid.returntypes;

import static com.aegisgrid.CommonUtils.checkArgument;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The verdict of a single scorer for a single input.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ScoreResult {

    /**
     * Returned when there is not enough context to score, for example while a
     * sequence window warms up.
     */
    public static final ScoreResult NO_ANOMALY = new ScoreResult(false, 0.0);

    private final boolean anomaly;

    /**
     * a value in [0, 1]; larger means more anomalous
     */
    private final double confidence;

    public ScoreResult(boolean anomaly, double confidence) {
        checkArgument(confidence >= 0.0 && confidence <= 1.0, "confidence must be in [0, 1] but was " + confidence);
        this.anomaly = anomaly;
        this.confidence = confidence;
    }
}
