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

package com.aegisgrid.fusion;

import static com.aegisgrid.CommonUtils.checkArgument;
import static com.aegisgrid.CommonUtils.checkNotNull;
import static com.aegisgrid.CommonUtils.round;

import lombok.Getter;

import com.aegisgrid.returntypes.AlertRecord;
import com.aegisgrid.returntypes.ScoreResult;

/**
 * Combines the point and sequence verdicts into one alert decision.
 *
 * The combined confidence is the weighted sum of the two confidences. When
 * both scorers flag an anomaly the sum is boosted by
 * {@value #COORDINATED_BOOST} and capped at 1. An alert is raised when the
 * combined confidence is strictly above the alert threshold; the reported
 * confidence is rounded to two decimals after that comparison.
 *
 * The policy is stateless and the records it returns carry no location and no
 * alert edge; the caller fills those in.
 */
@Getter
public class FusionPolicy {

    public static final double DEFAULT_POINT_WEIGHT = 0.6;
    public static final double DEFAULT_SEQUENCE_WEIGHT = 0.4;
    public static final double DEFAULT_ALERT_THRESHOLD = 0.7;
    public static final double COORDINATED_BOOST = 1.5;

    public static final String REASON_COORDINATED = "coordinated anomaly across both streams";
    public static final String REASON_POINT = "anomaly in point stream";
    public static final String REASON_SEQUENCE = "anomaly in sequence stream";
    public static final String REASON_NOMINAL = "nominal";

    private static final double WEIGHT_TOLERANCE = 1e-9;

    private final double pointWeight;
    private final double sequenceWeight;
    private final double alertThreshold;

    public FusionPolicy() {
        this(DEFAULT_POINT_WEIGHT, DEFAULT_SEQUENCE_WEIGHT, DEFAULT_ALERT_THRESHOLD);
    }

    public FusionPolicy(double pointWeight, double sequenceWeight, double alertThreshold) {
        checkArgument(pointWeight >= 0 && sequenceWeight >= 0, "weights must be non-negative");
        checkArgument(Math.abs(pointWeight + sequenceWeight - 1.0) <= WEIGHT_TOLERANCE, "weights must sum to 1");
        checkArgument(alertThreshold >= 0 && alertThreshold <= 1, "alertThreshold must be in [0, 1]");
        this.pointWeight = pointWeight;
        this.sequenceWeight = sequenceWeight;
        this.alertThreshold = alertThreshold;
    }

    public AlertRecord fuse(ScoreResult point, ScoreResult sequence) {
        checkNotNull(point, "point must not be null");
        checkNotNull(sequence, "sequence must not be null");

        double combined = point.getConfidence() * pointWeight + sequence.getConfidence() * sequenceWeight;
        String reason;
        if (point.isAnomaly() && sequence.isAnomaly()) {
            combined = Math.min(combined * COORDINATED_BOOST, 1.0);
            reason = REASON_COORDINATED;
        } else if (point.isAnomaly()) {
            reason = REASON_POINT;
        } else if (sequence.isAnomaly()) {
            reason = REASON_SEQUENCE;
        } else {
            reason = REASON_NOMINAL;
        }

        return AlertRecord.builder().aegisAlert(combined > alertThreshold).combinedConfidence(round(combined, 2))
                .reason(reason).scadaAnomaly(point.isAnomaly()).pmuAnomaly(sequence.isAnomaly()).build();
    }
}
