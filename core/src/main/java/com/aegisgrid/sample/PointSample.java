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

import java.util.List;

import lombok.Value;

/**
 * One point-in-time SCADA reading. Each reading is scored on its own, without
 * reference to earlier readings.
 */
@Value
public class PointSample implements FeatureVector {

    public static final List<String> FEATURES = List.of("voltage", "current", "frequency", "breaker_status");

    double voltage;
    double current;
    double frequency;
    /**
     * discrete status code; 1 is closed
     */
    int breakerStatus;

    @Override
    public double[] toFeatures() {
        return new double[] { voltage, current, frequency, breakerStatus };
    }
}
