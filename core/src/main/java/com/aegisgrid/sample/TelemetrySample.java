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

import lombok.NonNull;
import lombok.Value;

/**
 * A synchronized reading of both telemetry streams taken at one instant.
 */
@Value
public class TelemetrySample {

    long timestamp;
    @NonNull
    PointSample point;
    @NonNull
    SequenceSample sequence;
    @NonNull
    String location;
    /**
     * whether the source injected an anomaly into this reading; only known for
     * synthetic sources
     */
    boolean groundTruthAnomaly;
}
