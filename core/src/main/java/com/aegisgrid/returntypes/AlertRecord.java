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

import lombok.Builder;
import lombok.Value;

/**
 * The fused verdict for one evaluation cycle. {@link #isNewAlert()} is true
 * only on the cycle where alerting switches on.
 */
@Value
@Builder(toBuilder = true)
public class AlertRecord {

    boolean aegisAlert;
    double combinedConfidence;
    String reason;
    boolean scadaAnomaly;
    boolean pmuAnomaly;
    @Builder.Default
    String location = "";
    boolean newAlert;
    long timestamp;
    boolean groundTruthAnomaly;
}
