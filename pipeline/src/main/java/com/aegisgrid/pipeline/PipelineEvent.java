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

package com.aegisgrid.pipeline;

import static com.aegisgrid.CommonUtils.checkNotNull;

import lombok.Value;

import com.aegisgrid.returntypes.AlertRecord;

/**
 * An element of the consumer stream: either a status message or an alert
 * record, told apart by {@link #getKind()}.
 */
@Value
public class PipelineEvent {

    public enum Kind {
        STATUS, ALERT
    }

    Kind kind;
    /**
     * set for {@link Kind#STATUS}, null otherwise
     */
    String message;
    /**
     * set for {@link Kind#ALERT}, null otherwise
     */
    AlertRecord alert;

    public static PipelineEvent status(String message) {
        return new PipelineEvent(Kind.STATUS, checkNotNull(message, "message must not be null"), null);
    }

    public static PipelineEvent alert(AlertRecord alert) {
        return new PipelineEvent(Kind.ALERT, null, checkNotNull(alert, "alert must not be null"));
    }
}
