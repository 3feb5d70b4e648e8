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

/**
 * Lifecycle of a {@link PipelineOrchestrator}.
 *
 * <pre>
 * UNINITIALIZED -&gt; INITIALIZING -&gt; RUNNING -&gt; STOPPED
 * </pre>
 *
 * {@link #ERROR} is reachable from {@link #INITIALIZING} and {@link #RUNNING}.
 * {@link #STOPPED} and {@link #ERROR} are terminal.
 */
public enum PipelineState {
    UNINITIALIZED, INITIALIZING, RUNNING, STOPPED, ERROR
}
