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

import static com.aegisgrid.CommonUtils.checkArgument;
import static com.aegisgrid.CommonUtils.checkNotNull;

import java.util.Iterator;
import java.util.concurrent.Callable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.aegisgrid.returntypes.AlertRecord;

/**
 * Drives one orchestrator from start to finish on a worker thread and
 * forwards its alert records to an {@link EventChannel}. Failures propagate
 * out of {@link #call()} after they have been reported to the channel.
 */
public class PipelineWorker implements Callable<Void> {

    private static final Logger LOG = LogManager.getLogger(PipelineWorker.class);

    private final PipelineOrchestrator orchestrator;
    private final EventChannel channel;
    private final CancellationToken token;
    private final long maxIterations;

    public PipelineWorker(PipelineOrchestrator orchestrator, EventChannel channel, CancellationToken token,
            long maxIterations) {
        checkArgument(maxIterations >= 0, "maxIterations must be non-negative");
        this.orchestrator = checkNotNull(orchestrator, "orchestrator must not be null");
        this.channel = checkNotNull(channel, "channel must not be null");
        this.token = checkNotNull(token, "token must not be null");
        this.maxIterations = maxIterations;
    }

    @Override
    public Void call() {
        if (orchestrator.getState() == PipelineState.UNINITIALIZED) {
            orchestrator.initialize();
        }
        Iterator<AlertRecord> alerts = orchestrator.run(token);
        long produced = 0;
        while (alerts.hasNext()) {
            channel.publishAlert(alerts.next());
            produced++;
            if (maxIterations > 0 && produced >= maxIterations) {
                LOG.info("Produced {} records, stopping", produced);
                token.cancel();
            }
        }
        return null;
    }
}
