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

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.aegisgrid.returntypes.AlertRecord;

/**
 * An unbounded queue of {@link PipelineEvent}s between one producer and any
 * number of consumers. Publishing never blocks.
 */
public class EventChannel implements StatusSink {

    private final BlockingQueue<PipelineEvent> queue = new LinkedBlockingQueue<>();

    public void publish(PipelineEvent event) {
        queue.offer(checkNotNull(event, "event must not be null"));
    }

    public void publishAlert(AlertRecord alert) {
        publish(PipelineEvent.alert(alert));
    }

    @Override
    public void report(String message) {
        publish(PipelineEvent.status(message));
    }

    /**
     * @param timeout how long to wait for an event
     * @return the oldest queued event, or null if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public PipelineEvent poll(Duration timeout) throws InterruptedException {
        checkNotNull(timeout, "timeout must not be null");
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Moves every queued event to {@code target}, oldest first.
     *
     * @param target the collection to add to
     * @return the number of events moved
     */
    public int drainTo(Collection<? super PipelineEvent> target) {
        return queue.drainTo(checkNotNull(target, "target must not be null"));
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }
}
