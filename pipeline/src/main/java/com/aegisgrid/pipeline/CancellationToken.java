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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A single-shot cancellation signal shared between the thread that drives a
 * pipeline and the threads that may stop it. Once cancelled it stays
 * cancelled.
 */
public class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Blocks until the token is cancelled or the timeout elapses.
     *
     * @param timeout the longest time to wait
     * @return true if the token was cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        checkNotNull(timeout, "timeout must not be null");
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
