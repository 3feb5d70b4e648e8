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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

public class CancellationTokenTest {

    @Test
    public void testCancel() throws InterruptedException {
        CancellationToken token = new CancellationToken();
        assertFalse(token.isCancelled());
        assertFalse(token.awaitCancellation(Duration.ofMillis(10)));

        token.cancel();
        token.cancel();

        assertTrue(token.isCancelled());
        assertTrue(token.awaitCancellation(Duration.ofMinutes(1)));
        assertTrue(token.awaitCancellation(Duration.ZERO));
    }

    @Test
    public void testCancelFromAnotherThread() throws InterruptedException {
        CancellationToken token = new CancellationToken();
        Thread canceller = new Thread(token::cancel);
        canceller.start();

        assertTrue(token.awaitCancellation(Duration.ofMinutes(1)));
        canceller.join();
    }
}
