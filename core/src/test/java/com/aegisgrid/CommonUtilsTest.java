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

package com.aegisgrid;

import static com.aegisgrid.CommonUtils.clip;
import static com.aegisgrid.CommonUtils.flatten;
import static com.aegisgrid.CommonUtils.meanAbsoluteError;
import static com.aegisgrid.CommonUtils.round;
import static com.aegisgrid.CommonUtils.unflatten;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class CommonUtilsTest {

    @Test
    public void testCheckHelpers() {
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.checkArgument(false, "bad"));
        assertThrows(IllegalStateException.class, () -> CommonUtils.checkState(false, "bad"));
        assertThrows(NullPointerException.class, () -> CommonUtils.checkNotNull(null, "bad"));
        assertEquals("x", CommonUtils.checkNotNull("x", "bad"));
    }

    @Test
    public void testClip() {
        assertEquals(-1.0, clip(-3.0, -1.0, 0.0));
        assertEquals(0.0, clip(2.0, -1.0, 0.0));
        assertEquals(-0.25, clip(-0.25, -1.0, 0.0));
    }

    @Test
    public void testRound() {
        assertEquals(0.58, round(0.5800000000000001, 2));
        assertEquals(0.9, round(0.9000000000000001, 2));
        assertEquals(0.13, round(0.125, 2));
        assertThrows(IllegalArgumentException.class, () -> round(Double.NaN, 2));
    }

    @Test
    public void testFlattenAndUnflatten() {
        double[][] matrix = new double[][] { { 1, 2 }, { 3, 4 }, { 5, 6 } };
        double[] flat = flatten(matrix);
        assertArrayEquals(new double[] { 1, 2, 3, 4, 5, 6 }, flat);

        double[][] restored = unflatten(flat, 2);
        for (int i = 0; i < matrix.length; i++) {
            assertArrayEquals(matrix[i], restored[i]);
        }

        assertThrows(IllegalArgumentException.class, () -> unflatten(flat, 4));
        assertThrows(IllegalArgumentException.class, () -> flatten(new double[][] { { 1 }, { 2, 3 } }));
    }

    @Test
    public void testMeanAbsoluteError() {
        double[][] expected = new double[][] { { 1, 2 }, { 3, 4 } };
        double[][] actual = new double[][] { { 1.5, 1.5 }, { 3, 5 } };
        assertEquals(0.5, meanAbsoluteError(expected, actual), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> meanAbsoluteError(expected, new double[][] { { 1, 2 } }));
    }
}
