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

package com.aegisgrid.preprocessor;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class StandardScalerTest {

    private static final double EPSILON = 1e-12;

    @Test
    public void testFitUsesPopulationDeviation() {
        StandardScaler scaler = StandardScaler.fit(new double[][] { { 1, 10 }, { 3, 10 } });

        assertArrayEquals(new double[] { 2, 10 }, scaler.getMean(), EPSILON);
        // the second column never varies, so it keeps a unit scale
        assertArrayEquals(new double[] { 1, 1 }, scaler.getScale(), EPSILON);
        assertArrayEquals(new double[] { -1, 0 }, scaler.transform(new double[] { 1, 10 }), EPSILON);
        assertArrayEquals(new double[] { 3, 5 }, scaler.transform(new double[] { 5, 15 }), EPSILON);
    }

    @Test
    public void testTransformedCorpusIsStandardized() {
        double[][] data = new double[][] { { 2 }, { 4 }, { 4 }, { 4 }, { 5 }, { 5 }, { 7 }, { 9 } };
        StandardScaler scaler = StandardScaler.fit(data);
        assertEquals(5.0, scaler.getMean()[0], EPSILON);
        assertEquals(2.0, scaler.getScale()[0], EPSILON);

        double[][] scaled = scaler.transform(data);
        double sum = 0;
        double sumOfSquares = 0;
        for (double[] row : scaled) {
            sum += row[0];
            sumOfSquares += row[0] * row[0];
        }
        assertEquals(0.0, sum / data.length, EPSILON);
        assertEquals(1.0, sumOfSquares / data.length, EPSILON);
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> StandardScaler.fit(new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> new StandardScaler(new double[] { 0 }, new double[] { 0 }));
        assertThrows(IllegalArgumentException.class,
                () -> new StandardScaler(new double[] { 0, 1 }, new double[] { 1 }));

        StandardScaler scaler = StandardScaler.fit(new double[][] { { 1, 2 } });
        assertThrows(IllegalArgumentException.class, () -> scaler.transform(new double[] { 1 }));
    }
}
