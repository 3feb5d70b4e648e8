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

package com.aegisgrid.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

public class RandomCutForestOutlierModelTest {

    @Test
    public void testToOutlierScore() {
        assertEquals(0.0, RandomCutForestOutlierModel.toOutlierScore(0.0));
        assertEquals(-0.5, RandomCutForestOutlierModel.toOutlierScore(1.0));
        assertEquals(-0.75, RandomCutForestOutlierModel.toOutlierScore(3.0));
        assertEquals(0.0, RandomCutForestOutlierModel.toOutlierScore(-1.0));
        assertTrue(RandomCutForestOutlierModel.toOutlierScore(1e9) > -1.0);
    }

    @Test
    public void testOutlierScoreIsNeverNegativeZero() {
        for (double forestScore : new double[] { 0.0, -0.0, -1.0, -1e-12 }) {
            double outlierScore = RandomCutForestOutlierModel.toOutlierScore(forestScore);
            assertEquals(0L, Double.doubleToRawLongBits(outlierScore));
        }
    }

    @Test
    public void testFitAndScore() {
        Random random = new Random(0);
        List<double[]> corpus = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            corpus.add(new double[] { random.nextGaussian(), random.nextGaussian(), random.nextGaussian() });
        }
        RandomCutForestOutlierModel model = new RandomCutForestOutlierModel();
        assertFalse(model.isFitted());
        model.fit(corpus);
        assertTrue(model.isFitted());

        double[] far = new double[] { 20.0, -20.0, 20.0 };
        assertTrue(model.isOutlier(far));
        assertTrue(model.score(far) < model.score(new double[] { 0.0, 0.0, 0.0 }));
        assertTrue(model.score(far) > -1.0);
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RandomCutForestOutlierModel(0, 256, 42, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new RandomCutForestOutlierModel(50, 256, 42, 0.0));

        RandomCutForestOutlierModel model = new RandomCutForestOutlierModel();
        assertThrows(IllegalStateException.class, () -> model.score(new double[] { 1.0 }));
        assertThrows(IllegalArgumentException.class, () -> model.fit(Collections.emptyList()));

        model.fit(Collections.singletonList(new double[] { 1.0, 2.0 }));
        assertThrows(IllegalArgumentException.class, () -> model.score(new double[] { 1.0 }));
    }
}
