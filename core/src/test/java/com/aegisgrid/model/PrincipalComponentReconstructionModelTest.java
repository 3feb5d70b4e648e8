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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class PrincipalComponentReconstructionModelTest {

    private static final double EPSILON = 1e-9;

    /**
     * Windows whose flattened form is {@code t * (1, 2, 3, 4)}.
     */
    private static double[][] onLine(double t) {
        return new double[][] { { t, 2 * t }, { 3 * t, 4 * t } };
    }

    private static List<double[][]> lineCorpus() {
        List<double[][]> corpus = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            corpus.add(onLine(i * 0.5 - 3));
        }
        return corpus;
    }

    @Test
    public void testReconstructsWindowsInTheSubspace() {
        PrincipalComponentReconstructionModel model = new PrincipalComponentReconstructionModel(1);
        assertFalse(model.isFitted());
        model.fit(lineCorpus());
        assertTrue(model.isFitted());
        assertEquals(2, model.getTimesteps());
        assertEquals(1, model.getComponents().length);

        double[][] window = onLine(10.0);
        double[][] reconstruction = model.reconstruct(window);
        for (int i = 0; i < window.length; i++) {
            assertArrayEquals(window[i], reconstruction[i], EPSILON);
        }
        assertEquals(0.0, model.score(window), EPSILON);
    }

    @Test
    public void testWindowsOffTheSubspaceHaveError() {
        PrincipalComponentReconstructionModel model = new PrincipalComponentReconstructionModel(1);
        model.fit(lineCorpus());

        double[][] window = new double[][] { { 1, -2 }, { 3, -4 } };
        assertTrue(model.score(window) > 0.5);
    }

    @Test
    public void testFitIsDeterministic() {
        PrincipalComponentReconstructionModel first = new PrincipalComponentReconstructionModel();
        PrincipalComponentReconstructionModel second = new PrincipalComponentReconstructionModel();
        first.fit(lineCorpus());
        second.fit(lineCorpus());

        double[][] window = new double[][] { { 0.3, 1.1 }, { -2.0, 0.7 } };
        assertEquals(first.score(window), second.score(window));
    }

    @Test
    public void testRestoredModelMatches() {
        PrincipalComponentReconstructionModel model = new PrincipalComponentReconstructionModel(2);
        model.fit(lineCorpus());
        PrincipalComponentReconstructionModel restored = new PrincipalComponentReconstructionModel(
                model.getLatentDimension(), model.getTimesteps(), model.getMean(), model.getComponents());

        double[][] window = new double[][] { { 0.3, 1.1 }, { -2.0, 0.7 } };
        assertEquals(model.score(window), restored.score(window));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new PrincipalComponentReconstructionModel(0));

        PrincipalComponentReconstructionModel model = new PrincipalComponentReconstructionModel();
        assertThrows(IllegalStateException.class, () -> model.reconstruct(onLine(1.0)));
        assertThrows(IllegalArgumentException.class, () -> model.fit(new ArrayList<>()));

        model.fit(lineCorpus());
        assertThrows(IllegalArgumentException.class, () -> model.reconstruct(new double[][] { { 1, 2 } }));
        assertThrows(IllegalArgumentException.class,
                () -> new PrincipalComponentReconstructionModel(1, 3, new double[] { 1, 2 }, new double[][] { { 1, 2 } }));
    }
}
