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

package com.aegisgrid.simulator;

import java.util.Random;

/**
 * Normal variates from a seeded {@link Random}, two at a time.
 */
class NormalDistribution {
    private final Random rng;
    private final double[] buffer;
    private int index;

    NormalDistribution(Random rng) {
        this.rng = rng;
        buffer = new double[2];
        index = 0;
    }

    double nextDouble() {
        if (index == 0) {
            // Box-Muller; u stays in (0, 1] so the logarithm is finite
            double u = 1.0 - rng.nextDouble();
            double v = rng.nextDouble();
            double r = Math.sqrt(-2 * Math.log(u));
            buffer[0] = r * Math.cos(2 * Math.PI * v);
            buffer[1] = r * Math.sin(2 * Math.PI * v);
        }

        double result = buffer[index];
        index = (index + 1) % 2;

        return result;
    }

    double nextDouble(double mu, double sigma) {
        return mu + sigma * nextDouble();
    }

    double nextUniform(double lower, double upper) {
        return lower + (upper - lower) * rng.nextDouble();
    }

    boolean nextBernoulli(double probability) {
        return rng.nextDouble() < probability;
    }

    int nextInt(int bound) {
        return rng.nextInt(bound);
    }
}
