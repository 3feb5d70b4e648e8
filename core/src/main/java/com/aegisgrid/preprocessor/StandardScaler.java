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

import static com.aegisgrid.CommonUtils.checkArgument;
import static com.aegisgrid.CommonUtils.checkNotNull;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Per-feature standardization to zero mean and unit variance. The deviation
 * is the population deviation of the fitted data; a feature that never varies
 * keeps a scale of 1 so that it is centered but not stretched.
 */
public class StandardScaler {

    private final double[] mean;
    private final double[] scale;

    public StandardScaler(double[] mean, double[] scale) {
        checkNotNull(mean, "mean must not be null");
        checkNotNull(scale, "scale must not be null");
        checkArgument(mean.length > 0, "at least one feature is required");
        checkArgument(mean.length == scale.length, "mean and scale must have the same length");
        for (double s : scale) {
            checkArgument(s > 0 && Double.isFinite(s), "scale entries must be positive and finite");
        }
        this.mean = Arrays.copyOf(mean, mean.length);
        this.scale = Arrays.copyOf(scale, scale.length);
    }

    /**
     * Computes the mean and population standard deviation of every column.
     *
     * @param data rows of equal length
     * @return a scaler fitted on {@code data}
     */
    public static StandardScaler fit(double[][] data) {
        checkNotNull(data, "data must not be null");
        checkArgument(data.length > 0, "data must contain at least one row");
        int dimensions = data[0].length;
        double[] mean = new double[dimensions];
        double[] scale = new double[dimensions];
        double[] column = new double[data.length];
        StandardDeviation deviation = new StandardDeviation(false);
        Mean average = new Mean();
        for (int j = 0; j < dimensions; j++) {
            for (int i = 0; i < data.length; i++) {
                checkArgument(data[i].length == dimensions, "all rows must have the same length");
                column[i] = data[i][j];
            }
            mean[j] = average.evaluate(column);
            double sd = deviation.evaluate(column);
            scale[j] = (sd > 0) ? sd : 1.0;
        }
        return new StandardScaler(mean, scale);
    }

    public double[] transform(double[] point) {
        checkNotNull(point, "point must not be null");
        checkArgument(point.length == mean.length,
                String.format("point has %d features, expected %d", point.length, mean.length));
        double[] result = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            result[i] = (point[i] - mean[i]) / scale[i];
        }
        return result;
    }

    public double[][] transform(double[][] points) {
        checkNotNull(points, "points must not be null");
        double[][] result = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            result[i] = transform(points[i]);
        }
        return result;
    }

    public int getDimensions() {
        return mean.length;
    }

    public double[] getMean() {
        return Arrays.copyOf(mean, mean.length);
    }

    public double[] getScale() {
        return Arrays.copyOf(scale, scale.length);
    }
}
