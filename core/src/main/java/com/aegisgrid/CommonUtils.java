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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Restricts a value to the closed interval {@code [lower, upper]}.
     *
     * @param value the value to clip
     * @param lower the lower bound
     * @param upper the upper bound
     * @return the clipped value
     */
    public static double clip(double value, double lower, double upper) {
        return Math.max(lower, Math.min(upper, value));
    }

    /**
     * Rounds a value to a fixed number of decimal places, with ties rounded away
     * from zero.
     *
     * @param value  the value to round
     * @param places the number of decimal places to keep
     * @return the rounded value
     */
    public static double round(double value, int places) {
        checkArgument(places >= 0, "places must be non-negative");
        checkArgument(Double.isFinite(value), "only finite values can be rounded");
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Flattens a rectangular matrix row by row.
     *
     * @param matrix the matrix to flatten
     * @return an array holding the rows of {@code matrix} one after another
     */
    public static double[] flatten(double[][] matrix) {
        checkNotNull(matrix, "matrix must not be null");
        checkArgument(matrix.length > 0, "matrix must have at least one row");
        int columns = matrix[0].length;
        double[] result = new double[matrix.length * columns];
        for (int i = 0; i < matrix.length; i++) {
            checkArgument(matrix[i].length == columns, "matrix must be rectangular");
            System.arraycopy(matrix[i], 0, result, i * columns, columns);
        }
        return result;
    }

    /**
     * Inverse of {@link #flatten(double[][])}.
     *
     * @param values  row-major values
     * @param columns the number of columns in each row
     * @return a matrix with {@code values.length / columns} rows
     */
    public static double[][] unflatten(double[] values, int columns) {
        checkNotNull(values, "values must not be null");
        checkArgument(columns > 0 && values.length % columns == 0,
                String.format("cannot split %d values into rows of %d", values.length, columns));
        double[][] result = new double[values.length / columns][columns];
        for (int i = 0; i < result.length; i++) {
            System.arraycopy(values, i * columns, result[i], 0, columns);
        }
        return result;
    }

    /**
     * The mean of the absolute elementwise differences between two matrices of
     * the same shape.
     *
     * @param expected the reference matrix
     * @param actual   the matrix compared against the reference
     * @return the mean absolute error
     */
    public static double meanAbsoluteError(double[][] expected, double[][] actual) {
        checkNotNull(expected, "expected must not be null");
        checkNotNull(actual, "actual must not be null");
        checkArgument(expected.length == actual.length, "row counts differ");
        double sum = 0;
        int count = 0;
        for (int i = 0; i < expected.length; i++) {
            checkArgument(expected[i].length == actual[i].length, "column counts differ");
            for (int j = 0; j < expected[i].length; j++) {
                sum += Math.abs(expected[i][j] - actual[i][j]);
                count++;
            }
        }
        checkArgument(count > 0, "matrices must not be empty");
        return sum / count;
    }
}
