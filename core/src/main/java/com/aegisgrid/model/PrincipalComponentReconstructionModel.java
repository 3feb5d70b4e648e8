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

import static com.aegisgrid.CommonUtils.checkArgument;
import static com.aegisgrid.CommonUtils.checkNotNull;
import static com.aegisgrid.CommonUtils.checkState;
import static com.aegisgrid.CommonUtils.flatten;
import static com.aegisgrid.CommonUtils.unflatten;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * A linear autoencoder. Windows are flattened, centered on the training mean
 * and projected onto the leading principal components of the training
 * windows; the reconstruction maps the projection back into window space.
 * Fitting is deterministic for a given corpus.
 */
public class PrincipalComponentReconstructionModel implements ReconstructionModel {

    public static final int DEFAULT_LATENT_DIMENSION = 4;

    private final int latentDimension;

    private int timesteps;
    private int features;
    private double[] mean;
    /**
     * one principal direction per row, ordered by decreasing variance
     */
    private double[][] components;

    public PrincipalComponentReconstructionModel() {
        this(DEFAULT_LATENT_DIMENSION);
    }

    public PrincipalComponentReconstructionModel(int latentDimension) {
        checkArgument(latentDimension > 0, "latentDimension must be greater than 0");
        this.latentDimension = latentDimension;
    }

    /**
     * Restores a fitted model.
     *
     * @param latentDimension the configured latent dimension
     * @param timesteps       the window length
     * @param mean            the flattened training mean
     * @param components      the retained principal directions, one per row
     */
    public PrincipalComponentReconstructionModel(int latentDimension, int timesteps, double[] mean,
            double[][] components) {
        this(latentDimension);
        checkNotNull(mean, "mean must not be null");
        checkNotNull(components, "components must not be null");
        checkArgument(timesteps > 0 && mean.length % timesteps == 0, "mean length must be a multiple of timesteps");
        checkArgument(components.length > 0, "at least one component is required");
        for (double[] component : components) {
            checkArgument(component.length == mean.length, "components must match the mean length");
        }
        this.timesteps = timesteps;
        this.features = mean.length / timesteps;
        this.mean = Arrays.copyOf(mean, mean.length);
        this.components = copy(components);
    }

    @Override
    public void fit(List<double[][]> corpus) {
        checkNotNull(corpus, "corpus must not be null");
        checkArgument(!corpus.isEmpty(), "corpus must not be empty");
        int windowLength = corpus.get(0).length;
        checkArgument(windowLength > 0, "windows must not be empty");
        int width = corpus.get(0)[0].length;

        double[][] rows = new double[corpus.size()][];
        for (int i = 0; i < rows.length; i++) {
            checkArgument(corpus.get(i).length == windowLength, "all windows must have the same length");
            rows[i] = flatten(corpus.get(i));
        }
        int dimensions = rows[0].length;

        double[] center = new double[dimensions];
        for (double[] row : rows) {
            for (int j = 0; j < dimensions; j++) {
                center[j] += row[j];
            }
        }
        for (int j = 0; j < dimensions; j++) {
            center[j] /= rows.length;
        }
        double[][] centered = new double[rows.length][dimensions];
        for (int i = 0; i < rows.length; i++) {
            for (int j = 0; j < dimensions; j++) {
                centered[i][j] = rows[i][j] - center[j];
            }
        }

        // the right singular vectors come back ordered by non-increasing singular value
        RealMatrix v = new SingularValueDecomposition(new Array2DRowRealMatrix(centered, false)).getV();
        int retained = Math.min(latentDimension, v.getColumnDimension());
        double[][] directions = new double[retained][];
        for (int k = 0; k < retained; k++) {
            directions[k] = v.getColumn(k);
        }

        timesteps = windowLength;
        features = width;
        mean = center;
        components = directions;
    }

    @Override
    public boolean isFitted() {
        return components != null;
    }

    @Override
    public double[][] reconstruct(double[][] window) {
        checkState(isFitted(), "the model has not been fitted");
        checkNotNull(window, "window must not be null");
        checkArgument(window.length == timesteps,
                String.format("window has %d timesteps, expected %d", window.length, timesteps));
        double[] x = flatten(window);
        checkArgument(x.length == mean.length, "window has the wrong number of features");

        double[] result = Arrays.copyOf(mean, mean.length);
        for (double[] component : components) {
            double projection = 0;
            for (int j = 0; j < x.length; j++) {
                projection += component[j] * (x[j] - mean[j]);
            }
            for (int j = 0; j < x.length; j++) {
                result[j] += projection * component[j];
            }
        }
        return unflatten(result, features);
    }

    public int getLatentDimension() {
        return latentDimension;
    }

    public int getTimesteps() {
        return timesteps;
    }

    public double[] getMean() {
        return (mean == null) ? null : Arrays.copyOf(mean, mean.length);
    }

    public double[][] getComponents() {
        return (components == null) ? null : copy(components);
    }

    private static double[][] copy(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = Arrays.copyOf(matrix[i], matrix[i].length);
        }
        return result;
    }
}
