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

import java.util.List;

import lombok.Getter;

import com.amazon.randomcutforest.RandomCutForest;

/**
 * An {@link OutlierModel} backed by a Random Cut Forest.
 *
 * The forest's anomaly score {@code s} lies in {@code [0, inf)} and is close
 * to 1 at the boundary between ordinary and unusual points. It is reported as
 * the outlier score {@code -s / (1 + s)}, which lies in {@code (-1, 0]}, and
 * a point is an outlier when {@code s} exceeds {@link #getOutlierScoreCutoff()}.
 * With the default cutoff of 1.0 the boundary sits at an outlier score of
 * -0.5.
 */
@Getter
public class RandomCutForestOutlierModel implements OutlierModel {

    public static final int DEFAULT_NUMBER_OF_TREES = 50;
    public static final int DEFAULT_SAMPLE_SIZE = 256;
    public static final long DEFAULT_RANDOM_SEED = 42L;
    public static final double DEFAULT_OUTLIER_SCORE_CUTOFF = 1.0;

    private final int numberOfTrees;
    private final int sampleSize;
    private final long randomSeed;
    private final double outlierScoreCutoff;

    private RandomCutForest forest;

    public RandomCutForestOutlierModel() {
        this(DEFAULT_NUMBER_OF_TREES, DEFAULT_SAMPLE_SIZE, DEFAULT_RANDOM_SEED, DEFAULT_OUTLIER_SCORE_CUTOFF);
    }

    public RandomCutForestOutlierModel(int numberOfTrees, int sampleSize, long randomSeed,
            double outlierScoreCutoff) {
        checkArgument(numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(sampleSize > 0, "sampleSize must be greater than 0");
        checkArgument(outlierScoreCutoff > 0, "outlierScoreCutoff must be greater than 0");
        this.numberOfTrees = numberOfTrees;
        this.sampleSize = sampleSize;
        this.randomSeed = randomSeed;
        this.outlierScoreCutoff = outlierScoreCutoff;
    }

    /**
     * Wraps a forest restored from a persisted state.
     *
     * @param forest             a populated forest
     * @param randomSeed         the seed the forest was originally built with
     * @param outlierScoreCutoff the forest score above which points are
     *                           outliers
     */
    public RandomCutForestOutlierModel(RandomCutForest forest, long randomSeed, double outlierScoreCutoff) {
        this(checkNotNull(forest, "forest must not be null").getNumberOfTrees(), forest.getSampleSize(), randomSeed,
                outlierScoreCutoff);
        this.forest = forest;
    }

    @Override
    public void fit(List<double[]> corpus) {
        checkNotNull(corpus, "corpus must not be null");
        checkArgument(!corpus.isEmpty(), "corpus must not be empty");
        RandomCutForest fitted = RandomCutForest.builder().dimensions(corpus.get(0).length)
                .numberOfTrees(numberOfTrees).sampleSize(sampleSize).randomSeed(randomSeed).outputAfter(1)
                .parallelExecutionEnabled(false).build();
        for (double[] point : corpus) {
            fitted.update(point);
        }
        forest = fitted;
    }

    @Override
    public boolean isFitted() {
        return forest != null;
    }

    @Override
    public double score(double[] point) {
        return toOutlierScore(forestScore(point));
    }

    @Override
    public boolean isOutlier(double[] point) {
        return forestScore(point) > outlierScoreCutoff;
    }

    /**
     * Maps a forest anomaly score onto the outlier-score scale.
     *
     * @param forestScore a non-negative forest anomaly score
     * @return a value in {@code (-1, 0]}
     */
    public static double toOutlierScore(double forestScore) {
        if (forestScore <= 0.0) {
            return 0.0;
        }
        return -forestScore / (1.0 + forestScore);
    }

    private double forestScore(double[] point) {
        checkState(forest != null, "the forest has not been fitted");
        checkNotNull(point, "point must not be null");
        checkArgument(point.length == forest.getDimensions(),
                String.format("point has %d dimensions, expected %d", point.length, forest.getDimensions()));
        return forest.getAnomalyScore(point);
    }
}
