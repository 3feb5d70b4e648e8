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

import static com.aegisgrid.CommonUtils.checkArgument;
import static com.aegisgrid.CommonUtils.checkNotNull;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

import com.aegisgrid.fusion.FusionPolicy;
import com.aegisgrid.scorer.SequenceAnomalyScorer;

/**
 * Settings for a pipeline built by
 * {@link PipelineOrchestrator#fromConfig(PipelineConfig, StatusSink)}.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    public static final int DEFAULT_TRAINING_CORPUS_SIZE = 2000;
    public static final Duration DEFAULT_CADENCE = Duration.ofSeconds(1);
    public static final String DEFAULT_MODEL_DIRECTORY = "saved_models";

    @Builder.Default
    int timesteps = SequenceAnomalyScorer.DEFAULT_TIMESTEPS;
    @Builder.Default
    int trainingCorpusSize = DEFAULT_TRAINING_CORPUS_SIZE;
    @Builder.Default
    Duration cadence = DEFAULT_CADENCE;
    /**
     * weight of the point verdict; the sequence verdict gets the rest
     */
    @Builder.Default
    double pointWeight = FusionPolicy.DEFAULT_POINT_WEIGHT;
    @Builder.Default
    double alertThreshold = FusionPolicy.DEFAULT_ALERT_THRESHOLD;
    @Builder.Default
    String modelDirectory = DEFAULT_MODEL_DIRECTORY;
    @Builder.Default
    boolean highAnomalyMode = false;
    @Builder.Default
    long randomSeed = 42L;
    /**
     * the number of alert records to produce before stopping; 0 means no limit
     */
    @Builder.Default
    long maxIterations = 0L;

    public double getSequenceWeight() {
        return 1.0 - pointWeight;
    }

    /**
     * @throws IllegalArgumentException if any setting is out of range
     */
    public void validate() {
        checkArgument(timesteps > 0, "timesteps must be greater than 0");
        checkArgument(trainingCorpusSize > timesteps, "trainingCorpusSize must be greater than timesteps");
        checkNotNull(cadence, "cadence must not be null");
        checkArgument(!cadence.isNegative(), "cadence must not be negative");
        checkArgument(pointWeight >= 0 && pointWeight <= 1, "pointWeight must be in [0, 1]");
        checkArgument(alertThreshold >= 0 && alertThreshold <= 1, "alertThreshold must be in [0, 1]");
        checkNotNull(modelDirectory, "modelDirectory must not be null");
        checkArgument(maxIterations >= 0, "maxIterations must be non-negative");
    }
}
