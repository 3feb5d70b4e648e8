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

package com.aegisgrid.scorer;

import java.util.List;

import com.aegisgrid.exception.CorruptArtifactException;
import com.aegisgrid.exception.InsufficientDataException;
import com.aegisgrid.exception.NotTrainedException;
import com.aegisgrid.returntypes.ScoreResult;
import com.aegisgrid.store.ArtifactStore;

/**
 * A scorer turns one input into a {@link ScoreResult}. Its fitted state is
 * created by {@link #train(List)} or {@link #load(ArtifactStore, String)} and
 * is replaced as a whole; a partially fitted scorer is never observable.
 *
 * Scorers are not thread safe. A single worker trains, loads and scores.
 *
 * @param <S> the type of a training sample
 * @param <I> the type of a scored input
 */
public interface AnomalyScorer<S, I> {

    /**
     * Fits the scorer on a historical corpus, replacing any previous state.
     *
     * @param corpus the training samples, in time order
     * @throws InsufficientDataException if the corpus is too small
     */
    void train(List<S> corpus);

    /**
     * @param input the input to score
     * @return the verdict for {@code input}
     * @throws NotTrainedException if the scorer was never trained or loaded
     */
    ScoreResult analyze(I input);

    boolean isTrained();

    /**
     * Persists the fitted state as a single artifact.
     *
     * @param store the destination
     * @param name  the artifact name
     * @throws NotTrainedException if there is nothing to save
     */
    void save(ArtifactStore store, String name);

    /**
     * Replaces the fitted state with the one held in an artifact. On failure the
     * current state is left untouched.
     *
     * @param store the source
     * @param name  the artifact name
     * @throws CorruptArtifactException if the artifact is missing, unreadable or
     *                                  incomplete
     */
    void load(ArtifactStore store, String name);
}
