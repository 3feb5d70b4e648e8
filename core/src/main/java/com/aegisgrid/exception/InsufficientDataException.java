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

package com.aegisgrid.exception;

/**
 * Thrown when a training corpus is too small to fit a scorer.
 */
public class InsufficientDataException extends AegisException {

    private static final long serialVersionUID = 1L;

    private final int required;
    private final int actual;

    /**
     * @param required the smallest corpus size that can be fitted
     * @param actual   the size of the corpus that was supplied
     */
    public InsufficientDataException(int required, int actual) {
        super(String.format("training requires at least %d samples but %d were supplied", required, actual));
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
