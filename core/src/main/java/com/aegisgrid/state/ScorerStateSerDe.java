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

package com.aegisgrid.state;

import static com.aegisgrid.CommonUtils.checkNotNull;

import java.io.IOException;

import lombok.Getter;

import com.aegisgrid.exception.ArtifactStorageException;
import com.aegisgrid.exception.CorruptArtifactException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Encodes scorer state objects as JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>. The encoded
 * bytes are opaque to everything except this class.
 */
@Getter
public class ScorerStateSerDe {

    private final ObjectMapper objectMapper;

    public ScorerStateSerDe() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    /**
     * @param objectMapper the Jackson mapper used for both directions; exposed
     *                     so callers can customize the output
     */
    public ScorerStateSerDe(ObjectMapper objectMapper) {
        this.objectMapper = checkNotNull(objectMapper, "objectMapper must not be null");
    }

    public byte[] toBytes(Object state) {
        checkNotNull(state, "state must not be null");
        try {
            return objectMapper.writeValueAsBytes(state);
        } catch (JsonProcessingException e) {
            throw new ArtifactStorageException("unable to encode " + state.getClass().getSimpleName(), e);
        }
    }

    /**
     * @param blob bytes produced by {@link #toBytes(Object)}
     * @param type the expected state type
     * @param <S>  the state type
     * @return the decoded state
     * @throws CorruptArtifactException if the bytes do not decode to a
     *                                  {@code type}
     */
    public <S> S fromBytes(byte[] blob, Class<S> type) {
        checkNotNull(blob, "blob must not be null");
        S state;
        try {
            state = objectMapper.readValue(blob, type);
        } catch (IOException e) {
            throw new CorruptArtifactException("unable to decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
        if (state == null) {
            throw new CorruptArtifactException("artifact holds no " + type.getSimpleName());
        }
        return state;
    }
}
