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

package com.aegisgrid.store;

import static com.aegisgrid.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps artifacts in memory; used by tests and by pipelines that should never
 * touch the file system.
 */
public class InMemoryArtifactStore implements ArtifactStore {

    private final Map<String, byte[]> artifacts = new ConcurrentHashMap<>();

    @Override
    public String save(String name, byte[] blob) {
        checkNotNull(name, "name must not be null");
        checkNotNull(blob, "blob must not be null");
        artifacts.put(name, Arrays.copyOf(blob, blob.length));
        return "memory:" + name;
    }

    @Override
    public Optional<byte[]> load(String name) {
        checkNotNull(name, "name must not be null");
        byte[] blob = artifacts.get(name);
        return (blob == null) ? Optional.empty() : Optional.of(Arrays.copyOf(blob, blob.length));
    }

    @Override
    public boolean exists(String name) {
        return artifacts.containsKey(name);
    }

    public int size() {
        return artifacts.size();
    }
}
