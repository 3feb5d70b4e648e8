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

import java.util.Optional;

import com.aegisgrid.exception.ArtifactStorageException;
import com.aegisgrid.exception.CorruptArtifactException;

/**
 * Keeps named, opaque artifact blobs.
 */
public interface ArtifactStore {

    /**
     * Stores a blob, replacing any blob with the same name. Readers see either
     * the previous blob or the new one, never a partial write.
     *
     * @param name the artifact name
     * @param blob the artifact bytes
     * @return a handle describing where the blob was stored
     * @throws ArtifactStorageException if the blob cannot be written
     */
    String save(String name, byte[] blob);

    /**
     * @param name the artifact name
     * @return the stored bytes, or empty if no artifact has this name
     * @throws CorruptArtifactException if the artifact exists but cannot be read
     */
    Optional<byte[]> load(String name);

    boolean exists(String name);
}
