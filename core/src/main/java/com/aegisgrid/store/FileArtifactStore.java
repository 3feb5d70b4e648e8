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

import static com.aegisgrid.CommonUtils.checkArgument;
import static com.aegisgrid.CommonUtils.checkNotNull;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.aegisgrid.exception.ArtifactStorageException;
import com.aegisgrid.exception.CorruptArtifactException;

/**
 * Stores each artifact as a file in one directory. Writes go to a temporary
 * file that is then renamed over the target.
 */
public class FileArtifactStore implements ArtifactStore {

    private static final Logger LOG = LogManager.getLogger(FileArtifactStore.class);

    private final Path directory;

    public FileArtifactStore(Path directory) {
        this.directory = checkNotNull(directory, "directory must not be null");
    }

    @Override
    public String save(String name, byte[] blob) {
        checkNotNull(blob, "blob must not be null");
        Path target = resolve(name);
        Path temporary = null;
        try {
            Files.createDirectories(directory);
            temporary = Files.createTempFile(directory, name, ".tmp");
            Files.write(temporary, blob);
            try {
                Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported in {}, replacing {} directly", directory, name);
                Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Wrote {} bytes to {}", blob.length, target);
            return target.toString();
        } catch (IOException e) {
            deleteQuietly(temporary);
            throw new ArtifactStorageException("unable to write artifact " + target, e);
        }
    }

    @Override
    public Optional<byte[]> load(String name) {
        Path target = resolve(name);
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(target));
        } catch (IOException e) {
            throw new CorruptArtifactException("unable to read artifact " + target, e);
        }
    }

    @Override
    public boolean exists(String name) {
        return Files.isRegularFile(resolve(name));
    }

    public Path getDirectory() {
        return directory;
    }

    private Path resolve(String name) {
        checkNotNull(name, "name must not be null");
        checkArgument(!name.isEmpty() && !name.contains("/") && !name.contains("\\") && !name.startsWith("."),
                "invalid artifact name: " + name);
        return directory.resolve(name);
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Unable to delete temporary file {}", path, e);
        }
    }
}
