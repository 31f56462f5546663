package io.nosqlbench.provisioning.manifest;


/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.nosqlbench.provisioning.fs.ArtifactLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.function.UnaryOperator;

/// Reads and writes {@link ModelManifest} files.
///
/// Reads are tolerant: a missing or unreadable manifest is reported as absent so the caller
/// re-probes. Writes go through a temp file and a move.
public class ManifestStore {

    private static final Logger logger = LogManager.getLogger(ManifestStore.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /// @param modelDirectory the model directory
    /// @return the manifest, or empty when it is missing or malformed
    public Optional<ModelManifest> read(Path modelDirectory) {
        Path file = modelDirectory.resolve(ArtifactLayout.MANIFEST_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), ModelManifest.class));
        } catch (JsonProcessingException e) {
            logger.warn("ignoring malformed manifest {}: {}", file, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("unable to read manifest {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /// @param modelDirectory the model directory
    /// @param manifest the manifest to store
    /// @throws IOException when the file cannot be written
    public void write(Path modelDirectory, ModelManifest manifest) throws IOException {
        Files.createDirectories(modelDirectory);
        Path file = modelDirectory.resolve(ArtifactLayout.MANIFEST_FILE);
        Path temp = file.resolveSibling(ArtifactLayout.MANIFEST_FILE + ".tmp");
        mapper.writeValue(temp.toFile(), manifest);
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /// Reads, transforms and writes back a manifest.
    ///
    /// @param modelDirectory the model directory
    /// @param change the transformation
    /// @return the stored manifest
    /// @throws IOException when the file cannot be written
    public ModelManifest update(Path modelDirectory, UnaryOperator<ModelManifest> change) throws IOException {
        ModelManifest updated = change.apply(read(modelDirectory).orElse(ModelManifest.empty()));
        write(modelDirectory, updated);
        return updated;
    }
}
