package io.nosqlbench.provisioning.install;


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


import io.nosqlbench.provisioning.model.ArtifactKind;

import java.nio.file.Path;

/// Describes an artifact that is complete on disk.
///
/// @param identity the download identity
/// @param kind the artifact family
/// @param path the primary file, or the directory for datasets
/// @param auxiliaryPath the projector for models, otherwise null
/// @param sizeBytes total bytes on disk
public record InstalledArtifact(String identity, ArtifactKind kind, Path path, Path auxiliaryPath, long sizeBytes) {
}
