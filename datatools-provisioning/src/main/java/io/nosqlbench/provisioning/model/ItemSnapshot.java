package io.nosqlbench.provisioning.model;


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


import io.nosqlbench.provisioning.errors.DownloadError;

import java.util.List;

/// An immutable view of an item, safe to hand to any reader.
///
/// @param identity the download identity
/// @param kind the artifact family
/// @param displayName a caller-facing name
/// @param state the lifecycle state
/// @param progress overall fraction in [0,1]
/// @param speed smoothed bytes per second
/// @param completed true once finished
/// @param error the current error, or null
/// @param retryCount automatic retries so far
/// @param expectedBytes best-known total size
/// @param writtenBytes bytes known to be on disk or received
/// @param verifying true while a checksum is being computed
/// @param parts per-file progress
public record ItemSnapshot(
    String identity,
    ArtifactKind kind,
    String displayName,
    DownloadState state,
    double progress,
    double speed,
    boolean completed,
    DownloadError error,
    int retryCount,
    long expectedBytes,
    long writtenBytes,
    boolean verifying,
    List<PartSnapshot> parts
) {

    /// @param name the part name
    /// @param fileName the final file name
    /// @param fraction the part fraction
    /// @param writtenBytes bytes written for the part
    /// @param expectedBytes expected bytes for the part
    /// @param completed whether the part is done
    public record PartSnapshot(String name, String fileName, double fraction, long writtenBytes,
                               long expectedBytes, boolean completed) {
    }

    /// @param name a part name
    /// @return the part, or null
    public PartSnapshot part(String name) {
        return parts.stream().filter(p -> p.name().equals(name)).findFirst().orElse(null);
    }
}
