package io.nosqlbench.provisioning.metadata;


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


import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/// Hub lookups the orchestrators need before or between transfers.
public interface ArtifactMetadataSource {

    /// @param repoId an `owner/repo` id
    /// @return the projector published in the repo, if any
    /// @throws IOException when the hub cannot be queried
    Optional<ProjectorFile> findProjector(String repoId) throws IOException;

    /// @param url a file URL
    /// @return the remote size in bytes, 0 when the server does not say
    /// @throws IOException when the server cannot be reached
    long remoteSize(URI url) throws IOException;

    /// @param slug a bundle slug
    /// @return the bundle file, if published
    /// @throws IOException when the hub cannot be queried
    Optional<BundleFile> findBundle(String slug) throws IOException;
}
