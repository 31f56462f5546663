package io.nosqlbench.provisioning.transport;


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


import io.nosqlbench.provisioning.fs.ArtifactLayout;
import io.nosqlbench.provisioning.model.ArtifactKind;

import java.net.URI;
import java.nio.file.Path;
import java.util.Map;

/// One file transfer handed to a {@link TransferTransport}.
///
/// @param identity the owning download identity
/// @param part the sub-part name within the item
/// @param kind the artifact family
/// @param source where to fetch from
/// @param destination the final path; bytes go to its temp sibling first
/// @param expectedBytes the catalog size, 0 when unknown
/// @param headers extra request headers
public record TransferRequest(String identity, String part, ArtifactKind kind, URI source, Path destination,
                              long expectedBytes, Map<String, String> headers) {

    public TransferRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /// @return the in-progress file next to the destination
    public Path tempFile() {
        return ArtifactLayout.tempFor(destination);
    }
}
