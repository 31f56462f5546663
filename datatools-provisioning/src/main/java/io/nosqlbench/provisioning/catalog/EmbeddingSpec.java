package io.nosqlbench.provisioning.catalog;


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


import java.net.URI;

/// A single-file embedding model.
///
/// @param repoId the hub repo and identity
/// @param fileName the model file name
/// @param downloadUrl where to fetch it
/// @param sizeBytes the catalog size, 0 when unknown
public record EmbeddingSpec(String repoId, String fileName, URI downloadUrl, long sizeBytes) {

    public String identity() {
        return repoId;
    }
}
