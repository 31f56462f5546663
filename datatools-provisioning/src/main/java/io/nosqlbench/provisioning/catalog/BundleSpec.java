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

/// An SLM bundle.
///
/// @param slug the bundle slug and identity
/// @param displayName a caller-facing name
/// @param downloadUrl the bundle URL, or null to look it up in the bundle repository
/// @param sizeBytes the catalog size, 0 when unknown
/// @param sha256 the expected checksum in hex, or null
public record BundleSpec(String slug, String displayName, URI downloadUrl, long sizeBytes, String sha256) {

    public String identity() {
        return slug;
    }
}
