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


import java.net.URI;

/// An SLM bundle found in the bundle repository.
///
/// @param fileName its file name
/// @param downloadUrl where to fetch it
/// @param sizeBytes its size, 0 when unknown
/// @param sha256 its LFS checksum, or null
public record BundleFile(String fileName, URI downloadUrl, long sizeBytes, String sha256) {
}
