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

/// A catalog entry for one quantization of a model.
///
/// @param modelId the model id shown to callers
/// @param quantLabel the quantization label, e.g. `Q4_K_M`
/// @param downloadUrl the weights URL on the hub
/// @param sizeBytes the catalog size, 0 when unknown
/// @param format the weights format
/// @param baseRepoId the upstream repo to search for a projector after the quant's own repo, or null
public record ModelSpec(String modelId, String quantLabel, URI downloadUrl, long sizeBytes, ModelFormat format,
                        String baseRepoId) {

    public ModelSpec {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId is required");
        }
        if (downloadUrl == null) {
            throw new IllegalArgumentException("downloadUrl is required for " + modelId);
        }
        format = format == null ? ModelFormat.GGUF : format;
    }

    /// @return `<modelId>-<quantLabel>`
    public String identity() {
        return quantLabel == null || quantLabel.isBlank() ? modelId : modelId + "-" + quantLabel;
    }

    /// @return the repo hosting the weights
    public String repoId() {
        return RepoIds.fromUrl(downloadUrl)
            .orElseThrow(() -> new IllegalArgumentException("no repo id in " + downloadUrl));
    }
}
