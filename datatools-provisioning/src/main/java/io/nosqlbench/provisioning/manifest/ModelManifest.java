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


import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/// The per-model `artifacts.json` sidecar.
///
/// All fields are optional so older or partial manifests still load. A null
/// {@code mmprojChecked} means the projector has never been probed.
///
/// @param weights the weights file name
/// @param mmproj the projector file name, or null when absent or unknown
/// @param mmprojChecked whether projector presence has been determined
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelManifest(
    @JsonProperty("weights") String weights,
    @JsonProperty("mmproj") String mmproj,
    @JsonProperty("mmprojChecked") Boolean mmprojChecked
) {

    /// @return a manifest with nothing known
    public static ModelManifest empty() {
        return new ModelManifest(null, null, null);
    }

    /// @return true when projector presence or absence is recorded
    @JsonIgnore
    public boolean isProjectorChecked() {
        return Boolean.TRUE.equals(mmprojChecked);
    }

    public ModelManifest withWeights(String fileName) {
        return new ModelManifest(fileName, mmproj, mmprojChecked);
    }

    /// @param fileName the projector file name, or null to record that there is none
    /// @return a copy with the projector checked
    public ModelManifest withProjector(String fileName) {
        return new ModelManifest(weights, fileName, Boolean.TRUE);
    }
}
