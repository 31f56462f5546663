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


/// The four artifact families, each with its own orchestrator.
public enum ArtifactKind {
    MODEL("Model"),
    BUNDLE("Bundle"),
    DATASET("Dataset"),
    EMBEDDING("Embedding");

    private final String label;

    ArtifactKind(String label) {
        this.label = label;
    }

    /// @return the name used in log lines
    public String getLabel() {
        return label;
    }
}
