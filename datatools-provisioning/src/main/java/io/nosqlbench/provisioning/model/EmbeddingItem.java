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


import java.nio.file.Path;

/// A single-file embedding model.
public class EmbeddingItem extends DownloadItem {

    /// Part name of the model file
    public static final String MODEL = "model";

    public EmbeddingItem(String identity, String displayName, Path modelFile, long catalogBytes, double activeCeiling) {
        super(identity, ArtifactKind.EMBEDDING, displayName, activeCeiling);
        addPart(new PartProgress(MODEL, modelFile, catalogBytes));
    }

    public PartProgress model() {
        return part(MODEL);
    }
}
