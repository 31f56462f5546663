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

/// Model weights plus an optional vision projector stored alongside them.
public class ModelItem extends DownloadItem {

    /// Part name of the weights file
    public static final String WEIGHTS = "weights";
    /// Part name of the projector file
    public static final String PROJECTOR = "projector";

    private final Path modelDirectory;

    public ModelItem(String identity, String displayName, Path modelDirectory, Path weightsFile,
                     long catalogBytes, double activeCeiling) {
        super(identity, ArtifactKind.MODEL, displayName, activeCeiling);
        this.modelDirectory = modelDirectory;
        addPart(new PartProgress(WEIGHTS, weightsFile, catalogBytes));
    }

    public Path modelDirectory() {
        return modelDirectory;
    }

    public PartProgress weights() {
        return part(WEIGHTS);
    }

    /// @return the projector part, or null when the model has none or it has not been found yet
    public PartProgress projector() {
        return part(PROJECTOR);
    }

    /// Adds the projector part once its file name is known.
    ///
    /// @param projectorFile the final projector path
    /// @param catalogBytes its size when known
    /// @return the part
    public PartProgress attachProjector(Path projectorFile, long catalogBytes) {
        PartProgress existing = projector();
        if (existing != null && existing.finalPath().equals(projectorFile)) {
            existing.raiseExpected(catalogBytes);
            return existing;
        }
        PartProgress part = new PartProgress(PROJECTOR, projectorFile, catalogBytes);
        addPart(part);
        return part;
    }

    /// Drops the projector from progress accounting after a best-effort failure or absence.
    public void detachProjector() {
        removePart(PROJECTOR);
    }

    /// @return the projector fraction, or 0 when there is no projector
    public double projectorProgress() {
        PartProgress part = projector();
        return part == null ? 0d : part.fraction();
    }
}
