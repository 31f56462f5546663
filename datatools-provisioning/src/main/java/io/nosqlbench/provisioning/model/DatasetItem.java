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

/// A dataset made of several files under one directory.
///
/// When any file size is still unknown, progress gives every file an equal share instead of
/// weighting by bytes.
public class DatasetItem extends DownloadItem {

    private final Path directory;

    public DatasetItem(String identity, String displayName, Path directory, double activeCeiling) {
        super(identity, ArtifactKind.DATASET, displayName, activeCeiling);
        this.directory = directory;
    }

    /// @param fileName the file name relative to the dataset directory
    /// @param finalPath its final location
    /// @param catalogBytes its size when known
    public void addFile(String fileName, Path finalPath, long catalogBytes) {
        addPart(new PartProgress(fileName, finalPath, catalogBytes));
    }

    public Path directory() {
        return directory;
    }

    @Override
    public double combinedFraction() {
        if (parts().isEmpty()) {
            return 0d;
        }
        boolean anyUnknown = parts().stream().anyMatch(p -> p.expectedBytes() <= 0);
        if (!anyUnknown) {
            return super.combinedFraction();
        }
        return parts().stream().mapToDouble(PartProgress::fraction).sum() / parts().size();
    }

    /// @return bytes downloaded across all files
    public long downloadedBytes() {
        return writtenBytes();
    }
}
