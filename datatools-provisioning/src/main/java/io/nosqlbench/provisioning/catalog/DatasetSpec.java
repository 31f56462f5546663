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


import java.util.List;

/// A dataset made of several files.
///
/// @param datasetId the dataset id and identity
/// @param displayName written to `title.txt` in the dataset directory
/// @param files the candidate files; unsupported extensions are skipped
public record DatasetSpec(String datasetId, String displayName, List<DatasetFile> files) {

    public DatasetSpec {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public String identity() {
        return datasetId;
    }
}
