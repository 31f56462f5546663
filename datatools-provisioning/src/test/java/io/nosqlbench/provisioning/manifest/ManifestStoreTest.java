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


import io.nosqlbench.provisioning.fs.ArtifactLayout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ManifestStoreTest {

    private final ManifestStore store = new ManifestStore();

    @Test
    void missingManifestIsEmpty(@TempDir Path dir) {
        assertThat(store.read(dir)).isEmpty();
    }

    @Test
    void malformedManifestIsIgnored(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(ArtifactLayout.MANIFEST_FILE), "{not json");
        assertThat(store.read(dir)).isEmpty();
    }

    @Test
    void toleratesPartialAndUnknownFields(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(ArtifactLayout.MANIFEST_FILE), "{\"weights\":\"w.gguf\",\"extra\":1}");
        ModelManifest manifest = store.read(dir).orElseThrow();
        assertThat(manifest.weights()).isEqualTo("w.gguf");
        assertThat(manifest.mmproj()).isNull();
        assertThat(manifest.isProjectorChecked()).isFalse();
    }

    @Test
    void updateRecordsProjectorPresenceAndAbsence(@TempDir Path dir) throws Exception {
        Path modelDir = dir.resolve("models/acme/tiny");
        store.update(modelDir, m -> m.withWeights("w.gguf").withProjector("mmproj.gguf"));
        assertThat(store.read(modelDir)).contains(new ModelManifest("w.gguf", "mmproj.gguf", true));

        store.update(modelDir, m -> m.withProjector(null));
        ModelManifest absent = store.read(modelDir).orElseThrow();
        assertThat(absent.mmproj()).isNull();
        assertThat(absent.isProjectorChecked()).isTrue();
        assertThat(absent.weights()).isEqualTo("w.gguf");
        assertThat(Files.readString(modelDir.resolve(ArtifactLayout.MANIFEST_FILE))).contains("\"mmprojChecked\"");
    }
}
