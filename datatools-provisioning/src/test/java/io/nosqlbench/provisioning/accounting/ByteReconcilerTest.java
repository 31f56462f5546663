package io.nosqlbench.provisioning.accounting;


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
import io.nosqlbench.provisioning.fs.LocalFileProbe;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ByteReconcilerTest {

    private final ByteReconciler reconciler = new ByteReconciler(new LocalFileProbe());

    @Test
    void prefersTheTempFileOverTheFinalFile(@TempDir Path dir) throws Exception {
        Path weights = dir.resolve("model.gguf");
        Files.write(weights, new byte[10]);
        Files.write(ArtifactLayout.tempFor(weights), new byte[40]);

        assertThat(reconciler.probeBytes(weights)).isEqualTo(40);
        assertThat(reconciler.reconcile(weights, 25, 100)).isEqualTo(new PartBytes(40, 100));
    }

    @Test
    void expectedNeverDropsBelowWritten(@TempDir Path dir) {
        PartBytes bytes = reconciler.reconcile(dir.resolve("missing.bin"), 500, 200);
        assertThat(bytes.written()).isEqualTo(500);
        assertThat(bytes.expected()).isEqualTo(500);
    }

    @Test
    void findsCompanionsByHint(@TempDir Path dir) throws Exception {
        Files.write(dir.resolve("model.gguf"), new byte[5]);
        Files.write(dir.resolve("mmproj-f16.gguf" + ArtifactLayout.TEMP_SUFFIX), new byte[7]);

        assertThat(reconciler.findCompanion(dir, List.of("mmproj"))).isPresent();
        assertThat(reconciler.reconcileCompanion(dir, null, List.of("mmproj"), 3, 0)).isEqualTo(new PartBytes(7, 7));
        assertThat(reconciler.findCompanion(dir, List.of("tokenizer"))).isEmpty();
    }
}
