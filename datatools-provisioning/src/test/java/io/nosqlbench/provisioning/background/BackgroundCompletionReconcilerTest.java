package io.nosqlbench.provisioning.background;


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


import io.nosqlbench.provisioning.catalog.DatasetFile;
import io.nosqlbench.provisioning.catalog.DatasetSpec;
import io.nosqlbench.provisioning.catalog.ModelFormat;
import io.nosqlbench.provisioning.catalog.ModelSpec;
import io.nosqlbench.provisioning.fs.ArtifactLayout;
import io.nosqlbench.provisioning.metadata.ProjectorFile;
import io.nosqlbench.provisioning.model.DownloadState;
import io.nosqlbench.provisioning.model.ModelItem;
import io.nosqlbench.provisioning.registry.DownloadRegistry;
import io.nosqlbench.provisioning.support.Eventually;
import io.nosqlbench.provisioning.support.ScriptedTransport;
import io.nosqlbench.provisioning.support.TestHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BackgroundCompletionReconcilerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path root;

    private TestHarness harness;
    private DownloadRegistry registry;

    @BeforeEach
    void setUp() {
        harness = new TestHarness(root);
        registry = new DownloadRegistry(harness.ctx);
        registry.open();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private boolean finished(String identity) {
        return registry.item(identity).map(s -> s.state() == DownloadState.FINISHED).orElse(false);
    }

    @Test
    void backgroundWeightsFinishTheModel() throws Exception {
        ModelSpec spec = new ModelSpec("acme/tiny", "4bit",
            URI.create("https://hub.test/acme/tiny/resolve/main/model.safetensors"), 10, ModelFormat.MLX, null);
        registry.start(spec);
        ScriptedTransport.Transfer transfer = harness.transport.next(WAIT);

        Path temp = transfer.request().tempFile();
        Files.createDirectories(temp.getParent());
        Files.write(temp, new byte[10]);
        harness.background.deliver(temp);

        Eventually.await("model finished", () -> finished(spec.identity()));
        assertThat(Files.size(transfer.request().destination())).isEqualTo(10);
        assertThat(harness.installer.installed()).hasSize(1);

        harness.background.deliver(transfer.request().destination());
        Thread.sleep(100);
        assertThat(harness.installer.installed()).hasSize(1);
    }

    @Test
    void backgroundFileInTheDatasetDirectoryFinishesTheDataset() throws Exception {
        URI a = URI.create("https://hub.test/datasets/acme/manuals/resolve/main/a.txt");
        URI b = URI.create("https://hub.test/datasets/acme/manuals/resolve/main/b.txt");
        DatasetSpec spec = new DatasetSpec("acme/manuals", "Manuals",
            List.of(new DatasetFile("a.txt", a, 3), new DatasetFile("b.txt", b, 4)));
        registry.start(spec);
        ScriptedTransport.Transfer transfer = harness.transport.next(WAIT);

        Path directory = harness.ctx.layout().datasetDirectory("acme/manuals");
        Files.write(directory.resolve("a.txt"), new byte[3]);
        Path bTemp = ArtifactLayout.tempFor(directory.resolve("b.txt"));
        Files.write(bTemp, new byte[4]);
        harness.background.deliver(bTemp);

        Eventually.await("dataset finished", () -> finished("acme/manuals"));
        assertThat(directory.resolve("b.txt")).exists();
        assertThat(harness.installer.installed()).singleElement()
            .satisfies(artifact -> assertThat(artifact.sizeBytes()).isEqualTo(7));
        assertThat(transfer.request().source()).isEqualTo(a);
    }

    private boolean projectorCompleted(String identity) {
        return registry.item(identity)
            .map(s -> s.part(ModelItem.PROJECTOR) != null && s.part(ModelItem.PROJECTOR).completed())
            .orElse(false);
    }

    private ModelSpec withSharedProjector(String repo) {
        String projectorName = "mmproj-model-f16.gguf";
        harness.metadata.projector(repo, new ProjectorFile(repo, projectorName,
            URI.create("https://hub.test/" + repo + "/resolve/main/" + projectorName), 8));
        return new ModelSpec(repo, "Q4_K_M", URI.create("https://hub.test/" + repo + "/resolve/main/model-Q4_K_M.gguf"),
            100, ModelFormat.GGUF, null);
    }

    @Test
    void sharedProjectorNamesMatchOnlyTheirOwnModel() throws Exception {
        ModelSpec one = withSharedProjector("aaa/one");
        ModelSpec two = withSharedProjector("zzz/two");
        registry.start(one);
        registry.start(two);
        harness.transport.next(WAIT);
        harness.transport.next(WAIT);

        boolean strayClaimed = harness.ctx.owner().call(() -> registry.backgroundReconciler()
            .reconcile(root.resolve("elsewhere/mmproj-model-f16.gguf")));
        assertThat(strayClaimed).isFalse();

        Path twoProjector = harness.ctx.layout().modelDirectory("zzz/two").resolve("mmproj-model-f16.gguf");
        Files.createDirectories(twoProjector.getParent());
        Files.write(twoProjector, new byte[8]);
        harness.background.deliver(twoProjector);

        Eventually.await("second projector completed", () -> projectorCompleted(two.identity()));
        assertThat(projectorCompleted(one.identity())).isFalse();
        assertThat(registry.item(one.identity()).orElseThrow().writtenBytes()).isZero();
    }

    @Test
    void datasetsWithTheSameNameAreMatchedByDirectory() throws Exception {
        DatasetSpec first = new DatasetSpec("owner1/manuals", "Manuals", List.of(new DatasetFile("docs/a.txt",
            URI.create("https://hub.test/datasets/owner1/manuals/resolve/main/docs/a.txt"), 3)));
        DatasetSpec second = new DatasetSpec("owner2/manuals", "Manuals", List.of(new DatasetFile("docs/a.txt",
            URI.create("https://hub.test/datasets/owner2/manuals/resolve/main/docs/a.txt"), 3)));
        registry.start(first);
        registry.start(second);
        harness.transport.next(WAIT);
        harness.transport.next(WAIT);

        Path secondFile = harness.ctx.layout().datasetDirectory("owner2/manuals").resolve("docs/a.txt");
        Files.createDirectories(secondFile.getParent());
        Files.write(secondFile, new byte[3]);
        harness.background.deliver(secondFile);

        Eventually.await("second dataset finished", () -> finished("owner2/manuals"));
        assertThat(finished("owner1/manuals")).isFalse();
        assertThat(registry.item("owner1/manuals").orElseThrow().completed()).isFalse();
    }

    @Test
    void unmatchedFilesAreIgnored() {
        boolean claimed = harness.ctx.owner().call(
            () -> registry.backgroundReconciler().reconcile(root.resolve("elsewhere/unknown.bin")));
        assertThat(claimed).isFalse();
    }

    @Test
    void closeUnregistersTheListener() {
        assertThat(harness.background.listenerCount()).isEqualTo(1);
        registry.close();
        assertThat(harness.background.listenerCount()).isZero();
    }
}
