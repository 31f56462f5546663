package io.nosqlbench.provisioning.orchestrator;


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


import io.nosqlbench.provisioning.catalog.BundleSpec;
import io.nosqlbench.provisioning.metadata.BundleFile;
import io.nosqlbench.provisioning.model.DownloadState;
import io.nosqlbench.provisioning.model.ItemSnapshot;
import io.nosqlbench.provisioning.support.Eventually;
import io.nosqlbench.provisioning.support.TestHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;

class BundleOrchestratorTest {

    private static final URI URL = URI.create("https://hub.test/nosqlbench/slm-bundles/resolve/main/starter.bundle");
    private static final byte[] CONTENT = "bundle payload".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    private TestHarness harness;
    private BundleOrchestrator bundles;

    @BeforeEach
    void setUp() {
        harness = new TestHarness(root);
        bundles = new BundleOrchestrator(harness.ctx);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private static String sha256(byte[] bytes) throws Exception {
        return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
    }

    private ItemSnapshot awaitTerminal() {
        Eventually.await("bundle to end", () -> bundles.snapshot("starter").map(s -> s.state().isTerminal()).orElse(false));
        return bundles.snapshot("starter").orElseThrow();
    }

    @Test
    void verifiesTheChecksum() throws Exception {
        harness.transport.serve(URL.toString(), CONTENT);

        bundles.start(new BundleSpec("starter", "Starter", URL, CONTENT.length, sha256(CONTENT).toUpperCase()));
        ItemSnapshot done = awaitTerminal();

        assertThat(done.state()).isEqualTo(DownloadState.FINISHED);
        assertThat(done.verifying()).isFalse();
        assertThat(harness.installer.installed()).singleElement()
            .satisfies(a -> assertThat(a.path()).isEqualTo(harness.ctx.layout().bundleFile("starter")));
    }

    @Test
    void checksumMismatchFailsAndRemovesTheFile() throws Exception {
        harness.transport.serve(URL.toString(), CONTENT);

        bundles.start(new BundleSpec("starter", "Starter", URL, CONTENT.length, sha256(new byte[]{1})));
        ItemSnapshot failed = awaitTerminal();

        assertThat(failed.state()).isEqualTo(DownloadState.FAILED);
        assertThat(failed.error().message()).contains("checksum mismatch");
        assertThat(failed.error().isRetryable()).isFalse();
        assertThat(harness.ctx.layout().bundleFile("starter")).doesNotExist();
        assertThat(harness.installer.installed()).isEmpty();
    }

    @Test
    void looksUpTheBundleWhenTheCatalogHasNoUrl() throws Exception {
        harness.metadata.bundle("starter", new BundleFile("starter.bundle", URL, CONTENT.length, sha256(CONTENT)));
        harness.transport.serve(URL.toString(), CONTENT);

        bundles.start(new BundleSpec("starter", null, null, 0, null));
        ItemSnapshot done = awaitTerminal();

        assertThat(done.state()).isEqualTo(DownloadState.FINISHED);
        assertThat(done.expectedBytes()).isEqualTo(CONTENT.length);
        assertThat(Files.readAllBytes(harness.ctx.layout().bundleFile("starter"))).isEqualTo(CONTENT);
    }

    @Test
    void unpublishedBundleFailsPermanently() {
        bundles.start(new BundleSpec("starter", null, null, 0, null));
        ItemSnapshot failed = awaitTerminal();

        assertThat(failed.state()).isEqualTo(DownloadState.FAILED);
        assertThat(failed.error().message()).contains("no bundle published");
    }
}
