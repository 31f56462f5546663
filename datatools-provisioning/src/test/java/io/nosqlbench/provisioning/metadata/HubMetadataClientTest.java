package io.nosqlbench.provisioning.metadata;


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


import io.nosqlbench.jetty.testserver.JettyHubServerExtension;
import io.nosqlbench.jetty.testserver.JettyHubServerFixture;
import io.nosqlbench.jetty.testserver.RouteHandler;
import io.nosqlbench.provisioning.config.ProvisioningConfig;
import io.nosqlbench.provisioning.errors.TransferException;
import io.nosqlbench.provisioning.scheduler.RequestScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.net.URI;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(JettyHubServerExtension.class)
class HubMetadataClientTest {

    private static final String TINY_INFO = """
        {"id":"acme/tiny-GGUF","siblings":[
          {"rfilename":"README.md","size":12},
          {"rfilename":"tiny-Q4_K_M.gguf","size":100},
          {"rfilename":"mmproj-tiny-F16.gguf","size":16}
        ]}""";

    private JettyHubServerFixture server;
    private RequestScheduler scheduler;
    private HubMetadataClient client;
    private String base;

    @BeforeEach
    void setUp() {
        server = JettyHubServerExtension.getServer();
        server.clearRoutes();
        base = server.getBaseUrl().toString();
        scheduler = new RequestScheduler(RequestScheduler.defaultClient(), 2, delay -> { }, new Random(3));
        ProvisioningConfig config = ProvisioningConfig.builder()
            .withHubBaseUrl(base)
            .withBundleRepository("acme/bundles")
            .build();
        client = new HubMetadataClient(scheduler, config);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void findsAndCachesTheProjector() throws Exception {
        server.route("/api/models/acme/tiny-GGUF", RouteHandler.json(TINY_INFO));

        Optional<ProjectorFile> projector = client.findProjector("acme/tiny-GGUF");

        assertThat(projector).isPresent();
        assertThat(projector.get().fileName()).isEqualTo("mmproj-tiny-F16.gguf");
        assertThat(projector.get().sizeBytes()).isEqualTo(16);
        assertThat(projector.get().downloadUrl().toString())
            .endsWith("/acme/tiny-GGUF/resolve/main/mmproj-tiny-F16.gguf");

        client.findProjector("acme/tiny-GGUF");
        assertThat(server.requestCount("/api/models/acme/tiny-GGUF")).isEqualTo(1);
    }

    @Test
    void missingOrPrivateReposHaveNoProjector() throws Exception {
        server.route("/api/models/acme/private", RouteHandler.status(401, null));
        assertThat(client.findProjector("acme/unknown")).isEmpty();
        assertThat(client.findProjector("acme/private")).isEmpty();
    }

    @Test
    void persistentServerErrorsSurface() {
        server.route("/api/models/acme/broken", RouteHandler.status(500, null));
        assertThatThrownBy(() -> client.findProjector("acme/broken"))
            .isInstanceOf(TransferException.class)
            .hasMessageContaining("500");
        assertThat(server.requestCount("/api/models/acme/broken")).isEqualTo(RequestScheduler.MAX_ATTEMPTS);
    }

    @Test
    void remoteSizeUsesHeadContentLength() throws Exception {
        server.route("/acme/tiny-GGUF/resolve/main/tiny.gguf", RouteHandler.contentLength(123_456));
        long size = client.remoteSize(URI.create(base + "acme/tiny-GGUF/resolve/main/tiny.gguf"));
        assertThat(size).isEqualTo(123_456);
    }

    @Test
    void remoteSizeFallsBackToTheContentRangeTotal() throws Exception {
        server.route("/acme/x/resolve/main/y.bin", (request, response) -> {
            assertThat(request.getQueryString()).contains("download=1");
            response.setStatus(206);
            response.setHeader("Content-Range", "bytes 0-0/4096");
        });
        assertThat(client.remoteSize(URI.create(base + "acme/x/resolve/main/y.bin"))).isEqualTo(4096);
    }

    @Test
    void remoteSizeIsZeroWhenTheServerRefuses() throws Exception {
        assertThat(client.remoteSize(URI.create(base + "acme/x/resolve/main/absent.bin"))).isZero();
    }

    @Test
    void bundleLookupPrefersAnExactMatch() throws Exception {
        server.route("/api/models/acme/bundles", RouteHandler.json("""
            {"siblings":[
              {"rfilename":"other.bundle","size":5},
              {"rfilename":"starter.bundle","size":7,"lfs":{"sha256":"abc123","size":7}}
            ]}"""));

        BundleFile exact = client.findBundle("starter").orElseThrow();
        assertThat(exact.fileName()).isEqualTo("starter.bundle");
        assertThat(exact.sha256()).isEqualTo("abc123");
        assertThat(exact.sizeBytes()).isEqualTo(7);

        assertThat(client.findBundle("unlisted").orElseThrow().fileName()).isEqualTo("other.bundle");
    }

    @Test
    void extractsRepoIds() {
        assertThat(HubMetadataClient.repoIdFrom(URI.create("https://hub/api/models/acme/tiny"))).contains("acme/tiny");
        assertThat(HubMetadataClient.repoIdFrom(URI.create("https://hub/acme/tiny/resolve/main/w.gguf"))).contains("acme/tiny");
        assertThat(HubMetadataClient.repoIdFrom(URI.create("https://hub/acme"))).isEmpty();
        assertThat(HubMetadataClient.withDownloadFlag("https://hub/a?x=1")).isEqualTo("https://hub/a?x=1&download=1");
    }
}
