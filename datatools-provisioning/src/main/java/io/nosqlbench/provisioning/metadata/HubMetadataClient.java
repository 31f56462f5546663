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


import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nosqlbench.provisioning.catalog.RepoIds;
import io.nosqlbench.provisioning.config.ProvisioningConfig;
import io.nosqlbench.provisioning.errors.TransferException;
import io.nosqlbench.provisioning.fs.ArtifactLayout;
import io.nosqlbench.provisioning.scheduler.HubRequest;
import io.nosqlbench.provisioning.scheduler.HubResponse;
import io.nosqlbench.provisioning.scheduler.RequestScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// {@link ArtifactMetadataSource} backed by the hub's model API, sent through the
/// {@link RequestScheduler} so lookups share its concurrency cap, dedup and retries.
public class HubMetadataClient implements ArtifactMetadataSource {

    private static final Logger logger = LogManager.getLogger(HubMetadataClient.class);

    private final RequestScheduler scheduler;
    private final ProvisioningConfig config;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, Optional<ProjectorFile>> projectorCache = new ConcurrentHashMap<>();

    public HubMetadataClient(RequestScheduler scheduler, ProvisioningConfig config) {
        this.scheduler = scheduler;
        this.config = config;
    }

    @Override
    public Optional<ProjectorFile> findProjector(String repoId) throws IOException {
        Optional<ProjectorFile> cached = projectorCache.get(repoId);
        if (cached != null) {
            return cached;
        }
        Optional<JsonNode> model = modelInfo(repoId);
        Optional<ProjectorFile> found = Optional.empty();
        if (model.isPresent()) {
            for (JsonNode sibling : model.get().path("siblings")) {
                String name = sibling.path("rfilename").asText("");
                String lower = name.toLowerCase(Locale.ROOT);
                if (lower.contains("mmproj") && lower.endsWith(".gguf")) {
                    found = Optional.of(new ProjectorFile(repoId, name, resolveUrl(repoId, name), sizeOf(sibling)));
                    break;
                }
            }
        }
        logger.debug("projector lookup for {}: {}", repoId, found.map(ProjectorFile::fileName).orElse("none"));
        projectorCache.put(repoId, found);
        return found;
    }

    @Override
    public long remoteSize(URI url) throws IOException {
        String target = withDownloadFlag(url.toString());
        HubRequest request = authorized(HubRequest.head(target)).withTimeout(config.metadataTimeout());
        HubResponse response = scheduler.request(request);
        if (!response.isSuccessful()) {
            logger.debug("HEAD {} returned {}, size unknown", target, response.code());
            return 0L;
        }
        Optional<Long> length = response.header("Content-Length").flatMap(HubMetadataClient::parseLong);
        if (length.isPresent() && length.get() > 0) {
            return length.get();
        }
        return response.header("Content-Range").flatMap(HubMetadataClient::rangeTotal).orElse(0L);
    }

    @Override
    public Optional<BundleFile> findBundle(String slug) throws IOException {
        String repo = config.bundleRepository();
        Optional<JsonNode> model = modelInfo(repo);
        if (model.isEmpty()) {
            return Optional.empty();
        }
        String wanted = slug + ArtifactLayout.BUNDLE_EXTENSION;
        JsonNode fallback = null;
        for (JsonNode sibling : model.get().path("siblings")) {
            String name = sibling.path("rfilename").asText("");
            if (name.equals(wanted)) {
                return Optional.of(bundleFile(repo, sibling));
            }
            if (fallback == null && name.endsWith(ArtifactLayout.BUNDLE_EXTENSION)) {
                fallback = sibling;
            }
        }
        return Optional.ofNullable(fallback).map(s -> bundleFile(repo, s));
    }

    /// @param url a hub URL
    /// @return its `owner/repo` id
    public static Optional<String> repoIdFrom(URI url) {
        return RepoIds.fromUrl(url);
    }

    private BundleFile bundleFile(String repo, JsonNode sibling) {
        String name = sibling.path("rfilename").asText();
        String sha = sibling.path("lfs").path("sha256").asText(null);
        return new BundleFile(name, resolveUrl(repo, name), sizeOf(sibling), sha);
    }

    private Optional<JsonNode> modelInfo(String repoId) throws IOException {
        String url = config.hubBaseUrl() + "/api/models/" + repoId + "?blobs=true";
        HubRequest request = authorized(HubRequest.get(url).withHeader("Accept", "application/json"))
            .withTimeout(config.metadataTimeout());
        request = request.withCacheKey(url + "|application/json|GET|" + (config.hubToken() == null ? "" : config.hubToken()));
        HubResponse response = scheduler.request(request);
        if (response.code() == 404 || response.code() == 401) {
            logger.debug("hub has no readable model info for {} ({})", repoId, response.code());
            return Optional.empty();
        }
        if (!response.isSuccessful()) {
            throw TransferException.forStatus(response.code(), url);
        }
        return Optional.of(mapper.readTree(response.body()));
    }

    private HubRequest authorized(HubRequest request) {
        return request.withBearerToken(config.hubToken()).withHeader("User-Agent", config.userAgent());
    }

    private URI resolveUrl(String repoId, String fileName) {
        return URI.create(config.hubBaseUrl() + "/" + repoId + "/resolve/main/" + fileName);
    }

    private static long sizeOf(JsonNode sibling) {
        long size = sibling.path("size").asLong(0L);
        return size > 0 ? size : sibling.path("lfs").path("size").asLong(0L);
    }

    static String withDownloadFlag(String url) {
        if (url.contains("download=")) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + "download=1";
    }

    private static Optional<Long> parseLong(String value) {
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Long> rangeTotal(String contentRange) {
        int slash = contentRange.lastIndexOf('/');
        if (slash < 0 || slash == contentRange.length() - 1) {
            return Optional.empty();
        }
        return parseLong(contentRange.substring(slash + 1));
    }
}
