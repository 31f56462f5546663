package io.nosqlbench.provisioning.support;


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


import io.nosqlbench.provisioning.metadata.ArtifactMetadataSource;
import io.nosqlbench.provisioning.metadata.BundleFile;
import io.nosqlbench.provisioning.metadata.ProjectorFile;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/// Canned hub answers.
public class StaticHubMetadata implements ArtifactMetadataSource {

    private final Map<String, ProjectorFile> projectors = new ConcurrentHashMap<>();
    private final Map<String, Long> sizes = new ConcurrentHashMap<>();
    private final Map<String, BundleFile> bundles = new ConcurrentHashMap<>();
    private final Set<String> failingRepos = ConcurrentHashMap.newKeySet();
    private final AtomicInteger projectorLookups = new AtomicInteger();

    public StaticHubMetadata projector(String repoId, ProjectorFile file) {
        projectors.put(repoId, file);
        return this;
    }

    public StaticHubMetadata size(URI url, long bytes) {
        sizes.put(url.toString(), bytes);
        return this;
    }

    public StaticHubMetadata bundle(String slug, BundleFile file) {
        bundles.put(slug, file);
        return this;
    }

    public StaticHubMetadata failing(String repoId) {
        failingRepos.add(repoId);
        return this;
    }

    public int projectorLookups() {
        return projectorLookups.get();
    }

    @Override
    public Optional<ProjectorFile> findProjector(String repoId) throws IOException {
        projectorLookups.incrementAndGet();
        if (failingRepos.contains(repoId)) {
            throw new IOException("hub unavailable for " + repoId);
        }
        return Optional.ofNullable(projectors.get(repoId));
    }

    @Override
    public long remoteSize(URI url) {
        return sizes.getOrDefault(url.toString(), 0L);
    }

    @Override
    public Optional<BundleFile> findBundle(String slug) {
        return Optional.ofNullable(bundles.get(slug));
    }
}
