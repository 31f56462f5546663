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


import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Extracts `owner/repo` ids from hub URLs.
public final class RepoIds {

    private static final Set<String> PREFIXES = Set.of("api", "models", "repos");

    private RepoIds() {
    }

    /// Accepts `/owner/repo/resolve/main/file`, `/api/models/owner/repo` and
    /// `/repos/owner/repo/...` forms.
    ///
    /// @param url a hub URL
    /// @return the repo id, when the path has at least two non-prefix segments
    public static Optional<String> fromUrl(URI url) {
        String path = url.getPath();
        if (path == null) {
            return Optional.empty();
        }
        List<String> segments = new ArrayList<>();
        for (String s : path.split("/")) {
            if (!s.isEmpty()) {
                segments.add(s);
            }
        }
        int i = 0;
        while (i < segments.size() && PREFIXES.contains(segments.get(i))) {
            i++;
        }
        if (segments.size() - i < 2) {
            return Optional.empty();
        }
        return Optional.of(segments.get(i) + "/" + segments.get(i + 1));
    }
}
