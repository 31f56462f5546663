package io.nosqlbench.provisioning.fs;


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
import java.nio.file.Path;

/// On-disk layout under the storage root.
///
/// ```
/// <root>/models/<owner>/<repo>/<weights>.gguf
/// <root>/models/<owner>/<repo>/artifacts.json
/// <root>/datasets/<dataset id segments>/...
/// <root>/bundles/<slug>.bundle
/// <root>/embeddings/<file>
/// ```
///
/// An in-progress file is the final name with {@link #TEMP_SUFFIX} appended, next to the final
/// file. Every identity segment is checked so a crafted id cannot escape the root.
public class ArtifactLayout {

    /// Suffix of in-progress files
    public static final String TEMP_SUFFIX = ".download";
    /// Name of the per-model manifest
    public static final String MANIFEST_FILE = "artifacts.json";
    /// Extension of SLM bundle files
    public static final String BUNDLE_EXTENSION = ".bundle";

    private final Path root;

    public ArtifactLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /// @param repoId an `owner/repo` id
    /// @return the model directory
    public Path modelDirectory(String repoId) {
        return resolveSegments(root.resolve("models"), repoId);
    }

    /// @param modelDirectory a model directory
    /// @return its manifest path
    public Path manifestFile(Path modelDirectory) {
        return modelDirectory.resolve(MANIFEST_FILE);
    }

    /// @param datasetId a dataset id, possibly `owner/name`
    /// @return the dataset directory
    public Path datasetDirectory(String datasetId) {
        return resolveSegments(root.resolve("datasets"), datasetId);
    }

    /// @param datasetDirectory the dataset directory
    /// @param relativeName a file name, possibly with sub-directories
    /// @return the file path inside the dataset
    public Path datasetFile(Path datasetDirectory, String relativeName) {
        return resolveSegments(datasetDirectory, relativeName);
    }

    /// @param slug the bundle slug
    /// @return the bundle file
    public Path bundleFile(String slug) {
        return root.resolve("bundles").resolve(safeSegment(slug) + BUNDLE_EXTENSION);
    }

    /// @param fileName the embedding model file name
    /// @return the embedding file
    public Path embeddingFile(String fileName) {
        return root.resolve("embeddings").resolve(safeSegment(fileName));
    }

    /// @param finalPath a final artifact path
    /// @return the in-progress sibling
    public static Path tempFor(Path finalPath) {
        return finalPath.resolveSibling(finalPath.getFileName().toString() + TEMP_SUFFIX);
    }

    /// @param url a download URL
    /// @return the last path segment, without query
    public static String fileNameOf(URI url) {
        String path = url.getPath();
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            throw new IllegalArgumentException("no file name in " + url);
        }
        return safeSegment(path.substring(path.lastIndexOf('/') + 1));
    }

    /// @param segment one path component
    /// @return the segment, unchanged
    /// @throws IllegalArgumentException for empty, `.`, `..`, absolute or separator-bearing segments
    public static String safeSegment(String segment) {
        if (segment == null || segment.isBlank() || segment.equals(".") || segment.equals("..")
            || segment.contains("/") || segment.contains("\\") || segment.indexOf('\0') >= 0
            || Path.of(segment).isAbsolute()) {
            throw new IllegalArgumentException("unsafe path segment: '" + segment + "'");
        }
        return segment;
    }

    private static Path resolveSegments(Path base, String id) {
        if (id == null || id.isBlank() || id.startsWith("/") || id.startsWith("\\")) {
            throw new IllegalArgumentException("unsafe identity: '" + id + "'");
        }
        Path result = base;
        for (String segment : id.split("/", -1)) {
            result = result.resolve(safeSegment(segment));
        }
        return result;
    }
}
