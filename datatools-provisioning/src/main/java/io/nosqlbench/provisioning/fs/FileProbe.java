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


import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

/// The narrow view of the filesystem the orchestrators depend on.
public interface FileProbe {

    /// @param path a file
    /// @return its size, or empty when it does not exist
    OptionalLong size(Path path);

    /// @param path a file
    /// @return true when it exists
    default boolean exists(Path path) {
        return size(path).isPresent();
    }

    /// @param directory a directory
    /// @return its regular files, or an empty list when the directory is missing
    List<Path> list(Path directory);

    /// @param path a file that may be absent
    /// @throws IOException when an existing file cannot be removed
    void deleteIfExists(Path path) throws IOException;

    /// Moves a file into place, replacing any existing target.
    ///
    /// @param source the file to move
    /// @param target the destination
    /// @throws IOException when the move fails
    void move(Path source, Path target) throws IOException;
}
