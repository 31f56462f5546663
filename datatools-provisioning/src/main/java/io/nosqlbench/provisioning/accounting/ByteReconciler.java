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
import io.nosqlbench.provisioning.fs.FileProbe;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;

/// Combines in-memory byte counters with what is on disk.
///
/// The on-disk probe prefers the in-progress file, then the final file. Written bytes are the
/// larger of the probe and the counter, and the expected size is never below written. Results
/// depend only on the current disk state and the inputs, so repeated calls agree.
public class ByteReconciler {

    private final FileProbe probe;

    public ByteReconciler(FileProbe probe) {
        this.probe = probe;
    }

    /// @param finalFile the final path of the sub-part
    /// @param inMemoryWritten bytes reported by the transport
    /// @param bestKnownExpected best-known total, 0 when unknown
    /// @return reconciled counts
    public PartBytes reconcile(Path finalFile, long inMemoryWritten, long bestKnownExpected) {
        long onDisk = probeBytes(finalFile);
        long written = Math.max(onDisk, Math.max(0, inMemoryWritten));
        return new PartBytes(written, Math.max(bestKnownExpected, written));
    }

    /// @param finalFile the final path of the sub-part
    /// @return the temp file size when present, else the final file size, else 0
    public long probeBytes(Path finalFile) {
        OptionalLong temp = probe.size(ArtifactLayout.tempFor(finalFile));
        if (temp.isPresent()) {
            return temp.getAsLong();
        }
        return probe.size(finalFile).orElse(0L);
    }

    /// Reconciles a companion file whose name may not be known yet.
    ///
    /// @param directory the directory holding the companion
    /// @param knownName the companion's file name, or null
    /// @param hints lower-case substrings that identify the companion
    /// @param inMemoryWritten bytes reported by the transport
    /// @param bestKnownExpected best-known total, 0 when unknown
    /// @return reconciled counts
    public PartBytes reconcileCompanion(Path directory, String knownName, List<String> hints,
                                        long inMemoryWritten, long bestKnownExpected) {
        if (knownName != null) {
            return reconcile(directory.resolve(knownName), inMemoryWritten, bestKnownExpected);
        }
        long onDisk = findCompanion(directory, hints).flatMap(p -> {
            OptionalLong size = probe.size(p);
            return size.isPresent() ? Optional.of(size.getAsLong()) : Optional.empty();
        }).orElse(0L);
        long written = Math.max(onDisk, Math.max(0, inMemoryWritten));
        return new PartBytes(written, Math.max(bestKnownExpected, written));
    }

    /// @param directory a directory to scan
    /// @param hints lower-case substrings
    /// @return the first file whose name contains a hint, in-progress files included
    public Optional<Path> findCompanion(Path directory, List<String> hints) {
        for (Path file : probe.list(directory)) {
            String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
            for (String hint : hints) {
                if (name.contains(hint)) {
                    return Optional.of(file);
                }
            }
        }
        return Optional.empty();
    }
}
