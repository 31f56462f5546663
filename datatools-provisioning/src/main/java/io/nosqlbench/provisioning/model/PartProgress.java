package io.nosqlbench.provisioning.model;


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


import io.nosqlbench.provisioning.accounting.PartBytes;

import java.nio.file.Path;

/// Progress of one physical file inside an item.
///
/// Mutated only by the owning orchestrator on the owner context.
public class PartProgress {

    private final String name;
    private final Path finalPath;
    private long writtenBytes;
    private long expectedBytes;
    private double fraction;
    private boolean completed;

    /// @param name the sub-part name, unique within the item
    /// @param finalPath where the finished file lives
    /// @param catalogBytes the catalog size, 0 when unknown
    public PartProgress(String name, Path finalPath, long catalogBytes) {
        this.name = name;
        this.finalPath = finalPath;
        this.expectedBytes = Math.max(0, catalogBytes);
    }

    /// Applies reconciled byte counts. Expected bytes never shrink.
    ///
    /// @param bytes the reconciled counts
    public void apply(PartBytes bytes) {
        writtenBytes = Math.max(writtenBytes, bytes.written());
        expectedBytes = Math.max(Math.max(expectedBytes, bytes.expected()), writtenBytes);
        if (!completed && expectedBytes > 0) {
            fraction = Math.max(fraction, Math.min(1d, (double) writtenBytes / expectedBytes));
        }
    }

    /// @param reported a fraction from the transport, used when no byte totals are known
    public void applyFraction(double reported) {
        if (!completed && !Double.isNaN(reported)) {
            fraction = Math.max(fraction, Math.min(1d, Math.max(0d, reported)));
        }
    }

    /// Raises the expected size, never lowering it.
    ///
    /// @param bytes a better size estimate
    /// @return true when the estimate grew
    public boolean raiseExpected(long bytes) {
        if (bytes > expectedBytes) {
            expectedBytes = bytes;
            return true;
        }
        return false;
    }

    /// Takes the size reported by the server for this transfer. It replaces the catalog size,
    /// but never drops below bytes already written.
    ///
    /// @param bytes the session-reported size
    /// @return true when the expected size changed
    public boolean acceptSessionExpected(long bytes) {
        long next = Math.max(bytes, writtenBytes);
        if (bytes <= 0 || next == expectedBytes) {
            return false;
        }
        expectedBytes = next;
        return true;
    }

    /// Marks the file as fully present.
    ///
    /// @param sizeOnDisk the final size, or 0 to keep the current counts
    public void complete(long sizeOnDisk) {
        if (sizeOnDisk > 0) {
            writtenBytes = sizeOnDisk;
            expectedBytes = sizeOnDisk;
        } else {
            writtenBytes = Math.max(writtenBytes, expectedBytes);
            expectedBytes = writtenBytes;
        }
        fraction = 1d;
        completed = true;
    }

    public String name() {
        return name;
    }

    public Path finalPath() {
        return finalPath;
    }

    public long writtenBytes() {
        return writtenBytes;
    }

    public long expectedBytes() {
        return expectedBytes;
    }

    public double fraction() {
        return fraction;
    }

    public boolean isCompleted() {
        return completed;
    }

    ItemSnapshot.PartSnapshot snapshot() {
        return new ItemSnapshot.PartSnapshot(name, finalPath.getFileName().toString(), fraction, writtenBytes,
            expectedBytes, completed);
    }
}
