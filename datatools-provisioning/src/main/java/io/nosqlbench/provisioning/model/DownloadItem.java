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


import io.nosqlbench.provisioning.errors.DownloadError;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Observable state of one logical download.
///
/// Every mutator is called from the owner context only. Readers on other threads take a
/// {@link #snapshot()} through the owner context, so they never see a half-applied update.
///
/// While the item is active its reported progress is monotone and stays strictly below the
/// active ceiling; only {@link #markFinished()} sets it to 1.
public abstract class DownloadItem {

    private final String identity;
    private final ArtifactKind kind;
    private final String displayName;
    private final double activeCeiling;
    private final Map<String, PartProgress> parts = new LinkedHashMap<>();

    private DownloadState state = DownloadState.IDLE;
    private double progress;
    private double speed;
    private boolean completed;
    private DownloadError error;
    private int retryCount;
    private long generation;

    protected DownloadItem(String identity, ArtifactKind kind, String displayName, double activeCeiling) {
        this.identity = identity;
        this.kind = kind;
        this.displayName = displayName;
        this.activeCeiling = activeCeiling;
    }

    protected void addPart(PartProgress part) {
        parts.put(part.name(), part);
    }

    protected void removePart(String name) {
        parts.remove(name);
    }

    /// @param name a part name
    /// @return the part, or null
    public PartProgress part(String name) {
        return parts.get(name);
    }

    public Collection<PartProgress> parts() {
        return Collections.unmodifiableCollection(parts.values());
    }

    /// Raises the reported progress, clamped below completion.
    ///
    /// @param fraction the candidate fraction
    public void setActiveProgress(double fraction) {
        if (completed || Double.isNaN(fraction)) {
            return;
        }
        double clamped = Math.min(Math.max(fraction, 0d), activeCeiling);
        progress = Math.max(progress, clamped);
    }

    /// Recomputes progress from the parts. Never cached, since expected sizes can grow.
    public void refreshProgress() {
        setActiveProgress(combinedFraction());
    }

    /// @return the byte-weighted fraction across parts, or the current progress when no part has a size
    public double combinedFraction() {
        long expected = 0;
        long written = 0;
        for (PartProgress part : parts.values()) {
            if (part.expectedBytes() > 0) {
                expected += part.expectedBytes();
                written += Math.min(part.writtenBytes(), part.expectedBytes());
            }
        }
        if (expected <= 0) {
            return parts.values().stream().mapToDouble(PartProgress::fraction).max().orElse(progress);
        }
        return (double) written / expected;
    }

    /// Marks every part complete and the item finished.
    public void markFinished() {
        for (PartProgress part : parts.values()) {
            if (!part.isCompleted()) {
                part.complete(0);
            }
        }
        progress = 1d;
        speed = 0d;
        error = null;
        completed = true;
        state = DownloadState.FINISHED;
    }

    /// @return the sum of expected bytes over all parts
    public long expectedBytes() {
        return parts.values().stream().mapToLong(PartProgress::expectedBytes).sum();
    }

    /// @return the sum of written bytes over all parts
    public long writtenBytes() {
        return parts.values().stream().mapToLong(PartProgress::writtenBytes).sum();
    }

    /// @return the weight of this item in aggregate progress; 1 when no size is known yet
    public double aggregateWeight() {
        long best = Math.max(expectedBytes(), writtenBytes());
        return best > 0 ? best : 1d;
    }

    /// Starts a new task generation, so events from older tasks can be recognized and dropped.
    ///
    /// @return the new generation
    public long nextGeneration() {
        return ++generation;
    }

    public long generation() {
        return generation;
    }

    public String identity() {
        return identity;
    }

    public ArtifactKind kind() {
        return kind;
    }

    public String displayName() {
        return displayName;
    }

    public DownloadState state() {
        return state;
    }

    public void setState(DownloadState state) {
        this.state = state;
    }

    public double progress() {
        return progress;
    }

    public double speed() {
        return speed;
    }

    public void setSpeed(double speed) {
        this.speed = Math.max(0d, speed);
    }

    public boolean isCompleted() {
        return completed;
    }

    public DownloadError error() {
        return error;
    }

    public void setError(DownloadError error) {
        this.error = error;
    }

    public int retryCount() {
        return retryCount;
    }

    /// @return the incremented retry count
    public int incrementRetryCount() {
        return ++retryCount;
    }

    /// @return true while a checksum runs; only bundles verify
    public boolean isVerifying() {
        return false;
    }

    /// @return a consistent copy of the current state
    public ItemSnapshot snapshot() {
        List<ItemSnapshot.PartSnapshot> partSnapshots = new ArrayList<>();
        for (PartProgress part : parts.values()) {
            partSnapshots.add(part.snapshot());
        }
        return new ItemSnapshot(identity, kind, displayName, state, progress, speed, completed, error,
            retryCount, expectedBytes(), writtenBytes(), isVerifying(), List.copyOf(partSnapshots));
    }

    @Override
    public String toString() {
        return kind.getLabel() + "[" + identity + " " + state + " " + String.format("%.3f", progress) + "]";
    }
}
