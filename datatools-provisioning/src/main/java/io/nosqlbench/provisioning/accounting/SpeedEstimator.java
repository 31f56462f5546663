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


import io.nosqlbench.provisioning.config.ProvisioningConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Smoothed throughput per identity.
///
/// Byte samples are taken per (identity, sub-part) and only once at least the sample interval
/// has passed since the previous one. Each instantaneous rate is clamped to [0, max] and folded
/// into an exponential moving average per identity. {@link #sweep(Set)} zeroes identities whose
/// last sample is older than the staleness window, or that are paused.
public class SpeedEstimator {

    private final Clock clock;
    private final double alpha;
    private final Duration sampleInterval;
    private final Duration staleWindow;
    private final double maxSpeed;

    private final Map<SampleKey, Sample> samples = new ConcurrentHashMap<>();
    private final Map<String, Smoothed> speeds = new ConcurrentHashMap<>();

    /// @param clock time source
    /// @param config supplies alpha, sample interval, staleness window and the speed ceiling
    public SpeedEstimator(Clock clock, ProvisioningConfig config) {
        this(clock, config.emaAlpha(), config.sampleInterval(), config.staleWindow(), config.maxInstantSpeed());
    }

    public SpeedEstimator(Clock clock, double alpha, Duration sampleInterval, Duration staleWindow, double maxSpeed) {
        this.clock = clock;
        this.alpha = alpha;
        this.sampleInterval = sampleInterval;
        this.staleWindow = staleWindow;
        this.maxSpeed = maxSpeed;
    }

    /// Records a cumulative byte count for one sub-part.
    ///
    /// @param identity the download identity
    /// @param part the sub-part name
    /// @param totalBytes cumulative bytes written for the sub-part
    /// @return the identity's smoothed speed after this sample
    public double recordBytes(String identity, String part, long totalBytes) {
        Instant now = clock.instant();
        SampleKey key = new SampleKey(identity, part);
        Sample previous = samples.get(key);
        if (previous == null || totalBytes < previous.bytes()) {
            samples.put(key, new Sample(now, totalBytes));
            return speed(identity);
        }
        Duration elapsed = Duration.between(previous.at(), now);
        if (elapsed.compareTo(sampleInterval) < 0) {
            return speed(identity);
        }
        samples.put(key, new Sample(now, totalBytes));
        double seconds = elapsed.toNanos() / 1e9d;
        return recordInstant(identity, (totalBytes - previous.bytes()) / seconds);
    }

    /// Folds an instantaneous rate into the identity's average.
    ///
    /// @param identity the download identity
    /// @param instantSpeed bytes per second
    /// @return the new smoothed speed
    public double recordInstant(String identity, double instantSpeed) {
        double clamped = clamp(instantSpeed);
        Smoothed previous = speeds.get(identity);
        double prior = previous == null ? 0d : previous.speed();
        double next = prior == 0d ? clamped : (1 - alpha) * prior + alpha * clamped;
        speeds.put(identity, new Smoothed(next, clock.instant()));
        return next;
    }

    /// @param identity the download identity
    /// @return the smoothed speed, 0 when unknown
    public double speed(String identity) {
        Smoothed s = speeds.get(identity);
        return s == null ? 0d : s.speed();
    }

    /// Zeroes stale and paused identities.
    ///
    /// @param paused identities currently paused
    /// @return identities whose speed was set to 0 by this sweep
    public Set<String> sweep(Set<String> paused) {
        Instant cutoff = clock.instant().minus(staleWindow);
        Set<String> zeroed = new HashSet<>();
        for (Map.Entry<String, Smoothed> entry : speeds.entrySet()) {
            Smoothed s = entry.getValue();
            if (s.speed() == 0d) {
                continue;
            }
            if (paused.contains(entry.getKey()) || s.at().isBefore(cutoff)) {
                speeds.put(entry.getKey(), new Smoothed(0d, s.at()));
                zeroed.add(entry.getKey());
            }
        }
        return zeroed;
    }

    /// Sets an identity's speed to 0 immediately.
    ///
    /// @param identity the download identity
    public void zero(String identity) {
        speeds.computeIfPresent(identity, (k, s) -> new Smoothed(0d, s.at()));
    }

    /// Drops all state for an identity.
    ///
    /// @param identity the download identity
    public void forget(String identity) {
        speeds.remove(identity);
        samples.keySet().removeIf(k -> k.identity().equals(identity));
    }

    private double clamp(double value) {
        if (Double.isNaN(value) || value < 0) {
            return 0d;
        }
        return Math.min(value, maxSpeed);
    }

    private record SampleKey(String identity, String part) {
    }

    private record Sample(Instant at, long bytes) {
    }

    private record Smoothed(double speed, Instant at) {
    }
}
