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


import io.nosqlbench.provisioning.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SpeedEstimatorTest {

    private final MutableClock clock = new MutableClock();
    private final SpeedEstimator estimator =
        new SpeedEstimator(clock, 0.30, Duration.ofMillis(250), Duration.ofMillis(1250), 512d * 1024 * 1024);

    @Test
    void convergesOnASteadyRate() {
        long bytes = 0;
        estimator.recordBytes("m", "weights", bytes);
        for (int i = 0; i < 40; i++) {
            clock.advance(Duration.ofMillis(500));
            bytes += 1_000_000;
            estimator.recordBytes("m", "weights", bytes);
        }
        assertThat(estimator.speed("m")).isCloseTo(2_000_000d, within(1d));
    }

    @Test
    void ignoresSamplesInsideTheSampleInterval() {
        estimator.recordBytes("m", "weights", 0);
        clock.advance(Duration.ofMillis(100));
        assertThat(estimator.recordBytes("m", "weights", 5_000_000)).isZero();
    }

    @Test
    void smoothsWithAlpha() {
        estimator.recordInstant("m", 100d);
        assertThat(estimator.recordInstant("m", 200d)).isCloseTo(130d, within(1e-9));
    }

    @Test
    void clampsImplausibleBursts() {
        assertThat(estimator.recordInstant("m", 1e12)).isEqualTo(512d * 1024 * 1024);
        assertThat(estimator.recordInstant("n", -5d)).isZero();
    }

    @Test
    void sweepZeroesStaleAndPausedIdentities() {
        estimator.recordInstant("stale", 10d);
        estimator.recordInstant("paused", 10d);
        clock.advance(Duration.ofSeconds(1));
        estimator.recordInstant("fresh", 10d);
        estimator.recordInstant("paused", 10d);
        clock.advance(Duration.ofMillis(500));

        Set<String> zeroed = estimator.sweep(Set.of("paused"));

        assertThat(zeroed).containsExactlyInAnyOrder("stale", "paused");
        assertThat(estimator.speed("fresh")).isEqualTo(10d);
        assertThat(estimator.speed("stale")).isZero();
    }

    @Test
    void restartsSamplingAfterTheCountGoesBackwards() {
        estimator.recordBytes("m", "weights", 5000);
        clock.advance(Duration.ofSeconds(1));
        estimator.recordBytes("m", "weights", 0);
        clock.advance(Duration.ofSeconds(1));
        assertThat(estimator.recordBytes("m", "weights", 1000)).isEqualTo(1000d);
    }
}
