package io.nosqlbench.provisioning.scheduler;


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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class RetryDelaysTest {

    private final Random random = new Random(42);

    @Test
    void retryAfterIsClampedToItsBounds() {
        assertThat(RetryDelays.forResponse(limited("3"), 1, random)).isEqualTo(Duration.ofSeconds(3));
        assertThat(RetryDelays.forResponse(limited("0.1"), 1, random)).isEqualTo(Duration.ofMillis(500));
        assertThat(RetryDelays.forResponse(limited("120"), 1, random)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void unparseableRetryAfterFallsBackToBackoff() {
        Duration delay = RetryDelays.forResponse(limited("Wed, 21 Oct 2015 07:28:00 GMT"), 2, random);
        assertThat(delay.toMillis()).isBetween(2000L, 2250L);
    }

    @Test
    void backoffDoublesUntilTheCap() {
        assertThat(RetryDelays.backoff(1, random).toMillis()).isBetween(1000L, 1250L);
        assertThat(RetryDelays.backoff(3, random).toMillis()).isBetween(4000L, 4250L);
        assertThat(RetryDelays.backoff(4, random).toMillis()).isBetween(8000L, 8250L);
        assertThat(RetryDelays.backoff(30, random).toMillis()).isBetween(8000L, 8250L);
    }

    private static HubResponse limited(String retryAfter) {
        return new HubResponse(429, Map.of("retry-after", List.of(retryAfter)), new byte[0]);
    }
}
