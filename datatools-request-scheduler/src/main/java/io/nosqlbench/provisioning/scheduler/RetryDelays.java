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

import java.time.Duration;
import java.util.Optional;
import java.util.Random;

/// Computes how long the scheduler waits before the next attempt of a request.
public final class RetryDelays {

    /// The shortest honored `Retry-After`
    public static final Duration MIN_RETRY_AFTER = Duration.ofMillis(500);
    /// The longest honored `Retry-After`
    public static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(10);
    /// Cap on the exponential part of the backoff
    public static final Duration MAX_BACKOFF = Duration.ofSeconds(8);
    /// Upper bound of the random jitter added to a backoff
    public static final Duration MAX_JITTER = Duration.ofMillis(250);

    private RetryDelays() {
    }

    /// Uses the response's `Retry-After` header when it holds a number of seconds, clamped
    /// to [0.5s, 10s], otherwise falls back to {@link #backoff(int, Random)}.
    ///
    /// @param response the retryable response
    /// @param attempt the 1-based attempt that produced it
    /// @param random jitter source
    /// @return the delay before the next attempt
    public static Duration forResponse(HubResponse response, int attempt, Random random) {
        Optional<Duration> retryAfter = response.header("Retry-After").flatMap(RetryDelays::parseRetryAfter);
        return retryAfter.map(RetryDelays::clampRetryAfter).orElseGet(() -> backoff(attempt, random));
    }

    /// @param attempt the 1-based attempt that just failed
    /// @param random jitter source
    /// @return `min(2^(attempt-1), 8)` seconds plus jitter in [0, 0.25s]
    public static Duration backoff(int attempt, Random random) {
        int exponent = Math.max(0, Math.min(attempt - 1, 10));
        long baseMillis = Math.min(1000L << exponent, MAX_BACKOFF.toMillis());
        long jitter = (long) (random.nextDouble() * MAX_JITTER.toMillis());
        return Duration.ofMillis(baseMillis + jitter);
    }

    static Optional<Duration> parseRetryAfter(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            double seconds = Double.parseDouble(value.trim());
            if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofMillis(Math.round(seconds * 1000d)));
        } catch (NumberFormatException e) {
            // HTTP-date forms are not honored
            return Optional.empty();
        }
    }

    static Duration clampRetryAfter(Duration requested) {
        if (requested.compareTo(MIN_RETRY_AFTER) < 0) {
            return MIN_RETRY_AFTER;
        }
        if (requested.compareTo(MAX_RETRY_AFTER) > 0) {
            return MAX_RETRY_AFTER;
        }
        return requested;
    }
}
