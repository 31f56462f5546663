package io.nosqlbench.provisioning.concurrency;


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

/// Runs actions after a delay: retry backoff, grace-delay removal and the periodic sweep.
public interface DelayScheduler extends AutoCloseable {

    /// @param delay how long to wait
    /// @param action what to run
    /// @return a handle to cancel the action before it runs
    Scheduled schedule(Duration delay, Runnable action);

    /// @param period time between runs
    /// @param action what to run
    /// @return a handle to stop the repetition
    Scheduled every(Duration period, Runnable action);

    @Override
    void close();

    /// A pending action.
    interface Scheduled {
        void cancel();
    }
}
