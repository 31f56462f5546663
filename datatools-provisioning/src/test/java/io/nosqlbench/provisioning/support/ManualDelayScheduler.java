package io.nosqlbench.provisioning.support;


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


import io.nosqlbench.provisioning.concurrency.DelayScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/// A {@link DelayScheduler} whose actions only run when the test says so.
public class ManualDelayScheduler implements DelayScheduler {

    private final List<Entry> entries = new ArrayList<>();

    @Override
    public synchronized Scheduled schedule(Duration delay, Runnable action) {
        Entry entry = new Entry(delay, action, false);
        entries.add(entry);
        return entry;
    }

    @Override
    public synchronized Scheduled every(Duration period, Runnable action) {
        Entry entry = new Entry(period, action, true);
        entries.add(entry);
        return entry;
    }

    /// @return delays of pending one-shot actions, in scheduling order
    public synchronized List<Duration> pendingDelays() {
        List<Duration> delays = new ArrayList<>();
        for (Entry e : entries) {
            if (!e.periodic && !e.cancelled && !e.ran) {
                delays.add(e.delay);
            }
        }
        return delays;
    }

    /// Runs pending one-shot actions with exactly this delay.
    ///
    /// @param delay the delay to match
    /// @return how many ran
    public int runDelayed(Duration delay) {
        List<Entry> due = new ArrayList<>();
        synchronized (this) {
            for (Entry e : entries) {
                if (!e.periodic && !e.cancelled && !e.ran && e.delay.equals(delay)) {
                    e.ran = true;
                    due.add(e);
                }
            }
        }
        due.forEach(e -> e.action.run());
        return due.size();
    }

    /// Runs every periodic action once.
    public void tick() {
        List<Entry> periodic = new ArrayList<>();
        synchronized (this) {
            for (Entry e : entries) {
                if (e.periodic && !e.cancelled) {
                    periodic.add(e);
                }
            }
        }
        periodic.forEach(e -> e.action.run());
    }

    @Override
    public void close() {
    }

    private static final class Entry implements Scheduled {
        final Duration delay;
        final Runnable action;
        final boolean periodic;
        volatile boolean cancelled;
        volatile boolean ran;

        Entry(Duration delay, Runnable action, boolean periodic) {
            this.delay = delay;
            this.action = action;
            this.periodic = periodic;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }
    }
}
