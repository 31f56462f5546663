package io.nosqlbench.provisioning.connectivity;


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


import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/// A {@link ConnectivityMonitor} fed by {@link #update(boolean)} calls from a platform
/// reachability callback. Waiters are released on the transition to connected, never by polling.
public class ConnectivitySignal implements ConnectivityMonitor {

    private static final Logger logger = LogManager.getLogger(ConnectivitySignal.class);

    private final Object lock = new Object();
    private final List<CompletableFuture<Void>> waiters = new ArrayList<>();
    private boolean connected;

    public ConnectivitySignal(boolean initiallyConnected) {
        this.connected = initiallyConnected;
    }

    @Override
    public boolean isConnected() {
        synchronized (lock) {
            return connected;
        }
    }

    @Override
    public CompletableFuture<Void> whenConnected() {
        synchronized (lock) {
            if (connected) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.add(waiter);
            return waiter;
        }
    }

    /// @param nowConnected the current reachability
    public void update(boolean nowConnected) {
        List<CompletableFuture<Void>> released;
        synchronized (lock) {
            if (connected == nowConnected) {
                return;
            }
            connected = nowConnected;
            if (!nowConnected) {
                logger.info("network connectivity lost");
                return;
            }
            released = new ArrayList<>(waiters);
            waiters.clear();
        }
        logger.info("network connectivity restored, releasing {} waiting downloads", released.size());
        released.forEach(w -> w.complete(null));
    }
}
