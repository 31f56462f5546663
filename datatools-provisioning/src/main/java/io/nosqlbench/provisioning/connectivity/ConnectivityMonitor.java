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


import java.util.concurrent.CompletableFuture;

/// Reports network reachability and notifies when it returns.
public interface ConnectivityMonitor {

    boolean isConnected();

    /// @return a future completed as soon as the network is reachable; already complete when online
    CompletableFuture<Void> whenConnected();
}
