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


import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Identities the caller has paused. Their speed is forced to 0.
public class PauseSet {

    private final Set<String> paused = ConcurrentHashMap.newKeySet();

    public void add(String identity) {
        paused.add(identity);
    }

    public boolean remove(String identity) {
        return paused.remove(identity);
    }

    public boolean contains(String identity) {
        return paused.contains(identity);
    }

    public Set<String> snapshot() {
        return Set.copyOf(paused);
    }
}
