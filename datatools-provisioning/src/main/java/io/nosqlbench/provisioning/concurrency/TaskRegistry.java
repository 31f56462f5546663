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


import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Identity to running task. An entry exists exactly while a task runs for the identity.
public class TaskRegistry {

    private final Map<String, ActiveTask> tasks = new ConcurrentHashMap<>();

    /// @param task the task to register
    /// @return false when a task is already registered for its identity
    public boolean register(ActiveTask task) {
        return tasks.putIfAbsent(task.identity(), task) == null;
    }

    public Optional<ActiveTask> get(String identity) {
        return Optional.ofNullable(tasks.get(identity));
    }

    public boolean contains(String identity) {
        return tasks.containsKey(identity);
    }

    /// Removes the task only if it is still the registered one.
    ///
    /// @param task the task to remove
    /// @return true when it was removed
    public boolean remove(ActiveTask task) {
        return tasks.remove(task.identity(), task);
    }

    /// @param identity an identity
    /// @return the removed task, if any
    public Optional<ActiveTask> remove(String identity) {
        return Optional.ofNullable(tasks.remove(identity));
    }

    public Set<String> identities() {
        return Set.copyOf(tasks.keySet());
    }
}
