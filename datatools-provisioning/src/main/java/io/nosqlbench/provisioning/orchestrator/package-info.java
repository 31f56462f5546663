/// Per-kind download lifecycles.
///
/// {@link io.nosqlbench.provisioning.orchestrator.DownloadOrchestrator} holds the shared state
/// machine: one worker task per identity, every item mutation on the owner context, generation
/// counters to drop events from superseded tasks, retry with backoff once connectivity returns,
/// and idempotent finalization. Subclasses only say which files to fetch and how to install them.
package io.nosqlbench.provisioning.orchestrator;


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

