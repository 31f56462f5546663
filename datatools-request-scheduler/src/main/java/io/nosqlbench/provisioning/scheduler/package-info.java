/// Rate-limited access to a shared metadata origin.
///
/// {@link io.nosqlbench.provisioning.scheduler.RequestScheduler} caps concurrency with a FIFO
/// permit queue, folds identical concurrent requests into one call, and retries 429, 5xx and
/// transient transport failures with bounded backoff.
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
