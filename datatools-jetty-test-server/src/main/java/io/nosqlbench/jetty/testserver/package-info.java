/// Embedded Jetty server standing in for a model hub in tests.
///
/// This package provides an embedded Jetty server used to test the request scheduler,
/// the hub metadata client and the HTTP transfer transport. It serves static files with
/// byte-range support and answers scripted routes with fixed statuses, headers and bodies.
package io.nosqlbench.jetty.testserver;

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
