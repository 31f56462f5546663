package io.nosqlbench.provisioning.accounting;


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


/// Reconciled byte counts for one sub-part.
///
/// @param written bytes written so far
/// @param expected best-known total, never smaller than written
public record PartBytes(long written, long expected) {

    public PartBytes {
        written = Math.max(0, written);
        expected = Math.max(expected, written);
    }
}
