package io.nosqlbench.provisioning.transport;


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


/// Moves bytes for one file and reports through a typed event stream.
///
/// Implementations write into the destination's temp sibling, resume from it when present, and
/// move it into place before emitting `Finished`.
public interface TransferTransport {

    /// Starts a transfer. Returns immediately; events arrive on the listener.
    ///
    /// @param request what to fetch and where to put it
    /// @param listener the event receiver
    /// @return a handle to pause or cancel the transfer
    TransferHandle begin(TransferRequest request, TransferListener listener);
}
