package io.nosqlbench.provisioning.errors;


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


/// Transport error codes, independent of the HTTP client in use.
public enum TransferFailure {
    NOT_CONNECTED(true),
    TIMED_OUT(true),
    CANNOT_CONNECT(true),
    CANNOT_FIND_HOST(true),
    CONNECTION_LOST(true),
    DNS_LOOKUP_FAILED(true),
    /// a non-success HTTP status; see {@link TransferException#httpStatus()}
    HTTP_STATUS(false),
    /// the payload arrived but failed validation
    INVALID_CONTENT(false),
    /// a local file could not be written, moved or read
    FILESYSTEM(false),
    OTHER(false);

    private final boolean connectivity;

    TransferFailure(boolean connectivity) {
        this.connectivity = connectivity;
    }

    /// @return true for failures caused by the network path rather than the payload or the device
    public boolean isConnectivity() {
        return connectivity;
    }
}
