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


/// The error shown on an item.
///
/// Retryability is a function of {@link Kind} alone.
///
/// @param kind network or permanent
/// @param message a short human readable message
public record DownloadError(Kind kind, String message) {

    /// The two error families.
    public enum Kind {
        /// connectivity, timeouts, DNS and server 5xx; always retried
        NETWORK,
        /// everything else; surfaced and never retried
        PERMANENT
    }

    public static DownloadError network(String message) {
        return new DownloadError(Kind.NETWORK, message);
    }

    public static DownloadError permanent(String message) {
        return new DownloadError(Kind.PERMANENT, message);
    }

    /// @return true when the orchestrator should back off and try again
    public boolean isRetryable() {
        return kind == Kind.NETWORK;
    }
}
