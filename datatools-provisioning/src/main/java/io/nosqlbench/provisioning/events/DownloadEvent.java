package io.nosqlbench.provisioning.events;


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


import io.nosqlbench.provisioning.install.InstalledArtifact;

import java.util.OptionalLong;

/// Events a transport emits for one transfer, in emission order.
///
/// {@link Started} and {@link Progress} may repeat; exactly one of the remaining events ends
/// the stream.
public sealed interface DownloadEvent {

    /// @return true for the event that ends a transfer
    default boolean isTerminal() {
        return !(this instanceof Started || this instanceof Progress);
    }

    /// @param expectedBytes the size announced by the server, when known
    record Started(OptionalLong expectedBytes) implements DownloadEvent {
    }

    /// @param fraction transport-computed fraction
    /// @param bytesWritten bytes in the temp file
    /// @param expectedBytes announced total, 0 when unknown
    /// @param instantSpeed bytes per second since the previous progress event
    record Progress(double fraction, long bytesWritten, long expectedBytes, double instantSpeed)
        implements DownloadEvent {
    }

    /// @param fraction the fraction reached when the transfer halted
    record Paused(double fraction) implements DownloadEvent {
    }

    /// @param error the connectivity failure
    /// @param fraction the fraction reached before it
    record NetworkError(Throwable error, double fraction) implements DownloadEvent {
    }

    /// @param error the failure, to be classified
    record Failed(Throwable error) implements DownloadEvent {
    }

    record Cancelled() implements DownloadEvent {
    }

    /// @param artifact the file now in its final place
    record Finished(InstalledArtifact artifact) implements DownloadEvent {
    }
}
