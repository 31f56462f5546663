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


/// Splits transport failures into retryable network errors and permanent errors.
///
/// Server 5xx responses are promoted to network errors since they are usually transient.
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    /// @param error any failure from a transfer or a metadata call
    /// @return the item-level error
    public static DownloadError classify(Throwable error) {
        TransferException te = TransferException.from(error);
        return switch (te.failure()) {
            case NOT_CONNECTED -> DownloadError.network("No internet connection");
            case TIMED_OUT -> DownloadError.network("Connection timed out");
            case CANNOT_CONNECT, CANNOT_FIND_HOST -> DownloadError.network("Cannot reach server");
            case CONNECTION_LOST -> DownloadError.network("Connection lost");
            case DNS_LOOKUP_FAILED -> DownloadError.network("DNS lookup failed");
            case HTTP_STATUS -> te.httpStatus() >= 500 && te.httpStatus() <= 599
                ? DownloadError.network("Server error (" + te.httpStatus() + ")")
                : DownloadError.permanent(te.getMessage());
            case INVALID_CONTENT, FILESYSTEM, OTHER -> DownloadError.permanent(te.getMessage());
        };
    }
}
