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


import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.FileSystemException;

/// An I/O failure tagged with a {@link TransferFailure} code.
public class TransferException extends IOException {

    private final TransferFailure failure;
    private final int httpStatus;

    public TransferException(TransferFailure failure, String message) {
        this(failure, message, -1, null);
    }

    public TransferException(TransferFailure failure, String message, Throwable cause) {
        this(failure, message, -1, cause);
    }

    private TransferException(TransferFailure failure, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.httpStatus = httpStatus;
    }

    /// @param status the HTTP status code
    /// @param url the requested URL
    /// @return an {@link TransferFailure#HTTP_STATUS} exception
    public static TransferException forStatus(int status, String url) {
        return new TransferException(TransferFailure.HTTP_STATUS, "HTTP " + status + " from " + url, status, null);
    }

    /// Maps any throwable onto a code by looking at it and its causes.
    ///
    /// @param error the failure to map
    /// @return the same instance when it is already a TransferException, otherwise a wrapper
    public static TransferException from(Throwable error) {
        if (error instanceof TransferException te) {
            return te;
        }
        Throwable current = error;
        for (int depth = 0; current != null && depth < 5; depth++) {
            TransferFailure code = codeOf(current);
            if (code != null) {
                return new TransferException(code, messageOf(error), error);
            }
            current = current.getCause();
        }
        return new TransferException(TransferFailure.OTHER, messageOf(error), error);
    }

    private static TransferFailure codeOf(Throwable t) {
        if (t instanceof TransferException te) {
            return te.failure;
        }
        if (t instanceof UnknownHostException) {
            return TransferFailure.DNS_LOOKUP_FAILED;
        }
        if (t instanceof SocketTimeoutException) {
            return TransferFailure.TIMED_OUT;
        }
        if (t instanceof NoRouteToHostException) {
            return TransferFailure.NOT_CONNECTED;
        }
        if (t instanceof ConnectException) {
            return TransferFailure.CANNOT_CONNECT;
        }
        if (t instanceof SocketException || t instanceof EOFException) {
            return TransferFailure.CONNECTION_LOST;
        }
        if (t instanceof InterruptedIOException && "timeout".equals(t.getMessage())) {
            return TransferFailure.TIMED_OUT;
        }
        if (t instanceof FileSystemException) {
            return TransferFailure.FILESYSTEM;
        }
        return null;
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    public TransferFailure failure() {
        return failure;
    }

    /// @return the HTTP status, or -1 when the failure is not an HTTP status
    public int httpStatus() {
        return httpStatus;
    }
}
