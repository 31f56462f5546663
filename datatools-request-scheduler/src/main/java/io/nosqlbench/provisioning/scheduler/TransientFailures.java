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

import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

/// Decides which transport failures are worth another attempt.
///
/// Timeouts, DNS failures, refused or dropped connections are transient. Anything else,
/// including a cancellation, propagates immediately.
public final class TransientFailures {

    private TransientFailures() {
    }

    /// @param error a failure from one request attempt
    /// @return true when the attempt may be retried
    public static boolean isTransient(IOException error) {
        if (error instanceof RequestCancelledException) {
            return false;
        }
        Throwable current = error;
        for (int depth = 0; current != null && depth < 5; depth++) {
            if (isTransientType(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isTransientType(Throwable t) {
        if (t instanceof SocketTimeoutException
            || t instanceof UnknownHostException
            || t instanceof ConnectException
            || t instanceof NoRouteToHostException
            || t instanceof SocketException
            || t instanceof EOFException) {
            return true;
        }
        // OkHttp reports a call timeout as a bare InterruptedIOException("timeout")
        return t instanceof InterruptedIOException && "timeout".equals(t.getMessage());
    }
}
