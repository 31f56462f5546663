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


import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    @Test
    void connectivityFailuresAreRetryable() {
        assertThat(ErrorClassifier.classify(new UnknownHostException("hub"))).isEqualTo(DownloadError.network("DNS lookup failed"));
        assertThat(ErrorClassifier.classify(new SocketTimeoutException("slow")).message()).isEqualTo("Connection timed out");
        assertThat(ErrorClassifier.classify(new IOException("wrapped", new ConnectException("refused"))).isRetryable()).isTrue();
    }

    @Test
    void serverErrorsArePromotedToNetworkErrors() {
        DownloadError error = ErrorClassifier.classify(TransferException.forStatus(503, "http://hub/x"));
        assertThat(error.kind()).isEqualTo(DownloadError.Kind.NETWORK);
        assertThat(error.message()).isEqualTo("Server error (503)");
    }

    @Test
    void clientErrorsAndBadContentArePermanent() {
        assertThat(ErrorClassifier.classify(TransferException.forStatus(404, "http://hub/x")).isRetryable()).isFalse();
        assertThat(ErrorClassifier.classify(new TransferException(TransferFailure.INVALID_CONTENT, "bad checksum")))
            .isEqualTo(DownloadError.permanent("bad checksum"));
        assertThat(ErrorClassifier.classify(new IllegalStateException("boom")).isRetryable()).isFalse();
    }

    @Test
    void mapsNestedCauses() {
        TransferException mapped = TransferException.from(new RuntimeException(new UnknownHostException("h")));
        assertThat(mapped.failure()).isEqualTo(TransferFailure.DNS_LOOKUP_FAILED);
        assertThat(mapped.failure().isConnectivity()).isTrue();
        assertThat(mapped.httpStatus()).isEqualTo(-1);
    }
}
