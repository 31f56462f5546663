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

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// The buffered result of one {@link HubRequest}.
///
/// @param code the HTTP status code
/// @param headers response headers, keyed by lower-case name
/// @param body the response body, empty for HEAD
public record HubResponse(int code, Map<String, List<String>> headers, byte[] body) {

    /// @param name a header name, any case
    /// @return the first value of the header
    public Optional<String> header(String name) {
        List<String> values = headers.get(name.toLowerCase());
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    /// @return true for 2xx statuses
    public boolean isSuccessful() {
        return code >= 200 && code < 300;
    }

    /// @return true for statuses the scheduler retries: 429 and 5xx
    public boolean isRetryableStatus() {
        return code == 429 || (code >= 500 && code <= 599);
    }

    /// @return the body decoded as UTF-8
    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
