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

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/// One metadata request to the shared origin.
///
/// Requests with the same {@link #dedupKey()} that are in flight at the same time are folded
/// into a single round trip by the {@link RequestScheduler}.
///
/// @param url the absolute request URL
/// @param method the HTTP method, upper case
/// @param headers request headers, in a stable order
/// @param cacheKey an explicit dedup key, or null to derive one from url, method and headers
/// @param timeout the per-request call timeout, or null for the client default
public record HubRequest(String url, String method, Map<String, String> headers, String cacheKey,
                         Duration timeout) {

    public HubRequest {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be empty");
        }
        method = method == null ? "GET" : method.toUpperCase();
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(headers));
    }

    /// @param url the request URL
    /// @return a GET request with no headers
    public static HubRequest get(String url) {
        return new HubRequest(url, "GET", Map.of(), null, null);
    }

    /// @param url the request URL
    /// @return a HEAD request with no headers
    public static HubRequest head(String url) {
        return new HubRequest(url, "HEAD", Map.of(), null, null);
    }

    /// @param name header name
    /// @param value header value
    /// @return a copy with the header added
    public HubRequest withHeader(String name, String value) {
        TreeMap<String, String> copy = new TreeMap<>(headers);
        copy.put(name, value);
        return new HubRequest(url, method, copy, cacheKey, timeout);
    }

    /// @param bearerToken a token, ignored when null or blank
    /// @return a copy carrying an `Authorization: Bearer` header
    public HubRequest withBearerToken(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            return this;
        }
        return withHeader("Authorization", "Bearer " + bearerToken.trim());
    }

    /// @param key the dedup key
    /// @return a copy with an explicit dedup key
    public HubRequest withCacheKey(String key) {
        return new HubRequest(url, method, headers, key, timeout);
    }

    /// @param callTimeout the whole-call timeout
    /// @return a copy with a per-request timeout
    public HubRequest withTimeout(Duration callTimeout) {
        return new HubRequest(url, method, headers, cacheKey, callTimeout);
    }

    /// @return the key identical concurrent requests share
    public String dedupKey() {
        if (cacheKey != null) {
            return cacheKey;
        }
        String headerPart = headers.entrySet().stream()
            .map(e -> e.getKey().toLowerCase() + "=" + e.getValue())
            .collect(Collectors.joining(","));
        return method + "|" + url + "|" + headerPart;
    }
}
