package io.nosqlbench.jetty.testserver;

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

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/// A scripted response for one route of the {@link JettyHubServerFixture}.
///
/// Handlers run on Jetty worker threads, so anything they share with the test must be
/// thread-safe.
@FunctionalInterface
public interface RouteHandler {

    /// Writes the response for one request.
    /// @param request the servlet request
    /// @param response the servlet response
    /// @throws IOException if writing the response fails
    void handle(HttpServletRequest request, HttpServletResponse response) throws IOException;

    /// A handler that always answers with the given status and body.
    /// @param status the HTTP status code
    /// @param contentType the content type header value
    /// @param body the response body
    /// @return a fixed handler
    static RouteHandler fixed(int status, String contentType, String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return (request, response) -> {
            response.setStatus(status);
            response.setContentType(contentType);
            response.setContentLength(bytes.length);
            if (!"HEAD".equalsIgnoreCase(request.getMethod())) {
                response.getOutputStream().write(bytes);
            }
        };
    }

    /// A JSON 200 response.
    /// @param json the JSON document
    /// @return a fixed JSON handler
    static RouteHandler json(String json) {
        return fixed(200, "application/json", json);
    }

    /// A bare status response, optionally with a `Retry-After` header.
    /// @param status the HTTP status code
    /// @param retryAfter the `Retry-After` value, or null for none
    /// @return a status-only handler
    static RouteHandler status(int status, String retryAfter) {
        return (request, response) -> {
            response.setStatus(status);
            if (retryAfter != null) {
                response.setHeader("Retry-After", retryAfter);
            }
            response.setContentLength(0);
        };
    }

    /// Answers HEAD and GET with a content length but no body for HEAD.
    /// @param length the advertised content length
    /// @return a sizing handler
    static RouteHandler contentLength(long length) {
        return (request, response) -> {
            response.setStatus(200);
            response.setContentType("application/octet-stream");
            response.setContentLengthLong(length);
            if (!"HEAD".equalsIgnoreCase(request.getMethod())) {
                byte[] chunk = new byte[8192];
                long remaining = length;
                while (remaining > 0) {
                    int n = (int) Math.min(chunk.length, remaining);
                    response.getOutputStream().write(chunk, 0, n);
                    remaining -= n;
                }
            }
        };
    }
}
