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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JettyHubServerFixture class.
 * Verifies static file serving with ranges and scripted route sequencing.
 */
@ExtendWith(JettyHubServerExtension.class)
public class JettyHubServerFixtureTest {

    private JettyHubServerFixture server;

    @BeforeEach
    public void setUp() {
        server = JettyHubServerExtension.getServer();
    }

    @Test
    public void testServesStaticFiles() throws IOException {
        URL url = server.putFile("fixture/basic.txt", "hello hub".getBytes(StandardCharsets.UTF_8));
        HttpURLConnection connection = (HttpURLConnection) url.openConnection();
        try {
            assertEquals(200, connection.getResponseCode());
            try (InputStream in = connection.getInputStream()) {
                assertEquals("hello hub", new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
        } finally {
            connection.disconnect();
        }
    }

    @Test
    public void testRangeRequests() throws IOException {
        byte[] content = new byte[1000];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i % 251);
        }
        URL url = server.putFile("fixture/ranged.bin", content);

        HttpURLConnection connection = (HttpURLConnection) url.openConnection();
        connection.setRequestProperty("Range", "bytes=900-");
        try {
            assertEquals(206, connection.getResponseCode(), "partial content expected for a range request");
            String contentRange = connection.getHeaderField("Content-Range");
            assertNotNull(contentRange);
            assertTrue(contentRange.startsWith("bytes 900-999/1000"), contentRange);
            try (InputStream in = connection.getInputStream()) {
                byte[] tail = in.readAllBytes();
                assertEquals(100, tail.length);
                assertEquals(content[900], tail[0]);
            }
        } finally {
            connection.disconnect();
        }
    }

    @Test
    public void testScriptedRoutesAdvanceAndRepeatLastHandler() throws IOException {
        String path = "/scripted/sequence";
        URL url = server.route(path,
            RouteHandler.status(503, null),
            RouteHandler.status(429, "2"),
            RouteHandler.json("{\"ok\":true}"));

        assertEquals(503, statusOf(url));
        HttpURLConnection limited = (HttpURLConnection) url.openConnection();
        try {
            assertEquals(429, limited.getResponseCode());
            assertEquals("2", limited.getHeaderField("Retry-After"));
        } finally {
            limited.disconnect();
        }
        assertEquals(200, statusOf(url));
        assertEquals(200, statusOf(url));
        assertEquals(4, server.requestCount(path));
    }

    @Test
    public void testUnknownRouteIsNotFound() throws IOException {
        assertEquals(404, statusOf(server.url("/scripted/nothing-here")));
    }

    private int statusOf(URL url) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) url.openConnection();
        try {
            return connection.getResponseCode();
        } finally {
            connection.disconnect();
        }
    }
}
