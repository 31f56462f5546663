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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.net.URL;

////*
///  A JUnit Jupiter extension that shares one {@link JettyHubServerFixture} per JVM.
///
///  The server is started the first time a test class using the extension runs and is
///  stopped by a shutdown hook. Scripted routes persist across test classes, so tests
///  should register routes under paths unique to the test.
///
/// Example usage:
///
/// ```java
/// @ExtendWith(JettyHubServerExtension.class)
/// public class MyTest {
///     // Test methods
/// }
/// ```
///
public class JettyHubServerExtension implements BeforeAllCallback, AfterAllCallback {
    private static final Logger logger = LogManager.getLogger(JettyHubServerExtension.class);
    private static JettyHubServerFixture server;
    private static URL baseUrl;

    private static final Object lock = new Object();

    /**
     * Initializes and starts the server if not already started.
     * This method is thread-safe and idempotent.
     */
    public static void initialize() {
        synchronized (lock) {
            if (server == null) {
                try {
                    logger.info("Starting Jetty hub server for the module");
                    server = new JettyHubServerFixture();
                    server.start();
                    baseUrl = server.getBaseUrl();
                    logger.info("Jetty hub server started at {}", baseUrl);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        if (server != null) {
                            logger.info("Stopping Jetty hub server for the module (shutdown hook)");
                            server.close();
                            server = null;
                            baseUrl = null;
                        }
                    }));
                } catch (IOException e) {
                    logger.error("Failed to start Jetty hub server", e);
                    throw new RuntimeException("Failed to start Jetty hub server", e);
                }
            }
        }
    }

    /**
     * Gets the base URL of the test web server.
     * @return The base URL of the test web server
     */
    public static URL getBaseUrl() {
        initialize();
        return baseUrl;
    }

    /**
     * Gets the shared fixture instance.
     * @return The shared JettyHubServerFixture
     */
    public static JettyHubServerFixture getServer() {
        initialize();
        return server;
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
        logger.debug("JettyHubServerExtension beforeAll called for {}", context.getDisplayName());
    }

    @Override
    public void afterAll(ExtensionContext context) {
        // stopped by the shutdown hook
        logger.debug("JettyHubServerExtension afterAll called for {}", context.getDisplayName());
    }
}
