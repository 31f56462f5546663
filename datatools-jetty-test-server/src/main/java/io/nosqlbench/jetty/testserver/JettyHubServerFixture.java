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
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.DefaultServlet;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * A test fixture that starts a Jetty web server standing in for a model hub.
 * <p>
 * Two kinds of content are served:
 * <ul>
 *   <li>static files under {@code /files/}, from a private temporary directory, with
 *   byte-range support from Jetty's {@link DefaultServlet}</li>
 *   <li>scripted routes for every other path, registered with {@link #route(String, RouteHandler...)}</li>
 * </ul>
 * The fixture counts requests per path and tracks the highest number of requests that
 * were in flight at the same time, so tests can assert on deduplication and concurrency.
 * <p>
 * Example usage:
 * ```java
 * try (JettyHubServerFixture server = new JettyHubServerFixture()) {
 *     server.start();
 *     server.route("/api/models/acme/demo", RouteHandler.json("{}"));
 *     URL url = server.url("/api/models/acme/demo");
 * }
 * ```
 */
public class JettyHubServerFixture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(JettyHubServerFixture.class);

    /// Path prefix for static files.
    public static final String FILES_PREFIX = "/files/";

    private Server server;
    private int port;
    private final Path filesRoot;
    private final Map<String, List<RouteHandler>> routes = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> requestCounts = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    /**
     * Creates a fixture serving static files from a fresh temporary directory.
     */
    public JettyHubServerFixture() {
        try {
            this.filesRoot = Files.createTempDirectory("hub-fixture");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Starts the web server on a random available port.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        this.port = findAvailablePort();
        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.setResourceBase(filesRoot.toAbsolutePath().toString());
        server.setHandler(context);

        ServletHolder files = new ServletHolder("files", DefaultServlet.class);
        files.setInitParameter("dirAllowed", "false");
        files.setInitParameter("pathInfoOnly", "true");
        files.setInitParameter("acceptRanges", "true");
        files.setInitParameter("etags", "true");
        context.addServlet(files, FILES_PREFIX + "*");
        context.addServlet(new ServletHolder("routes", new RoutingServlet()), "/");

        try {
            server.start();
            logger.info("Jetty hub server started on port {} serving files from {}", port, filesRoot);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /// Registers a scripted route. Successive requests use successive handlers; the last
    /// handler answers every request after the list runs out.
    /// @param path the request path, starting with `/`
    /// @param handlers one or more handlers
    /// @return the absolute URL of the route
    public URL route(String path, RouteHandler... handlers) {
        if (handlers.length == 0) {
            throw new IllegalArgumentException("at least one handler is required for " + path);
        }
        routes.put(path, new ArrayList<>(Arrays.asList(handlers)));
        requestCounts.remove(path);
        return url(path);
    }

    /// Writes a static file below the files root.
    /// @param relativePath the path below `/files/`
    /// @param content the file content
    /// @return the absolute URL of the file
    public URL putFile(String relativePath, byte[] content) {
        Path target = filesRoot.resolve(relativePath).normalize();
        if (!target.startsWith(filesRoot)) {
            throw new IllegalArgumentException("path escapes the files root: " + relativePath);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return url(FILES_PREFIX + relativePath);
    }

    /// Removes every scripted route and resets the counters.
    public void clearRoutes() {
        routes.clear();
        requestCounts.clear();
        maxInFlight.set(0);
    }

    /// @param path a request path
    /// @return how many requests reached the path since it was registered
    public int requestCount(String path) {
        AtomicInteger count = requestCounts.get(path);
        return count == null ? 0 : count.get();
    }

    /// @return the highest number of concurrently served route requests since the last reset
    public int maxConcurrentRequests() {
        return maxInFlight.get();
    }

    /// Resets the concurrency high-water mark.
    public void resetConcurrency() {
        maxInFlight.set(0);
    }

    /**
     * Gets the base URL of the server.
     *
     * @return The base URL of the server
     */
    public URL getBaseUrl() {
        return url("/");
    }

    /// @param path an absolute request path
    /// @return the absolute URL for the path on this server
    public URL url(String path) {
        try {
            return new URL("http://127.0.0.1:" + port + path);
        } catch (Exception e) {
            throw new RuntimeException("Failed to create server URL for " + path, e);
        }
    }

    /// @return the directory static files are served from
    public Path getFilesRoot() {
        return filesRoot;
    }

    /**
     * Stops the server and removes the static files directory.
     */
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Jetty hub server stopped");
            } catch (Exception e) {
                logger.error("Error stopping Jetty server", e);
            }
        }
        try (Stream<Path> paths = Files.walk(filesRoot)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            logger.warn("Failed to remove fixture files under {}: {}", filesRoot, e.getMessage());
        }
    }

    private int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new RuntimeException("Failed to find available port", e);
        }
    }

    private RouteHandler nextHandler(String path, int ordinal) {
        List<RouteHandler> handlers = routes.get(path);
        if (handlers == null) {
            return null;
        }
        return handlers.get(Math.min(ordinal, handlers.size() - 1));
    }

    private class RoutingServlet extends HttpServlet {
        @Override
        protected void service(HttpServletRequest request, HttpServletResponse response) throws IOException {
            String path = request.getRequestURI();
            int ordinal = requestCounts.computeIfAbsent(path, p -> new AtomicInteger()).getAndIncrement();
            RouteHandler handler = nextHandler(path, ordinal);
            if (handler == null) {
                logger.debug("No route for {} {}", request.getMethod(), path);
                response.sendError(404, "no route for " + path);
                return;
            }
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                handler.handle(request, response);
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }
}
