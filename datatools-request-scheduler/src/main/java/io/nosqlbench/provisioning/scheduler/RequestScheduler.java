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

import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/// Bounds the number of simultaneous metadata requests sent to one origin.
///
/// Callers that find no free permit queue in FIFO order. Identical requests that overlap in
/// time share one round trip and one result. Responses with status 429 or 5xx and transient
/// transport failures are retried up to {@link #MAX_ATTEMPTS} times; when the attempts run
/// out on a retryable status, the last response is returned rather than thrown.
///
/// A permit is held only for the network call itself and is released before any retry
/// delay, including on the failure and cancellation paths.
public class RequestScheduler implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(RequestScheduler.class);

    /// Default number of concurrent requests
    public static final int DEFAULT_MAX_CONCURRENT = 2;
    /// Total attempts per request, including the first
    public static final int MAX_ATTEMPTS = 5;

    private final OkHttpClient client;
    private final int maxConcurrent;
    private final Sleeper sleeper;
    private final Random random;
    private final ExecutorService workers;

    private final Object lock = new Object();
    private final Deque<CompletableFuture<Long>> waiters = new ArrayDeque<>();
    private final Map<String, Inflight> inflight = new HashMap<>();
    private final Set<Call> activeCalls = ConcurrentHashMap.newKeySet();
    private int permits;
    private long epoch;

    /// Creates a scheduler with the default OkHttp client and the system sleeper.
    ///
    /// @param maxConcurrent the permit count, at least 1
    public RequestScheduler(int maxConcurrent) {
        this(defaultClient(), maxConcurrent, Sleeper.SYSTEM, new Random());
    }

    /// @param client the HTTP client used for every attempt
    /// @param maxConcurrent the permit count, at least 1
    /// @param sleeper waits out retry delays
    /// @param random jitter source
    public RequestScheduler(OkHttpClient client, int maxConcurrent, Sleeper sleeper, Random random) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1: " + maxConcurrent);
        }
        this.client = client;
        this.maxConcurrent = maxConcurrent;
        this.sleeper = sleeper;
        this.random = random;
        this.permits = maxConcurrent;
        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "request-scheduler-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /// @return an OkHttp client with short connect and read timeouts
    public static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .followRedirects(true)
            .build();
    }

    /// @return the configured permit count
    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    /// Starts the request, or joins the one already in flight with the same dedup key.
    ///
    /// @param request the request to send
    /// @return a future for the shared result
    public CompletableFuture<HubResponse> submit(HubRequest request) {
        String key = request.dedupKey();
        synchronized (lock) {
            Inflight existing = inflight.get(key);
            if (existing != null) {
                logger.trace("joining in-flight request {}", key);
                return existing.result.copy();
            }
            Inflight entry = new Inflight();
            inflight.put(key, entry);
            entry.worker = workers.submit(() -> run(key, request, entry));
            return entry.result.copy();
        }
    }

    /// Sends a request and waits for its result.
    ///
    /// @param request the request to send
    /// @return the final response
    /// @throws IOException on a non-transient failure, exhausted transient failures, or cancellation
    public HubResponse request(HubRequest request) throws IOException {
        try {
            return submit(request).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted waiting for " + request.url());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IOException(cause);
        }
    }

    /// @param url request URL
    /// @param method HTTP method
    /// @param headers request headers
    /// @param cacheKey explicit dedup key, or null
    /// @return the final response
    /// @throws IOException see {@link #request(HubRequest)}
    public HubResponse request(String url, String method, Map<String, String> headers, String cacheKey)
        throws IOException {
        return request(new HubRequest(url, method, headers, cacheKey, null));
    }

    /// Fails every in-flight and queued request with {@link RequestCancelledException},
    /// cancels their network calls, and restores the full permit count.
    public void cancelAll() {
        List<Inflight> dropped;
        List<CompletableFuture<Long>> queued;
        synchronized (lock) {
            epoch++;
            dropped = new ArrayList<>(inflight.values());
            inflight.clear();
            queued = new ArrayList<>(waiters);
            waiters.clear();
            permits = maxConcurrent;
        }
        if (!dropped.isEmpty() || !queued.isEmpty()) {
            logger.info("cancelling {} in-flight and {} queued metadata requests", dropped.size(), queued.size());
        }
        RequestCancelledException cancelled = new RequestCancelledException("request scheduler was cancelled");
        for (CompletableFuture<Long> waiter : queued) {
            waiter.completeExceptionally(cancelled);
        }
        for (Inflight entry : dropped) {
            entry.result.completeExceptionally(cancelled);
            Future<?> worker = entry.worker;
            if (worker != null) {
                worker.cancel(true);
            }
        }
        for (Call call : activeCalls) {
            call.cancel();
        }
    }

    @Override
    public void close() {
        cancelAll();
        workers.shutdownNow();
    }

    private void run(String key, HubRequest request, Inflight entry) {
        try {
            entry.result.complete(execute(request));
        } catch (InterruptedException e) {
            entry.result.completeExceptionally(new RequestCancelledException("interrupted: " + request.url()));
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            entry.result.completeExceptionally(e);
        } finally {
            synchronized (lock) {
                inflight.remove(key, entry);
            }
        }
    }

    private HubResponse execute(HubRequest request) throws IOException, InterruptedException {
        for (int attempt = 1; ; attempt++) {
            Duration pause;
            long token = acquire();
            try {
                HubResponse response = call(request);
                if (!response.isRetryableStatus() || attempt >= MAX_ATTEMPTS) {
                    return response;
                }
                pause = RetryDelays.forResponse(response, attempt, random);
                logger.debug("{} {} returned {}, attempt {} of {}, retrying in {}ms",
                    request.method(), request.url(), response.code(), attempt, MAX_ATTEMPTS, pause.toMillis());
            } catch (IOException e) {
                if (!TransientFailures.isTransient(e) || attempt >= MAX_ATTEMPTS) {
                    throw e;
                }
                pause = RetryDelays.backoff(attempt, random);
                logger.debug("{} {} failed ({}), attempt {} of {}, retrying in {}ms",
                    request.method(), request.url(), e.toString(), attempt, MAX_ATTEMPTS, pause.toMillis());
            } finally {
                release(token);
            }
            sleeper.sleep(pause);
        }
    }

    private long acquire() throws InterruptedException, RequestCancelledException {
        CompletableFuture<Long> ticket;
        synchronized (lock) {
            if (permits > 0) {
                permits--;
                return epoch;
            }
            ticket = new CompletableFuture<>();
            waiters.addLast(ticket);
        }
        try {
            return ticket.get();
        } catch (ExecutionException e) {
            throw new RequestCancelledException("request scheduler was cancelled");
        } catch (InterruptedException e) {
            synchronized (lock) {
                if (!waiters.remove(ticket) && ticket.isDone() && !ticket.isCompletedExceptionally()) {
                    release(ticket.join());
                }
            }
            throw e;
        }
    }

    private void release(long token) {
        synchronized (lock) {
            if (token != epoch) {
                return;
            }
            CompletableFuture<Long> next = waiters.pollFirst();
            if (next != null) {
                next.complete(epoch);
            } else {
                permits = Math.min(permits + 1, maxConcurrent);
            }
        }
    }

    private HubResponse call(HubRequest request) throws IOException {
        Request.Builder builder = new Request.Builder().url(request.url());
        request.headers().forEach(builder::header);
        boolean head = "HEAD".equals(request.method());
        switch (request.method()) {
            case "GET" -> builder.get();
            case "HEAD" -> builder.head();
            case "POST", "PUT", "PATCH" -> builder.method(request.method(), RequestBody.create(new byte[0], null));
            default -> builder.method(request.method(), null);
        }
        OkHttpClient callClient = request.timeout() == null
            ? client
            : client.newBuilder().callTimeout(request.timeout()).build();
        Call call = callClient.newCall(builder.build());
        activeCalls.add(call);
        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            byte[] bytes = (body == null || head) ? new byte[0] : body.bytes();
            Map<String, List<String>> headers = new LinkedHashMap<>();
            for (String name : response.headers().names()) {
                headers.put(name.toLowerCase(), response.headers(name));
            }
            return new HubResponse(response.code(), headers, bytes);
        } finally {
            activeCalls.remove(call);
        }
    }

    private static final class Inflight {
        private final CompletableFuture<HubResponse> result = new CompletableFuture<>();
        private volatile Future<?> worker;
    }
}
