package io.nosqlbench.provisioning.transport;


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


import io.nosqlbench.provisioning.errors.TransferException;
import io.nosqlbench.provisioning.errors.TransferFailure;
import io.nosqlbench.provisioning.events.DownloadEvent;
import io.nosqlbench.provisioning.install.InstalledArtifact;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/// {@link TransferTransport} over OkHttp with byte-range resume.
///
/// A transfer resumes from the destination's `.download` sibling with a `Range` request. When
/// the server ignores the range it starts over. A 416 answer to a non-empty temp file means the
/// file is already complete. Progress is emitted no more often than the configured tick.
///
/// Pausing keeps the temp file, cancelling deletes it. Connectivity failures end the transfer
/// with `NetworkError`, anything else with `Failed`.
public class HttpTransferTransport implements TransferTransport, AutoCloseable {

    private static final Logger logger = LogManager.getLogger(HttpTransferTransport.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    private final OkHttpClient client;
    private final Duration progressInterval;
    private final String userAgent;
    private final ExecutorService executor;

    /// @param progressInterval minimum time between progress events
    /// @param userAgent the User-Agent header value
    public HttpTransferTransport(Duration progressInterval, String userAgent) {
        this(new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .retryOnConnectionFailure(true)
            .followRedirects(true)
            .build(), progressInterval, userAgent);
    }

    public HttpTransferTransport(OkHttpClient client, Duration progressInterval, String userAgent) {
        this.client = client;
        this.progressInterval = progressInterval;
        this.userAgent = userAgent;
        AtomicInteger count = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "http-transfer-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public TransferHandle begin(TransferRequest request, TransferListener listener) {
        HttpTransfer transfer = new HttpTransfer(request, listener);
        executor.execute(transfer::run);
        return transfer;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private final class HttpTransfer implements TransferHandle {
        private final TransferRequest request;
        private final TransferListener listener;
        private volatile boolean pauseRequested;
        private volatile boolean cancelRequested;
        private volatile Call call;
        private long written;
        private long expected;

        private HttpTransfer(TransferRequest request, TransferListener listener) {
            this.request = request;
            this.listener = listener;
            this.expected = request.expectedBytes();
        }

        @Override
        public void pause() {
            pauseRequested = true;
            abortCall();
        }

        @Override
        public void cancel() {
            cancelRequested = true;
            abortCall();
        }

        private void abortCall() {
            Call current = call;
            if (current != null) {
                current.cancel();
            }
        }

        private void run() {
            Path temp = request.tempFile();
            try {
                transfer(temp);
            } catch (IOException | RuntimeException e) {
                if (stopRequested(temp)) {
                    return;
                }
                TransferException te = TransferException.from(e);
                if (te.failure().isConnectivity()) {
                    logger.debug("transfer of {} interrupted by network failure: {}", request.source(), te.getMessage());
                    listener.onEvent(new DownloadEvent.NetworkError(te, fraction()));
                } else {
                    logger.warn("transfer of {} failed: {}", request.source(), te.getMessage());
                    listener.onEvent(new DownloadEvent.Failed(te));
                }
            }
        }

        private void transfer(Path temp) throws IOException {
            Files.createDirectories(temp.getParent());
            long offset = Files.exists(temp) ? Files.size(temp) : 0L;

            Request.Builder builder = new Request.Builder().url(request.source().toString())
                .header("User-Agent", userAgent);
            request.headers().forEach(builder::header);
            if (offset > 0) {
                builder.header("Range", "bytes=" + offset + "-");
            }
            Call current = client.newCall(builder.build());
            call = current;
            if (stopRequested(temp)) {
                return;
            }

            try (Response response = current.execute()) {
                int code = response.code();
                if (code == 416 && offset > 0) {
                    logger.debug("server reports {} already complete at {} bytes", request.source(), offset);
                    written = offset;
                    expected = Math.max(expected, offset);
                    complete(temp);
                    return;
                }
                if (!response.isSuccessful()) {
                    throw TransferException.forStatus(code, request.source().toString());
                }
                boolean append = offset > 0 && code == 206;
                if (offset > 0 && !append) {
                    logger.debug("server ignored range for {}, restarting", request.source());
                }
                written = append ? offset : 0L;
                ResponseBody body = response.body();
                if (body == null) {
                    throw new TransferException(TransferFailure.INVALID_CONTENT, "empty body from " + request.source());
                }
                long length = body.contentLength();
                if (length >= 0) {
                    expected = written + length;
                }
                listener.onEvent(new DownloadEvent.Started(expected > 0 ? OptionalLong.of(expected) : OptionalLong.empty()));
                copy(body.byteStream(), temp, append);
            }
            if (stopRequested(temp)) {
                return;
            }
            complete(temp);
        }

        private void copy(InputStream in, Path temp, boolean append) throws IOException {
            OpenOption[] options = append
                ? new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.APPEND}
                : new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE};
            long intervalNanos = progressInterval.toNanos();
            long lastEmit = System.nanoTime();
            long lastBytes = written;
            try (InputStream source = in; OutputStream out = Files.newOutputStream(temp, options)) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int n;
                while (!pauseRequested && !cancelRequested && (n = source.read(buffer)) != -1) {
                    out.write(buffer, 0, n);
                    written += n;
                    long now = System.nanoTime();
                    if (now - lastEmit >= intervalNanos) {
                        double seconds = (now - lastEmit) / 1e9d;
                        listener.onEvent(new DownloadEvent.Progress(fraction(), written, expected,
                            (written - lastBytes) / seconds));
                        lastEmit = now;
                        lastBytes = written;
                    }
                }
            }
        }

        private void complete(Path temp) throws IOException {
            long size = Files.size(temp);
            try {
                Files.move(temp, request.destination(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, request.destination(), StandardCopyOption.REPLACE_EXISTING);
            }
            listener.onEvent(new DownloadEvent.Progress(1d, size, size, 0d));
            listener.onEvent(new DownloadEvent.Finished(
                new InstalledArtifact(request.identity(), request.kind(), request.destination(), null, size)));
        }

        /// Emits the terminal event for a pause or cancel, if one was requested.
        private boolean stopRequested(Path temp) {
            if (cancelRequested) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    logger.warn("unable to remove {} after cancel: {}", temp, e.getMessage());
                }
                listener.onEvent(new DownloadEvent.Cancelled());
                return true;
            }
            if (pauseRequested) {
                listener.onEvent(new DownloadEvent.Paused(fraction()));
                return true;
            }
            return false;
        }

        private double fraction() {
            return expected > 0 ? Math.min(1d, (double) written / expected) : 0d;
        }
    }
}
