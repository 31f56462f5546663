package io.nosqlbench.provisioning.support;


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


import io.nosqlbench.provisioning.events.DownloadEvent;
import io.nosqlbench.provisioning.transport.TransferHandle;
import io.nosqlbench.provisioning.transport.TransferListener;
import io.nosqlbench.provisioning.transport.TransferRequest;
import io.nosqlbench.provisioning.transport.TransferTransport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/// A transport driven by the test. Each `begin` becomes a {@link Transfer} the test can feed
/// events to, unless content was registered for its URL with {@link #serve}, in which case it
/// completes at once.
public class ScriptedTransport implements TransferTransport {

    private final BlockingQueue<Transfer> pending = new LinkedBlockingQueue<>();
    private final List<TransferRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, byte[]> served = new ConcurrentHashMap<>();

    /// @param url a source URL
    /// @param content bytes every transfer of the URL completes with
    public void serve(String url, byte[] content) {
        served.put(url, content);
    }

    @Override
    public TransferHandle begin(TransferRequest request, TransferListener listener) {
        requests.add(request);
        Transfer transfer = new Transfer(request, listener);
        byte[] content = served.get(request.source().toString());
        if (content != null) {
            transfer.complete(content);
        } else {
            pending.add(transfer);
        }
        return transfer;
    }

    /// @param timeout how long to wait
    /// @return the next scripted transfer
    public Transfer next(Duration timeout) throws InterruptedException {
        Transfer transfer = pending.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (transfer == null) {
            throw new AssertionError("no transfer began within " + timeout);
        }
        return transfer;
    }

    /// @return every request seen so far
    public List<TransferRequest> requests() {
        return List.copyOf(requests);
    }

    /// One transfer under test control.
    public static class Transfer implements TransferHandle {
        private final TransferRequest request;
        private final TransferListener listener;
        private volatile boolean ended;

        Transfer(TransferRequest request, TransferListener listener) {
            this.request = request;
            this.listener = listener;
        }

        public TransferRequest request() {
            return request;
        }

        public void started(long expectedBytes) {
            emit(new DownloadEvent.Started(expectedBytes > 0 ? OptionalLong.of(expectedBytes) : OptionalLong.empty()));
        }

        /// Writes `written` bytes to the temp file and reports them.
        public void progress(long written, long expected) {
            writeTemp(new byte[(int) written]);
            double fraction = expected > 0 ? (double) written / expected : 0d;
            emit(new DownloadEvent.Progress(fraction, written, expected, 0d));
        }

        /// Writes the content to the destination and reports completion.
        public void complete(byte[] content) {
            try {
                Files.createDirectories(request.destination().getParent());
                Files.write(request.destination(), content);
                Files.deleteIfExists(request.tempFile());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            emit(new DownloadEvent.Progress(1d, content.length, content.length, 0d));
            emit(new DownloadEvent.Finished(null));
        }

        public void networkError(Throwable error) {
            emit(new DownloadEvent.NetworkError(error, 0d));
        }

        public void fail(Throwable error) {
            emit(new DownloadEvent.Failed(error));
        }

        public boolean isEnded() {
            return ended;
        }

        @Override
        public void pause() {
            emit(new DownloadEvent.Paused(0d));
        }

        @Override
        public void cancel() {
            try {
                Files.deleteIfExists(request.tempFile());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            emit(new DownloadEvent.Cancelled());
        }

        private void writeTemp(byte[] bytes) {
            Path temp = request.tempFile();
            try {
                Files.createDirectories(temp.getParent());
                Files.write(temp, bytes);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        private synchronized void emit(DownloadEvent event) {
            if (ended) {
                return;
            }
            if (event.isTerminal()) {
                ended = true;
            }
            listener.onEvent(event);
        }
    }
}
