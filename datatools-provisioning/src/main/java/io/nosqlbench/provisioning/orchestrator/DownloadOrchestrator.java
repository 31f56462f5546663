package io.nosqlbench.provisioning.orchestrator;


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


import io.nosqlbench.provisioning.accounting.ByteSizes;
import io.nosqlbench.provisioning.accounting.PartBytes;
import io.nosqlbench.provisioning.concurrency.ActiveTask;
import io.nosqlbench.provisioning.concurrency.DelayScheduler;
import io.nosqlbench.provisioning.config.ProvisioningConfig;
import io.nosqlbench.provisioning.config.ProvisioningContext;
import io.nosqlbench.provisioning.errors.DownloadError;
import io.nosqlbench.provisioning.errors.ErrorClassifier;
import io.nosqlbench.provisioning.events.DownloadEvent;
import io.nosqlbench.provisioning.fs.ArtifactLayout;
import io.nosqlbench.provisioning.install.InstalledArtifact;
import io.nosqlbench.provisioning.model.ArtifactKind;
import io.nosqlbench.provisioning.model.DownloadItem;
import io.nosqlbench.provisioning.model.DownloadState;
import io.nosqlbench.provisioning.model.ItemSnapshot;
import io.nosqlbench.provisioning.model.PartProgress;
import io.nosqlbench.provisioning.transport.TransferHandle;
import io.nosqlbench.provisioning.transport.TransferRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;

/// The lifecycle shared by all artifact kinds.
///
/// One worker task per identity drives the transfers through {@link #download}; every state
/// change is applied on the owner context. Public operations may be called from any thread.
///
/// ```
/// idle -> running -> paused | backoffRetry | failed | cancelled | finished
/// paused, backoffRetry -> running
/// ```
///
/// Finalization is idempotent: the first of a transport `Finished`, a background completion
/// notice or the on-disk sweep marks the item completed, and later ones see that and return.
///
/// @param <S> the catalog spec type
/// @param <I> the item type
public abstract class DownloadOrchestrator<S, I extends DownloadItem> {

    private static final Logger logger = LogManager.getLogger(DownloadOrchestrator.class);

    protected final ProvisioningContext ctx;
    protected final ProvisioningConfig config;
    private final ArtifactKind kind;

    private final Map<String, I> items = new ConcurrentHashMap<>();
    private final Map<String, S> specs = new ConcurrentHashMap<>();
    private final Map<String, DelayScheduler.Scheduled> retries = new ConcurrentHashMap<>();
    private final Map<String, Set<Long>> loggedSizes = new ConcurrentHashMap<>();

    protected DownloadOrchestrator(ProvisioningContext ctx, ArtifactKind kind) {
        this.ctx = ctx;
        this.config = ctx.config();
        this.kind = kind;
    }

    /// @param spec a catalog spec
    /// @return its identity
    protected abstract String identityOf(S spec);

    /// @param spec a catalog spec
    /// @return a fresh item with its known parts
    protected abstract I createItem(S spec);

    /// Runs on a worker thread and performs every transfer the artifact needs.
    ///
    /// @param spec the catalog spec
    /// @param item the item, to be mutated only through the owner context
    /// @param task the running task
    /// @return the terminal event for the whole artifact
    /// @throws IOException for failures to classify
    /// @throws InterruptedException when the task is cancelled
    protected abstract DownloadEvent download(S spec, I item, ActiveTask task) throws IOException, InterruptedException;

    /// Moves finished files into place and records them. Runs on the owner context.
    ///
    /// @param spec the catalog spec
    /// @param item the item
    /// @return the installed artifact
    /// @throws IOException when the artifact is not complete on disk
    protected abstract InstalledArtifact finalizeOnDisk(S spec, I item) throws IOException;

    /// @param spec the catalog spec
    /// @param item the item
    /// @return true when every file is in its final place
    protected abstract boolean completedOnDisk(S spec, I item);

    /// @param spec a catalog spec
    /// @return true when the artifact was already installed and no item is needed
    protected boolean shortCircuit(S spec) {
        return false;
    }

    /// Finalizes an item whose file arrived through a background transfer notice.
    ///
    /// @param destination the file the platform wrote
    /// @return true when an item of this kind claimed the file
    public boolean matchBackgroundCompletion(Path destination) {
        return false;
    }

    public ArtifactKind kind() {
        return kind;
    }

    /// Starts a download. No-op when a task already runs for the identity.
    ///
    /// @param spec the catalog spec
    public void start(S spec) {
        ctx.owner().run(() -> startOnOwner(spec));
    }

    /// Halts a running or retrying download, keeping its bytes.
    ///
    /// @param identity the identity
    /// @return true when an item of this kind was paused
    public boolean pause(String identity) {
        return ctx.owner().call(() -> pauseOnOwner(identity));
    }

    /// Starts a fresh task for a paused or retrying download, resuming from its temp file.
    ///
    /// @param identity the identity
    /// @return true when a task was started
    public boolean resume(String identity) {
        return ctx.owner().call(() -> resumeOnOwner(identity));
    }

    /// Stops a download, removes its item and deletes its temp and final files.
    ///
    /// @param identity the identity
    /// @return true when this kind knew the identity
    public boolean cancel(String identity) {
        return ctx.owner().call(() -> cancelOnOwner(identity));
    }

    /// @return snapshots of every item of this kind
    public List<ItemSnapshot> snapshots() {
        return ctx.owner().call(() -> {
            List<ItemSnapshot> result = new ArrayList<>();
            for (I item : items.values()) {
                result.add(item.snapshot());
            }
            return result;
        });
    }

    /// @param identity an identity
    /// @return its snapshot, if this kind has the item
    public Optional<ItemSnapshot> snapshot(String identity) {
        return ctx.owner().call(() -> Optional.ofNullable(items.get(identity)).map(DownloadItem::snapshot));
    }

    /// @return the live items; only for use on the owner context
    public Collection<I> itemsOnOwner() {
        return Collections.unmodifiableCollection(items.values());
    }

    /// Finalizes items that reached the sweep threshold and are complete on disk. Owner context only.
    ///
    /// @return how many items were finalized
    public int finalizeStalled() {
        int finalized = 0;
        for (I item : List.copyOf(items.values())) {
            if (item.isCompleted() || item.state().isTerminal() || item.progress() < config.finalizeThreshold()) {
                continue;
            }
            S spec = specs.get(item.identity());
            if (spec != null && completedOnDisk(spec, item)) {
                logger.info("{} {} is complete on disk without a finished event, finalizing",
                    kind.getLabel(), item.identity());
                finish(spec, item);
                finalized++;
            }
        }
        return finalized;
    }

    /// Copies the smoothed speed onto items, forcing 0 for paused or idle ones. Owner context only.
    public void refreshSpeeds() {
        for (I item : items.values()) {
            boolean moving = item.state() == DownloadState.RUNNING && !ctx.pauses().contains(item.identity());
            item.setSpeed(moving ? ctx.speeds().speed(item.identity()) : 0d);
        }
    }

    private void startOnOwner(S spec) {
        String identity = identityOf(spec);
        if (ctx.tasks().contains(identity)) {
            logger.debug("{} {} already has a running task", kind.getLabel(), identity);
            return;
        }
        I item = items.get(identity);
        if (item != null && item.isCompleted()) {
            logger.debug("{} {} already finished", kind.getLabel(), identity);
            return;
        }
        if (item == null && shortCircuit(spec)) {
            return;
        }
        if (item == null || item.state() == DownloadState.FAILED || item.state() == DownloadState.CANCELLED) {
            item = createItem(spec);
            items.put(identity, item);
        }
        specs.put(identity, spec);
        cancelRetry(identity);
        ctx.pauses().remove(identity);
        item.setState(DownloadState.RUNNING);
        item.setError(null);

        ActiveTask task = new ActiveTask(identity, item.nextGeneration());
        ctx.tasks().register(task);
        I target = item;
        task.setWork(ctx.workers().submit(() -> runTask(spec, target, task)));
        logger.info("starting {} download {}", kind.getLabel(), identity);
    }

    private boolean pauseOnOwner(String identity) {
        I item = items.get(identity);
        if (item == null || item.isCompleted() || item.state().isTerminal()) {
            return false;
        }
        ctx.tasks().remove(identity).ifPresent(ActiveTask::pause);
        cancelRetry(identity);
        item.nextGeneration();
        item.setState(DownloadState.PAUSED);
        item.setSpeed(0d);
        ctx.speeds().zero(identity);
        ctx.pauses().add(identity);
        logger.info("paused {} download {} at {}", kind.getLabel(), identity, String.format("%.3f", item.progress()));
        return true;
    }

    private boolean resumeOnOwner(String identity) {
        I item = items.get(identity);
        S spec = specs.get(identity);
        if (item == null || spec == null || item.isCompleted() || ctx.tasks().contains(identity)) {
            return false;
        }
        if (item.state() != DownloadState.PAUSED && item.state() != DownloadState.BACKOFF_RETRY) {
            return false;
        }
        startOnOwner(spec);
        return true;
    }

    private boolean cancelOnOwner(String identity) {
        I item = items.remove(identity);
        S spec = specs.remove(identity);
        Optional<ActiveTask> task = ctx.tasks().remove(identity);
        if (item == null && task.isEmpty()) {
            return false;
        }
        task.ifPresent(ActiveTask::cancel);
        cancelRetry(identity);
        ctx.pauses().remove(identity);
        ctx.speeds().forget(identity);
        loggedSizes.remove(identity);
        if (item != null) {
            item.nextGeneration();
            item.setState(DownloadState.CANCELLED);
            if (!item.isCompleted()) {
                deleteFiles(item);
            }
        }
        logger.info("cancelled {} download {}", kind.getLabel(), identity);
        return true;
    }

    private void deleteFiles(I item) {
        for (PartProgress part : item.parts()) {
            for (Path path : List.of(ArtifactLayout.tempFor(part.finalPath()), part.finalPath())) {
                try {
                    ctx.fileProbe().deleteIfExists(path);
                } catch (IOException e) {
                    logger.warn("unable to delete {} for cancelled {}: {}", path, item.identity(), e.getMessage());
                }
            }
        }
    }

    private void runTask(S spec, I item, ActiveTask task) {
        DownloadEvent outcome;
        try {
            outcome = download(spec, item, task);
        } catch (InterruptedException | CancellationException e) {
            logger.debug("worker for {} {} stopped", kind.getLabel(), task.identity());
            return;
        } catch (IOException e) {
            outcome = new DownloadEvent.Failed(e);
        } catch (RuntimeException e) {
            logger.error("unexpected failure downloading {} {}", kind.getLabel(), task.identity(), e);
            outcome = new DownloadEvent.Failed(e);
        }
        DownloadEvent terminal = outcome;
        try {
            ctx.owner().execute(() -> onTerminal(spec, item, task, terminal));
        } catch (RejectedExecutionException e) {
            logger.debug("owner context closed before {} {} ended: {}", kind.getLabel(), task.identity(), terminal);
        }
    }

    private void onTerminal(S spec, I item, ActiveTask task, DownloadEvent event) {
        if (!isCurrent(item, task)) {
            ctx.tasks().remove(task);
            logger.debug("dropping stale {} for {} {}", event, kind.getLabel(), task.identity());
            return;
        }
        if (event instanceof DownloadEvent.Finished) {
            finish(spec, item);
        } else if (event instanceof DownloadEvent.Paused) {
            ctx.tasks().remove(task);
            item.setState(DownloadState.PAUSED);
            item.setSpeed(0d);
            ctx.speeds().zero(item.identity());
            ctx.pauses().add(item.identity());
        } else if (event instanceof DownloadEvent.NetworkError networkError) {
            ctx.tasks().remove(task);
            DownloadError error = ErrorClassifier.classify(networkError.error());
            scheduleRetry(item, error.isRetryable() ? error : DownloadError.network(error.message()));
        } else if (event instanceof DownloadEvent.Failed failed) {
            ctx.tasks().remove(task);
            DownloadError error = ErrorClassifier.classify(failed.error());
            if (error.isRetryable()) {
                scheduleRetry(item, error);
            } else {
                failPermanently(item, error);
            }
        } else if (event instanceof DownloadEvent.Cancelled) {
            ctx.tasks().remove(task);
            if (!task.isCancelRequested()) {
                cancelOnOwner(item.identity());
            }
        }
    }

    /// Finalizes an item. Owner context only; a no-op once the item is completed.
    ///
    /// @param spec the catalog spec
    /// @param item the item
    protected void finish(S spec, I item) {
        String identity = item.identity();
        if (item.isCompleted() || items.get(identity) != item) {
            logger.debug("{} {} already finalized", kind.getLabel(), identity);
            return;
        }
        InstalledArtifact artifact;
        try {
            artifact = finalizeOnDisk(spec, item);
        } catch (IOException e) {
            ctx.tasks().get(identity).ifPresent(t -> ctx.tasks().remove(t));
            failPermanently(item, ErrorClassifier.classify(e));
            return;
        }
        ctx.tasks().get(identity).ifPresent(t -> ctx.tasks().remove(t));
        cancelRetry(identity);
        ctx.pauses().remove(identity);
        ctx.speeds().forget(identity);
        item.markFinished();
        try {
            ctx.installer().install(artifact);
        } catch (RuntimeException e) {
            logger.error("installing {} {} failed", kind.getLabel(), identity, e);
        }
        logger.info("finished {} download {} ({})", kind.getLabel(), identity, ByteSizes.human(artifact.sizeBytes()));
        scheduleRemoval(item, config.finishedGrace());
    }

    private void scheduleRetry(I item, DownloadError error) {
        String identity = item.identity();
        int retry = item.incrementRetryCount();
        long seconds = Math.min(1L << Math.min(retry, 30), config.maxBackoff().toSeconds());
        Duration delay = Duration.ofSeconds(seconds);
        item.setState(DownloadState.BACKOFF_RETRY);
        item.setError(error);
        item.setSpeed(0d);
        ctx.speeds().zero(identity);
        long generation = item.generation();
        logger.debug("{} {} hit '{}', retry {} in {}s once connected", kind.getLabel(), identity, error.message(),
            retry, seconds);
        DelayScheduler.Scheduled timer = ctx.delays().schedule(delay, () ->
            ctx.connectivity().whenConnected().thenRun(() ->
                ctx.owner().execute(() -> retryIfStillWanted(item, generation))));
        retries.put(identity, timer);
    }

    private void retryIfStillWanted(I item, long generation) {
        String identity = item.identity();
        retries.remove(identity);
        S spec = specs.get(identity);
        if (spec == null || items.get(identity) != item || item.generation() != generation
            || item.state() != DownloadState.BACKOFF_RETRY || ctx.tasks().contains(identity)
            || ctx.pauses().contains(identity)) {
            return;
        }
        logger.info("retrying {} download {} (attempt {})", kind.getLabel(), identity, item.retryCount() + 1);
        startOnOwner(spec);
    }

    private void failPermanently(I item, DownloadError error) {
        item.setState(DownloadState.FAILED);
        item.setError(error);
        item.setSpeed(0d);
        ctx.speeds().forget(item.identity());
        logger.info("{} download {} failed: {}", kind.getLabel(), item.identity(), error.message());
        scheduleRemoval(item, config.failedGrace());
    }

    private void scheduleRemoval(I item, Duration grace) {
        ctx.delays().schedule(grace, () -> ctx.owner().execute(() -> {
            String identity = item.identity();
            if (items.remove(identity, item)) {
                specs.remove(identity);
                loggedSizes.remove(identity);
                logger.debug("removed {} {} after {}", kind.getLabel(), identity, item.state());
            }
        }));
    }

    private void cancelRetry(String identity) {
        DelayScheduler.Scheduled pending = retries.remove(identity);
        if (pending != null) {
            pending.cancel();
        }
    }

    /// @param item an item
    /// @param task a task started for it
    /// @return true when the task still drives the item's current generation
    protected boolean isCurrent(I item, ActiveTask task) {
        return items.get(item.identity()) == item && item.generation() == task.generation();
    }

    /// Runs an update on the owner context when the task is still current. Waits for it.
    ///
    /// @param item the item
    /// @param task the task
    /// @param update the mutation
    protected void updateIfCurrent(I item, ActiveTask task, Runnable update) {
        ctx.owner().run(() -> {
            if (isCurrent(item, task)) {
                update.run();
            }
        });
    }

    /// Drives one transfer and blocks until it ends. Non-terminal events are applied to the
    /// item on the owner context in emission order.
    ///
    /// @param task the running task
    /// @param item the item
    /// @param request the transfer
    /// @return the terminal event of the transfer
    /// @throws InterruptedException when the task is cancelled
    protected DownloadEvent runTransfer(ActiveTask task, I item, TransferRequest request) throws InterruptedException {
        if (task.isStopRequested()) {
            return stopEvent(task);
        }
        BlockingQueue<DownloadEvent> events = new LinkedBlockingQueue<>();
        TransferHandle handle = ctx.transport().begin(request, events::add);
        task.attach(handle);
        try {
            while (true) {
                DownloadEvent event = events.take();
                if (event.isTerminal()) {
                    return event;
                }
                updateIfCurrent(item, task, () -> onTransferEvent(item, request, event));
            }
        } catch (InterruptedException e) {
            if (!task.isCancelRequested()) {
                handle.pause();
            }
            throw e;
        } finally {
            task.detach(handle);
        }
    }

    /// @param task a task asked to stop
    /// @return the matching terminal event
    protected DownloadEvent stopEvent(ActiveTask task) {
        return task.isCancelRequested() ? new DownloadEvent.Cancelled() : new DownloadEvent.Paused(0d);
    }

    /// Applies a started or progress event to the part it belongs to. Owner context only.
    ///
    /// @param item the item
    /// @param request the transfer that emitted the event
    /// @param event the event
    protected void onTransferEvent(I item, TransferRequest request, DownloadEvent event) {
        PartProgress part = item.part(request.part());
        if (part == null) {
            return;
        }
        if (event instanceof DownloadEvent.Started started) {
            started.expectedBytes().ifPresent(bytes -> {
                if (part.acceptSessionExpected(bytes)) {
                    logSize(item, part.expectedBytes(), "Content-Length");
                }
            });
        } else if (event instanceof DownloadEvent.Progress progress) {
            if (progress.expectedBytes() > 0 && part.acceptSessionExpected(progress.expectedBytes())) {
                logSize(item, part.expectedBytes(), "Content-Length");
            }
            PartBytes bytes = ctx.reconciler().reconcile(part.finalPath(), progress.bytesWritten(), part.expectedBytes());
            part.apply(bytes);
            if (part.expectedBytes() <= 0) {
                part.applyFraction(progress.fraction());
            }
            double speed = ctx.speeds().recordBytes(item.identity(), part.name(), bytes.written());
            item.setSpeed(ctx.pauses().contains(item.identity()) ? 0d : speed);
            item.refreshProgress();
        }
    }

    /// Logs a detected size once per kind, identity and value.
    ///
    /// @param item the item
    /// @param bytes the size
    /// @param source where it came from
    protected void logSize(DownloadItem item, long bytes, String source) {
        if (bytes > 0 && loggedSizes.computeIfAbsent(item.identity(), id -> ConcurrentHashMap.newKeySet()).add(bytes)) {
            logger.debug("[Download][Size][{}] id={} size={} ({}B) source={}",
                kind.getLabel(), item.identity(), ByteSizes.human(bytes), bytes, source);
        }
    }

    boolean hasLoggedSizes(String identity) {
        return loggedSizes.containsKey(identity);
    }

    /// @return request headers carrying the hub token, when configured
    protected Map<String, String> authHeaders() {
        String token = config.hubToken();
        return token == null ? Map.of() : Map.of("Authorization", "Bearer " + token);
    }

    /// @param identity an identity
    /// @return the spec it was started with
    protected Optional<S> specOf(String identity) {
        return Optional.ofNullable(specs.get(identity));
    }
}
