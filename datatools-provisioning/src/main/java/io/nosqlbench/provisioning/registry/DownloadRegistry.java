package io.nosqlbench.provisioning.registry;


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


import io.nosqlbench.provisioning.background.BackgroundCompletionReconciler;
import io.nosqlbench.provisioning.catalog.BundleSpec;
import io.nosqlbench.provisioning.catalog.DatasetSpec;
import io.nosqlbench.provisioning.catalog.EmbeddingSpec;
import io.nosqlbench.provisioning.catalog.ModelSpec;
import io.nosqlbench.provisioning.concurrency.ActiveTask;
import io.nosqlbench.provisioning.concurrency.DelayScheduler;
import io.nosqlbench.provisioning.config.ProvisioningContext;
import io.nosqlbench.provisioning.model.DownloadItem;
import io.nosqlbench.provisioning.model.ItemSnapshot;
import io.nosqlbench.provisioning.orchestrator.BundleOrchestrator;
import io.nosqlbench.provisioning.orchestrator.DatasetOrchestrator;
import io.nosqlbench.provisioning.orchestrator.DownloadOrchestrator;
import io.nosqlbench.provisioning.orchestrator.EmbeddingOrchestrator;
import io.nosqlbench.provisioning.orchestrator.ModelOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// The front door for every download: starts, pauses, resumes and cancels by identity, and
/// aggregates progress across all artifact kinds.
///
/// ```java
/// try (DownloadRegistry registry = new DownloadRegistry(ctx)) {
///     registry.open();
///     registry.start(modelSpec);
///     double overall = registry.overallProgress();
/// }
/// ```
///
/// Identities are namespaced per kind, but pause, resume and cancel check every kind.
public class DownloadRegistry implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(DownloadRegistry.class);

    private final ProvisioningContext ctx;
    private final ModelOrchestrator models;
    private final BundleOrchestrator bundles;
    private final DatasetOrchestrator datasets;
    private final EmbeddingOrchestrator embeddings;
    private final List<DownloadOrchestrator<?, ?>> all;
    private final BackgroundCompletionReconciler reconciler;
    private DelayScheduler.Scheduled sweeper;
    private boolean open;
    private boolean closed;

    public DownloadRegistry(ProvisioningContext ctx) {
        this.ctx = ctx;
        this.models = new ModelOrchestrator(ctx);
        this.bundles = new BundleOrchestrator(ctx);
        this.datasets = new DatasetOrchestrator(ctx);
        this.embeddings = new EmbeddingOrchestrator(ctx);
        this.all = List.of(models, bundles, datasets, embeddings);
        this.reconciler = new BackgroundCompletionReconciler(ctx.owner(), List.of(models, datasets), all);
    }

    /// Starts the periodic sweep and listens for background transfer completions.
    public synchronized void open() {
        if (open || closed) {
            return;
        }
        open = true;
        sweeper = ctx.delays().every(ctx.config().sweepInterval(), () -> ctx.owner().execute(this::sweepOnOwner));
        if (ctx.backgroundService() != null) {
            ctx.backgroundService().register(reconciler);
        }
        logger.debug("download registry open, sweeping every {}", ctx.config().sweepInterval());
    }

    public void start(ModelSpec spec) {
        models.start(spec);
    }

    public void start(BundleSpec spec) {
        bundles.start(spec);
    }

    public void start(DatasetSpec spec) {
        datasets.start(spec);
    }

    public void start(EmbeddingSpec spec) {
        embeddings.start(spec);
    }

    /// @param identity an identity of any kind
    /// @return true when some download was paused
    public boolean pause(String identity) {
        boolean any = false;
        for (DownloadOrchestrator<?, ?> orchestrator : all) {
            any |= orchestrator.pause(identity);
        }
        return any;
    }

    /// @param identity an identity of any kind
    /// @return true when some download was resumed
    public boolean resume(String identity) {
        boolean any = false;
        for (DownloadOrchestrator<?, ?> orchestrator : all) {
            any |= orchestrator.resume(identity);
        }
        return any;
    }

    /// @param identity an identity of any kind
    /// @return true when some download was cancelled
    public boolean cancel(String identity) {
        boolean any = false;
        for (DownloadOrchestrator<?, ?> orchestrator : all) {
            any |= orchestrator.cancel(identity);
        }
        return any;
    }

    /// @return progress across every item, weighted by expected bytes; 0 when there are none
    public double overallProgress() {
        return ctx.owner().call(() -> {
            double weighted = 0d;
            double weights = 0d;
            for (DownloadOrchestrator<?, ?> orchestrator : all) {
                for (DownloadItem item : orchestrator.itemsOnOwner()) {
                    double weight = item.aggregateWeight();
                    weighted += weight * item.progress();
                    weights += weight;
                }
            }
            return weights <= 0d ? 0d : weighted / weights;
        });
    }

    /// @return true when every current item is completed, including when there are none
    public boolean allCompleted() {
        return ctx.owner().call(() -> {
            for (DownloadOrchestrator<?, ?> orchestrator : all) {
                for (DownloadItem item : orchestrator.itemsOnOwner()) {
                    if (!item.isCompleted()) {
                        return false;
                    }
                }
            }
            return true;
        });
    }

    /// @return snapshots of every item, models first
    public List<ItemSnapshot> snapshot() {
        return ctx.owner().call(() -> {
            List<ItemSnapshot> result = new ArrayList<>();
            for (DownloadOrchestrator<?, ?> orchestrator : all) {
                result.addAll(orchestrator.snapshots());
            }
            return result;
        });
    }

    /// @param identity an identity of any kind
    /// @return the first matching item
    public Optional<ItemSnapshot> item(String identity) {
        return ctx.owner().call(() -> {
            for (DownloadOrchestrator<?, ?> orchestrator : all) {
                Optional<ItemSnapshot> found = orchestrator.snapshot(identity);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        });
    }

    /// Runs one sweep now and waits for it.
    ///
    /// @return how many items the sweep finalized
    public int sweepNow() {
        return ctx.owner().call(this::sweepOnOwner);
    }

    private int sweepOnOwner() {
        Set<String> zeroed = ctx.speeds().sweep(ctx.pauses().snapshot());
        if (!zeroed.isEmpty()) {
            logger.trace("speeds went stale for {}", zeroed);
        }
        for (DownloadOrchestrator<?, ?> orchestrator : all) {
            orchestrator.refreshSpeeds();
        }
        return reconciler.sweep();
    }

    public ModelOrchestrator models() {
        return models;
    }

    public BundleOrchestrator bundles() {
        return bundles;
    }

    public DatasetOrchestrator datasets() {
        return datasets;
    }

    public EmbeddingOrchestrator embeddings() {
        return embeddings;
    }

    public BackgroundCompletionReconciler backgroundReconciler() {
        return reconciler;
    }

    /// Stops listening, pauses running transfers so their temp files survive, and closes the context.
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (sweeper != null) {
            sweeper.cancel();
        }
        if (ctx.backgroundService() != null && open) {
            ctx.backgroundService().unregister(reconciler);
        }
        open = false;
        ctx.owner().run(() -> {
            for (String identity : ctx.tasks().identities()) {
                ctx.tasks().get(identity).ifPresent(ActiveTask::pause);
            }
        });
        ctx.close();
    }
}
