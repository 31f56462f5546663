package io.nosqlbench.provisioning.config;


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


import io.nosqlbench.provisioning.accounting.ByteReconciler;
import io.nosqlbench.provisioning.accounting.SpeedEstimator;
import io.nosqlbench.provisioning.background.BackgroundTransferService;
import io.nosqlbench.provisioning.concurrency.DelayScheduler;
import io.nosqlbench.provisioning.concurrency.ExecutorDelayScheduler;
import io.nosqlbench.provisioning.concurrency.OwnerContext;
import io.nosqlbench.provisioning.concurrency.PauseSet;
import io.nosqlbench.provisioning.concurrency.TaskRegistry;
import io.nosqlbench.provisioning.connectivity.ConnectivityMonitor;
import io.nosqlbench.provisioning.connectivity.ConnectivitySignal;
import io.nosqlbench.provisioning.fs.ArtifactLayout;
import io.nosqlbench.provisioning.fs.FileProbe;
import io.nosqlbench.provisioning.fs.LocalFileProbe;
import io.nosqlbench.provisioning.install.InstallationSink;
import io.nosqlbench.provisioning.manifest.ManifestStore;
import io.nosqlbench.provisioning.metadata.ArtifactMetadataSource;
import io.nosqlbench.provisioning.transport.TransferTransport;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/// Everything an orchestrator needs, passed at construction instead of process-wide state.
///
/// The context also holds the state shared across orchestrators: the pause set, the task
/// registry, the speed estimator and the owner context they all write through.
public final class ProvisioningContext implements AutoCloseable {

    private final ProvisioningConfig config;
    private final TransferTransport transport;
    private final ArtifactMetadataSource metadata;
    private final InstallationSink installer;
    private final FileProbe fileProbe;
    private final ConnectivityMonitor connectivity;
    private final DelayScheduler delays;
    private final Clock clock;
    private final BackgroundTransferService backgroundService;
    private final OwnerContext owner;
    private final ExecutorService workers;
    private final ArtifactLayout layout;
    private final ByteReconciler reconciler;
    private final SpeedEstimator speeds;
    private final ManifestStore manifests;
    private final PauseSet pauses = new PauseSet();
    private final TaskRegistry tasks = new TaskRegistry();

    private ProvisioningContext(Builder b) {
        this.config = b.config;
        this.transport = Objects.requireNonNull(b.transport, "transport");
        this.metadata = Objects.requireNonNull(b.metadata, "metadata");
        this.installer = Objects.requireNonNull(b.installer, "installer");
        this.fileProbe = b.fileProbe;
        this.connectivity = b.connectivity;
        this.delays = b.delays;
        this.clock = b.clock;
        this.backgroundService = b.backgroundService;
        this.owner = new OwnerContext("provisioning-owner");
        AtomicInteger count = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "provisioning-worker-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.layout = new ArtifactLayout(config.storageRoot());
        this.reconciler = new ByteReconciler(fileProbe);
        this.speeds = new SpeedEstimator(clock, config);
        this.manifests = new ManifestStore();
    }

    public static Builder builder(ProvisioningConfig config) {
        return new Builder(config);
    }

    public ProvisioningConfig config() {
        return config;
    }

    public TransferTransport transport() {
        return transport;
    }

    public ArtifactMetadataSource metadata() {
        return metadata;
    }

    public InstallationSink installer() {
        return installer;
    }

    public FileProbe fileProbe() {
        return fileProbe;
    }

    public ConnectivityMonitor connectivity() {
        return connectivity;
    }

    public DelayScheduler delays() {
        return delays;
    }

    public Clock clock() {
        return clock;
    }

    /// @return the platform background-transfer service, or null when there is none
    public BackgroundTransferService backgroundService() {
        return backgroundService;
    }

    public OwnerContext owner() {
        return owner;
    }

    public ExecutorService workers() {
        return workers;
    }

    public ArtifactLayout layout() {
        return layout;
    }

    public ByteReconciler reconciler() {
        return reconciler;
    }

    public SpeedEstimator speeds() {
        return speeds;
    }

    public ManifestStore manifests() {
        return manifests;
    }

    public PauseSet pauses() {
        return pauses;
    }

    public TaskRegistry tasks() {
        return tasks;
    }

    @Override
    public void close() {
        delays.close();
        workers.shutdownNow();
        owner.close();
    }

    /// Builder for {@link ProvisioningContext}. Transport, metadata source and installer are required.
    public static final class Builder {
        private final ProvisioningConfig config;
        private TransferTransport transport;
        private ArtifactMetadataSource metadata;
        private InstallationSink installer;
        private FileProbe fileProbe = new LocalFileProbe();
        private ConnectivityMonitor connectivity = new ConnectivitySignal(true);
        private DelayScheduler delays;
        private Clock clock = Clock.systemUTC();
        private BackgroundTransferService backgroundService;

        private Builder(ProvisioningConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder withTransport(TransferTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withMetadata(ArtifactMetadataSource metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder withInstaller(InstallationSink installer) {
            this.installer = installer;
            return this;
        }

        public Builder withFileProbe(FileProbe fileProbe) {
            this.fileProbe = fileProbe;
            return this;
        }

        public Builder withConnectivity(ConnectivityMonitor connectivity) {
            this.connectivity = connectivity;
            return this;
        }

        public Builder withDelays(DelayScheduler delays) {
            this.delays = delays;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withBackgroundService(BackgroundTransferService backgroundService) {
            this.backgroundService = backgroundService;
            return this;
        }

        public ProvisioningContext build() {
            if (delays == null) {
                delays = new ExecutorDelayScheduler();
            }
            return new ProvisioningContext(this);
        }
    }
}
