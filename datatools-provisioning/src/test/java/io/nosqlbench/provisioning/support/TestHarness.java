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


import io.nosqlbench.provisioning.config.ProvisioningConfig;
import io.nosqlbench.provisioning.config.ProvisioningContext;
import io.nosqlbench.provisioning.connectivity.ConnectivitySignal;

import java.nio.file.Path;

/// Wires a {@link ProvisioningContext} to scripted collaborators under a temporary root.
public class TestHarness implements AutoCloseable {

    public final Path root;
    public final ScriptedTransport transport = new ScriptedTransport();
    public final StaticHubMetadata metadata = new StaticHubMetadata();
    public final RecordingInstaller installer = new RecordingInstaller();
    public final ManualDelayScheduler delays = new ManualDelayScheduler();
    public final ConnectivitySignal connectivity = new ConnectivitySignal(true);
    public final RecordingBackgroundService background = new RecordingBackgroundService();
    public final ProvisioningContext ctx;

    public TestHarness(Path root) {
        this.root = root;
        ProvisioningConfig config = ProvisioningConfig.builder()
            .withStorageRoot(root)
            .build();
        this.ctx = ProvisioningContext.builder(config)
            .withTransport(transport)
            .withMetadata(metadata)
            .withInstaller(installer)
            .withDelays(delays)
            .withConnectivity(connectivity)
            .withBackgroundService(background)
            .build();
    }

    @Override
    public void close() {
        ctx.close();
    }
}
