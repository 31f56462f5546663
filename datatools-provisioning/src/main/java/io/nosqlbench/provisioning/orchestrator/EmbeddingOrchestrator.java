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


import io.nosqlbench.provisioning.catalog.EmbeddingSpec;
import io.nosqlbench.provisioning.concurrency.ActiveTask;
import io.nosqlbench.provisioning.config.ProvisioningContext;
import io.nosqlbench.provisioning.errors.TransferException;
import io.nosqlbench.provisioning.errors.TransferFailure;
import io.nosqlbench.provisioning.events.DownloadEvent;
import io.nosqlbench.provisioning.fs.ArtifactLayout;
import io.nosqlbench.provisioning.install.InstalledArtifact;
import io.nosqlbench.provisioning.model.ArtifactKind;
import io.nosqlbench.provisioning.model.EmbeddingItem;
import io.nosqlbench.provisioning.transport.TransferRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.OptionalLong;

/// Downloads single-file embedding models.
///
/// A model already on disk is handed to the installer without creating an item.
public class EmbeddingOrchestrator extends DownloadOrchestrator<EmbeddingSpec, EmbeddingItem> {

    private static final Logger logger = LogManager.getLogger(EmbeddingOrchestrator.class);

    public EmbeddingOrchestrator(ProvisioningContext ctx) {
        super(ctx, ArtifactKind.EMBEDDING);
    }

    @Override
    protected String identityOf(EmbeddingSpec spec) {
        return spec.identity();
    }

    @Override
    protected EmbeddingItem createItem(EmbeddingSpec spec) {
        return new EmbeddingItem(spec.identity(), spec.repoId(), fileFor(spec), spec.sizeBytes(),
            config.activeProgressCeiling());
    }

    private Path fileFor(EmbeddingSpec spec) {
        return ctx.layout().embeddingFile(spec.fileName());
    }

    @Override
    protected boolean shortCircuit(EmbeddingSpec spec) {
        Path file = fileFor(spec);
        OptionalLong size = ctx.fileProbe().size(file);
        if (size.isEmpty() || ctx.fileProbe().exists(ArtifactLayout.tempFor(file))) {
            return false;
        }
        logger.info("embedding model {} already installed at {}", spec.identity(), file);
        try {
            ctx.installer().install(new InstalledArtifact(spec.identity(), ArtifactKind.EMBEDDING, file, null,
                size.getAsLong()));
        } catch (RuntimeException e) {
            logger.error("installing embedding model {} failed", spec.identity(), e);
        }
        return true;
    }

    @Override
    protected DownloadEvent download(EmbeddingSpec spec, EmbeddingItem item, ActiveTask task)
        throws IOException, InterruptedException {
        long size = spec.sizeBytes();
        if (size <= 0) {
            size = probeSize(spec);
            long probed = size;
            updateIfCurrent(item, task, () -> {
                if (item.model().raiseExpected(probed)) {
                    logSize(item, probed, "HEAD");
                }
            });
        } else {
            logSize(item, size, "catalog");
        }
        return runTransfer(task, item, new TransferRequest(item.identity(), EmbeddingItem.MODEL,
            ArtifactKind.EMBEDDING, spec.downloadUrl(), item.model().finalPath(), size, authHeaders()));
    }

    private long probeSize(EmbeddingSpec spec) throws IOException {
        try {
            return ctx.metadata().remoteSize(spec.downloadUrl());
        } catch (IOException e) {
            if (TransferException.from(e).failure().isConnectivity()) {
                throw e;
            }
            logger.debug("size probe for {} failed, continuing without a size: {}", spec.identity(), e.getMessage());
            return 0L;
        }
    }

    @Override
    protected boolean completedOnDisk(EmbeddingSpec spec, EmbeddingItem item) {
        Path file = item.model().finalPath();
        return ctx.fileProbe().exists(file) && !ctx.fileProbe().exists(ArtifactLayout.tempFor(file));
    }

    @Override
    protected InstalledArtifact finalizeOnDisk(EmbeddingSpec spec, EmbeddingItem item) throws IOException {
        Path file = item.model().finalPath();
        OptionalLong size = ctx.fileProbe().size(file);
        if (size.isEmpty()) {
            throw new TransferException(TransferFailure.FILESYSTEM, "embedding model missing after download: " + file);
        }
        item.model().complete(size.getAsLong());
        return new InstalledArtifact(item.identity(), ArtifactKind.EMBEDDING, file, null, size.getAsLong());
    }
}
