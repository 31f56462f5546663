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


import io.nosqlbench.provisioning.catalog.DatasetFile;
import io.nosqlbench.provisioning.catalog.DatasetSpec;
import io.nosqlbench.provisioning.concurrency.ActiveTask;
import io.nosqlbench.provisioning.config.ProvisioningContext;
import io.nosqlbench.provisioning.errors.TransferException;
import io.nosqlbench.provisioning.errors.TransferFailure;
import io.nosqlbench.provisioning.events.DownloadEvent;
import io.nosqlbench.provisioning.fs.ArtifactLayout;
import io.nosqlbench.provisioning.install.InstalledArtifact;
import io.nosqlbench.provisioning.model.ArtifactKind;
import io.nosqlbench.provisioning.model.DatasetItem;
import io.nosqlbench.provisioning.model.PartProgress;
import io.nosqlbench.provisioning.transport.TransferRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/// Downloads the supported files of a dataset, one after another, into one directory.
///
/// Files whose final copy already exists are skipped, so a restarted dataset only fetches
/// what is missing.
public class DatasetOrchestrator extends DownloadOrchestrator<DatasetSpec, DatasetItem> {

    private static final Logger logger = LogManager.getLogger(DatasetOrchestrator.class);

    /// Written into each dataset directory with the display name
    public static final String TITLE_FILE = "title.txt";

    public DatasetOrchestrator(ProvisioningContext ctx) {
        super(ctx, ArtifactKind.DATASET);
    }

    @Override
    protected String identityOf(DatasetSpec spec) {
        return spec.identity();
    }

    @Override
    protected DatasetItem createItem(DatasetSpec spec) {
        Path directory = ctx.layout().datasetDirectory(spec.datasetId());
        String name = spec.displayName() == null ? spec.datasetId() : spec.displayName();
        DatasetItem item = new DatasetItem(spec.identity(), name, directory, config.activeProgressCeiling());
        for (DatasetFile file : supportedFiles(spec)) {
            item.addFile(file.name(), ctx.layout().datasetFile(directory, file.name()), file.sizeBytes());
        }
        return item;
    }

    /// @param spec a dataset
    /// @return its files with a supported extension
    List<DatasetFile> supportedFiles(DatasetSpec spec) {
        List<DatasetFile> supported = new ArrayList<>();
        for (DatasetFile file : spec.files()) {
            if (config.datasetExtensions().contains(file.extension())) {
                supported.add(file);
            } else {
                logger.debug("skipping {} in dataset {}: unsupported extension", file.name(), spec.datasetId());
            }
        }
        return supported;
    }

    @Override
    protected DownloadEvent download(DatasetSpec spec, DatasetItem item, ActiveTask task)
        throws IOException, InterruptedException {
        List<DatasetFile> files = supportedFiles(spec);
        if (files.isEmpty()) {
            throw new TransferException(TransferFailure.INVALID_CONTENT,
                "dataset " + spec.datasetId() + " has no files with a supported extension");
        }
        writeTitle(item.directory(), item.displayName());
        probeUnknownSizes(files, item, task);

        for (DatasetFile file : files) {
            if (task.isStopRequested()) {
                return stopEvent(task);
            }
            PartProgress part = ctx.owner().call(() -> item.part(file.name()));
            if (part == null) {
                continue;
            }
            Path destination = part.finalPath();
            OptionalLong existing = ctx.fileProbe().size(destination);
            if (existing.isPresent() && !ctx.fileProbe().exists(ArtifactLayout.tempFor(destination))) {
                completePart(item, task, part, existing.getAsLong());
                continue;
            }
            DownloadEvent outcome = runTransfer(task, item, new TransferRequest(item.identity(), file.name(),
                ArtifactKind.DATASET, file.url(), destination, part.expectedBytes(), authHeaders()));
            if (!(outcome instanceof DownloadEvent.Finished)) {
                return outcome;
            }
            completePart(item, task, part, ctx.fileProbe().size(destination).orElse(0L));
        }
        return new DownloadEvent.Finished(null);
    }

    private void completePart(DatasetItem item, ActiveTask task, PartProgress part, long size) {
        updateIfCurrent(item, task, () -> {
            part.complete(size);
            item.refreshProgress();
        });
    }

    private void probeUnknownSizes(List<DatasetFile> files, DatasetItem item, ActiveTask task) throws IOException {
        for (DatasetFile file : files) {
            if (file.sizeBytes() > 0 || task.isStopRequested()) {
                continue;
            }
            long size;
            try {
                size = ctx.metadata().remoteSize(file.url());
            } catch (IOException e) {
                if (TransferException.from(e).failure().isConnectivity()) {
                    throw e;
                }
                logger.debug("size probe for {} failed: {}", file.url(), e.getMessage());
                continue;
            }
            if (size > 0) {
                updateIfCurrent(item, task, () -> {
                    PartProgress part = item.part(file.name());
                    if (part != null && part.raiseExpected(size)) {
                        logSize(item, item.expectedBytes(), "HEAD");
                    }
                });
            }
        }
    }

    private void writeTitle(Path directory, String title) {
        try {
            Files.createDirectories(directory);
            Files.writeString(directory.resolve(TITLE_FILE), title, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("unable to write {} in {}: {}", TITLE_FILE, directory, e.getMessage());
        }
    }

    @Override
    protected boolean completedOnDisk(DatasetSpec spec, DatasetItem item) {
        for (PartProgress part : item.parts()) {
            if (!ctx.fileProbe().exists(part.finalPath())) {
                return false;
            }
        }
        return !item.parts().isEmpty();
    }

    /// Lenient: files that never arrived are logged and left out of the installed size.
    @Override
    protected InstalledArtifact finalizeOnDisk(DatasetSpec spec, DatasetItem item) throws IOException {
        long total = 0;
        for (PartProgress part : item.parts()) {
            Path destination = part.finalPath();
            Path temp = ArtifactLayout.tempFor(destination);
            if (!ctx.fileProbe().exists(destination) && ctx.fileProbe().exists(temp)) {
                ctx.fileProbe().move(temp, destination);
            }
            OptionalLong size = ctx.fileProbe().size(destination);
            if (size.isPresent()) {
                part.complete(size.getAsLong());
                total += size.getAsLong();
            } else {
                logger.warn("dataset {} finished without {}", item.identity(), part.name());
            }
        }
        return new InstalledArtifact(item.identity(), ArtifactKind.DATASET, item.directory(), null, total);
    }

    @Override
    public boolean matchBackgroundCompletion(Path destination) {
        Path file = destination.toAbsolutePath().normalize();
        for (DatasetItem item : new ArrayList<>(itemsOnOwner())) {
            Path directory = item.directory().toAbsolutePath().normalize();
            if (item.isCompleted() || file.equals(directory) || !file.startsWith(directory)) {
                continue;
            }
            Optional<DatasetSpec> spec = specOf(item.identity());
            if (spec.isEmpty()) {
                continue;
            }
            String name = destination.getFileName().toString();
            if (name.endsWith(ArtifactLayout.TEMP_SUFFIX)) {
                Path target = destination.resolveSibling(name.substring(0, name.length() - ArtifactLayout.TEMP_SUFFIX.length()));
                try {
                    if (!ctx.fileProbe().exists(target)) {
                        ctx.fileProbe().move(destination, target);
                    }
                } catch (IOException e) {
                    logger.warn("unable to move background file {} into place: {}", destination, e.getMessage());
                }
            }
            logger.info("background transfer completed dataset {}", item.identity());
            finish(spec.get(), item);
            return true;
        }
        return false;
    }
}
