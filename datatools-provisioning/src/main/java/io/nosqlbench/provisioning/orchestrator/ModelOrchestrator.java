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


import io.nosqlbench.provisioning.catalog.ModelSpec;
import io.nosqlbench.provisioning.concurrency.ActiveTask;
import io.nosqlbench.provisioning.config.ProvisioningContext;
import io.nosqlbench.provisioning.errors.TransferException;
import io.nosqlbench.provisioning.errors.TransferFailure;
import io.nosqlbench.provisioning.events.DownloadEvent;
import io.nosqlbench.provisioning.fs.ArtifactLayout;
import io.nosqlbench.provisioning.install.InstalledArtifact;
import io.nosqlbench.provisioning.manifest.ModelManifest;
import io.nosqlbench.provisioning.metadata.ProjectorFile;
import io.nosqlbench.provisioning.model.ArtifactKind;
import io.nosqlbench.provisioning.model.ModelItem;
import io.nosqlbench.provisioning.model.PartProgress;
import io.nosqlbench.provisioning.transport.TransferRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/// Downloads model weights, plus the vision projector when the repo publishes one.
///
/// The projector is fetched first and is best-effort: a failed lookup or transfer drops it
/// from the item and the weights still download. Presence and absence are remembered in the
/// model directory's `artifacts.json`, so later starts skip the hub lookup.
public class ModelOrchestrator extends DownloadOrchestrator<ModelSpec, ModelItem> {

    private static final Logger logger = LogManager.getLogger(ModelOrchestrator.class);

    /// The first bytes of every GGUF file
    static final byte[] GGUF_MAGIC = "GGUF".getBytes(StandardCharsets.US_ASCII);
    /// Projector files carry this in their name
    static final List<String> PROJECTOR_HINTS = List.of("mmproj");

    public ModelOrchestrator(ProvisioningContext ctx) {
        super(ctx, ArtifactKind.MODEL);
    }

    @Override
    protected String identityOf(ModelSpec spec) {
        return spec.identity();
    }

    @Override
    protected ModelItem createItem(ModelSpec spec) {
        Path directory = ctx.layout().modelDirectory(spec.repoId());
        Path weights = directory.resolve(ArtifactLayout.fileNameOf(spec.downloadUrl()));
        ModelItem item = new ModelItem(spec.identity(), spec.modelId(), directory, weights, spec.sizeBytes(),
            config.activeProgressCeiling());
        Optional<ModelManifest> manifest = ctx.manifests().read(directory);
        String recorded = manifest.map(ModelManifest::mmproj).orElse(null);
        if (recorded != null) {
            item.attachProjector(directory.resolve(ArtifactLayout.safeSegment(recorded)), companionBytes(directory, recorded));
        } else if (spec.format().supportsProjector() && !manifest.map(ModelManifest::isProjectorChecked).orElse(false)) {
            // an earlier session may have left a projector behind without recording it
            ctx.reconciler().findCompanion(directory, PROJECTOR_HINTS).ifPresent(found -> {
                Path finalPath = finalPathOf(found);
                item.attachProjector(finalPath, companionBytes(directory, null));
                logger.debug("found unrecorded projector {} for {}", finalPath.getFileName(), item.identity());
            });
        }
        return item;
    }

    private long companionBytes(Path directory, String knownName) {
        return ctx.reconciler().reconcileCompanion(directory, knownName, PROJECTOR_HINTS, 0L, 0L).written();
    }

    private static Path finalPathOf(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(ArtifactLayout.TEMP_SUFFIX)) {
            return file.resolveSibling(name.substring(0, name.length() - ArtifactLayout.TEMP_SUFFIX.length()));
        }
        return file;
    }

    @Override
    protected DownloadEvent download(ModelSpec spec, ModelItem item, ActiveTask task)
        throws IOException, InterruptedException {
        if (spec.format().supportsProjector()) {
            Optional<DownloadEvent> halted = resolveProjector(spec, item, task);
            if (halted.isPresent()) {
                return halted.get();
            }
        }
        if (task.isStopRequested()) {
            return stopEvent(task);
        }
        Path weights = item.weights().finalPath();
        if (ctx.fileProbe().exists(weights) && !ctx.fileProbe().exists(ArtifactLayout.tempFor(weights))) {
            logger.debug("weights for {} already on disk", item.identity());
            return new DownloadEvent.Finished(null);
        }
        TransferRequest request = new TransferRequest(item.identity(), ModelItem.WEIGHTS, ArtifactKind.MODEL,
            spec.downloadUrl(), weights, spec.sizeBytes(), authHeaders());
        return runTransfer(task, item, request);
    }

    /// Brings the projector onto disk when there is one.
    ///
    /// @return a pause or cancel that must end the task, otherwise empty
    private Optional<DownloadEvent> resolveProjector(ModelSpec spec, ModelItem item, ActiveTask task)
        throws InterruptedException {
        Path directory = item.modelDirectory();
        Optional<ModelManifest> manifest = ctx.manifests().read(directory);
        if (manifest.isPresent() && manifest.get().isProjectorChecked()) {
            String recorded = manifest.get().mmproj();
            if (recorded == null) {
                logger.debug("{} has no projector per its manifest", item.identity());
                return Optional.empty();
            }
            Path file = directory.resolve(ArtifactLayout.safeSegment(recorded));
            OptionalLong size = ctx.fileProbe().size(file);
            if (size.isPresent() && !ctx.fileProbe().exists(ArtifactLayout.tempFor(file))) {
                updateIfCurrent(item, task, () -> item.attachProjector(file, size.getAsLong()).complete(size.getAsLong()));
                return Optional.empty();
            }
        }

        ProjectorLookup lookup = lookupProjector(spec);
        if (lookup.found().isEmpty()) {
            if (lookup.decided()) {
                recordProjector(directory, null);
            }
            updateIfCurrent(item, task, item::detachProjector);
            return Optional.empty();
        }

        ProjectorFile found = lookup.found().get();
        Path file = directory.resolve(ArtifactLayout.fileNameOf(found.downloadUrl()));
        updateIfCurrent(item, task, () -> {
            item.attachProjector(file, found.sizeBytes());
            logSize(item, found.sizeBytes(), "metadata");
            item.refreshProgress();
        });

        if (!ctx.fileProbe().exists(file) || ctx.fileProbe().exists(ArtifactLayout.tempFor(file))) {
            TransferRequest request = new TransferRequest(item.identity(), ModelItem.PROJECTOR, ArtifactKind.MODEL,
                found.downloadUrl(), file, found.sizeBytes(), authHeaders());
            DownloadEvent outcome = runTransfer(task, item, request);
            if (outcome instanceof DownloadEvent.Paused || outcome instanceof DownloadEvent.Cancelled) {
                return Optional.of(outcome);
            }
            if (!(outcome instanceof DownloadEvent.Finished)) {
                logger.warn("projector for {} not downloaded, continuing with weights only: {}",
                    item.identity(), describe(outcome));
                updateIfCurrent(item, task, item::detachProjector);
                return Optional.empty();
            }
        }

        if (!hasGgufMagic(file)) {
            logger.warn("projector {} for {} is not a GGUF file, discarding it", file.getFileName(), item.identity());
            deleteQuietly(file);
            updateIfCurrent(item, task, item::detachProjector);
            return Optional.empty();
        }
        long size = ctx.fileProbe().size(file).orElse(found.sizeBytes());
        updateIfCurrent(item, task, () -> {
            PartProgress part = item.projector();
            if (part != null) {
                part.complete(size);
                item.refreshProgress();
            }
        });
        recordProjector(directory, file.getFileName().toString());
        return Optional.empty();
    }

    /// @param found the projector, if any repo published one
    /// @param decided false when a lookup failed, so absence must not be recorded
    private record ProjectorLookup(Optional<ProjectorFile> found, boolean decided) {
    }

    private ProjectorLookup lookupProjector(ModelSpec spec) {
        Set<String> repos = new LinkedHashSet<>();
        repos.add(spec.repoId());
        if (spec.baseRepoId() != null && !spec.baseRepoId().isBlank()) {
            repos.add(spec.baseRepoId());
        }
        boolean undecided = false;
        for (String repo : repos) {
            try {
                Optional<ProjectorFile> found = ctx.metadata().findProjector(repo);
                if (found.isPresent()) {
                    return new ProjectorLookup(found, true);
                }
            } catch (IOException e) {
                logger.warn("projector lookup in {} failed: {}", repo, e.getMessage());
                undecided = true;
            }
        }
        return new ProjectorLookup(Optional.empty(), !undecided);
    }

    private void recordProjector(Path directory, String fileName) {
        try {
            ctx.manifests().update(directory, m -> m.withProjector(fileName));
        } catch (IOException e) {
            logger.warn("unable to record projector state in {}: {}", directory, e.getMessage());
        }
    }

    private boolean hasGgufMagic(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return Arrays.equals(in.readNBytes(GGUF_MAGIC.length), GGUF_MAGIC);
        } catch (IOException e) {
            logger.warn("unable to read {}: {}", file, e.getMessage());
            return false;
        }
    }

    private void deleteQuietly(Path file) {
        try {
            ctx.fileProbe().deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("unable to delete {}: {}", file, e.getMessage());
        }
    }

    private static String describe(DownloadEvent outcome) {
        if (outcome instanceof DownloadEvent.Failed failed) {
            return String.valueOf(failed.error().getMessage());
        }
        if (outcome instanceof DownloadEvent.NetworkError networkError) {
            return String.valueOf(networkError.error().getMessage());
        }
        return outcome.toString();
    }

    @Override
    protected boolean completedOnDisk(ModelSpec spec, ModelItem item) {
        for (PartProgress part : item.parts()) {
            if (!ctx.fileProbe().exists(part.finalPath()) || ctx.fileProbe().exists(ArtifactLayout.tempFor(part.finalPath()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected InstalledArtifact finalizeOnDisk(ModelSpec spec, ModelItem item) throws IOException {
        Path weights = item.weights().finalPath();
        promoteTemp(weights);
        OptionalLong size = ctx.fileProbe().size(weights);
        if (size.isEmpty()) {
            throw new TransferException(TransferFailure.FILESYSTEM, "weights missing after download: " + weights);
        }
        item.weights().complete(size.getAsLong());

        Path projectorPath = null;
        PartProgress projector = item.projector();
        if (projector == null && spec.format().supportsProjector()) {
            projector = ctx.reconciler().findCompanion(item.modelDirectory(), PROJECTOR_HINTS)
                .filter(found -> finalPathOf(found).equals(found) && hasGgufMagic(found))
                .map(found -> item.attachProjector(found, 0L))
                .orElse(null);
        }
        if (projector != null && ctx.fileProbe().exists(projector.finalPath())) {
            projectorPath = projector.finalPath();
            projector.complete(companionBytes(item.modelDirectory(), projectorPath.getFileName().toString()));
        }
        String projectorName = projectorPath == null ? null : projectorPath.getFileName().toString();
        boolean projectorKnown = projectorPath != null || !spec.format().supportsProjector();
        try {
            ctx.manifests().update(item.modelDirectory(), m -> {
                ModelManifest next = m.withWeights(weights.getFileName().toString());
                return projectorKnown ? next.withProjector(projectorName) : next;
            });
        } catch (IOException e) {
            logger.warn("unable to update manifest for {}: {}", item.identity(), e.getMessage());
        }
        return new InstalledArtifact(item.identity(), ArtifactKind.MODEL, weights, projectorPath, size.getAsLong());
    }

    private void promoteTemp(Path finalPath) throws IOException {
        Path temp = ArtifactLayout.tempFor(finalPath);
        if (ctx.fileProbe().exists(temp) && !ctx.fileProbe().exists(finalPath)) {
            ctx.fileProbe().move(temp, finalPath);
        }
    }

    @Override
    public boolean matchBackgroundCompletion(Path destination) {
        for (ModelItem item : new ArrayList<>(itemsOnOwner())) {
            if (item.isCompleted()) {
                continue;
            }
            if (belongsTo(destination, item, item.weights().finalPath())) {
                Optional<ModelSpec> spec = specOf(item.identity());
                if (spec.isPresent()) {
                    logger.info("background transfer completed weights for {}", item.identity());
                    finish(spec.get(), item);
                    return true;
                }
            }
            PartProgress projector = item.projector();
            if (projector != null && belongsTo(destination, item, projector.finalPath())) {
                OptionalLong size = ctx.fileProbe().size(projector.finalPath());
                projector.complete(size.orElse(0L));
                item.refreshProgress();
                recordProjector(item.modelDirectory(), projector.finalPath().getFileName().toString());
                logger.info("background transfer completed projector for {}", item.identity());
                return true;
            }
        }
        return false;
    }

    /// A bare file name only counts inside the item's own model directory, since projector and
    /// weights names repeat across repos.
    private static boolean belongsTo(Path destination, ModelItem item, Path finalPath) {
        Path temp = ArtifactLayout.tempFor(finalPath);
        if (destination.equals(finalPath) || destination.equals(temp)) {
            return true;
        }
        Path parent = destination.toAbsolutePath().normalize().getParent();
        if (parent == null || !parent.equals(item.modelDirectory().toAbsolutePath().normalize())) {
            return false;
        }
        Path name = destination.getFileName();
        return name.equals(finalPath.getFileName()) || name.equals(temp.getFileName());
    }
}
