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


import io.nosqlbench.provisioning.catalog.BundleSpec;
import io.nosqlbench.provisioning.concurrency.ActiveTask;
import io.nosqlbench.provisioning.config.ProvisioningContext;
import io.nosqlbench.provisioning.errors.TransferException;
import io.nosqlbench.provisioning.errors.TransferFailure;
import io.nosqlbench.provisioning.events.DownloadEvent;
import io.nosqlbench.provisioning.fs.ArtifactLayout;
import io.nosqlbench.provisioning.install.InstalledArtifact;
import io.nosqlbench.provisioning.metadata.BundleFile;
import io.nosqlbench.provisioning.model.ArtifactKind;
import io.nosqlbench.provisioning.model.BundleItem;
import io.nosqlbench.provisioning.transport.TransferRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;

/// Downloads SLM bundles and verifies their SHA-256 when a checksum is known.
public class BundleOrchestrator extends DownloadOrchestrator<BundleSpec, BundleItem> {

    private static final Logger logger = LogManager.getLogger(BundleOrchestrator.class);

    public BundleOrchestrator(ProvisioningContext ctx) {
        super(ctx, ArtifactKind.BUNDLE);
    }

    @Override
    protected String identityOf(BundleSpec spec) {
        return spec.identity();
    }

    @Override
    protected BundleItem createItem(BundleSpec spec) {
        String name = spec.displayName() == null ? spec.slug() : spec.displayName();
        return new BundleItem(spec.identity(), name, ctx.layout().bundleFile(spec.slug()), spec.sizeBytes(),
            config.activeProgressCeiling());
    }

    @Override
    protected DownloadEvent download(BundleSpec spec, BundleItem item, ActiveTask task)
        throws IOException, InterruptedException {
        URI source = spec.downloadUrl();
        long size = spec.sizeBytes();
        String sha256 = spec.sha256();
        if (source == null) {
            Optional<BundleFile> published = ctx.metadata().findBundle(spec.slug());
            if (published.isEmpty()) {
                throw new TransferException(TransferFailure.INVALID_CONTENT,
                    "no bundle published for " + spec.slug() + " in " + config.bundleRepository());
            }
            BundleFile file = published.get();
            source = file.downloadUrl();
            size = size > 0 ? size : file.sizeBytes();
            sha256 = sha256 != null ? sha256 : file.sha256();
            long known = size;
            updateIfCurrent(item, task, () -> {
                item.bundle().raiseExpected(known);
                logSize(item, known, "metadata");
            });
        }
        if (task.isStopRequested()) {
            return stopEvent(task);
        }

        Path destination = item.bundle().finalPath();
        boolean present = ctx.fileProbe().exists(destination) && !ctx.fileProbe().exists(ArtifactLayout.tempFor(destination));
        if (!present) {
            DownloadEvent outcome = runTransfer(task, item,
                new TransferRequest(item.identity(), BundleItem.BUNDLE, ArtifactKind.BUNDLE, source, destination,
                    size, authHeaders()));
            if (!(outcome instanceof DownloadEvent.Finished)) {
                return outcome;
            }
        }
        if (sha256 == null || sha256.isBlank()) {
            return new DownloadEvent.Finished(null);
        }

        updateIfCurrent(item, task, () -> item.setVerifying(true));
        try {
            String actual = sha256Of(destination);
            if (!actual.equalsIgnoreCase(sha256.trim())) {
                logger.warn("checksum mismatch for bundle {}: expected {} got {}", item.identity(),
                    sha256.toLowerCase(Locale.ROOT), actual);
                ctx.fileProbe().deleteIfExists(destination);
                return new DownloadEvent.Failed(new TransferException(TransferFailure.INVALID_CONTENT,
                    "checksum mismatch for " + destination.getFileName()));
            }
            logger.debug("verified checksum of bundle {}", item.identity());
            return new DownloadEvent.Finished(null);
        } finally {
            updateIfCurrent(item, task, () -> item.setVerifying(false));
        }
    }

    /// @param file a file
    /// @return its SHA-256 as lower-case hex
    /// @throws IOException when the file cannot be read
    static String sha256Of(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    @Override
    protected boolean completedOnDisk(BundleSpec spec, BundleItem item) {
        Path file = item.bundle().finalPath();
        return ctx.fileProbe().exists(file) && !ctx.fileProbe().exists(ArtifactLayout.tempFor(file));
    }

    @Override
    protected InstalledArtifact finalizeOnDisk(BundleSpec spec, BundleItem item) throws IOException {
        Path file = item.bundle().finalPath();
        Path temp = ArtifactLayout.tempFor(file);
        if (ctx.fileProbe().exists(temp) && !ctx.fileProbe().exists(file)) {
            ctx.fileProbe().move(temp, file);
        }
        OptionalLong size = ctx.fileProbe().size(file);
        if (size.isEmpty()) {
            throw new TransferException(TransferFailure.FILESYSTEM, "bundle missing after download: " + file);
        }
        item.bundle().complete(size.getAsLong());
        return new InstalledArtifact(item.identity(), ArtifactKind.BUNDLE, file, null, size.getAsLong());
    }
}
