package io.nosqlbench.provisioning.background;


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


import io.nosqlbench.provisioning.concurrency.OwnerContext;
import io.nosqlbench.provisioning.orchestrator.DownloadOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.List;

/// Matches files finished by the platform's background transfer service to live items, and
/// finalizes items whose bytes are all on disk but which never saw a finished event.
///
/// Matchers are asked in order; the first one that claims a file wins. The sweep covers every
/// orchestrator, whether or not it can match background files.
public class BackgroundCompletionReconciler implements TransferCompletionListener {

    private static final Logger logger = LogManager.getLogger(BackgroundCompletionReconciler.class);

    private final OwnerContext owner;
    private final List<DownloadOrchestrator<?, ?>> matchers;
    private final List<DownloadOrchestrator<?, ?>> swept;

    /// @param owner the owner context every reconciliation runs on
    /// @param matchers candidates for background files, in matching order
    /// @param swept every orchestrator whose stalled items the sweep finalizes
    public BackgroundCompletionReconciler(OwnerContext owner, List<DownloadOrchestrator<?, ?>> matchers,
                                          List<DownloadOrchestrator<?, ?>> swept) {
        this.owner = owner;
        this.matchers = List.copyOf(matchers);
        this.swept = List.copyOf(swept);
    }

    @Override
    public void transferCompleted(Path destination) {
        owner.execute(() -> reconcile(destination));
    }

    /// Owner context only.
    ///
    /// @param destination a file the background service wrote
    /// @return true when an item claimed it
    public boolean reconcile(Path destination) {
        for (DownloadOrchestrator<?, ?> orchestrator : matchers) {
            if (orchestrator.matchBackgroundCompletion(destination)) {
                return true;
            }
        }
        logger.debug("no download matched background file {}", destination);
        return false;
    }

    /// Owner context only.
    ///
    /// @return how many items were finalized
    public int sweep() {
        int finalized = 0;
        for (DownloadOrchestrator<?, ?> orchestrator : swept) {
            finalized += orchestrator.finalizeStalled();
        }
        return finalized;
    }
}
