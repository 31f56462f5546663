package io.nosqlbench.provisioning.concurrency;


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


import io.nosqlbench.provisioning.transport.TransferHandle;

import java.util.concurrent.Future;

/// The running work for one identity: its worker future and the transfer it is driving.
///
/// A pause or cancel requested while no transfer is attached is applied to the next one as
/// soon as it attaches, and worker loops check {@link #isStopRequested()} between files.
public class ActiveTask {

    private final String identity;
    private final long generation;
    private volatile Future<?> work;
    private volatile TransferHandle transfer;
    private volatile boolean pauseRequested;
    private volatile boolean cancelRequested;

    public ActiveTask(String identity, long generation) {
        this.identity = identity;
        this.generation = generation;
    }

    public String identity() {
        return identity;
    }

    /// @return the item generation this task was started for
    public long generation() {
        return generation;
    }

    public void setWork(Future<?> work) {
        this.work = work;
    }

    /// @param handle the transfer now running for this task
    public synchronized void attach(TransferHandle handle) {
        this.transfer = handle;
        if (cancelRequested) {
            handle.cancel();
        } else if (pauseRequested) {
            handle.pause();
        }
    }

    /// @param handle the transfer that just ended
    public synchronized void detach(TransferHandle handle) {
        if (this.transfer == handle) {
            this.transfer = null;
        }
    }

    /// Asks the current transfer to halt and keep its bytes.
    public synchronized void pause() {
        pauseRequested = true;
        if (transfer != null) {
            transfer.pause();
        }
    }

    /// Stops the transfer and interrupts the worker.
    public synchronized void cancel() {
        cancelRequested = true;
        if (transfer != null) {
            transfer.cancel();
        }
        Future<?> w = work;
        if (w != null) {
            w.cancel(true);
        }
    }

    public boolean isPauseRequested() {
        return pauseRequested;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public boolean isStopRequested() {
        return pauseRequested || cancelRequested;
    }
}
