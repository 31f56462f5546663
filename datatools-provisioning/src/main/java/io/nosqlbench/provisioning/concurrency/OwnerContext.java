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


import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/// The single writer for all item state.
///
/// Every mutation of items, the task registry and the pause set runs on this context's one
/// thread, in submission order. Readers use {@link #call(Supplier)} to get a consistent view.
public class OwnerContext implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(OwnerContext.class);

    private final ExecutorService executor;
    private volatile Thread ownerThread;

    public OwnerContext(String name) {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            ownerThread = t;
            return t;
        });
    }

    /// @return true when called from the owner thread
    public boolean isOwnerThread() {
        return Thread.currentThread() == ownerThread;
    }

    /// Enqueues an action without waiting.
    ///
    /// @param action the action to run on the owner thread
    public void execute(Runnable action) {
        executor.execute(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                logger.error("owner action failed", e);
            }
        });
    }

    /// Runs an action on the owner thread and waits for its result. Runs inline when already
    /// on the owner thread.
    ///
    /// @param action the action
    /// @param <T> result type
    /// @return the action's result
    /// @throws CancellationException when the waiting thread is interrupted
    public <T> T call(Supplier<T> action) {
        if (isOwnerThread()) {
            return action.get();
        }
        Future<T> result = executor.submit(action::get);
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted waiting for the owner context");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause);
        }
    }

    /// @param action an action to run on the owner thread, waiting for completion
    public void run(Runnable action) {
        call(() -> {
            action.run();
            return null;
        });
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
