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


import io.nosqlbench.provisioning.background.BackgroundTransferService;
import io.nosqlbench.provisioning.background.TransferCompletionListener;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/// Stands in for the platform service; {@link #deliver(Path)} plays a completion notice.
public class RecordingBackgroundService implements BackgroundTransferService {

    private final List<TransferCompletionListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void register(TransferCompletionListener listener) {
        listeners.add(listener);
    }

    @Override
    public void unregister(TransferCompletionListener listener) {
        listeners.remove(listener);
    }

    public void deliver(Path destination) {
        listeners.forEach(l -> l.transferCompleted(destination));
    }

    public int listenerCount() {
        return listeners.size();
    }
}
