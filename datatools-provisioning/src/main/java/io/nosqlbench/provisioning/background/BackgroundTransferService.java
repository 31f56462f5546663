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


/// The platform service that may finish transfers while this process is suspended.
///
/// The registry registers one listener at {@code open()} and removes it at {@code close()}.
public interface BackgroundTransferService {

    void register(TransferCompletionListener listener);

    void unregister(TransferCompletionListener listener);
}
