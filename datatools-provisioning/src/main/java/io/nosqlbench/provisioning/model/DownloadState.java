package io.nosqlbench.provisioning.model;


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


/**
 * Lifecycle of one logical download.
 *
 * <p>State Transitions:
 * <ul>
 *   <li><strong>IDLE → RUNNING:</strong> a task is started for the identity</li>
 *   <li><strong>RUNNING → PAUSED:</strong> the caller paused it; the temp file is kept</li>
 *   <li><strong>RUNNING → BACKOFF_RETRY:</strong> a retryable error arrived</li>
 *   <li><strong>PAUSED, BACKOFF_RETRY → RUNNING:</strong> resumed, or retried after backoff and reconnection</li>
 *   <li><strong>RUNNING → FAILED, CANCELLED, FINISHED:</strong> terminal, removed after a grace delay</li>
 * </ul>
 */
public enum DownloadState {
    IDLE,
    RUNNING,
    PAUSED,
    BACKOFF_RETRY,
    FAILED,
    CANCELLED,
    FINISHED;

    /**
     * @return true for states that never transition again
     */
    public boolean isTerminal() {
        return this == FAILED || this == CANCELLED || this == FINISHED;
    }
}
