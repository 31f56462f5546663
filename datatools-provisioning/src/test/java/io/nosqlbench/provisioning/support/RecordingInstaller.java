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


import io.nosqlbench.provisioning.install.InstallationSink;
import io.nosqlbench.provisioning.install.InstalledArtifact;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingInstaller implements InstallationSink {

    private final List<InstalledArtifact> installed = new CopyOnWriteArrayList<>();

    @Override
    public void install(InstalledArtifact artifact) {
        installed.add(artifact);
    }

    public List<InstalledArtifact> installed() {
        return List.copyOf(installed);
    }
}
