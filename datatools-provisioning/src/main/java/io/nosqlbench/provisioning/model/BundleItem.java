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


import java.nio.file.Path;

/// A single SLM bundle archive.
public class BundleItem extends DownloadItem {

    /// Part name of the bundle file
    public static final String BUNDLE = "bundle";

    private boolean verifying;

    public BundleItem(String identity, String displayName, Path bundleFile, long catalogBytes, double activeCeiling) {
        super(identity, ArtifactKind.BUNDLE, displayName, activeCeiling);
        addPart(new PartProgress(BUNDLE, bundleFile, catalogBytes));
    }

    public PartProgress bundle() {
        return part(BUNDLE);
    }

    @Override
    public boolean isVerifying() {
        return verifying;
    }

    public void setVerifying(boolean verifying) {
        this.verifying = verifying;
    }
}
