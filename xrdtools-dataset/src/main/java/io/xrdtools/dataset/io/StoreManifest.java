package io.xrdtools.dataset.io;

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

import io.xrdtools.dataset.DatasetDescriptor;

import java.util.List;

/// JSON manifest embedded in every stored dataset file.
///
/// @param formatVersion layout version of the file
/// @param descriptor dataset shape and metadata
/// @param referenceNames reference table names, in the order of the `reference/r{i}` datasets
record StoreManifest(int formatVersion, DatasetDescriptor descriptor, List<String> referenceNames) {

    static final int CURRENT_VERSION = 1;
}
