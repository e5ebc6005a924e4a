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

import io.xrdtools.dataset.DiffractionDataset;

import java.io.IOException;
import java.nio.file.Path;

/// Durable storage for sealed datasets.
///
/// Implementations must round-trip exactly: `load(save(d))` reproduces every cell, index,
/// measurement name, reference table, peak label and attribute of `d`.
public interface DatasetStore {

    /// Seals `dataset` if needed and writes it to `path`, replacing any existing file.
    void save(DiffractionDataset dataset, Path path) throws IOException;

    DiffractionDataset load(Path path) throws IOException;
}
