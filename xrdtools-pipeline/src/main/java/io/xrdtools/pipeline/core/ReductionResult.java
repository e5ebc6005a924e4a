package io.xrdtools.pipeline.core;

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

import java.nio.file.Path;
import java.util.Optional;

/// A reduced dataset with the frames it lost.
///
/// @param dataset sealed dataset
/// @param failures reference and sample frames that could not be refined
/// @param summary run counts
/// @param outputDirectory where the result was saved, or null if it was not
public record ReductionResult(DiffractionDataset dataset, FailureManifest failures, ReductionSummary summary,
                              Path outputDirectory) {

    public ReductionResult savedTo(Path directory) {
        return new ReductionResult(dataset, failures, summary, directory);
    }

    public Optional<Path> saved() {
        return Optional.ofNullable(outputDirectory);
    }
}
