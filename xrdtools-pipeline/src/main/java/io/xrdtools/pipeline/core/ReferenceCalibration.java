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

import io.xrdtools.dataset.ReferenceTables;

import java.util.List;

/// Output of the reference pass.
///
/// @param tables per-(peak, azimuth) mean of each primary measurement
/// @param background averaged background peaks, empty if no background candidates exist
/// @param failures reference frames that could not be refined
/// @param framesUsed reference frames that contributed to the tables
public record ReferenceCalibration(ReferenceTables tables, BackgroundTemplate background,
                                   FailureManifest failures, int framesUsed) {

    public static final ReferenceCalibration NONE = new ReferenceCalibration(ReferenceTables.empty(),
        BackgroundTemplate.EMPTY, new FailureManifest(List.of()), 0);

    public ReferenceContext context() {
        return new ReferenceContext(tables, background);
    }

    public boolean isPresent() {
        return framesUsed > 0;
    }
}
