package io.xrdtools.pipeline.config;

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

import io.xrdtools.refine.AnalysisWindow;

/// A configured reflection: display name, Miller index, nominal 2θ position and fit limits.
public record PeakSpec(String name, String millerIndex, double position, AnalysisWindow limits) {

    /// Half-width of the limits given to peaks configured by position only.
    public static final double DEFAULT_HALF_WIDTH = 0.2;

    /// A peak known only by position, named `Unknown {ordinal}`.
    public static PeakSpec positionOnly(int ordinal, double position) {
        return new PeakSpec("Unknown " + ordinal, "000", position,
            new AnalysisWindow(position - DEFAULT_HALF_WIDTH, position + DEFAULT_HALF_WIDTH));
    }

    /// Miller index if present, otherwise the name.
    public String label() {
        return millerIndex == null || millerIndex.isBlank() ? name : millerIndex;
    }
}
