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

import java.time.Duration;
import java.util.Locale;

/// Counts describing one reduction run.
public record ReductionSummary(int referenceFrames, int sampleFrames, int cachedFrames, int failedFrames,
                               Duration elapsed) {

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%d sample frames (%d cached, %d failed), %d reference frames in %.1fs",
            sampleFrames, cachedFrames, failedFrames, referenceFrames, elapsed.toMillis() / 1000.0);
    }
}
