package io.xrdtools.pipeline.frames;

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

import io.xrdtools.pipeline.exceptions.FrameDiscoveryException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/// Produces the ordered frames of an image directory.
public interface FrameSource {

    /// @param directory directory to search
    /// @param range global frame selection
    /// @return selected frames with strictly increasing global indices, possibly empty
    List<FrameDescriptor> discover(Path directory, FrameRange range) throws IOException;

    /// @throws FrameDiscoveryException if global indices do not strictly increase
    static void requireStrictlyIncreasing(Path directory, List<FrameDescriptor> frames) {
        for (int i = 1; i < frames.size(); i++) {
            int previous = frames.get(i - 1).globalIndex();
            int current = frames.get(i).globalIndex();
            if (current <= previous) {
                throw new FrameDiscoveryException(directory,
                    "frame index " + current + " at position " + i + " does not follow " + previous);
            }
        }
    }
}
