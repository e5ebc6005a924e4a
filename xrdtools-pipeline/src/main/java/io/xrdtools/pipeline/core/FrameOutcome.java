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

import io.xrdtools.pipeline.frames.FrameDescriptor;

/// What happened to one dispatched or cached frame.
public interface FrameOutcome {

    FrameDescriptor frame();

    /// The frame was refined, now or in an earlier dispatch.
    record Completed(FrameDescriptor frame, FrameResult result, boolean fromCache) implements FrameOutcome {
    }

    /// Refinement of some slice failed, so the whole frame is dropped.
    record Failed(FrameDescriptor frame, String reason) implements FrameOutcome {
    }
}
