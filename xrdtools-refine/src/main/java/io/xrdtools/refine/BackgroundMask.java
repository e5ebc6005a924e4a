package io.xrdtools.refine;

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

/// Which background-peak parameters the refinement engine may change during one step.
public record BackgroundMask(boolean position, boolean intensity, boolean sigma, boolean gamma) {

    public static final BackgroundMask NONE = new BackgroundMask(false, false, false, false);
    public static final BackgroundMask INTENSITY = new BackgroundMask(false, true, false, false);
    public static final BackgroundMask SIGMA = new BackgroundMask(false, false, true, false);
    public static final BackgroundMask POSITION_SIGMA = new BackgroundMask(true, false, true, false);

    public boolean isEmpty() {
        return !(position || intensity || sigma || gamma);
    }
}
