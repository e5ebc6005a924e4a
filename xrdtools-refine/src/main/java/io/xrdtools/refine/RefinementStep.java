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

/// One call to the refinement engine: a label for logs and failure reports, plus the peak and
/// background freedom masks for the call.
public record RefinementStep(String label, ParameterMask peaks, BackgroundMask background) {

    public static RefinementStep peaks(String label, ParameterMask mask) {
        return new RefinementStep(label, mask, BackgroundMask.NONE);
    }

    public static RefinementStep background(String label, BackgroundMask mask) {
        return new RefinementStep(label, ParameterMask.NONE, mask);
    }
}
