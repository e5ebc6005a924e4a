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

/// Which peak parameters the refinement engine may change during one step.
public record ParameterMask(boolean area, boolean position, boolean sigma, boolean gamma) {

    public static final ParameterMask NONE = new ParameterMask(false, false, false, false);
    public static final ParameterMask AREA = new ParameterMask(true, false, false, false);
    public static final ParameterMask POSITION = new ParameterMask(false, true, false, false);
    public static final ParameterMask SIGMA = new ParameterMask(false, false, true, false);
    public static final ParameterMask GAMMA = new ParameterMask(false, false, false, true);
    public static final ParameterMask WIDTHS = new ParameterMask(false, false, true, true);
    public static final ParameterMask ALL = new ParameterMask(true, true, true, true);

    public boolean isEmpty() {
        return !(area || position || sigma || gamma);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "[]";
        }
        StringBuilder sb = new StringBuilder("[");
        if (area) sb.append("area,");
        if (position) sb.append("pos,");
        if (sigma) sb.append("sig,");
        if (gamma) sb.append("gam,");
        sb.setLength(sb.length() - 1);
        return sb.append(']').toString();
    }
}
