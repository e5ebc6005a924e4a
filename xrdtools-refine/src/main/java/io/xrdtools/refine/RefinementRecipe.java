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

import java.util.ArrayList;
import java.util.List;

/// The ordered stages a slice is driven through.
///
/// ## Standard Recipe
///
/// | Stage | Applies to | Steps (peak mask / background mask) | Passes |
/// |-------|-----------|-------------------------------------|--------|
/// | Reference background 1 | reference frames | `[] / [int]`, `[] / [int]` | 1..max |
/// | Reference background 2 | reference frames | `[] / [int]`, `[] / [sig]` | 1..max |
/// | Reference background 3 | reference frames | `[] / [pos,sig]` | 1..max |
/// | Dynamic background 1 | sample frames, when enabled | `[] / [int]`, `[] / [sig]` | 1..max |
/// | Dynamic background 2 | sample frames, when enabled | `[] / [pos,sig]` | 1..max |
/// | Intensity | all | `[area]` | 0..max |
/// | Position | all | `[pos]` | 0..max |
/// | Shape | all | `[sig]`, `[gam]`, `[sig,gam]` | 0..max |
/// | Full | all | `[area,pos,sig,gam]` | 0..max |
public final class RefinementRecipe {

    public static final int DEFAULT_MAX_ITERATIONS = 3;

    private final List<RefinementStage> stages;

    public RefinementRecipe(List<RefinementStage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("a recipe needs at least one stage");
        }
        for (int i = 1; i < stages.size(); i++) {
            if (stages.get(i).target().ordinal() < stages.get(i - 1).target().ordinal()) {
                throw new IllegalArgumentException("stage " + i + " targets " + stages.get(i).target()
                    + " which precedes " + stages.get(i - 1).target());
            }
        }
        this.stages = List.copyOf(stages);
    }

    public static RefinementRecipe standard(boolean reference, boolean dynamicBackground) {
        return standard(reference, dynamicBackground, DEFAULT_MAX_ITERATIONS);
    }

    /// Builds the standard recipe.
    ///
    /// @param reference whether the slice belongs to a reference frame
    /// @param dynamicBackground whether sample frames re-refine the background first
    /// @param maxIterations pass budget per stage
    public static RefinementRecipe standard(boolean reference, boolean dynamicBackground, int maxIterations) {
        List<RefinementStage> stages = new ArrayList<>();
        int minBackground = Math.min(1, maxIterations);
        if (reference) {
            stages.add(new RefinementStage(RefinementState.REFERENCE_REFINED, List.of(
                RefinementStep.background("reference background intensity", BackgroundMask.INTENSITY),
                RefinementStep.background("reference background intensity", BackgroundMask.INTENSITY)),
                minBackground, maxIterations));
            stages.add(new RefinementStage(RefinementState.REFERENCE_REFINED, List.of(
                RefinementStep.background("reference background intensity", BackgroundMask.INTENSITY),
                RefinementStep.background("reference background width", BackgroundMask.SIGMA)),
                minBackground, maxIterations));
            stages.add(new RefinementStage(RefinementState.REFERENCE_REFINED, List.of(
                RefinementStep.background("reference background position", BackgroundMask.POSITION_SIGMA)),
                minBackground, maxIterations));
        } else if (dynamicBackground) {
            stages.add(new RefinementStage(RefinementState.DYNAMIC_BACKGROUND_REFINED, List.of(
                RefinementStep.background("dynamic background intensity", BackgroundMask.INTENSITY),
                RefinementStep.background("dynamic background width", BackgroundMask.SIGMA)),
                minBackground, maxIterations));
            stages.add(new RefinementStage(RefinementState.DYNAMIC_BACKGROUND_REFINED, List.of(
                RefinementStep.background("dynamic background position", BackgroundMask.POSITION_SIGMA)),
                minBackground, maxIterations));
        }
        stages.add(new RefinementStage(RefinementState.INTENSITY_REFINED, List.of(
            RefinementStep.peaks("intensity", ParameterMask.AREA)), 0, maxIterations));
        stages.add(new RefinementStage(RefinementState.POSITION_REFINED, List.of(
            RefinementStep.peaks("position", ParameterMask.POSITION)), 0, maxIterations));
        stages.add(new RefinementStage(RefinementState.SHAPE_REFINED, List.of(
            RefinementStep.peaks("sigma", ParameterMask.SIGMA),
            RefinementStep.peaks("gamma", ParameterMask.GAMMA),
            RefinementStep.peaks("widths", ParameterMask.WIDTHS)), 0, maxIterations));
        stages.add(new RefinementStage(RefinementState.FULL_REFINED, List.of(
            RefinementStep.peaks("full", ParameterMask.ALL)), 0, maxIterations));
        return new RefinementRecipe(stages);
    }

    public List<RefinementStage> stages() {
        return stages;
    }

    /// @return total engine calls if every stage ran to its pass budget
    public int maxEngineCalls() {
        return stages.stream().mapToInt(s -> s.steps().size() * s.maxIterations()).sum();
    }
}
