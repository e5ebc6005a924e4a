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

import io.xrdtools.dataset.ChunkPlanner;
import io.xrdtools.refine.ConvergenceCriteria;
import io.xrdtools.refine.RefinementRecipe;

/// Tunables of a reduction run that do not describe the experiment itself.
///
/// @param targetChunkBytes chunk byte budget of the output dataset
/// @param workers parallel frame workers
/// @param convergenceThreshold relative-change convergence threshold
/// @param dynamicBackground whether sample frames re-refine background peaks first
/// @param maxStageIterations pass budget of every refinement stage
public record ProcessingOptions(long targetChunkBytes, int workers, double convergenceThreshold,
                                boolean dynamicBackground, int maxStageIterations) {

    public ProcessingOptions {
        if (targetChunkBytes <= 0) {
            throw new IllegalArgumentException("targetChunkBytes must be positive: " + targetChunkBytes);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1: " + workers);
        }
        if (!(convergenceThreshold > 0)) {
            throw new IllegalArgumentException("convergenceThreshold must be positive: " + convergenceThreshold);
        }
        if (maxStageIterations < 1) {
            throw new IllegalArgumentException("maxStageIterations must be >= 1: " + maxStageIterations);
        }
    }

    public static ProcessingOptions defaults() {
        return new ProcessingOptions(ChunkPlanner.DEFAULT_TARGET_BYTES, defaultWorkers(),
            ConvergenceCriteria.DEFAULT_THRESHOLD, true, RefinementRecipe.DEFAULT_MAX_ITERATIONS);
    }

    /// All processors but one, and at least one.
    public static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    public ProcessingOptions withWorkers(int count) {
        return new ProcessingOptions(targetChunkBytes, count, convergenceThreshold, dynamicBackground, maxStageIterations);
    }
}
