package io.xrdtools.command.common;

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

import io.xrdtools.pipeline.config.ProcessingParameters;
import picocli.CommandLine;

/**
 * Shared worker-count option for commands that run reductions.
 * Without {@code --threads} the recipe's own setting applies, which defaults to all cores but one.
 */
public class WorkerOption {

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of parallel frame workers (default: the recipe's setting, else all cores but one)"
    )
    private Integer explicitThreads;

    /**
     * Gets the explicitly specified worker count, if any.
     *
     * @return the worker count, or null if the recipe decides
     */
    public Integer getExplicitThreads() {
        return explicitThreads;
    }

    /**
     * Applies the command line worker count to recipe parameters.
     *
     * @param params parameters loaded from a recipe
     * @return params with the explicit worker count, or params unchanged
     */
    public ProcessingParameters applyTo(ProcessingParameters params) {
        if (explicitThreads == null) {
            return params;
        }
        return params.withOptions(params.options().withWorkers(Math.max(1, explicitThreads)));
    }

    /**
     * Checks if the user asked for more workers than there are cores.
     *
     * @return true if the explicit worker count exceeds available cores
     */
    public boolean exceedsAvailableCores() {
        return explicitThreads != null && explicitThreads > Runtime.getRuntime().availableProcessors();
    }
}
