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

import io.xrdtools.pipeline.exceptions.RecipeException;

import java.util.Arrays;
import java.util.Locale;

/// Experiment stage a recipe describes.
public enum Stage {
    /// before treatment
    BEF,
    /// after treatment
    AFT,
    /// continuous measurement
    CONT,
    /// difference between stages
    DELT,
    /// difference computed on d-spacing
    DELTDSPACING;

    public static Stage parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RecipeException("Unknown stage '" + value + "', expected one of " + Arrays.toString(values()), e);
        }
    }
}
