package io.xrdtools.dataset.io;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Shared Gson configuration for dataset manifests and other JSON sidecars.
///
/// Pretty printed, without HTML escaping, and with NaN and infinities written as JSON literals.
/// The instance is thread-safe.
public final class DatasetGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private DatasetGsonConfig() {
    }

    public static Gson gson() {
        return INSTANCE;
    }

    /// @return a new builder with the shared defaults, for callers that register extra adapters
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }
}
