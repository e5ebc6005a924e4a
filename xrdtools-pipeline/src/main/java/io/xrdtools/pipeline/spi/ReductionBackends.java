package io.xrdtools.pipeline.spi;

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

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/// Looks up [ReductionBackendProvider] implementations on the class path.
public final class ReductionBackends {

    private ReductionBackends() {
    }

    public static Optional<ReductionBackendProvider> get(String name) {
        return providers().filter(p -> p.name().equalsIgnoreCase(name)).findFirst();
    }

    /// The only provider, or empty when there are none or several.
    public static Optional<ReductionBackendProvider> single() {
        List<ReductionBackendProvider> all = providers().toList();
        return all.size() == 1 ? Optional.of(all.get(0)) : Optional.empty();
    }

    public static List<String> availableNames() {
        return providers().map(ReductionBackendProvider::name).sorted().toList();
    }

    private static Stream<ReductionBackendProvider> providers() {
        return ServiceLoader.load(ReductionBackendProvider.class).stream().map(ServiceLoader.Provider::get);
    }
}
