package io.xrdtools.pipeline.compute;

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
import java.util.function.Function;

/// Runs independent tasks and hands back their results.
public interface ComputeBackend extends AutoCloseable {

    /// Applies `task` to every item.
    ///
    /// @return results in the order of `items`, whatever order the tasks finished in
    <T, R> List<R> execute(List<T> items, Function<T, R> task);

    /// @return the number of tasks that can run at once
    int parallelism();

    @Override
    void close();
}
