package io.xrdtools.dataset.exceptions;

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

/// Thrown when a dataset cannot be built from the requested dimensions or names.
///
/// This is a fatal error for a reduction batch: nothing can be written into a
/// container whose declared shape is invalid.
public class DatasetConstructionException extends RuntimeException {

    public DatasetConstructionException(String message) {
        super(message);
    }

    public DatasetConstructionException(String format, Object... args) {
        super(String.format(format, args));
    }
}
