package io.xrdtools.pipeline.exceptions;

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

/// Thrown when a cached frame result does not fit the dataset being built.
/// Non-fatal: the entry is dropped and the frame recomputed.
public class CacheCorruptionException extends RuntimeException {

    private final String key;

    public CacheCorruptionException(String key, String message) {
        super(String.format("Cache entry %s is unusable: %s", key, message));
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
