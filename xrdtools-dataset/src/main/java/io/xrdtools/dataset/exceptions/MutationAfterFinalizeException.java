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

/// Thrown when a cell-level mutation is attempted on a sealed dataset.
/// Once sealed, only whole-column appends are accepted.
public class MutationAfterFinalizeException extends RuntimeException {

    private final String operation;

    public MutationAfterFinalizeException(String operation) {
        super(String.format("Cannot %s: the dataset has been sealed and only accepts whole-column appends", operation));
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
