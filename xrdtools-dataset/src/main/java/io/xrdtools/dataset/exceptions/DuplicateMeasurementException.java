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

/// Thrown when a measurement column is appended under a name the dataset already has.
public class DuplicateMeasurementException extends RuntimeException {

    private final String measurement;

    public DuplicateMeasurementException(String measurement) {
        super(String.format("Measurement '%s' already exists in this dataset", measurement));
        this.measurement = measurement;
    }

    public String getMeasurement() {
        return measurement;
    }
}
