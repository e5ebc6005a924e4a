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

import java.util.Arrays;

/// Thrown when an appended column, or a dataset being compared, does not agree
/// with the (peak, frame, azimuth) shape of the target dataset.
public class ShapeMismatchException extends RuntimeException {

    private final String subject;
    private final int[] expected;
    private final int[] actual;

    public ShapeMismatchException(String subject, int[] expected, int[] actual) {
        super(String.format("Shape mismatch for '%s': expected %s but was %s",
            subject, Arrays.toString(expected), Arrays.toString(actual)));
        this.subject = subject;
        this.expected = expected.clone();
        this.actual = actual.clone();
    }

    public String getSubject() {
        return subject;
    }

    public int[] getExpected() {
        return expected.clone();
    }

    public int[] getActual() {
        return actual.clone();
    }
}
