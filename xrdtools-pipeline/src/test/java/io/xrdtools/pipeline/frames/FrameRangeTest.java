package io.xrdtools.pipeline.frames;

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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FrameRange")
class FrameRangeTest {

    @ParameterizedTest(name = "({0}, {1}, {2}) selects {3}: {4}")
    @CsvSource({
        "0, -1, 1, 0, true",
        "0, -1, 1, 99999, true",
        "10, -1, 1, 9, false",
        "10, 20, 5, 15, true",
        "10, 20, 5, 20, false",
        "10, 20, 5, 12, false",
        "3, 30, 3, 27, true"
    })
    @DisplayName("should select start, every step-th index after it, and nothing at or past end")
    void shouldSelect(int start, int end, int step, int index, boolean expected) {
        assertThat(new FrameRange(start, end, step).selects(index)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should reject invalid bounds")
    void shouldRejectInvalidBounds() {
        assertThatThrownBy(() -> new FrameRange(-1, -1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FrameRange(0, -1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FrameRange(10, 5, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
