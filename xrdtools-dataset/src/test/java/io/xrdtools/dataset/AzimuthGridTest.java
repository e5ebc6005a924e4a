package io.xrdtools.dataset;

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

@DisplayName("AzimuthGrid")
class AzimuthGridTest {

    @Test
    @DisplayName("should count bins over the configured span")
    void shouldCountBins() {
        assertThat(new AzimuthGrid(0, 360, 90).count()).isEqualTo(4);
        assertThat(new AzimuthGrid(0, 360, 5).count()).isEqualTo(72);
        assertThat(new AzimuthGrid(-180, 180, 10).count()).isEqualTo(36);
    }

    @ParameterizedTest(name = "angle {0} -> bin {1}")
    @CsvSource({
        "0, 0",
        "44.9, 0",
        "45.1, 1",
        "90, 1",
        "270, 3",
        "359, 3",
        "-30, 0",
        "720, 3"
    })
    @DisplayName("should map angles to the nearest bin and clamp out-of-range angles")
    void shouldMapAngleToIndex(double angle, int expected) {
        assertThat(new AzimuthGrid(0, 360, 90).indexOf(angle)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should reject non-positive spacing and empty spans")
    void shouldRejectInvalidGrids() {
        assertThatThrownBy(() -> new AzimuthGrid(0, 360, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("spacing");
        assertThatThrownBy(() -> new AzimuthGrid(10, 10, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("end must be greater");
    }

    @Test
    @DisplayName("should build full-circle grids")
    void shouldBuildFullCircle() {
        AzimuthGrid grid = AzimuthGrid.fullCircle(8);

        assertThat(grid.spacing()).isEqualTo(45.0);
        assertThat(grid.angleOf(3)).isEqualTo(135.0);
        assertThat(grid.count()).isEqualTo(8);
    }
}
