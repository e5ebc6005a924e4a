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

import io.xrdtools.dataset.exceptions.DatasetConstructionException;
import io.xrdtools.dataset.exceptions.DuplicateMeasurementException;
import io.xrdtools.dataset.exceptions.MutationAfterFinalizeException;
import io.xrdtools.dataset.exceptions.ReferenceUnavailableException;
import io.xrdtools.dataset.exceptions.ShapeMismatchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DiffractionDataset")
class DiffractionDatasetTest {

    private static final List<String> NAMES = List.of("pos", "area", "sigma", "gamma", "d");
    private static final AzimuthGrid QUADRANTS = new AzimuthGrid(0, 360, 90);

    private static List<MeasurementRow> rows(double area, double d) {
        List<MeasurementRow> rows = new ArrayList<>();
        for (int a = 0; a < 4; a++) {
            rows.add(new MeasurementRow(a * 90.0,
                Map.of("pos", 6.0 + a, "area", area, "sigma", 0.1, "gamma", 0.2, "d", d)));
        }
        return rows;
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject axes smaller than one")
        void shouldRejectEmptyAxes() {
            assertThatThrownBy(() -> DiffractionDataset.create(0, 3, 4, NAMES, QUADRANTS))
                .isInstanceOf(DatasetConstructionException.class)
                .hasMessageContaining("peaks=0");
        }

        @Test
        @DisplayName("should reject repeated or missing names")
        void shouldRejectBadNames() {
            assertThatThrownBy(() -> DiffractionDataset.create(1, 1, 4, List.of("a", "a"), QUADRANTS))
                .isInstanceOf(DatasetConstructionException.class)
                .hasMessageContaining("repeated");
            assertThatThrownBy(() -> DiffractionDataset.create(1, 1, 4, List.of(), QUADRANTS))
                .isInstanceOf(DatasetConstructionException.class);
        }

        @Test
        @DisplayName("should reject a grid that disagrees with the azimuth count")
        void shouldRejectGridMismatch() {
            assertThatThrownBy(() -> DiffractionDataset.create(1, 1, 5, NAMES, QUADRANTS))
                .isInstanceOf(DatasetConstructionException.class)
                .hasMessageContaining("4 bins");
        }

        @Test
        @DisplayName("should start open")
        void shouldStartOpen() {
            DiffractionDataset dataset = DiffractionDataset.create(2, 3, 4, NAMES);

            assertThat(dataset.isSealed()).isFalse();
            assertThatThrownBy(() -> dataset.value(0, 0, 0, "pos"))
                .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Frame data")
    class FrameData {

        private DiffractionDataset dataset;

        @BeforeEach
        void setUp() {
            dataset = DiffractionDataset.create(2, 3, 4, NAMES, QUADRANTS);
        }

        @Test
        @DisplayName("should read back every written cell after sealing")
        void shouldRoundTripCells() {
            for (int p = 0; p < 2; p++) {
                for (int f = 0; f < 3; f++) {
                    dataset.setFrameData(p, f, 100 + f, rows(10 * p + f, 0.2 + f * 0.01));
                }
            }
            dataset.seal();

            assertThat(dataset.value(1, 2, 3, "area")).isEqualTo(12f);
            assertThat(dataset.value(0, 1, 2, "pos")).isEqualTo(8f);
            assertThat(dataset.value(1, 0, 0, "d")).isEqualTo(0.2f);
            assertThat(dataset.frameNumber(1, 2)).isEqualTo(102);
            assertThat(dataset.azimuthSeries(1, 3, "area")).containsExactly(10f, 11f, 12f);
            assertThat(dataset.peakMeasurement(0, "gamma")[2]).containsOnly(0.2f);
        }

        @Test
        @DisplayName("should keep the first non-zero angle per azimuth bin")
        void shouldFixAzimuthAngleOnFirstWrite() {
            dataset.setFrameData(0, 0, List.of(new MeasurementRow(91.5, Map.of("area", 1.0))));
            dataset.setFrameData(0, 1, List.of(new MeasurementRow(88.0, Map.of("area", 2.0))));
            dataset.seal();

            assertThat(dataset.azimuthAngle(0, 1)).isEqualTo(91.5f);
            assertThat(dataset.azimuthAngle(0, 2)).isZero();
        }

        @Test
        @DisplayName("should skip non-finite values and unknown measurement names")
        void shouldSkipNonFiniteAndUnknown() {
            dataset.setFrameData(0, 0, List.of(
                new MeasurementRow(0, Map.of("area", Double.NaN, "pos", 5.0, "mystery", 9.0))));
            dataset.seal();

            assertThat(dataset.value(0, 0, 0, "area")).isZero();
            assertThat(dataset.value(0, 0, 0, "pos")).isEqualTo(5f);
            assertThat(dataset.hasMeasurement("mystery")).isFalse();
        }

        @Test
        @DisplayName("should reject cell writes after sealing")
        void shouldRejectMutationAfterSeal() {
            dataset.seal();

            assertThatThrownBy(() -> dataset.setFrameData(0, 0, rows(1, 1)))
                .isInstanceOf(MutationAfterFinalizeException.class);
        }

        @Test
        @DisplayName("should treat repeated seals as no-ops")
        void shouldSealIdempotently() {
            dataset.setFrameData(0, 0, rows(5, 1));
            dataset.seal();
            ChunkDims first = dataset.chunkDims();
            dataset.seal();

            assertThat(dataset.chunkDims()).isEqualTo(first);
            assertThat(dataset.value(0, 0, 0, "area")).isEqualTo(5f);
        }

        @Test
        @DisplayName("should reject out-of-range indices")
        void shouldRejectBadIndices() {
            assertThatThrownBy(() -> dataset.setFrameData(2, 0, rows(1, 1)))
                .isInstanceOf(IndexOutOfBoundsException.class);
        }
    }

    @Nested
    @DisplayName("Derived measurements")
    class Derived {

        private DiffractionDataset dataset;

        @BeforeEach
        void setUp() {
            dataset = DiffractionDataset.create(2, 3, 4, NAMES, QUADRANTS);
            for (int p = 0; p < 2; p++) {
                for (int f = 0; f < 3; f++) {
                    dataset.setFrameData(p, f, rows(100, 0.2 + 0.01 * f));
                }
            }
        }

        @Test
        @DisplayName("should produce all-zero deltas for a constant series")
        void shouldProduceZeroDeltaForConstantArea() {
            dataset.seal();
            dataset.calculateDelta("area");

            float[][][] delta = dataset.measurement("delta area");
            for (int p = 0; p < 2; p++) {
                for (int f = 0; f < 3; f++) {
                    assertThat(delta[p][f]).containsOnly(0f);
                }
            }
        }

        @Test
        @DisplayName("should define delta at frame zero as zero")
        void shouldZeroFirstFrameDelta() {
            dataset.calculateDelta("d");

            assertThat(dataset.isSealed()).isTrue();
            float[] series = dataset.azimuthSeries(0, 0, "delta d");
            assertThat(series[0]).isZero();
            assertThat(series[1]).isCloseTo(0.01f, within(1e-6f));
            assertThat(series[2]).isCloseTo(0.01f, within(1e-6f));
        }

        @Test
        @DisplayName("should compute strain and zero it where either side is zero")
        void shouldComputeStrain() {
            float[][] reference = new float[2][4];
            for (float[] row : reference) {
                Arrays.fill(row, 0.2f);
            }
            reference[1][3] = 0f;

            dataset.calculateStrain(reference);

            assertThat(dataset.value(0, 0, 0, "strain")).isZero();
            assertThat(dataset.value(0, 2, 1, "strain")).isCloseTo(0.1f, within(1e-5f));
            assertThat(dataset.value(1, 2, 3, "strain")).isZero();
            assertThat(dataset.value(0, 2, 1, "abs strain")).isCloseTo(0.1f, within(1e-5f));
        }

        @Test
        @DisplayName("should reject a second strain calculation")
        void shouldRejectDuplicateStrain() {
            float[][] reference = {{0.2f, 0.2f, 0.2f, 0.2f}, {0.2f, 0.2f, 0.2f, 0.2f}};
            dataset.calculateStrain(reference);

            assertThatThrownBy(() -> dataset.calculateStrain(reference))
                .isInstanceOf(DuplicateMeasurementException.class)
                .hasMessageContaining("strain");
        }

        @Test
        @DisplayName("should append nothing when only abs strain already exists")
        void shouldLeaveColumnsUntouchedOnPartialDuplicate() {
            float[][] reference = {{0.2f, 0.2f, 0.2f, 0.2f}, {0.2f, 0.2f, 0.2f, 0.2f}};
            dataset.addMeasurement(DiffractionDataset.ABS_STRAIN, new float[2][3][4]);
            List<String> before = dataset.measurementNames();

            assertThatThrownBy(() -> dataset.calculateStrain(reference))
                .isInstanceOf(DuplicateMeasurementException.class)
                .hasMessageContaining(DiffractionDataset.ABS_STRAIN);
            assertThat(dataset.measurementNames()).isEqualTo(before);
            assertThat(dataset.hasMeasurement(DiffractionDataset.STRAIN)).isFalse();
        }

        @Test
        @DisplayName("should compute percent change against captured reference tables")
        void shouldComputePercentChange() {
            float[][] area = {{80f, 80f, 80f, 80f}, {0f, 125f, 125f, 125f}};
            dataset.setReferenceTables(ReferenceTables.of(Map.of("area", area)));

            dataset.calculatePercentChange("area");

            assertThat(dataset.value(0, 1, 2, "pct area")).isCloseTo(25f, within(1e-4f));
            assertThat(dataset.value(1, 1, 2, "pct area")).isCloseTo(-20f, within(1e-4f));
            assertThat(dataset.value(1, 1, 0, "pct area")).isZero();
        }

        @Test
        @DisplayName("should fail percent change without reference values")
        void shouldFailWithoutReference() {
            assertThatThrownBy(() -> dataset.calculatePercentChange("area"))
                .isInstanceOf(ReferenceUnavailableException.class)
                .hasMessageContaining("area");
            assertThatThrownBy(() -> dataset.calculateStrain())
                .isInstanceOf(ReferenceUnavailableException.class);
        }

        @Test
        @DisplayName("should reject appended columns of the wrong shape")
        void shouldRejectShapeMismatch() {
            assertThatThrownBy(() -> dataset.addMeasurement("bad", new float[2][3][5]))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("bad");
        }

        @Test
        @DisplayName("should keep existing columns when appending and re-plan chunks")
        void shouldAppendColumns() {
            float[][][] extra = new float[2][3][4];
            extra[1][2][3] = 42f;

            dataset.addMeasurement("extra", extra);

            assertThat(dataset.measurementNames()).endsWith("extra");
            assertThat(dataset.chunkDims().measurement()).isEqualTo(6);
            assertThat(dataset.value(1, 2, 3, "extra")).isEqualTo(42f);
            assertThat(dataset.value(1, 2, 3, "area")).isEqualTo(100f);
            assertThatThrownBy(() -> dataset.addMeasurement("extra", extra))
                .isInstanceOf(DuplicateMeasurementException.class);
        }
    }

    @Test
    @DisplayName("should spread cells across many chunks under a small budget")
    void shouldReadAcrossChunkBoundaries() {
        DiffractionDataset dataset = DiffractionDataset.create(3, 10, 4, List.of("v"), QUADRANTS, 4 * 6);
        for (int p = 0; p < 3; p++) {
            for (int f = 0; f < 10; f++) {
                List<MeasurementRow> rows = new ArrayList<>();
                for (int a = 0; a < 4; a++) {
                    rows.add(new MeasurementRow(a * 90.0, Map.of("v", (double) (p * 1000 + f * 10 + a))));
                }
                dataset.setFrameData(p, f, rows);
            }
        }
        dataset.seal();

        assertThat(dataset.chunkGrid()[0]).isEqualTo(3);
        assertThat(dataset.chunkDims().elements()).isLessThanOrEqualTo(6);
        for (int p = 0; p < 3; p++) {
            for (int f = 0; f < 10; f++) {
                for (int a = 0; a < 4; a++) {
                    assertThat(dataset.value(p, f, a, "v")).isEqualTo((float) (p * 1000 + f * 10 + a));
                }
            }
        }
    }

    @Test
    @DisplayName("should copy into an independent dataset")
    void shouldCopyIndependently() {
        DiffractionDataset dataset = DiffractionDataset.create(1, 2, 4, NAMES, QUADRANTS);
        dataset.setFrameData(0, 1, rows(7, 0.3));
        dataset.putAttribute("sample", "S1");

        DiffractionDataset copy = dataset.copy();
        copy.addMeasurement("more", new float[1][2][4]);

        assertThat(copy.value(0, 1, 2, "area")).isEqualTo(7f);
        assertThat(copy.attribute("sample")).contains("S1");
        assertThat(dataset.hasMeasurement("more")).isFalse();
    }
}
