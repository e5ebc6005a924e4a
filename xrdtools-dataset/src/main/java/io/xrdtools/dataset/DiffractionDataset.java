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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/// A 4-D (peak × frame × azimuth × measurement) array of reduced diffraction results.
///
/// ## Lifecycle
///
/// A dataset is created **open**, on a dense backing store, and is filled cell by cell through
/// [#setFrameData]. [#seal()] converts it, once and irreversibly, to a chunked layout sized by
/// [ChunkPlanner]. After sealing the only legal mutation is appending a whole column via
/// [#addMeasurement] or one of the derived-measurement calculations, each of which seals an
/// open dataset first.
///
/// ```
///   create ──▶ OPEN ──setFrameData*──▶ OPEN ──seal──▶ SEALED ──addMeasurement*──▶ SEALED
/// ```
///
/// Raw reads ([#value], [#measurement], [#frameNumber], ...) require the sealed state.
///
/// ## Indexes
///
/// Alongside the array the dataset keeps a `(peak, frame)` frame-number index and a
/// `(peak, azimuth)` angle index. Azimuth angles map to indices through the [AzimuthGrid].
///
/// ## Thread Safety
///
/// Not thread-safe. The open API is meant to be driven by exactly one aggregating thread.
public final class DiffractionDataset {

    private static final Logger logger = LogManager.getLogger(DiffractionDataset.class);

    public static final String STRAIN = "strain";
    public static final String ABS_STRAIN = "abs strain";
    public static final String D_SPACING = "d";
    public static final String DELTA_PREFIX = "delta ";
    public static final String PCT_PREFIX = "pct ";
    /// Attribute naming the experimental stage the dataset was measured in.
    public static final String STAGE_ATTRIBUTE = "stage";

    private final int peaks;
    private final int frames;
    private final int azimuths;
    private final AzimuthGrid grid;
    private final long targetBytes;
    private final List<String> measurementNames;
    private final Map<String, Integer> columns;
    private final int[][] frameNumbers;
    private final float[][] azimuthAngles;
    private final List<String> peakLabels;
    private final Map<String, String> attributes;
    private ReferenceTables referenceTables = ReferenceTables.empty();
    private DatasetBacking backing;

    private DiffractionDataset(int peaks, int frames, int azimuths, List<String> names,
                               AzimuthGrid grid, long targetBytes, DatasetBacking backing,
                               int[][] frameNumbers, float[][] azimuthAngles) {
        this.peaks = peaks;
        this.frames = frames;
        this.azimuths = azimuths;
        this.grid = grid;
        this.targetBytes = targetBytes;
        this.measurementNames = new ArrayList<>(names);
        this.columns = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            columns.put(names.get(i), i);
        }
        this.backing = backing;
        this.frameNumbers = frameNumbers;
        this.azimuthAngles = azimuthAngles;
        this.peakLabels = new ArrayList<>();
        for (int p = 0; p < peaks; p++) {
            peakLabels.add("peak " + p);
        }
        this.attributes = new TreeMap<>();
    }

    /// Creates an open dataset over a full-circle azimuth grid with the default chunk budget.
    public static DiffractionDataset create(int peaks, int frames, int azimuths, List<String> names) {
        if (azimuths < 1) {
            throw new DatasetConstructionException("azimuths must be >= 1, got %d", azimuths);
        }
        return create(peaks, frames, azimuths, names, AzimuthGrid.fullCircle(azimuths));
    }

    public static DiffractionDataset create(int peaks, int frames, int azimuths, List<String> names,
                                            AzimuthGrid grid) {
        return create(peaks, frames, azimuths, names, grid, ChunkPlanner.DEFAULT_TARGET_BYTES);
    }

    /// Creates an open dataset.
    ///
    /// @param peaks number of tracked peaks
    /// @param frames number of frames
    /// @param azimuths number of azimuth bins, which must equal `grid.count()`
    /// @param names initial measurement columns
    /// @param grid azimuthal binning
    /// @param targetBytes chunk byte budget for sealing
    /// @throws DatasetConstructionException if any axis is < 1, names are empty, blank or repeated,
    ///     or the grid disagrees with `azimuths`
    public static DiffractionDataset create(int peaks, int frames, int azimuths, List<String> names,
                                            AzimuthGrid grid, long targetBytes) {
        if (peaks < 1 || frames < 1 || azimuths < 1) {
            throw new DatasetConstructionException(
                "dataset dimensions must all be >= 1: peaks=%d, frames=%d, azimuths=%d", peaks, frames, azimuths);
        }
        if (names == null || names.isEmpty()) {
            throw new DatasetConstructionException("at least one measurement name is required");
        }
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new DatasetConstructionException("measurement names must not be blank: " + names);
            }
            if (!seen.add(name)) {
                throw new DatasetConstructionException("measurement name '%s' is repeated", name);
            }
        }
        if (grid == null) {
            throw new DatasetConstructionException("an azimuth grid is required");
        }
        if (grid.count() != azimuths) {
            throw new DatasetConstructionException(
                "azimuth grid %s has %d bins but the dataset declares %d", grid, grid.count(), azimuths);
        }
        if (targetBytes <= 0) {
            throw new DatasetConstructionException("chunk target must be positive, got %d", targetBytes);
        }
        return new DiffractionDataset(peaks, frames, azimuths, names, grid, targetBytes,
            new DenseBacking(peaks, frames, azimuths, names.size()),
            new int[peaks][frames], new float[peaks][azimuths]);
    }

    /// Rebuilds a sealed dataset from stored content.
    ///
    /// @param descriptor shape, names and metadata
    /// @param frameNumbers `[peaks][frames]` frame-number index
    /// @param azimuthAngles `[peaks][azimuths]` angle index
    /// @param references captured reference tables, possibly empty
    /// @param chunks chunk arrays in chunk-grid order (peak-major, then frame, then azimuth)
    /// @throws DatasetConstructionException if any part disagrees with the descriptor
    public static DiffractionDataset restore(DatasetDescriptor descriptor, int[][] frameNumbers,
                                             float[][] azimuthAngles, ReferenceTables references,
                                             float[][][][][] chunks) {
        DiffractionDataset dataset = create(descriptor.peaks(), descriptor.frames(), descriptor.azimuths(),
            descriptor.measurementNames(), descriptor.grid(), descriptor.targetBytes());
        if (frameNumbers.length != descriptor.peaks() || azimuthAngles.length != descriptor.peaks()) {
            throw new DatasetConstructionException("index arrays do not cover %d peaks", descriptor.peaks());
        }
        for (int p = 0; p < descriptor.peaks(); p++) {
            if (frameNumbers[p].length != descriptor.frames() || azimuthAngles[p].length != descriptor.azimuths()) {
                throw new DatasetConstructionException("index arrays for peak %d do not match the declared shape", p);
            }
            System.arraycopy(frameNumbers[p], 0, dataset.frameNumbers[p], 0, descriptor.frames());
            System.arraycopy(azimuthAngles[p], 0, dataset.azimuthAngles[p], 0, descriptor.azimuths());
        }
        try {
            dataset.backing = ChunkedBacking.fromChunks(descriptor.peaks(), descriptor.frames(),
                descriptor.azimuths(), descriptor.measurementNames().size(), descriptor.chunkDims(), chunks);
        } catch (IllegalArgumentException e) {
            throw new DatasetConstructionException("stored chunks are inconsistent: " + e.getMessage());
        }
        dataset.setPeakLabels(descriptor.peakLabels());
        dataset.attributes.putAll(descriptor.attributes());
        dataset.setReferenceTables(references);
        return dataset;
    }

    /// Writes one (peak, frame) slice.
    ///
    /// Rows are applied in ascending azimuth order. The first non-zero angle seen for a
    /// (peak, azimuth bin) becomes that bin's stored angle. Values under names the dataset does
    /// not have, and non-finite values, are skipped and leave the cell at 0.
    ///
    /// @throws MutationAfterFinalizeException if the dataset is sealed
    /// @throws IndexOutOfBoundsException if `peakIdx` or `frameIdx` is out of range
    public void setFrameData(int peakIdx, int frameIdx, int frameNumber, List<MeasurementRow> rows) {
        if (!(backing instanceof DenseBacking dense)) {
            throw new MutationAfterFinalizeException("set frame data");
        }
        Objects.checkIndex(peakIdx, peaks);
        Objects.checkIndex(frameIdx, frames);

        List<MeasurementRow> ordered = new ArrayList<>(rows);
        ordered.sort(Comparator.comparingDouble(MeasurementRow::azimuth));

        frameNumbers[peakIdx][frameIdx] = frameNumber;
        for (MeasurementRow row : ordered) {
            int azimuthIdx = grid.indexOf(row.azimuth());
            if (azimuthAngles[peakIdx][azimuthIdx] == 0f) {
                azimuthAngles[peakIdx][azimuthIdx] = (float) row.azimuth();
            }
            for (Map.Entry<String, Double> value : row.values().entrySet()) {
                Integer column = columns.get(value.getKey());
                if (column == null) {
                    logger.trace("skipping unknown measurement '{}'", value.getKey());
                    continue;
                }
                double v = value.getValue();
                if (!Double.isFinite(v)) {
                    continue;
                }
                dense.set(peakIdx, frameIdx, azimuthIdx, column, (float) v);
            }
        }
    }

    /// Writes one (peak, frame) slice using the frame index as its frame number.
    public void setFrameData(int peakIdx, int frameIdx, List<MeasurementRow> rows) {
        setFrameData(peakIdx, frameIdx, frameIdx, rows);
    }

    /// Converts the dense backing to the planned chunk layout. Repeat calls do nothing.
    public void seal() {
        if (backing instanceof DenseBacking dense) {
            ChunkDims dims = ChunkPlanner.plan(peaks, frames, azimuths, dense.measurementCount(), targetBytes);
            backing = dense.toChunked(dims);
            logger.debug("sealed dataset ({}, {}, {}, {}) with chunks {}",
                peaks, frames, azimuths, dense.measurementCount(), dims);
        }
    }

    public boolean isSealed() {
        return backing instanceof ChunkedBacking;
    }

    /// Appends a whole column, sealing the dataset first if it is still open.
    ///
    /// @param name new measurement name
    /// @param values `[peaks][frames][azimuths]` values
    /// @throws DuplicateMeasurementException if `name` exists
    /// @throws ShapeMismatchException if `values` does not match the first three axes
    public void addMeasurement(String name, float[][][] values) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("measurement name must not be blank");
        }
        if (columns.containsKey(name)) {
            throw new DuplicateMeasurementException(name);
        }
        checkShape(name, values);
        seal();
        ChunkedBacking chunked = (ChunkedBacking) backing;
        int measurements = chunked.measurementCount() + 1;
        ChunkDims dims = ChunkPlanner.plan(peaks, frames, azimuths, measurements, targetBytes);
        backing = chunked.appendColumn(values, dims);
        columns.put(name, measurementNames.size());
        measurementNames.add(name);
        logger.debug("added measurement '{}' as column {}", name, measurements - 1);
    }

    private void checkShape(String name, float[][][] values) {
        int[] expected = {peaks, frames, azimuths};
        if (values == null || values.length != peaks) {
            throw new ShapeMismatchException(name, expected,
                new int[]{values == null ? 0 : values.length, -1, -1});
        }
        for (float[][] byFrame : values) {
            if (byFrame.length != frames) {
                throw new ShapeMismatchException(name, expected, new int[]{peaks, byFrame.length, -1});
            }
            for (float[] byAzimuth : byFrame) {
                if (byAzimuth.length != azimuths) {
                    throw new ShapeMismatchException(name, expected, new int[]{peaks, frames, byAzimuth.length});
                }
            }
        }
    }

    /// Appends `delta {measurement}`, the difference between consecutive frames.
    ///
    /// `delta[f] = x[f] - x[f-1]` for `f >= 1`; frame 0 is always 0.
    public void calculateDelta(String measurement) {
        seal();
        float[][][] source = measurement(measurement);
        float[][][] delta = new float[peaks][frames][azimuths];
        for (int p = 0; p < peaks; p++) {
            for (int f = 1; f < frames; f++) {
                for (int a = 0; a < azimuths; a++) {
                    delta[p][f][a] = source[p][f][a] - source[p][f - 1][a];
                }
            }
        }
        addMeasurement(DELTA_PREFIX + measurement, delta);
    }

    /// Appends `strain` and `abs strain` against the captured reference d-spacing table.
    ///
    /// @throws ReferenceUnavailableException if no reference d-spacing was captured
    public void calculateStrain() {
        if (!referenceTables.has(D_SPACING)) {
            throw new ReferenceUnavailableException(D_SPACING);
        }
        calculateStrain(referenceTables.table(D_SPACING));
    }

    /// Appends `strain = (d - ref) / ref` and its absolute value.
    ///
    /// Cells where either value is zero or non-finite get 0, never NaN.
    ///
    /// @param referenceD `[peaks][azimuths]` reference d-spacing
    /// @throws DuplicateMeasurementException if `strain` or `abs strain` already exists; nothing is appended then
    public void calculateStrain(float[][] referenceD) {
        for (String name : List.of(STRAIN, ABS_STRAIN)) {
            if (columns.containsKey(name)) {
                throw new DuplicateMeasurementException(name);
            }
        }
        checkReferenceShape(D_SPACING, referenceD);
        seal();
        float[][][] d = measurement(D_SPACING);
        float[][][] strain = new float[peaks][frames][azimuths];
        float[][][] absStrain = new float[peaks][frames][azimuths];
        for (int p = 0; p < peaks; p++) {
            for (int f = 0; f < frames; f++) {
                for (int a = 0; a < azimuths; a++) {
                    float value = relativeChange(d[p][f][a], referenceD[p][a]);
                    strain[p][f][a] = value;
                    absStrain[p][f][a] = Math.abs(value);
                }
            }
        }
        addMeasurement(STRAIN, strain);
        addMeasurement(ABS_STRAIN, absStrain);
    }

    /// Appends `pct {measurement}`, the percent change against the captured reference table.
    ///
    /// @throws ReferenceUnavailableException if no reference values exist for `measurement`
    public void calculatePercentChange(String measurement) {
        if (!referenceTables.has(measurement)) {
            throw new ReferenceUnavailableException(measurement);
        }
        seal();
        float[][][] values = measurement(measurement);
        float[][] reference = referenceTables.table(measurement);
        float[][][] pct = new float[peaks][frames][azimuths];
        for (int p = 0; p < peaks; p++) {
            for (int f = 0; f < frames; f++) {
                for (int a = 0; a < azimuths; a++) {
                    pct[p][f][a] = relativeChange(values[p][f][a], reference[p][a]) * 100f;
                }
            }
        }
        addMeasurement(PCT_PREFIX + measurement, pct);
    }

    private static float relativeChange(float value, float reference) {
        if (value == 0f || reference == 0f || !Float.isFinite(value) || !Float.isFinite(reference)) {
            return 0f;
        }
        float change = (value - reference) / reference;
        return Float.isFinite(change) ? change : 0f;
    }

    private void checkReferenceShape(String name, float[][] table) {
        int[] expected = {peaks, azimuths};
        if (table.length != peaks) {
            throw new ShapeMismatchException(name, expected, new int[]{table.length, -1});
        }
        for (float[] row : table) {
            if (row.length != azimuths) {
                throw new ShapeMismatchException(name, expected, new int[]{peaks, row.length});
            }
        }
    }

    /// Attaches reference tables captured by the calibration pass.
    ///
    /// @throws ShapeMismatchException if non-empty tables are not `[peaks][azimuths]`
    public void setReferenceTables(ReferenceTables tables) {
        Objects.requireNonNull(tables, "tables");
        if (!tables.isEmpty() && (tables.peaks() != peaks || tables.azimuths() != azimuths)) {
            throw new ShapeMismatchException("reference tables", new int[]{peaks, azimuths},
                new int[]{tables.peaks(), tables.azimuths()});
        }
        this.referenceTables = tables;
    }

    public ReferenceTables referenceTables() {
        return referenceTables;
    }

    public Optional<float[][]> referenceTable(String measurement) {
        return referenceTables.has(measurement) ? Optional.of(referenceTables.table(measurement)) : Optional.empty();
    }

    public void setPeakLabels(List<String> labels) {
        if (labels.size() != peaks) {
            throw new IllegalArgumentException("expected " + peaks + " peak labels but got " + labels.size());
        }
        peakLabels.clear();
        peakLabels.addAll(labels);
    }

    public List<String> peakLabels() {
        return List.copyOf(peakLabels);
    }

    public void putAttribute(String key, String value) {
        attributes.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    public Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public int peaks() {
        return peaks;
    }

    public int frames() {
        return frames;
    }

    public int azimuths() {
        return azimuths;
    }

    public AzimuthGrid grid() {
        return grid;
    }

    public long targetBytes() {
        return targetBytes;
    }

    public List<String> measurementNames() {
        return List.copyOf(measurementNames);
    }

    public boolean hasMeasurement(String name) {
        return columns.containsKey(name);
    }

    /// @return the column index of `name`
    /// @throws IllegalArgumentException if the measurement does not exist
    public int columnOf(String name) {
        Integer column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("unknown measurement '" + name + "', available: " + measurementNames);
        }
        return column;
    }

    public float value(int peak, int frame, int azimuth, String measurement) {
        return value(peak, frame, azimuth, columnOf(measurement));
    }

    public float value(int peak, int frame, int azimuth, int column) {
        requireSealed();
        Objects.checkIndex(peak, peaks);
        Objects.checkIndex(frame, frames);
        Objects.checkIndex(azimuth, azimuths);
        Objects.checkIndex(column, measurementNames.size());
        return backing.get(peak, frame, azimuth, column);
    }

    /// @return a `[peaks][frames][azimuths]` copy of one column
    public float[][][] measurement(String name) {
        requireSealed();
        int column = columnOf(name);
        float[][][] values = new float[peaks][frames][azimuths];
        for (int p = 0; p < peaks; p++) {
            for (int f = 0; f < frames; f++) {
                for (int a = 0; a < azimuths; a++) {
                    values[p][f][a] = backing.get(p, f, a, column);
                }
            }
        }
        return values;
    }

    /// @return a `[frames][azimuths]` copy of one column for one peak
    public float[][] peakMeasurement(int peak, String name) {
        requireSealed();
        Objects.checkIndex(peak, peaks);
        int column = columnOf(name);
        float[][] values = new float[frames][azimuths];
        for (int f = 0; f < frames; f++) {
            for (int a = 0; a < azimuths; a++) {
                values[f][a] = backing.get(peak, f, a, column);
            }
        }
        return values;
    }

    /// @return the per-frame series of one column at one (peak, azimuth)
    public float[] azimuthSeries(int peak, int azimuth, String name) {
        requireSealed();
        Objects.checkIndex(peak, peaks);
        Objects.checkIndex(azimuth, azimuths);
        int column = columnOf(name);
        float[] values = new float[frames];
        for (int f = 0; f < frames; f++) {
            values[f] = backing.get(peak, f, azimuth, column);
        }
        return values;
    }

    public int frameNumber(int peak, int frame) {
        requireSealed();
        return frameNumbers[peak][frame];
    }

    public float azimuthAngle(int peak, int azimuth) {
        requireSealed();
        return azimuthAngles[peak][azimuth];
    }

    public int[][] frameNumbers() {
        requireSealed();
        int[][] copy = new int[peaks][];
        for (int p = 0; p < peaks; p++) {
            copy[p] = frameNumbers[p].clone();
        }
        return copy;
    }

    public float[][] azimuthAngles() {
        requireSealed();
        float[][] copy = new float[peaks][];
        for (int p = 0; p < peaks; p++) {
            copy[p] = azimuthAngles[p].clone();
        }
        return copy;
    }

    /// @return the chunk shape of the sealed layout
    public ChunkDims chunkDims() {
        return sealedBacking().dims();
    }

    /// @return `{peakChunks, frameChunks, azimuthChunks}` of the sealed layout
    public int[] chunkGrid() {
        return sealedBacking().grid();
    }

    /// @return a copy of one chunk, shaped `[peaks][frames][azimuths][measurements]` within the chunk
    public float[][][][] chunk(int peakChunk, int frameChunk, int azimuthChunk) {
        return sealedBacking().chunkCopy(peakChunk, frameChunk, azimuthChunk);
    }

    /// Describes this sealed dataset for persistence.
    public DatasetDescriptor descriptor() {
        return new DatasetDescriptor(peaks, frames, azimuths, measurementNames, grid, targetBytes,
            chunkDims(), peakLabels, attributes);
    }

    /// @return an independent sealed copy of this dataset
    public DiffractionDataset copy() {
        seal();
        int[] chunkGrid = chunkGrid();
        float[][][][][] chunks = new float[chunkGrid[0] * chunkGrid[1] * chunkGrid[2]][][][][];
        for (int cp = 0; cp < chunkGrid[0]; cp++) {
            for (int cf = 0; cf < chunkGrid[1]; cf++) {
                for (int ca = 0; ca < chunkGrid[2]; ca++) {
                    chunks[(cp * chunkGrid[1] + cf) * chunkGrid[2] + ca] = chunk(cp, cf, ca);
                }
            }
        }
        return restore(descriptor(), frameNumbers(), azimuthAngles(), referenceTables, chunks);
    }

    private ChunkedBacking sealedBacking() {
        requireSealed();
        return (ChunkedBacking) backing;
    }

    private void requireSealed() {
        if (!isSealed()) {
            throw new IllegalStateException("dataset must be sealed before it can be read");
        }
    }

    @Override
    public String toString() {
        return "DiffractionDataset{" + peaks + " peaks × " + frames + " frames × " + azimuths
            + " azimuths × " + measurementNames.size() + " measurements, "
            + (isSealed() ? "sealed" : "open") + "}";
    }
}
