package io.xrdtools.dataset.io;

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

import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.Dataset;
import io.jhdf.api.WritableGroup;
import io.jhdf.exceptions.HdfException;
import io.xrdtools.dataset.DatasetDescriptor;
import io.xrdtools.dataset.DiffractionDataset;
import io.xrdtools.dataset.ReferenceTables;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Stores datasets as HDF5 files through jHDF.
///
/// ## File Layout
///
/// ```
/// /manifest          uint8[]   UTF-8 JSON StoreManifest
/// /frame_numbers     int32[peaks][frames]
/// /azimuth_angles    float32[peaks][azimuths]
/// /chunks/c{p}_{f}_{a}  float32[..][..][..][measurements], one dataset per chunk
/// /reference/r{i}    float32[peaks][azimuths], named by manifest.referenceNames[i]
/// ```
///
/// Files are written to a sibling temporary path and moved into place, so a reader never sees
/// a half-written dataset.
public class Hdf5DatasetStore implements DatasetStore {

    private static final Logger logger = LogManager.getLogger(Hdf5DatasetStore.class);

    static final String MANIFEST = "manifest";
    static final String FRAME_NUMBERS = "frame_numbers";
    static final String AZIMUTH_ANGLES = "azimuth_angles";
    static final String CHUNKS = "chunks";
    static final String REFERENCE = "reference";

    @Override
    public void save(DiffractionDataset dataset, Path path) throws IOException {
        dataset.seal();
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");

        ReferenceTables references = dataset.referenceTables();
        List<String> referenceNames = references.names();
        StoreManifest manifest = new StoreManifest(StoreManifest.CURRENT_VERSION, dataset.descriptor(), referenceNames);
        byte[] manifestBytes = DatasetGsonConfig.gson().toJson(manifest).getBytes(StandardCharsets.UTF_8);

        try (WritableHdfFile out = HdfFile.write(temp)) {
            out.putDataset(MANIFEST, manifestBytes);
            out.putDataset(FRAME_NUMBERS, dataset.frameNumbers());
            out.putDataset(AZIMUTH_ANGLES, dataset.azimuthAngles());

            WritableGroup chunks = out.putGroup(CHUNKS);
            int[] grid = dataset.chunkGrid();
            for (int cp = 0; cp < grid[0]; cp++) {
                for (int cf = 0; cf < grid[1]; cf++) {
                    for (int ca = 0; ca < grid[2]; ca++) {
                        chunks.putDataset(chunkName(cp, cf, ca), dataset.chunk(cp, cf, ca));
                    }
                }
            }

            if (!referenceNames.isEmpty()) {
                WritableGroup reference = out.putGroup(REFERENCE);
                for (int i = 0; i < referenceNames.size(); i++) {
                    reference.putDataset("r" + i, references.table(referenceNames.get(i)));
                }
            }
        } catch (HdfException e) {
            Files.deleteIfExists(temp);
            throw new IOException("Failed to write dataset to " + path, e);
        }
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("Saved {} to {}", dataset, path);
    }

    @Override
    public DiffractionDataset load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("No dataset file at " + path);
        }
        try (HdfFile in = new HdfFile(path)) {
            String json = new String((byte[]) read(in, MANIFEST), StandardCharsets.UTF_8);
            StoreManifest manifest = DatasetGsonConfig.gson().fromJson(json, StoreManifest.class);
            if (manifest == null || manifest.descriptor() == null) {
                throw new IOException("Dataset file " + path + " has an empty manifest");
            }
            if (manifest.formatVersion() != StoreManifest.CURRENT_VERSION) {
                throw new IOException("Unsupported dataset format version " + manifest.formatVersion() + " in " + path);
            }
            DatasetDescriptor descriptor = manifest.descriptor();
            int[][] frameNumbers = (int[][]) read(in, FRAME_NUMBERS);
            float[][] azimuthAngles = (float[][]) read(in, AZIMUTH_ANGLES);

            int[] grid = descriptor.chunkDims().grid(descriptor.peaks(), descriptor.frames(), descriptor.azimuths());
            float[][][][][] chunks = new float[grid[0] * grid[1] * grid[2]][][][][];
            for (int cp = 0; cp < grid[0]; cp++) {
                for (int cf = 0; cf < grid[1]; cf++) {
                    for (int ca = 0; ca < grid[2]; ca++) {
                        chunks[(cp * grid[1] + cf) * grid[2] + ca] =
                            (float[][][][]) read(in, CHUNKS + "/" + chunkName(cp, cf, ca));
                    }
                }
            }

            Map<String, float[][]> tables = new LinkedHashMap<>();
            List<String> referenceNames = manifest.referenceNames() == null ? List.of() : manifest.referenceNames();
            for (int i = 0; i < referenceNames.size(); i++) {
                tables.put(referenceNames.get(i), (float[][]) read(in, REFERENCE + "/r" + i));
            }
            DiffractionDataset dataset = DiffractionDataset.restore(descriptor, frameNumbers, azimuthAngles,
                ReferenceTables.of(tables), chunks);
            logger.debug("Loaded {} from {}", dataset, path);
            return dataset;
        } catch (HdfException | ClassCastException e) {
            throw new IOException("Failed to read dataset from " + path, e);
        }
    }

    private static Object read(HdfFile in, String datasetPath) {
        Dataset dataset = in.getDatasetByPath(datasetPath);
        return dataset.getData();
    }

    static String chunkName(int peakChunk, int frameChunk, int azimuthChunk) {
        return "c" + peakChunk + "_" + frameChunk + "_" + azimuthChunk;
    }
}
