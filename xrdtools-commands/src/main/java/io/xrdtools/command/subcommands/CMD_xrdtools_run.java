package io.xrdtools.command.subcommands;

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

import io.xrdtools.command.common.WorkerOption;
import io.xrdtools.dataset.io.Hdf5DatasetStore;
import io.xrdtools.pipeline.cache.ResultCache;
import io.xrdtools.pipeline.config.ProcessingParameters;
import io.xrdtools.pipeline.config.RecipeLoader;
import io.xrdtools.pipeline.core.FrameResult;
import io.xrdtools.pipeline.core.ReductionPipeline;
import io.xrdtools.pipeline.core.ReductionResult;
import io.xrdtools.pipeline.frames.DirectoryFrameSource;
import io.xrdtools.pipeline.spi.ReductionBackendProvider;
import io.xrdtools.pipeline.spi.ReductionBackends;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the reduction one recipe describes, or every {@code *.json} recipe of a directory.
 *
 * <p>In directory mode each recipe that succeeds is moved into a {@code processed}
 * subdirectory, and a failing recipe does not stop the ones after it. All recipes of one
 * invocation share a result cache, so frames reduced twice with identical parameters are
 * refined once.
 */
@CommandLine.Command(name = "run",
    header = "Reduce the frames described by processing recipes",
    description = "Refines every frame of a recipe's image directory and stores the resulting dataset\n" +
        "under a new directory of --output.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: every recipe reduced", "1: at least one recipe failed", "2: usage error"})
public class CMD_xrdtools_run implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_xrdtools_run.class);

    public static final String PROCESSED_DIR = "processed";

    static class RecipeSource {
        @CommandLine.Option(names = {"-r", "--recipe"}, description = "A single recipe file")
        Path recipe;

        @CommandLine.Option(names = {"--recipes"}, description = "A directory of recipe files, run in name order")
        Path recipeDirectory;
    }

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private RecipeSource source;

    @CommandLine.Option(names = {"-o", "--output"}, defaultValue = ".",
        description = "Directory that receives one dataset directory per recipe (default: ${DEFAULT-VALUE})")
    private Path output;

    @CommandLine.Option(names = {"-b", "--backend"},
        description = "Name of the refinement backend to use when several are installed")
    private String backend;

    @CommandLine.Mixin
    private WorkerOption workers = new WorkerOption();

    @Override
    public Integer call() {
        Optional<ReductionBackendProvider> provider = backend == null
            ? ReductionBackends.single()
            : ReductionBackends.get(backend);
        if (provider.isEmpty()) {
            logger.error("No refinement backend {}; available: {}",
                backend == null ? "selected" : "named '" + backend + "'", ReductionBackends.availableNames());
            return 2;
        }
        if (workers.exceedsAvailableCores()) {
            logger.warn("--threads {} exceeds the {} available cores", workers.getExplicitThreads(),
                Runtime.getRuntime().availableProcessors());
        }
        ReductionBackendProvider selected = provider.get();
        logger.debug("using refinement backend '{}'", selected.name());
        ReductionPipeline pipeline = new ReductionPipeline(new DirectoryFrameSource(), selected.integrator(),
            selected.engine(), new Hdf5DatasetStore());
        ResultCache<FrameResult> cache = new ResultCache<>();

        if (source.recipe != null) {
            return reduce(pipeline, source.recipe, cache) ? 0 : 1;
        }
        return runBatch(pipeline, source.recipeDirectory, cache);
    }

    private int runBatch(ReductionPipeline pipeline, Path directory, ResultCache<FrameResult> cache) {
        if (!Files.isDirectory(directory)) {
            logger.error("Recipe directory not found: {}", directory);
            return 2;
        }
        List<Path> recipes;
        try (Stream<Path> files = Files.list(directory)) {
            recipes = files.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".json"))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            logger.error("Cannot list recipes in {}: {}", directory, e.getMessage());
            return 2;
        }
        if (recipes.isEmpty()) {
            logger.warn("No recipes found in {}", directory);
            return 0;
        }

        int failed = 0;
        Path processed = directory.resolve(PROCESSED_DIR);
        for (Path recipe : recipes) {
            if (!reduce(pipeline, recipe, cache)) {
                failed++;
                continue;
            }
            try {
                Files.createDirectories(processed);
                Files.move(recipe, processed.resolve(recipe.getFileName()), StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                logger.error("Reduced {} but could not move it to {}: {}", recipe, processed, e.getMessage());
                failed++;
            }
        }
        System.out.printf("%d of %d recipes reduced%n", recipes.size() - failed, recipes.size());
        return failed == 0 ? 0 : 1;
    }

    private boolean reduce(ReductionPipeline pipeline, Path recipe, ResultCache<FrameResult> cache) {
        try {
            ProcessingParameters params = workers.applyTo(RecipeLoader.load(recipe));
            Files.createDirectories(output);
            ReductionResult result = pipeline.runAndSave(params, output, cache);
            System.out.printf("%s: %s -> %s%n", recipe.getFileName(), result.summary(),
                result.saved().map(Path::toString).orElse("(not saved)"));
            return true;
        } catch (IOException | RuntimeException e) {
            logger.error("Reduction of {} failed: {}", recipe, e.getMessage(), e);
            return false;
        }
    }
}
