package io.xrdtools.pipeline.core;

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

import io.xrdtools.pipeline.cache.CacheKey;
import io.xrdtools.pipeline.cache.ResultCache;
import io.xrdtools.pipeline.compute.ComputeBackend;
import io.xrdtools.pipeline.config.ProcessingOptions;
import io.xrdtools.pipeline.config.ProcessingParameters;
import io.xrdtools.pipeline.exceptions.CacheCorruptionException;
import io.xrdtools.pipeline.frames.FrameDescriptor;
import io.xrdtools.refine.RefinementRecipe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// Turns frames into outcomes, computing each frame at most once per cache.
///
/// Cached frames are never dispatched. The rest go to the compute backend as independent work
/// units. Outcomes come back sorted by global frame index whatever order workers finished in.
public class SampleProcessingScheduler {

    private static final Logger logger = LogManager.getLogger(SampleProcessingScheduler.class);

    private final ComputeBackend backend;
    private final ResultCache<FrameResult> cache;
    private final FrameProcessor processor;
    private final ProcessingParameters params;
    private final String signature;

    public SampleProcessingScheduler(ComputeBackend backend, ResultCache<FrameResult> cache,
                                     FrameProcessor processor, ProcessingParameters params) {
        this.backend = backend;
        this.cache = cache;
        this.processor = processor;
        this.params = params;
        this.signature = params.signature();
    }

    /// Processes sample frames against calibrated reference context.
    public List<FrameOutcome> process(List<FrameDescriptor> frames, ReferenceContext context) {
        return dispatch(frames, CacheKey.Role.SAMPLE, context);
    }

    /// Processes frames in the given role.
    public List<FrameOutcome> dispatch(List<FrameDescriptor> frames, CacheKey.Role role, ReferenceContext context) {
        boolean reference = role == CacheKey.Role.REFERENCE;
        ProcessingOptions options = params.options();
        RefinementRecipe recipe = RefinementRecipe.standard(reference, options.dynamicBackground(),
            options.maxStageIterations());

        String contextFingerprint = context.fingerprint();

        List<FrameOutcome> outcomes = new ArrayList<>(frames.size());
        List<WorkUnit> pending = new ArrayList<>();
        for (FrameDescriptor frame : frames) {
            CacheKey key = CacheKey.of(frame.file(), params.sample(), frame.globalIndex(), signature, role,
                contextFingerprint);
            Optional<FrameResult> cached = cached(key);
            if (cached.isPresent()) {
                outcomes.add(new FrameOutcome.Completed(frame, cached.get(), true));
            } else {
                pending.add(new WorkUnit(frame, reference, context, recipe, key));
            }
        }
        logger.info("{} pass: {} frames, {} cached, {} dispatched to {} workers",
            role.name().toLowerCase(Locale.ROOT), frames.size(), outcomes.size(), pending.size(), backend.parallelism());

        List<FrameOutcome> computed = backend.execute(pending, processor::process);
        for (int i = 0; i < pending.size(); i++) {
            FrameOutcome outcome = computed.get(i);
            if (outcome instanceof FrameOutcome.Completed completed) {
                cache.putIfAbsent(pending.get(i).key(), completed.result());
            }
            outcomes.add(outcome);
        }
        outcomes.sort(Comparator.comparingInt(o -> o.frame().globalIndex()));
        return outcomes;
    }

    /// A usable cached result, evicting entries that do not fit the current parameters.
    private Optional<FrameResult> cached(CacheKey key) {
        Optional<FrameResult> hit = cache.get(key);
        if (hit.isEmpty()) {
            return hit;
        }
        try {
            hit.get().checkShape(key, params.peakCount(), params.azimuths().count(),
                params.backgroundCandidates().size());
            return hit;
        } catch (CacheCorruptionException e) {
            logger.warn("{}; recomputing", e.getMessage());
            cache.evict(key);
            return Optional.empty();
        }
    }
}
