package io.xrdtools.refine;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Drives one [RefinementSession] through a [RefinementRecipe].
///
/// ## Per-Stage Loop
///
/// ```
/// for pass in 0 until stage.maxIterations:
///     previous = current
///     for step in stage.steps:
///         result = engine.refine(step)          // Updated or Failure
///         Failure  -> session FAILED, stop
///         Updated  -> correct masked parameters, current = corrected
///     if pass >= stage.minIterations and no correction fired this pass
///        and maxRelativeChange(previous, current) < threshold:
///         converged, next stage
/// ```
///
/// A stage that runs out of passes is accepted as it stands. After the last stage the session
/// is `DONE`. An engine failure at any point ends the session in `FAILED`; the caller decides
/// what that means for the owning frame.
public class RefinementController {

    private static final Logger logger = LogManager.getLogger(RefinementController.class);

    private final RefinementEngine engine;
    private final ParameterCorrector corrector;
    private final ConvergenceCriteria convergence;

    public RefinementController(RefinementEngine engine) {
        this(engine, new ParameterCorrector(), ConvergenceCriteria.DEFAULT);
    }

    public RefinementController(RefinementEngine engine, ParameterCorrector corrector, ConvergenceCriteria convergence) {
        this.engine = engine;
        this.corrector = corrector;
        this.convergence = convergence;
    }

    public SliceResult run(RefinementSession session, RefinementRecipe recipe) {
        if (session.state() != RefinementState.INIT) {
            throw new IllegalStateException("session already ran, state is " + session.state());
        }
        AzimuthalSlice slice = session.slice();
        List<StageReport> reports = new ArrayList<>();

        ParameterSnapshot seeded;
        try {
            session.recordEngineCall();
            seeded = engine.seedBackground(slice, session.current(), session.window());
        } catch (RefinementException | RuntimeException e) {
            return failed(session, reports, "background seeding: " + e.getMessage());
        }
        if (seeded == null || !seeded.hasSameShapeAs(session.current())) {
            return failed(session, reports, "background seeding: engine returned unusable parameters");
        }
        session.update(seeded);
        session.transition(RefinementState.BACKGROUND_SEEDED);

        for (RefinementStage stage : recipe.stages()) {
            int corrections = 0;
            boolean converged = false;
            int passes = 0;
            double change = Double.POSITIVE_INFINITY;

            for (int pass = 0; pass < stage.maxIterations(); pass++) {
                session.beginPass();
                passes++;
                int passCorrections = 0;
                for (RefinementStep step : stage.steps()) {
                    session.recordEngineCall();
                    StepResult result = StepResult.attempt(engine, slice, session.current(), step, session.window());
                    if (result instanceof StepResult.Failure failure) {
                        logger.debug("slice {} failed in step '{}': {}", slice.index(), failure.step(), failure.reason());
                        return failed(session, reports, failure.step() + ": " + failure.reason());
                    }
                    ParameterSnapshot updated = ((StepResult.Updated) result).snapshot();
                    ParameterCorrector.Correction correction =
                        corrector.correct(updated, step.peaks(), session.seed(), session.window());
                    passCorrections += correction.corrections();
                    session.update(correction.snapshot());
                }
                corrections += passCorrections;
                change = convergence.maxRelativeChange(session.previous(), session.current());
                if (pass >= stage.minIterations() && passCorrections == 0 && change < convergence.threshold()) {
                    converged = true;
                    break;
                }
            }
            session.transition(stage.target());
            reports.add(new StageReport(stage.target(), passes, converged, corrections, change));
            if (!converged) {
                logger.trace("slice {}: stage {} used all {} passes (last change {})",
                    slice.index(), stage.target(), passes, change);
            }
        }

        session.transition(RefinementState.DONE);
        return new SliceResult(slice.index(), slice.azimuth(), RefinementState.DONE, session.current(),
            reports, session.engineCalls(), null);
    }

    private SliceResult failed(RefinementSession session, List<StageReport> reports, String reason) {
        session.fail(reason);
        AzimuthalSlice slice = session.slice();
        return new SliceResult(slice.index(), slice.azimuth(), RefinementState.FAILED, session.current(),
            reports, session.engineCalls(), reason);
    }
}
