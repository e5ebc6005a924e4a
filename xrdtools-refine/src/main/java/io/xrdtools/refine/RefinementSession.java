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

/// Mutable refinement state of one azimuthal slice.
///
/// The session holds the current and previous-pass [ParameterSnapshot]s and the state machine
/// position. Snapshots themselves are immutable; the session only swaps references. One session
/// belongs to one thread for its whole life.
public final class RefinementSession {

    private final AzimuthalSlice slice;
    private final ParameterSnapshot seed;
    private final AnalysisWindow window;

    private RefinementState state = RefinementState.INIT;
    private ParameterSnapshot current;
    private ParameterSnapshot previous;
    private int iterations;
    private int engineCalls;
    private String failure;

    public RefinementSession(AzimuthalSlice slice, ParameterSnapshot seed, AnalysisWindow window) {
        this.slice = slice;
        this.seed = seed;
        this.window = window;
        this.current = seed;
        this.previous = seed;
    }

    public AzimuthalSlice slice() {
        return slice;
    }

    public ParameterSnapshot seed() {
        return seed;
    }

    public AnalysisWindow window() {
        return window;
    }

    public RefinementState state() {
        return state;
    }

    public ParameterSnapshot current() {
        return current;
    }

    public ParameterSnapshot previous() {
        return previous;
    }

    /// @return total passes executed across all stages
    public int iterations() {
        return iterations;
    }

    public int engineCalls() {
        return engineCalls;
    }

    void transition(RefinementState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("illegal refinement transition " + state + " -> " + next);
        }
        state = next;
    }

    void beginPass() {
        previous = current;
        iterations++;
    }

    void recordEngineCall() {
        engineCalls++;
    }

    void update(ParameterSnapshot snapshot) {
        current = snapshot;
    }

    void fail(String reason) {
        failure = reason;
        transition(RefinementState.FAILED);
    }

    String failure() {
        return failure;
    }
}
