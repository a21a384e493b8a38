/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.cortexkernel.reasoning.evolution;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Parameters of a single self play round. A null proposer or solver falls back to the engine's heuristics.
 */
@Value
public class EvolveOptions {
    public static final double DEFAULT_DIFFICULTY = 0.5;
    public static final int DEFAULT_NUM_PROBLEMS = 5;

    double difficulty;
    int numProblems;
    ProblemProposer proposer;
    ProblemSolver solver;

    @Builder
    public EvolveOptions(Double difficulty, Integer numProblems, ProblemProposer proposer, ProblemSolver solver) {
        this.difficulty = Objects.requireNonNullElse(difficulty, DEFAULT_DIFFICULTY);
        this.numProblems = Objects.requireNonNullElse(numProblems, DEFAULT_NUM_PROBLEMS);
        this.proposer = proposer;
        this.solver = solver;
        Preconditions.checkArgument(this.difficulty >= 0 && this.difficulty <= 1, "difficulty must be in [0, 1]");
        Preconditions.checkArgument(this.numProblems >= 1, "numProblems must be at least 1");
    }

    public static EvolveOptions defaults() {
        return EvolveOptions.builder().build();
    }
}
