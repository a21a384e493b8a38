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

@Value
public class EvolveLoopOptions {
    public static final int DEFAULT_MAX_ROUNDS = 10;
    public static final double DEFAULT_INITIAL_DIFFICULTY = 0.3;

    int maxRounds;
    double initialDifficulty;
    DifficultySchedule schedule;
    int numProblems;
    ProblemProposer proposer;
    ProblemSolver solver;

    @Builder
    public EvolveLoopOptions(
            Integer maxRounds,
            Double initialDifficulty,
            DifficultySchedule schedule,
            Integer numProblems,
            ProblemProposer proposer,
            ProblemSolver solver) {
        this.maxRounds = Objects.requireNonNullElse(maxRounds, DEFAULT_MAX_ROUNDS);
        this.initialDifficulty = Objects.requireNonNullElse(initialDifficulty, DEFAULT_INITIAL_DIFFICULTY);
        this.schedule = Objects.requireNonNullElse(schedule, DifficultySchedule.ADAPTIVE);
        this.numProblems = Objects.requireNonNullElse(numProblems, EvolveOptions.DEFAULT_NUM_PROBLEMS);
        this.proposer = proposer;
        this.solver = solver;
        Preconditions.checkArgument(this.maxRounds >= 0, "maxRounds must not be negative");
        Preconditions.checkArgument(this.initialDifficulty >= 0 && this.initialDifficulty <= 1,
                                    "initialDifficulty must be in [0, 1]");
        Preconditions.checkArgument(this.numProblems >= 1, "numProblems must be at least 1");
    }

    public static EvolveLoopOptions defaults() {
        return EvolveLoopOptions.builder().build();
    }

    public EvolveOptions roundOptions(double difficulty) {
        return new EvolveOptions(difficulty, numProblems, proposer, solver);
    }
}
