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

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class DifficultyScheduleTest {

    @Test
    void linearAndExponentialAlwaysGrow() {
        assertAll(
                () -> assertEquals(0.35, DifficultySchedule.LINEAR.next(0.3, 0.0), 1e-9),
                () -> assertEquals(0.23, DifficultySchedule.EXPONENTIAL.next(0.2, 1.0), 1e-9)
                 );
    }

    @Test
    void adaptiveFollowsQuality() {
        assertAll(
                () -> assertEquals(0.58, DifficultySchedule.ADAPTIVE.next(0.5, 0.8), 1e-9),
                () -> assertEquals(0.45, DifficultySchedule.ADAPTIVE.next(0.5, 0.2), 1e-9),
                () -> assertEquals(0.5, DifficultySchedule.ADAPTIVE.next(0.5, 0.5), 1e-9),
                () -> assertEquals(0.1, DifficultySchedule.ADAPTIVE.next(0.12, 0.1), 1e-9)
                 );
    }

    @Test
    void defaultSolverDegradesWithDifficulty() {
        final var proposer = new JitteredProblemProposer(new Random(3));
        final var solver = new HeuristicProblemSolver(new Random(3));
        final var problems = proposer.propose(1, 0.5, 4);

        assertEquals(4, problems.size());
        for (final var problem : problems) {
            assertTrue(problem.getDifficulty() >= 0.4 && problem.getDifficulty() <= 0.6);
            final var solution = solver.solve(problem);
            assertEquals(problem.getId(), solution.getProblemId());
            assertTrue(solution.getQuality() >= 0.5 && solution.getQuality() <= 0.8);
        }
    }
}
