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

import com.phonepe.cortexkernel.core.utils.KernelUtils;
import lombok.AllArgsConstructor;

import java.util.Random;

/**
 * Grades problems by difficulty alone: harder problems get worse solutions, with some noise
 */
@AllArgsConstructor
public class HeuristicProblemSolver implements ProblemSolver {
    private final Random random;

    @Override
    public Solution solve(ProblemProposal problem) {
        final var quality = KernelUtils.clamp01(0.8 - 0.3 * problem.getDifficulty()
                                                        + (random.nextDouble() - 0.5) * 0.2);
        return new Solution(problem.getId(), "Solution for: " + problem.getDescription(), quality);
    }
}
