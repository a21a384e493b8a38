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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Proposes placeholder problems whose difficulty wanders up to 0.1 around the requested one
 */
@AllArgsConstructor
public class JitteredProblemProposer implements ProblemProposer {
    private final Random random;

    @Override
    public List<ProblemProposal> propose(int round, double difficulty, int count) {
        final var problems = new ArrayList<ProblemProposal>(count);
        for (int i = 0; i < count; i++) {
            final var jittered = KernelUtils.clamp01(difficulty + (random.nextDouble() - 0.5) * 0.2);
            problems.add(new ProblemProposal(KernelUtils.id("prob"),
                                             "Problem %d-%d (difficulty: %.0f%%)".formatted(round, i, jittered * 100),
                                             jittered));
        }
        return problems;
    }
}
