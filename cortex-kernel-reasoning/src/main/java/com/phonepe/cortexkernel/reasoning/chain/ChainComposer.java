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

package com.phonepe.cortexkernel.reasoning.chain;

import com.google.common.base.Strings;
import com.phonepe.cortexkernel.core.utils.KernelUtils;
import lombok.AllArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Lays out the steps of a reasoning chain for each prompting strategy. Every step is linked to the one before it.
 */
@AllArgsConstructor
public class ChainComposer {
    private static final int MAX_SUB_PROBLEMS = 3;
    private static final int MAX_CONSISTENCY_SAMPLES = 3;

    private final Random random;

    public List<ReasoningStep> compose(String problem, ReasoningStrategy strategy, ReasonOptions options,
                                       int maxSteps) {
        final var steps = new ArrayList<ReasoningStep>();
        switch (strategy) {
            case ZERO_SHOT -> zeroShot(problem, options.getContext(), maxSteps, steps);
            case FEW_SHOT -> fewShot(problem, options.getFewShotExamples(), maxSteps, steps);
            case SELF_CONSISTENCY -> selfConsistency(problem, maxSteps, steps);
            case LEAST_TO_MOST -> leastToMost(problem, maxSteps, steps);
        }
        return steps;
    }

    public static ReasoningStep step(List<ReasoningStep> chain, StepType type, String content, double confidence) {
        final var parentId = chain.isEmpty() ? null : chain.get(chain.size() - 1).getId();
        final var step = new ReasoningStep(KernelUtils.id("step"),
                                           parentId,
                                           type,
                                           content,
                                           KernelUtils.clamp01(confidence),
                                           LocalDateTime.now());
        chain.add(step);
        return step;
    }

    private void zeroShot(String problem, String context, int maxSteps, List<ReasoningStep> steps) {
        if (!Strings.isNullOrEmpty(context) && maxSteps >= 3) {
            step(steps, StepType.HYPOTHESIS,
                 "Understanding: %s (Context: %s)".formatted(problem, truncate(context, 200)), 0.6);
        }
        if (maxSteps >= 2) {
            step(steps, StepType.DEDUCTION, "Decomposition: Identifying key components of the problem", 0.65);
        }
        step(steps, StepType.CONCLUSION, "Conclusion: Synthesized answer for \"%s\"".formatted(truncate(problem, 100)),
             0.7);
    }

    private void fewShot(String problem, List<FewShotExample> examples, int maxSteps, List<ReasoningStep> steps) {
        final var usable = Math.min(examples.size(), Math.max(0, maxSteps - 2));
        for (int i = 0; i < usable; i++) {
            final var example = examples.get(i);
            step(steps, StepType.EVIDENCE,
                 "Example %d: \"%s\" → %s".formatted(i + 1,
                                                     truncate(example.getProblem(), 50),
                                                     truncate(example.getAnswer(), 50)),
                 0.8);
        }
        if (maxSteps >= 2) {
            step(steps, StepType.DEDUCTION,
                 "Applying pattern from %d examples to: \"%s\"".formatted(usable, truncate(problem, 100)), 0.75);
        }
        step(steps, StepType.CONCLUSION, "Few-shot conclusion for: \"%s\"".formatted(truncate(problem, 100)), 0.75);
    }

    private void selfConsistency(String problem, int maxSteps, List<ReasoningStep> steps) {
        final var samples = Math.min(MAX_CONSISTENCY_SAMPLES, Math.max(1, maxSteps / 2));
        var confidenceSum = 0.0;
        for (int i = 0; i < samples; i++) {
            final var confidence = 0.5 + random.nextDouble() * 0.4;
            confidenceSum += confidence;
            step(steps, StepType.HYPOTHESIS,
                 "Chain %d result for: \"%s\"".formatted(i + 1, truncate(problem, 50)), confidence);
        }
        final var mean = confidenceSum / samples;
        step(steps, StepType.CONCLUSION,
             "Self-consistency consensus from %d chains (avg confidence: %.0f%%)".formatted(samples, mean * 100),
             mean);
    }

    private void leastToMost(String problem, int maxSteps, List<ReasoningStep> steps) {
        final var subject = truncate(problem, 50);
        final var subProblems = List.of(
                "Sub-problem 1 (easiest): Foundation of \"%s\"".formatted(subject),
                "Sub-problem 2 (medium): Core analysis of \"%s\"".formatted(subject),
                "Sub-problem 3 (hardest): Full synthesis of \"%s\"".formatted(subject));
        final var count = Math.min(MAX_SUB_PROBLEMS, maxSteps - 1);
        for (int i = 0; i < count; i++) {
            step(steps, i == 0 ? StepType.HYPOTHESIS : StepType.DEDUCTION, subProblems.get(i), 0.5 + (i + 1) * 0.1);
        }
        step(steps, StepType.CONCLUSION,
             "Least-to-most conclusion: Built up from %d sub-problems".formatted(count), 0.8);
    }

    private static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }
}
