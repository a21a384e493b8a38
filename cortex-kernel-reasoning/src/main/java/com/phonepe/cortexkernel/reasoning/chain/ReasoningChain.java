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

import lombok.Value;

import java.util.List;

/**
 * Snapshot of a chain of thought. Conclusion and confidence come from the last step.
 */
@Value
public class ReasoningChain {
    public static final String NO_CONCLUSION = "No conclusion reached";

    String chainId;
    ReasoningStrategy strategy;
    List<ReasoningStep> steps;
    String conclusion;
    double confidence;

    public static ReasoningChain of(String chainId, ReasoningStrategy strategy, List<ReasoningStep> steps) {
        final var last = steps.isEmpty() ? null : steps.get(steps.size() - 1);
        return new ReasoningChain(chainId,
                                  strategy,
                                  List.copyOf(steps),
                                  last == null ? NO_CONCLUSION : last.getContent(),
                                  last == null ? 0.5 : last.getConfidence());
    }
}
