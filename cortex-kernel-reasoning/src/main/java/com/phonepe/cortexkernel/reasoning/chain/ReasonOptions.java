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

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Optional parameters for building a reasoning chain. Null strategy and max steps fall back to engine defaults.
 */
@Value
public class ReasonOptions {
    ReasoningStrategy strategy;
    String context;
    List<FewShotExample> fewShotExamples;
    Integer maxSteps;

    @Builder
    public ReasonOptions(
            ReasoningStrategy strategy,
            String context,
            List<FewShotExample> fewShotExamples,
            Integer maxSteps) {
        this.strategy = strategy;
        this.context = context;
        this.fewShotExamples = List.copyOf(Objects.requireNonNullElse(fewShotExamples, List.of()));
        this.maxSteps = maxSteps;
    }

    public static ReasonOptions defaults() {
        return ReasonOptions.builder().build();
    }
}
