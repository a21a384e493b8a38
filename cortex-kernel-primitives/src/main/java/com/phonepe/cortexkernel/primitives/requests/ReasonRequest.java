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

package com.phonepe.cortexkernel.primitives.requests;

import com.phonepe.cortexkernel.reasoning.chain.FewShotExample;
import com.phonepe.cortexkernel.reasoning.chain.ReasonOptions;
import com.phonepe.cortexkernel.reasoning.chain.ReasoningStrategy;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ReasonRequest {
    @NonNull
    String problem;
    ReasoningStrategy strategy;
    String context;
    List<FewShotExample> fewShotExamples;
    Integer maxSteps;

    public ReasonOptions toReasonOptions() {
        return ReasonOptions.builder()
                .strategy(strategy)
                .context(context)
                .fewShotExamples(fewShotExamples)
                .maxSteps(maxSteps)
                .build();
    }
}
