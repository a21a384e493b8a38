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

import com.phonepe.cortexkernel.reasoning.evolution.DifficultySchedule;
import com.phonepe.cortexkernel.reasoning.evolution.EvolveLoopOptions;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SelfEvolveRequest {
    Integer maxRounds;
    Double initialDifficulty;
    DifficultySchedule schedule;
    Integer numProblems;

    public EvolveLoopOptions toEvolveLoopOptions() {
        return EvolveLoopOptions.builder()
                .maxRounds(maxRounds)
                .initialDifficulty(initialDifficulty)
                .schedule(schedule)
                .numProblems(numProblems)
                .build();
    }
}
