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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.cortexkernel.reasoning.simulation.SimulateOptions;
import com.phonepe.cortexkernel.reasoning.simulation.StateTransition;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class SimulateRequest {
    Map<String, Object> initialState;
    /**
     * Environment model. Required, there is no meaningful default.
     */
    @JsonIgnore
    StateTransition transition;
    Integer numTrajectories;
    Integer maxSteps;
    Double discountFactor;

    public SimulateOptions toSimulateOptions() {
        return SimulateOptions.builder()
                .numTrajectories(numTrajectories)
                .maxSteps(maxSteps)
                .discountFactor(discountFactor)
                .build();
    }
}
