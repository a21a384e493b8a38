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

package com.phonepe.cortexkernel.reasoning.simulation;

import com.phonepe.cortexkernel.core.utils.KernelUtils;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * A point in a simulated environment. The transition function decides what the data means.
 */
@Value
@With
@Builder
public class SimulationState {
    @Builder.Default
    String stateId = KernelUtils.id("state");
    @Builder.Default
    Map<String, Object> data = Map.of();
    double reward;
    boolean terminal;
    int step;

    public static SimulationState initial(Map<String, Object> data) {
        return SimulationState.builder()
                .data(data)
                .build();
    }
}
