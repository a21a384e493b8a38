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

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Rollout parameters. A null trajectory count falls back to the engine default.
 */
@Value
public class SimulateOptions {
    public static final int DEFAULT_MAX_STEPS = 20;

    Integer numTrajectories;
    int maxSteps;
    /**
     * Reward of the n-th transition is multiplied by discountFactor^(n-1). 1.0 sums rewards as they are.
     */
    double discountFactor;

    @Builder
    public SimulateOptions(Integer numTrajectories, Integer maxSteps, Double discountFactor) {
        this.numTrajectories = numTrajectories;
        this.maxSteps = Objects.requireNonNullElse(maxSteps, DEFAULT_MAX_STEPS);
        this.discountFactor = Objects.requireNonNullElse(discountFactor, 1.0);
        Preconditions.checkArgument(numTrajectories == null || numTrajectories >= 1,
                                    "numTrajectories must be at least 1");
        Preconditions.checkArgument(this.maxSteps >= 0, "maxSteps must not be negative");
        Preconditions.checkArgument(this.discountFactor > 0 && this.discountFactor <= 1,
                                    "discountFactor must be in (0, 1]");
    }

    public static SimulateOptions defaults() {
        return SimulateOptions.builder().build();
    }
}
