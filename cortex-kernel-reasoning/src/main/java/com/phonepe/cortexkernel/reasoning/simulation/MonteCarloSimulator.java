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
import lombok.AllArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Samples independent trajectories through a {@link StateTransition}. Candidates are picked by roulette wheel
 * selection weighted on {@code max(0.01, reward + 1)}.
 */
@AllArgsConstructor
public class MonteCarloSimulator {
    private static final double MIN_WEIGHT = 0.01;

    private final Random random;

    public SimulationResult simulate(
            String simulationId,
            SimulationState initialState,
            StateTransition transition,
            int numTrajectories,
            SimulateOptions options) {
        final var trajectories = new ArrayList<Trajectory>(numTrajectories);
        for (int i = 0; i < numTrajectories; i++) {
            trajectories.add(rollout(initialState, transition, options));
        }
        trajectories.sort(Comparator.comparingDouble(Trajectory::getTotalReward).reversed());
        final var expected = KernelUtils.mean(trajectories.stream()
                                                      .map(Trajectory::getTotalReward)
                                                      .toList());
        return new SimulationResult(simulationId, List.copyOf(trajectories), trajectories.get(0), expected);
    }

    private Trajectory rollout(SimulationState initialState, StateTransition transition, SimulateOptions options) {
        final var states = new ArrayList<SimulationState>();
        states.add(initialState);
        var current = initialState;
        var totalReward = 0.0;
        var discount = 1.0;
        for (int step = 0; step < options.getMaxSteps() && !current.isTerminal(); step++) {
            final var candidates = transition.next(current);
            if (candidates == null || candidates.isEmpty()) {
                break;
            }
            current = pick(candidates).withStep(current.getStep() + 1);
            states.add(current);
            totalReward += current.getReward() * discount;
            discount *= options.getDiscountFactor();
        }
        return new Trajectory(KernelUtils.id("traj"), List.copyOf(states), totalReward, states.size());
    }

    private SimulationState pick(List<SimulationState> candidates) {
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        final var weights = candidates.stream()
                .mapToDouble(candidate -> Math.max(MIN_WEIGHT, candidate.getReward() + 1))
                .toArray();
        var remaining = random.nextDouble() * Arrays.stream(weights).sum();
        for (int i = 0; i < weights.length; i++) {
            remaining -= weights[i];
            if (remaining <= 0) {
                return candidates.get(i);
            }
        }
        return candidates.get(candidates.size() - 1);
    }
}
