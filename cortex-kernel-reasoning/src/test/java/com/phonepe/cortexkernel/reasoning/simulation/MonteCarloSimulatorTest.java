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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MonteCarloSimulatorTest {

    private final MonteCarloSimulator simulator = new MonteCarloSimulator(new Random(7));

    @Test
    void rewardsAreDiscountedPerTransition() {
        final StateTransition always = state -> List.of(SimulationState.builder().reward(1.0).build());
        final var result = simulator.simulate("sim_1",
                                              SimulationState.initial(Map.of()),
                                              always,
                                              2,
                                              SimulateOptions.builder().maxSteps(3).discountFactor(0.5).build());

        assertAll(
                () -> assertEquals(2, result.getTrajectories().size()),
                () -> assertEquals(1.75, result.getBestTrajectory().getTotalReward(), 1e-9),
                () -> assertEquals(4, result.getBestTrajectory().getSteps()),
                () -> assertEquals(List.of(0, 1, 2, 3),
                                   result.getBestTrajectory().getStates().stream()
                                           .map(SimulationState::getStep)
                                           .toList()),
                () -> assertEquals(1.75, result.getExpectedReward(), 1e-9)
                 );
    }

    @Test
    void terminalStatesEndTheTrajectory() {
        final StateTransition toTerminal = state -> List.of(SimulationState.builder()
                                                                    .reward(2.0)
                                                                    .terminal(true)
                                                                    .build());
        final var result = simulator.simulate("sim_2",
                                              SimulationState.initial(Map.of("start", true)),
                                              toTerminal,
                                              3,
                                              SimulateOptions.defaults());

        assertTrue(result.getTrajectories().stream()
                           .allMatch(trajectory -> trajectory.getSteps() == 2
                                   && trajectory.getTotalReward() == 2.0));
        assertEquals(Map.of("start", true), result.getBestTrajectory().getStates().get(0).getData());
    }

    @Test
    void samplingFavoursRewardingCandidates() {
        final StateTransition choice = state -> state.getStep() == 0
                                                ? List.of(SimulationState.builder().reward(10.0).build(),
                                                          SimulationState.builder().reward(-1.0).build())
                                                : List.of();
        final var result = simulator.simulate("sim_3",
                                              SimulationState.initial(Map.of()),
                                              choice,
                                              200,
                                              SimulateOptions.defaults());
        final var rewarding = result.getTrajectories().stream()
                .filter(trajectory -> trajectory.getTotalReward() == 10.0)
                .count();

        assertTrue(rewarding > 190, "rewarding trajectories: " + rewarding);
        assertEquals(10.0, result.getBestTrajectory().getTotalReward());
    }

    @Test
    void rejectsInvalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> SimulateOptions.builder().discountFactor(0.0).build());
        assertThrows(IllegalArgumentException.class, () -> SimulateOptions.builder().numTrajectories(0).build());
        assertThrows(IllegalArgumentException.class, () -> SimulateOptions.builder().maxSteps(-1).build());
    }
}
