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

package com.phonepe.cortexkernel.reasoning;

import com.google.common.base.Preconditions;
import com.phonepe.cortexkernel.reasoning.chain.ReasoningStrategy;
import com.phonepe.cortexkernel.reasoning.search.SearchAlgorithm;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;
import java.util.Random;

/**
 * Setup for a {@link ReasoningEngine}. Missing values are replaced by defaults.
 */
@Value
public class ReasoningEngineConfig {
    public static final int DEFAULT_MAX_STEPS_PER_CHAIN = 10;
    public static final int DEFAULT_BEAM_WIDTH = 5;
    public static final double DEFAULT_MCTS_EXPLORATION_CONSTANT = 1.414;
    public static final int DEFAULT_JUDGE_COUNT = 3;
    public static final int DEFAULT_TRAJECTORIES = 10;
    public static final int DEFAULT_PLATEAU_WINDOW = 3;
    public static final double DEFAULT_PASS_THRESHOLD = 0.5;
    public static final double DEFAULT_CONSENSUS_THRESHOLD = 0.5;
    public static final int DEFAULT_DEBATE_ROUNDS = 3;
    public static final int DEFAULT_EVOLUTION_HISTORY_SIZE = 100;

    ReasoningStrategy defaultStrategy;
    int maxStepsPerChain;
    SearchAlgorithm defaultSearchAlgorithm;
    int defaultBeamWidth;
    /**
     * The C in UCB1. Larger values favour less visited nodes.
     */
    double mctsExplorationConstant;
    int defaultJudgeCount;
    int defaultTrajectories;
    /**
     * Number of recent rounds inspected for a quality plateau during an evolution loop
     */
    int plateauWindow;
    double passThreshold;
    double consensusThreshold;
    int debateRounds;
    int evolutionHistorySize;
    /**
     * Source of randomness for sampling. Pass a seeded instance for repeatable runs.
     */
    Random random;

    @Builder
    public ReasoningEngineConfig(
            ReasoningStrategy defaultStrategy,
            Integer maxStepsPerChain,
            SearchAlgorithm defaultSearchAlgorithm,
            Integer defaultBeamWidth,
            Double mctsExplorationConstant,
            Integer defaultJudgeCount,
            Integer defaultTrajectories,
            Integer plateauWindow,
            Double passThreshold,
            Double consensusThreshold,
            Integer debateRounds,
            Integer evolutionHistorySize,
            Random random) {
        this.defaultStrategy = Objects.requireNonNullElse(defaultStrategy, ReasoningStrategy.ZERO_SHOT);
        this.maxStepsPerChain = Objects.requireNonNullElse(maxStepsPerChain, DEFAULT_MAX_STEPS_PER_CHAIN);
        this.defaultSearchAlgorithm = Objects.requireNonNullElse(defaultSearchAlgorithm, SearchAlgorithm.BFS);
        this.defaultBeamWidth = Objects.requireNonNullElse(defaultBeamWidth, DEFAULT_BEAM_WIDTH);
        this.mctsExplorationConstant = Objects.requireNonNullElse(mctsExplorationConstant,
                                                                  DEFAULT_MCTS_EXPLORATION_CONSTANT);
        this.defaultJudgeCount = Objects.requireNonNullElse(defaultJudgeCount, DEFAULT_JUDGE_COUNT);
        this.defaultTrajectories = Objects.requireNonNullElse(defaultTrajectories, DEFAULT_TRAJECTORIES);
        this.plateauWindow = Objects.requireNonNullElse(plateauWindow, DEFAULT_PLATEAU_WINDOW);
        this.passThreshold = Objects.requireNonNullElse(passThreshold, DEFAULT_PASS_THRESHOLD);
        this.consensusThreshold = Objects.requireNonNullElse(consensusThreshold, DEFAULT_CONSENSUS_THRESHOLD);
        this.debateRounds = Objects.requireNonNullElse(debateRounds, DEFAULT_DEBATE_ROUNDS);
        this.evolutionHistorySize = Objects.requireNonNullElse(evolutionHistorySize, DEFAULT_EVOLUTION_HISTORY_SIZE);
        this.random = Objects.requireNonNullElseGet(random, Random::new);
        Preconditions.checkArgument(this.maxStepsPerChain >= 1, "maxStepsPerChain must be at least 1");
        Preconditions.checkArgument(this.defaultBeamWidth >= 1, "defaultBeamWidth must be at least 1");
        Preconditions.checkArgument(this.mctsExplorationConstant >= 0, "mctsExplorationConstant must not be negative");
        Preconditions.checkArgument(this.defaultJudgeCount >= 1, "defaultJudgeCount must be at least 1");
        Preconditions.checkArgument(this.defaultTrajectories >= 1, "defaultTrajectories must be at least 1");
        Preconditions.checkArgument(this.plateauWindow >= 2, "plateauWindow must be at least 2");
        Preconditions.checkArgument(this.passThreshold >= 0 && this.passThreshold <= 1,
                                    "passThreshold must be in [0, 1]");
        Preconditions.checkArgument(this.consensusThreshold >= 0 && this.consensusThreshold <= 1,
                                    "consensusThreshold must be in [0, 1]");
        Preconditions.checkArgument(this.debateRounds >= 0, "debateRounds must not be negative");
        Preconditions.checkArgument(this.evolutionHistorySize > 0, "evolutionHistorySize must be positive");
    }

    public static ReasoningEngineConfig defaults() {
        return ReasoningEngineConfig.builder().build();
    }
}
