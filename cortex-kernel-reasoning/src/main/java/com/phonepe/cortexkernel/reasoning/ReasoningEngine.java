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
import com.google.common.collect.EvictingQueue;
import com.phonepe.cortexkernel.core.events.EventType;
import com.phonepe.cortexkernel.core.events.KernelEventBus;
import com.phonepe.cortexkernel.core.utils.BoundedMap;
import com.phonepe.cortexkernel.core.utils.KernelUtils;
import com.phonepe.cortexkernel.reasoning.chain.ChainComposer;
import com.phonepe.cortexkernel.reasoning.chain.ReasonOptions;
import com.phonepe.cortexkernel.reasoning.chain.ReasoningChain;
import com.phonepe.cortexkernel.reasoning.chain.ReasoningStep;
import com.phonepe.cortexkernel.reasoning.chain.ReasoningStrategy;
import com.phonepe.cortexkernel.reasoning.chain.StepType;
import com.phonepe.cortexkernel.reasoning.evolution.EvolutionRound;
import com.phonepe.cortexkernel.reasoning.evolution.EvolveLoopOptions;
import com.phonepe.cortexkernel.reasoning.evolution.EvolveOptions;
import com.phonepe.cortexkernel.reasoning.evolution.HeuristicProblemSolver;
import com.phonepe.cortexkernel.reasoning.evolution.JitteredProblemProposer;
import com.phonepe.cortexkernel.reasoning.evolution.ProblemProposer;
import com.phonepe.cortexkernel.reasoning.evolution.ProblemSolver;
import com.phonepe.cortexkernel.reasoning.judge.Evidence;
import com.phonepe.cortexkernel.reasoning.judge.HeuristicJudgeScorer;
import com.phonepe.cortexkernel.reasoning.judge.JudgeOptions;
import com.phonepe.cortexkernel.reasoning.judge.JudgePanel;
import com.phonepe.cortexkernel.reasoning.judge.JudgeScorer;
import com.phonepe.cortexkernel.reasoning.judge.Verdict;
import com.phonepe.cortexkernel.reasoning.search.SearchAlgorithm;
import com.phonepe.cortexkernel.reasoning.search.SearchOptions;
import com.phonepe.cortexkernel.reasoning.search.SearchResult;
import com.phonepe.cortexkernel.reasoning.search.SearchTree;
import com.phonepe.cortexkernel.reasoning.search.TreeSearch;
import com.phonepe.cortexkernel.reasoning.simulation.MonteCarloSimulator;
import com.phonepe.cortexkernel.reasoning.simulation.SimulateOptions;
import com.phonepe.cortexkernel.reasoning.simulation.SimulationResult;
import com.phonepe.cortexkernel.reasoning.simulation.SimulationState;
import com.phonepe.cortexkernel.reasoning.simulation.StateTransition;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;

/**
 * Chain of thought, tree search, monte carlo simulation, judge panels and self play evolution.
 * <p>
 * The algorithms themselves run without holding the engine's monitor. Only the result stores and counters are
 * guarded by it.
 */
@Slf4j
public class ReasoningEngine {
    public static final String SOURCE = "reasoning";

    static final int MAX_CHAINS = 500;
    static final int MAX_TREES = 200;
    static final int MAX_SIMULATIONS = 200;
    static final int MAX_VERDICTS = 500;

    private static final double PLATEAU_SPREAD = 0.02;
    private static final double PLATEAU_BOOST = 0.1;
    private static final double ADDED_STEP_CONFIDENCE = 0.5;

    @Getter
    private final ReasoningEngineConfig config;
    private final KernelEventBus eventBus;
    private final ChainComposer chainComposer;
    private final MonteCarloSimulator simulator;
    private final JudgePanel judgePanel;
    private final JudgeScorer defaultScorer = new HeuristicJudgeScorer();
    private final ProblemProposer defaultProposer;
    private final ProblemSolver defaultSolver;

    private final BoundedMap<String, ChainSession> chains = new BoundedMap<>(MAX_CHAINS);
    private final BoundedMap<String, SearchTree> trees = new BoundedMap<>(MAX_TREES);
    private final BoundedMap<String, SimulationResult> simulations = new BoundedMap<>(MAX_SIMULATIONS);
    private final BoundedMap<String, Verdict> verdicts = new BoundedMap<>(MAX_VERDICTS);
    private final EvictingQueue<EvolutionRound> evolutionHistory;
    /**
     * Finished rounds waiting for earlier rounds to complete. Empty value marks a round that failed.
     */
    private final SortedMap<Integer, Optional<EvolutionRound>> pendingRounds = new TreeMap<>();

    private boolean running;
    private int evolutionRound;
    private int lastRecordedRound;
    private long totalChains;
    private long totalSteps;
    private long totalSearches;
    private long totalSearchNodes;
    private long totalSimulations;
    private long totalJudgements;
    private long totalEvolutions;
    private double confidenceSum;

    private record ChainSession(ReasoningStrategy strategy, List<ReasoningStep> steps) {
    }

    public ReasoningEngine() {
        this(ReasoningEngineConfig.defaults());
    }

    public ReasoningEngine(@NonNull ReasoningEngineConfig config) {
        this(config, new KernelEventBus(SOURCE));
    }

    public ReasoningEngine(@NonNull ReasoningEngineConfig config, @NonNull KernelEventBus eventBus) {
        this.config = config;
        this.eventBus = eventBus;
        this.chainComposer = new ChainComposer(config.getRandom());
        this.simulator = new MonteCarloSimulator(config.getRandom());
        this.judgePanel = JudgePanel.builder()
                .passThreshold(config.getPassThreshold())
                .consensusThreshold(config.getConsensusThreshold())
                .debateRounds(config.getDebateRounds())
                .build();
        this.defaultProposer = new JitteredProblemProposer(config.getRandom());
        this.defaultSolver = new HeuristicProblemSolver(config.getRandom());
        this.evolutionHistory = EvictingQueue.create(config.getEvolutionHistorySize());
    }

    public KernelEventBus events() {
        return eventBus;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        log.info("Reasoning engine started. Default strategy: {}, default search: {}",
                 config.getDefaultStrategy(), config.getDefaultSearchAlgorithm());
        eventBus.emit(EventType.STARTED);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Reasoning engine stopped");
        eventBus.emit(EventType.STOPPED);
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public ReasoningChain reason(String problem) {
        return reason(problem, ReasonOptions.defaults());
    }

    /**
     * Build a chain of thought for a problem using the requested prompting strategy
     */
    public ReasoningChain reason(@NonNull String problem, @NonNull ReasonOptions options) {
        final var strategy = Objects.requireNonNullElse(options.getStrategy(), config.getDefaultStrategy());
        final var maxSteps = Objects.requireNonNullElse(options.getMaxSteps(), config.getMaxStepsPerChain());
        Preconditions.checkArgument(maxSteps >= 1, "maxSteps must be at least 1");
        final var chainId = KernelUtils.id("chain");
        final var steps = chainComposer.compose(problem, strategy, options, maxSteps);
        final var chain = ReasoningChain.of(chainId, strategy, steps);
        synchronized (this) {
            chains.put(chainId, new ChainSession(strategy, steps));
            totalChains++;
            totalSteps += steps.size();
            confidenceSum += chain.getConfidence();
            log.debug("Chain {} built with {} steps using {}", chainId, steps.size(), strategy);
            eventBus.emit(EventType.COMPLETED, Map.of("chainId", chainId,
                                                      "strategy", strategy,
                                                      "steps", steps.size(),
                                                      "confidence", chain.getConfidence()));
        }
        return chain;
    }

    public Optional<ReasoningStep> addStep(String chainId, String content, StepType type) {
        return addStep(chainId, content, type, ADDED_STEP_CONFIDENCE);
    }

    /**
     * Append a step to an existing chain. The step is linked to the current last step of the chain.
     *
     * @return The appended step, or empty if the chain is unknown
     */
    public synchronized Optional<ReasoningStep> addStep(
            @NonNull String chainId,
            @NonNull String content,
            @NonNull StepType type,
            double confidence) {
        final var session = chains.get(chainId);
        if (session == null) {
            log.debug("Ignoring step for unknown chain {}", chainId);
            return Optional.empty();
        }
        final var step = ChainComposer.step(session.steps(), type, content, confidence);
        totalSteps++;
        return Optional.of(step);
    }

    public SearchResult search(String problem, ToDoubleFunction<String> evaluator) {
        return search(problem, evaluator, SearchOptions.defaults());
    }

    /**
     * Grow a state tree rooted at the problem and report the best path found. The tree never grows beyond
     * {@link SearchOptions#getMaxNodes()} nodes.
     */
    public SearchResult search(
            @NonNull String problem,
            @NonNull ToDoubleFunction<String> evaluator,
            @NonNull SearchOptions options) {
        final var algorithm = Objects.requireNonNullElse(options.getAlgorithm(), config.getDefaultSearchAlgorithm());
        final var treeId = KernelUtils.id("tree");
        final var treeSearch = new TreeSearch(problem,
                                              evaluator,
                                              options.getExpander(),
                                              options.getMaxNodes(),
                                              options.getMaxDepth());
        final var best = switch (algorithm) {
            case BFS -> treeSearch.breadthFirst();
            case DFS -> treeSearch.depthFirst();
            case BEAM -> treeSearch.beam(Objects.requireNonNullElse(options.getBeamWidth(),
                                                                    config.getDefaultBeamWidth()));
            case MCTS -> treeSearch.monteCarlo(config.getMctsExplorationConstant());
        };
        final var tree = treeSearch.toTree(treeId, algorithm);
        final var bestScore = algorithm == SearchAlgorithm.MCTS ? best.value() : best.getScore();
        final var result = new SearchResult(treeId, algorithm, tree.pathTo(best), bestScore, tree.size());
        synchronized (this) {
            trees.put(treeId, tree);
            totalSearches++;
            totalSearchNodes += tree.size();
            log.debug("Search {} using {} explored {} nodes. Best score: {}",
                      treeId, algorithm, tree.size(), bestScore);
            eventBus.emit(EventType.SEARCHED, Map.of("treeId", treeId,
                                                     "algorithm", algorithm,
                                                     "nodesExplored", tree.size(),
                                                     "bestScore", bestScore));
        }
        return result;
    }

    public SimulationResult simulate(SimulationState initialState, StateTransition transition) {
        return simulate(initialState, transition, SimulateOptions.defaults());
    }

    /**
     * Roll out independent trajectories from the initial state. Trajectories are returned best first.
     */
    public SimulationResult simulate(
            @NonNull SimulationState initialState,
            @NonNull StateTransition transition,
            @NonNull SimulateOptions options) {
        final var simulationId = KernelUtils.id("sim");
        final var numTrajectories = Objects.requireNonNullElse(options.getNumTrajectories(),
                                                               config.getDefaultTrajectories());
        final var result = simulator.simulate(simulationId, initialState, transition, numTrajectories, options);
        synchronized (this) {
            simulations.put(simulationId, result);
            totalSimulations++;
            log.debug("Simulation {} ran {} trajectories. Expected reward: {}",
                      simulationId, numTrajectories, result.getExpectedReward());
            eventBus.emit(EventType.SIMULATED, Map.of("simulationId", simulationId,
                                                      "trajectories", numTrajectories,
                                                      "expectedReward", result.getExpectedReward(),
                                                      "bestReward", result.getBestTrajectory().getTotalReward()));
        }
        return result;
    }

    public Verdict judge(String output, List<String> categories) {
        return judge(output, categories, JudgeOptions.defaults());
    }

    /**
     * Have a panel of judges score the output on every category and fold their votes into a verdict
     */
    public Verdict judge(@NonNull String output, @NonNull List<String> categories, @NonNull JudgeOptions options) {
        final var numJudges = Objects.requireNonNullElse(options.getNumJudges(), config.getDefaultJudgeCount());
        final var scorer = Objects.requireNonNullElse(options.getScorer(), defaultScorer);
        final var verdict = judgePanel.judge(KernelUtils.id("verdict"),
                                             output,
                                             categories,
                                             numJudges,
                                             options.getConsensusMethod(),
                                             options.getContext(),
                                             scorer);
        synchronized (this) {
            verdicts.put(verdict.getId(), verdict);
            totalJudgements++;
            log.debug("Verdict {} by {} judges: score {}, consensus {}, passed: {}",
                      verdict.getId(), numJudges, verdict.getOverallScore(), verdict.getConsensus(),
                      verdict.isPassed());
            eventBus.emit(EventType.JUDGED, Map.of("verdictId", verdict.getId(),
                                                   "passed", verdict.isPassed(),
                                                   "overallScore", verdict.getOverallScore(),
                                                   "consensus", verdict.getConsensus(),
                                                   "numJudges", numJudges));
        }
        return verdict;
    }

    /**
     * Attach supporting evidence to a stored verdict
     *
     * @return false if the verdict is unknown
     */
    public synchronized boolean addEvidence(@NonNull String verdictId, @NonNull String content) {
        final var verdict = verdicts.get(verdictId);
        if (verdict == null) {
            return false;
        }
        verdicts.put(verdictId, verdict.withEvidenceAdded(new Evidence(content, LocalDateTime.now())));
        return true;
    }

    public EvolutionRound evolve() {
        return evolve(EvolveOptions.defaults());
    }

    /**
     * Run one self play round: propose problems at the given difficulty, solve them and grade the solutions
     */
    public EvolutionRound evolve(@NonNull EvolveOptions options) {
        final int round;
        synchronized (this) {
            round = ++evolutionRound;
        }
        final EvolutionRound evolution;
        try {
            evolution = playRound(round, options);
        }
        catch (RuntimeException e) {
            synchronized (this) {
                pendingRounds.put(round, Optional.empty());
                recordFinishedRounds();
            }
            throw e;
        }
        synchronized (this) {
            pendingRounds.put(round, Optional.of(evolution));
            recordFinishedRounds();
        }
        return evolution;
    }

    private EvolutionRound playRound(int round, EvolveOptions options) {
        final var proposer = Objects.requireNonNullElse(options.getProposer(), defaultProposer);
        final var solver = Objects.requireNonNullElse(options.getSolver(), defaultSolver);
        final var problems = List.copyOf(proposer.propose(round, options.getDifficulty(), options.getNumProblems()));
        final var solutions = problems.stream()
                .map(solver::solve)
                .toList();
        final var qualities = solutions.stream()
                .map(solution -> KernelUtils.clamp01(solution.getQuality()))
                .toList();
        return new EvolutionRound(round,
                                  problems,
                                  solutions,
                                  KernelUtils.mean(qualities),
                                  qualities.stream()
                                          .mapToDouble(Double::doubleValue)
                                          .max()
                                          .orElse(0),
                                  options.getDifficulty(),
                                  LocalDateTime.now());
    }

    /**
     * Rounds run concurrently but enter the history strictly in round order. A round that finishes early waits
     * in {@link #pendingRounds} until every earlier round has finished or failed.
     */
    private void recordFinishedRounds() {
        while (!pendingRounds.isEmpty() && pendingRounds.firstKey() == lastRecordedRound + 1) {
            lastRecordedRound++;
            pendingRounds.remove(pendingRounds.firstKey())
                    .ifPresent(this::recordRound);
        }
    }

    private void recordRound(EvolutionRound evolution) {
        evolutionHistory.add(evolution);
        totalEvolutions++;
        log.debug("Evolution round {} at difficulty {}: avg quality {}, best quality {}",
                  evolution.getRound(), evolution.getDifficulty(), evolution.getAvgQuality(),
                  evolution.getBestQuality());
        eventBus.emit(EventType.EVOLVED, Map.of("round", evolution.getRound(),
                                                "difficulty", evolution.getDifficulty(),
                                                "avgQuality", evolution.getAvgQuality(),
                                                "bestQuality", evolution.getBestQuality(),
                                                "problems", evolution.getSolutions().size()));
    }

    public List<EvolutionRound> evolveLoop() {
        return evolveLoop(EvolveLoopOptions.defaults());
    }

    /**
     * Run consecutive self play rounds, adjusting the difficulty after every round according to the schedule.
     * If average quality has flattened out over the last few rounds the difficulty gets an extra bump.
     */
    public List<EvolutionRound> evolveLoop(@NonNull EvolveLoopOptions options) {
        final var rounds = new ArrayList<EvolutionRound>(options.getMaxRounds());
        var difficulty = options.getInitialDifficulty();
        for (int i = 0; i < options.getMaxRounds(); i++) {
            final var round = evolve(options.roundOptions(difficulty));
            rounds.add(round);
            if (plateaued(rounds)) {
                log.debug("Quality plateau detected after round {}. Raising difficulty", round.getRound());
                difficulty += PLATEAU_BOOST;
            }
            difficulty = Math.min(1.0, options.getSchedule().next(difficulty, round.getAvgQuality()));
        }
        log.info("Evolution loop finished after {} rounds. Final difficulty: {}", rounds.size(), difficulty);
        return List.copyOf(rounds);
    }

    public synchronized Optional<ReasoningChain> getChain(String chainId) {
        return Optional.ofNullable(chains.get(chainId))
                .map(session -> ReasoningChain.of(chainId, session.strategy(), session.steps()));
    }

    public synchronized Optional<SearchTree> getSearchTree(String treeId) {
        return Optional.ofNullable(trees.get(treeId));
    }

    public synchronized Optional<SimulationResult> getSimulation(String simulationId) {
        return Optional.ofNullable(simulations.get(simulationId));
    }

    public synchronized Optional<Verdict> getVerdict(String verdictId) {
        return Optional.ofNullable(verdicts.get(verdictId));
    }

    /**
     * @return Retained evolution rounds, oldest first
     */
    public synchronized List<EvolutionRound> getEvolutionHistory() {
        return List.copyOf(evolutionHistory);
    }

    public synchronized ReasoningEngineStats getStats() {
        return ReasoningEngineStats.builder()
                .running(running)
                .totalChains(totalChains)
                .totalSteps(totalSteps)
                .totalSearches(totalSearches)
                .avgSearchNodes(totalSearches > 0 ? (double) totalSearchNodes / totalSearches : 0)
                .totalSimulations(totalSimulations)
                .totalJudgements(totalJudgements)
                .totalEvolutions(totalEvolutions)
                .avgConfidence(totalChains > 0 ? confidenceSum / totalChains : 0)
                .build();
    }

    private boolean plateaued(List<EvolutionRound> rounds) {
        final var window = config.getPlateauWindow();
        if (rounds.size() < window) {
            return false;
        }
        final var recent = rounds.subList(rounds.size() - window, rounds.size())
                .stream()
                .mapToDouble(EvolutionRound::getAvgQuality)
                .summaryStatistics();
        return recent.getMax() - recent.getMin() < PLATEAU_SPREAD;
    }
}
