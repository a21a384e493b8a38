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

package com.phonepe.cortexkernel.reasoning.search;

import com.phonepe.cortexkernel.core.utils.KernelUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Grows a single search tree rooted at the problem statement. The tree never holds more than {@code maxNodes}
 * nodes and never grows below {@code maxDepth}.
 */
public class TreeSearch {
    static final int BFS_BRANCHING = 3;
    static final int DFS_BRANCHING = 2;
    static final int MCTS_BRANCHING = 3;

    private final ToDoubleFunction<String> evaluator;
    private final StateExpander expander;
    private final int maxNodes;
    private final int maxDepth;
    private final Map<String, SearchNode> nodes = new LinkedHashMap<>();
    private final SearchNode root;

    public TreeSearch(
            String problem,
            ToDoubleFunction<String> evaluator,
            StateExpander expander,
            int maxNodes,
            int maxDepth) {
        this.evaluator = evaluator;
        this.expander = expander;
        this.maxNodes = maxNodes;
        this.maxDepth = maxDepth;
        final var score = evaluator.applyAsDouble(problem);
        this.root = new SearchNode(KernelUtils.id("node"), problem, score, 0, null, 1, score);
        nodes.put(root.getId(), root);
    }

    /**
     * Expand the shallowest unexpanded node first, three children at a time
     *
     * @return Highest scoring node
     */
    public SearchNode breadthFirst() {
        final var frontier = new ArrayDeque<SearchNode>();
        frontier.add(root);
        var best = root;
        while (!frontier.isEmpty() && nodes.size() < maxNodes) {
            final var current = frontier.poll();
            for (final var child : expand(current, BFS_BRANCHING)) {
                frontier.add(child);
                best = better(best, child);
            }
        }
        return best;
    }

    /**
     * Expand the most recently generated node first, two children at a time
     *
     * @return Highest scoring node
     */
    public SearchNode depthFirst() {
        final var frontier = new ArrayDeque<SearchNode>();
        frontier.push(root);
        var best = root;
        while (!frontier.isEmpty() && nodes.size() < maxNodes) {
            final var current = frontier.pop();
            for (final var child : expand(current, DFS_BRANCHING)) {
                frontier.push(child);
                best = better(best, child);
            }
        }
        return best;
    }

    /**
     * Level by level expansion keeping only the best {@code beamWidth} nodes of every level
     *
     * @return Highest scoring node
     */
    public SearchNode beam(int beamWidth) {
        var beam = List.of(root);
        var best = root;
        for (int depth = 0; depth < maxDepth && nodes.size() < maxNodes; depth++) {
            final var candidates = new ArrayList<SearchNode>();
            for (final var node : beam) {
                candidates.addAll(expand(node, beamWidth));
            }
            if (candidates.isEmpty()) {
                break;
            }
            candidates.sort(Comparator.comparingDouble(SearchNode::getScore).reversed());
            beam = List.copyOf(candidates.subList(0, Math.min(beamWidth, candidates.size())));
            for (final var candidate : beam) {
                best = better(best, candidate);
            }
        }
        return best;
    }

    /**
     * Monte carlo tree search. Every iteration selects a node by UCB1, adds at most one child to it, scores the new
     * leaf with the evaluator and propagates the reward back to the root.
     *
     * @return Most visited child of the root, or the root if nothing could be expanded
     */
    public SearchNode monteCarlo(double explorationConstant) {
        for (int iteration = 0; iteration < maxNodes; iteration++) {
            var current = root;
            while (!current.getChildren().isEmpty() && !canGrow(current)) {
                current = bestByUcb(current, explorationConstant);
            }
            final var expanded = expandOne(current);
            final var leaf = expanded == null ? current : expanded;
            final var reward = evaluator.applyAsDouble(leaf.getState());
            var node = leaf;
            while (node != null) {
                node.backPropagate(reward);
                node = node.getParentId() == null ? null : nodes.get(node.getParentId());
            }
        }
        var best = root;
        var bestVisits = 0;
        for (final var childId : root.getChildren()) {
            final var child = nodes.get(childId);
            if (child.getVisits() > bestVisits) {
                bestVisits = child.getVisits();
                best = child;
            }
        }
        return best;
    }

    public SearchTree toTree(String treeId, SearchAlgorithm algorithm) {
        return new SearchTree(treeId, algorithm, root.getId(), Collections.unmodifiableMap(nodes));
    }

    public int size() {
        return nodes.size();
    }

    private List<SearchNode> expand(SearchNode parent, int count) {
        final var wanted = Math.min(count, maxNodes - nodes.size());
        if (wanted <= 0 || parent.getDepth() >= maxDepth) {
            return List.of();
        }
        final var states = expander.expand(parent.getState(), parent.getDepth() + 1, wanted);
        final var children = new ArrayList<SearchNode>(wanted);
        for (final var state : states.subList(0, Math.min(wanted, states.size()))) {
            children.add(addChild(parent, state));
        }
        return children;
    }

    private SearchNode expandOne(SearchNode parent) {
        if (!canGrow(parent)) {
            return null;
        }
        final var index = parent.getChildren().size();
        final var states = expander.expand(parent.getState(), parent.getDepth() + 1, index + 1);
        if (states.size() <= index) {
            parent.markExhausted();
            return null;
        }
        return addChild(parent, states.get(index));
    }

    private boolean canGrow(SearchNode node) {
        return !node.isExhausted()
                && node.getChildren().size() < MCTS_BRANCHING
                && node.getDepth() < maxDepth
                && nodes.size() < maxNodes;
    }

    private SearchNode bestByUcb(SearchNode parent, double explorationConstant) {
        SearchNode best = null;
        var bestUcb = Double.NEGATIVE_INFINITY;
        for (final var childId : parent.getChildren()) {
            final var child = nodes.get(childId);
            final var exploitation = child.getVisits() > 0 ? child.getTotalReward() / child.getVisits() : 0;
            final var exploration = explorationConstant
                    * Math.sqrt(Math.log(parent.getVisits() + 1.0) / (child.getVisits() + 1.0));
            if (exploitation + exploration > bestUcb) {
                bestUcb = exploitation + exploration;
                best = child;
            }
        }
        return best;
    }

    private SearchNode addChild(SearchNode parent, String state) {
        final var child = new SearchNode(KernelUtils.id("node"),
                                         state,
                                         evaluator.applyAsDouble(state),
                                         parent.getDepth() + 1,
                                         parent.getId(),
                                         0,
                                         0);
        nodes.put(child.getId(), child);
        parent.addChild(child.getId());
        return child;
    }

    private static SearchNode better(SearchNode current, SearchNode candidate) {
        return candidate.getScore() > current.getScore() ? candidate : current;
    }
}
