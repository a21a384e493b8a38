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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.ToDoubleFunction;

import static org.junit.jupiter.api.Assertions.*;

class TreeSearchTest {

    private static final ToDoubleFunction<String> FLAT = state -> 0.5;

    @Test
    void depthFirstGoesDeeperThanBreadthFirst() {
        final var dfs = new TreeSearch("p", FLAT, StateExpander.synthetic(), 10, 10);
        dfs.depthFirst();
        final var bfs = new TreeSearch("p", FLAT, StateExpander.synthetic(), 10, 10);
        bfs.breadthFirst();

        assertAll(
                () -> assertEquals(10, dfs.size()),
                () -> assertEquals(10, bfs.size()),
                () -> assertEquals(5, maxDepth(dfs.toTree("t1", SearchAlgorithm.DFS))),
                () -> assertEquals(2, maxDepth(bfs.toTree("t2", SearchAlgorithm.BFS)))
                 );
    }

    @Test
    void beamOnlyExpandsTheBestNodesOfEachLevel() {
        final var search = new TreeSearch("p",
                                          state -> state.endsWith("_0") ? 0.9 : 0.1,
                                          StateExpander.synthetic(),
                                          100,
                                          3);
        final var best = search.beam(2);
        final var tree = search.toTree("t", SearchAlgorithm.BEAM);

        assertAll(
                () -> assertEquals(11, tree.size()),
                () -> assertEquals(4, countAtDepth(tree, 3)),
                () -> assertEquals(0.9, best.getScore()),
                () -> assertEquals(2, tree.root().getChildren().size())
                 );
    }

    @Test
    void monteCarloAddsOneNodePerIterationAndBackPropagates() {
        final var search = new TreeSearch("p", FLAT, StateExpander.synthetic(), 20, 10);
        final var best = search.monteCarlo(1.414);
        final var tree = search.toTree("t", SearchAlgorithm.MCTS);

        assertAll(
                () -> assertEquals(20, tree.size()),
                () -> assertEquals(21, tree.root().getVisits()),
                () -> assertEquals(1, best.getDepth()),
                () -> assertTrue(tree.root().getChildren().size() <= TreeSearch.MCTS_BRANCHING),
                () -> assertEquals(0.5, best.value(), 1e-9),
                () -> assertEquals(List.of("p", best.getState()), tree.pathTo(best))
                 );
    }

    @Test
    void searchStopsWhenExpanderRunsDry() {
        final StateExpander dry = (state, depth, count) -> List.of();
        final var mcts = new TreeSearch("p", FLAT, dry, 20, 10);
        final var best = mcts.monteCarlo(1.414);
        final var bfs = new TreeSearch("p", FLAT, dry, 20, 10);

        assertAll(
                () -> assertEquals(1, mcts.size()),
                () -> assertEquals("p", best.getState()),
                () -> assertEquals("p", bfs.breadthFirst().getState()),
                () -> assertEquals(1, bfs.size())
                 );
    }

    private static int maxDepth(SearchTree tree) {
        return tree.getNodes().values().stream().mapToInt(SearchNode::getDepth).max().orElse(0);
    }

    private static long countAtDepth(SearchTree tree, int depth) {
        return tree.getNodes().values().stream().filter(node -> node.getDepth() == depth).count();
    }
}
