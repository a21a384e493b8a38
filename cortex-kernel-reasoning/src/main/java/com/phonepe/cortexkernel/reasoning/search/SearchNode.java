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

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of a search tree. Only {@link TreeSearch} mutates nodes, and only while the search is running.
 */
@Getter
@ToString(exclude = "children")
public class SearchNode {
    private final String id;
    private final String state;
    private final double score;
    private final int depth;
    private final String parentId;
    @Getter(AccessLevel.NONE)
    private final List<String> children = new ArrayList<>();
    private int visits;
    private double totalReward;
    @Getter(AccessLevel.NONE)
    private boolean exhausted;

    SearchNode(String id, String state, double score, int depth, String parentId, int visits, double totalReward) {
        this.id = id;
        this.state = state;
        this.score = score;
        this.depth = depth;
        this.parentId = parentId;
        this.visits = visits;
        this.totalReward = totalReward;
    }

    public List<String> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Mean back-propagated reward, or the evaluator score for nodes that were never visited
     */
    public double value() {
        return visits > 0 ? totalReward / visits : score;
    }

    void addChild(String childId) {
        children.add(childId);
    }

    boolean isExhausted() {
        return exhausted;
    }

    void markExhausted() {
        exhausted = true;
    }

    void backPropagate(double reward) {
        visits++;
        totalReward += reward;
    }
}
