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

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Value
public class SearchTree {
    String treeId;
    SearchAlgorithm algorithm;
    String rootId;
    /**
     * Nodes by id in creation order
     */
    Map<String, SearchNode> nodes;

    public SearchNode root() {
        return nodes.get(rootId);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * States from the root down to the given node
     */
    public List<String> pathTo(SearchNode node) {
        final var path = new ArrayList<String>();
        var current = node;
        while (current != null) {
            path.add(0, current.getState());
            current = current.getParentId() == null ? null : nodes.get(current.getParentId());
        }
        return path;
    }
}
