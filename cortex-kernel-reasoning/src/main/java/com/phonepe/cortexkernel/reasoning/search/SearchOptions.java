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

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Optional search parameters. Null algorithm and beam width fall back to engine defaults.
 */
@Value
public class SearchOptions {
    public static final int DEFAULT_MAX_NODES = 100;
    public static final int DEFAULT_MAX_DEPTH = 10;

    SearchAlgorithm algorithm;
    /**
     * Hard cap on the number of nodes in the tree, root included
     */
    int maxNodes;
    int maxDepth;
    Integer beamWidth;
    StateExpander expander;

    @Builder
    public SearchOptions(
            SearchAlgorithm algorithm,
            Integer maxNodes,
            Integer maxDepth,
            Integer beamWidth,
            StateExpander expander) {
        this.algorithm = algorithm;
        this.maxNodes = Objects.requireNonNullElse(maxNodes, DEFAULT_MAX_NODES);
        this.maxDepth = Objects.requireNonNullElse(maxDepth, DEFAULT_MAX_DEPTH);
        this.beamWidth = beamWidth;
        this.expander = Objects.requireNonNullElseGet(expander, StateExpander::synthetic);
        Preconditions.checkArgument(this.maxNodes >= 1, "maxNodes must be at least 1");
        Preconditions.checkArgument(this.maxDepth >= 0, "maxDepth must not be negative");
        Preconditions.checkArgument(beamWidth == null || beamWidth >= 1, "beamWidth must be at least 1");
    }

    public static SearchOptions defaults() {
        return SearchOptions.builder().build();
    }
}
