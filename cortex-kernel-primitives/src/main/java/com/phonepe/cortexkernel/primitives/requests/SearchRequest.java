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

package com.phonepe.cortexkernel.primitives.requests;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.cortexkernel.reasoning.search.SearchAlgorithm;
import com.phonepe.cortexkernel.reasoning.search.SearchOptions;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.function.ToDoubleFunction;

@Value
@Builder
@Jacksonized
public class SearchRequest {
    @NonNull
    String problem;
    SearchAlgorithm algorithm;
    Integer maxNodes;
    Integer maxDepth;
    Integer beamWidth;
    /**
     * Scores candidate states. When absent states are scored against the problem statement.
     */
    @JsonIgnore
    ToDoubleFunction<String> evaluator;

    public SearchOptions toSearchOptions() {
        return SearchOptions.builder()
                .algorithm(algorithm)
                .maxNodes(maxNodes)
                .maxDepth(maxDepth)
                .beamWidth(beamWidth)
                .build();
    }
}
