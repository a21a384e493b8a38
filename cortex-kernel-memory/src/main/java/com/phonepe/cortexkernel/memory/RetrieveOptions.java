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

package com.phonepe.cortexkernel.memory;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;
import java.util.Set;

/**
 * Optional parameters for {@link ContextMemoryUnit#retrieve(String, RetrieveOptions)}
 */
@Value
public class RetrieveOptions {
    MemoryTarget target;
    /**
     * Only entries carrying at least one of these tags are considered
     */
    Set<String> tags;
    /**
     * Maximum number of results. Null means no limit.
     */
    Integer topK;
    double minScore;

    @Builder
    public RetrieveOptions(MemoryTarget target, Set<String> tags, Integer topK, Double minScore) {
        this.target = Objects.requireNonNullElse(target, MemoryTarget.ALL);
        this.tags = tags == null ? Set.of() : Set.copyOf(tags);
        this.topK = topK;
        this.minScore = Objects.requireNonNullElse(minScore, 0.0);
    }

    public static RetrieveOptions defaults() {
        return RetrieveOptions.builder().build();
    }
}
