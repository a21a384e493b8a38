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

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Setup for a {@link ContextMemoryUnit}. Missing values are replaced by defaults.
 */
@Value
public class ContextMemoryConfig {
    public static final int DEFAULT_STM_CAPACITY = 100;
    public static final int DEFAULT_LTM_CAPACITY = 1000;
    public static final double DEFAULT_Q_LEARNING_RATE = 0.1;
    public static final double DEFAULT_PROMOTION_Q_THRESHOLD = 0.7;
    public static final double DEFAULT_IMPORTANCE = 0.5;
    public static final int DEFAULT_KNOWLEDGE_BLOCK_CAPACITY = 200;

    int stmCapacity;
    int ltmCapacity;
    /**
     * Step size used when moving a q-value towards a reward
     */
    double qLearningRate;
    /**
     * Short term entries whose q-value reaches this are moved to long term memory
     */
    double promotionQThreshold;
    boolean enableSemanticIndex;
    double defaultImportance;
    int knowledgeBlockCapacity;

    @Builder
    public ContextMemoryConfig(
            Integer stmCapacity,
            Integer ltmCapacity,
            Double qLearningRate,
            Double promotionQThreshold,
            Boolean enableSemanticIndex,
            Double defaultImportance,
            Integer knowledgeBlockCapacity) {
        this.stmCapacity = Objects.requireNonNullElse(stmCapacity, DEFAULT_STM_CAPACITY);
        this.ltmCapacity = Objects.requireNonNullElse(ltmCapacity, DEFAULT_LTM_CAPACITY);
        this.qLearningRate = Objects.requireNonNullElse(qLearningRate, DEFAULT_Q_LEARNING_RATE);
        this.promotionQThreshold = Objects.requireNonNullElse(promotionQThreshold, DEFAULT_PROMOTION_Q_THRESHOLD);
        this.enableSemanticIndex = Objects.requireNonNullElse(enableSemanticIndex, true);
        this.defaultImportance = Objects.requireNonNullElse(defaultImportance, DEFAULT_IMPORTANCE);
        this.knowledgeBlockCapacity = Objects.requireNonNullElse(knowledgeBlockCapacity,
                                                                 DEFAULT_KNOWLEDGE_BLOCK_CAPACITY);
        Preconditions.checkArgument(this.stmCapacity > 0, "stmCapacity must be positive");
        Preconditions.checkArgument(this.ltmCapacity > 0, "ltmCapacity must be positive");
        Preconditions.checkArgument(this.qLearningRate > 0 && this.qLearningRate <= 1,
                                    "qLearningRate must be in (0, 1]");
        Preconditions.checkArgument(this.promotionQThreshold >= 0 && this.promotionQThreshold <= 1,
                                    "promotionQThreshold must be in [0, 1]");
        Preconditions.checkArgument(this.defaultImportance >= 0 && this.defaultImportance <= 1,
                                    "defaultImportance must be in [0, 1]");
        Preconditions.checkArgument(this.knowledgeBlockCapacity > 0, "knowledgeBlockCapacity must be positive");
    }

    public static ContextMemoryConfig defaults() {
        return ContextMemoryConfig.builder().build();
    }
}
