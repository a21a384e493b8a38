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
import lombok.With;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Immutable snapshot of an item held by the {@link ContextMemoryUnit}. Mutations replace the entry.
 */
@Value
@With
@Builder
public class MemoryEntry {
    String id;
    /**
     * Unique within a scope
     */
    String key;
    Object value;
    MemoryScope scope;
    List<String> tags;
    double importance;
    /**
     * Estimated utility in [0, 1]. Drives eviction and promotion.
     */
    double qValue;
    int accessCount;
    LocalDateTime createdAt;
    LocalDateTime lastAccessedAt;
    /**
     * Creation order, breaks ties between entries with the same q-value
     */
    long sequence;
}
