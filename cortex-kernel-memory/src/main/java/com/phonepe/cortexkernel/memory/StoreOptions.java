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

import java.util.List;
import java.util.Objects;

/**
 * Optional parameters for {@link ContextMemoryUnit#store(String, Object, StoreOptions)}
 */
@Value
public class StoreOptions {
    MemoryScope scope;
    /**
     * Replaces existing tags when updating an entry. Null keeps the existing tags.
     */
    List<String> tags;
    /**
     * Initial q-value of a new entry. Null uses the configured default importance.
     */
    Double importance;

    @Builder
    public StoreOptions(MemoryScope scope, List<String> tags, Double importance) {
        this.scope = Objects.requireNonNullElse(scope, MemoryScope.STM);
        this.tags = tags == null ? null : List.copyOf(tags);
        this.importance = importance;
    }

    public static StoreOptions defaults() {
        return StoreOptions.builder().build();
    }

    public static StoreOptions in(MemoryScope scope) {
        return StoreOptions.builder().scope(scope).build();
    }
}
