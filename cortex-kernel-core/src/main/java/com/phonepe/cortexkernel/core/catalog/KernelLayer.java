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

package com.phonepe.cortexkernel.core.catalog;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

/**
 * Ordinal grouping of kernel primitives. A primitive may only depend on primitives of a strictly lower layer.
 */
@Getter
@AllArgsConstructor
public enum KernelLayer {
    HARDWARE_ABSTRACTION(0, "Hardware Abstraction"),
    CORE_EXECUTION(1, "Core Execution"),
    MEMORY_SUBSYSTEM(2, "Memory Subsystem"),
    REASONING_AND_SEARCH(3, "Reasoning & Search"),
    MODEL_LIFECYCLE(4, "Model Lifecycle"),
    COORDINATION_AND_ROUTING(5, "Coordination & Routing"),
    ;

    private final int level;
    private final String displayName;

    public static KernelLayer ofLevel(int level) {
        return Arrays.stream(values())
                .filter(layer -> layer.level == level)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid kernel layer: " + level));
    }

    public boolean isBelow(KernelLayer other) {
        return level < other.level;
    }
}
