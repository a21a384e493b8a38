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

import java.util.List;
import java.util.stream.IntStream;

/**
 * Generates candidate successor states while searching
 */
@FunctionalInterface
public interface StateExpander {

    /**
     * @param state State being expanded
     * @param depth Depth of the children to be generated
     * @param count Maximum number of children wanted
     * @return Successor states. Anything beyond count is ignored.
     */
    List<String> expand(String state, int depth, int count);

    /**
     * Children named {@code <state> → step<depth>_<index>}
     */
    static StateExpander synthetic() {
        return (state, depth, count) -> IntStream.range(0, count)
                .mapToObj(index -> "%s → step%d_%d".formatted(state, depth, index))
                .toList();
    }
}
