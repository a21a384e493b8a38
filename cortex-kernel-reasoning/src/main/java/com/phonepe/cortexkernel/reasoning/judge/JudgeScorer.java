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

package com.phonepe.cortexkernel.reasoning.judge;

/**
 * Scores an output against one evaluation category
 */
@FunctionalInterface
public interface JudgeScorer {
    /**
     * @param judgeIndex Position of the judge in the panel, starting at zero
     * @param output     Output under evaluation
     * @param category   Category being scored
     * @param context    Optional context the output should relate to, may be null
     * @return Score, clamped to [0, 1] by the caller
     */
    double score(int judgeIndex, String output, String category, String context);
}
