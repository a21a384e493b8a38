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

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Panel parameters. A null judge count or scorer falls back to the engine's configuration.
 */
@Value
public class JudgeOptions {
    Integer numJudges;
    ConsensusMethod consensusMethod;
    String context;
    JudgeScorer scorer;

    @Builder
    public JudgeOptions(Integer numJudges, ConsensusMethod consensusMethod, String context, JudgeScorer scorer) {
        Preconditions.checkArgument(numJudges == null || numJudges >= 1, "numJudges must be at least 1");
        this.numJudges = numJudges;
        this.consensusMethod = Objects.requireNonNullElse(consensusMethod, ConsensusMethod.MAJORITY);
        this.context = context;
        this.scorer = scorer;
    }

    public static JudgeOptions defaults() {
        return JudgeOptions.builder().build();
    }
}
