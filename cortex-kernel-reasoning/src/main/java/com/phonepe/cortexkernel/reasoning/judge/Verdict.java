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

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a judge panel. Instances are immutable, adding evidence produces a new verdict.
 */
@Value
@With
@Builder
public class Verdict {
    String id;
    String output;
    ConsensusMethod consensusMethod;
    List<JudgeVote> votes;
    Map<String, Double> categoryScores;
    double overallScore;
    double consensus;
    boolean passed;
    @Builder.Default
    List<Evidence> evidence = List.of();
    LocalDateTime timestamp;

    public Verdict withEvidenceAdded(Evidence item) {
        return withEvidence(ImmutableList.<Evidence>builder()
                                    .addAll(evidence)
                                    .add(item)
                                    .build());
    }
}
