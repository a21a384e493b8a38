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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JudgePanelTest {

    private final JudgePanel panel = JudgePanel.builder()
            .passThreshold(0.5)
            .consensusThreshold(0.5)
            .debateRounds(3)
            .build();

    private static final JudgeScorer SPLIT = (judge, output, category, context) -> judge == 0 ? 0.2 : 0.8;

    @Test
    void unanimousPanelsReachFullConsensus() {
        final var good = panel.judge("v1", "out", List.of("accuracy", "clarity"), 3, ConsensusMethod.MAJORITY,
                                     null, (judge, output, category, context) -> 0.9);
        final var bad = panel.judge("v2", "out", List.of("accuracy"), 3, ConsensusMethod.MAJORITY,
                                    null, (judge, output, category, context) -> 0.2);

        assertAll(
                () -> assertEquals(0.9, good.getOverallScore(), 1e-9),
                () -> assertEquals(1.0, good.getConsensus(), 1e-9),
                () -> assertTrue(good.isPassed()),
                () -> assertEquals(List.of("accuracy", "clarity"), List.copyOf(good.getCategoryScores().keySet())),
                () -> assertEquals(3, good.getVotes().size()),
                () -> assertEquals(1.0, bad.getConsensus(), 1e-9),
                () -> assertFalse(bad.isPassed())
                 );
    }

    @Test
    void majorityConsensusIsShareOfTheLargerSide() {
        final var verdict = panel.judge("v", "out", List.of("accuracy"), 3, ConsensusMethod.MAJORITY, null,
                                        (judge, output, category, context) -> judge == 1 ? 0.1 : 0.9);

        assertAll(
                () -> assertEquals(2.0 / 3, verdict.getConsensus(), 1e-9),
                () -> assertEquals(1.9 / 3, verdict.getOverallScore(), 1e-9),
                () -> assertEquals(1.9 / 3, verdict.getCategoryScores().get("accuracy"), 1e-9),
                () -> assertTrue(verdict.isPassed())
                 );
    }

    @Test
    void weightedConsensusFavoursConfidentJudges() {
        final var verdict = panel.judge("v", "out", List.of("accuracy"), 2, ConsensusMethod.WEIGHTED, null, SPLIT);

        assertAll(
                () -> assertEquals(0.68, verdict.getOverallScore(), 1e-9),
                () -> assertEquals(0.7, verdict.getConsensus(), 1e-9),
                () -> assertTrue(verdict.isPassed())
                 );
    }

    @Test
    void debateConvergesTowardsThePanelMean() {
        final var verdict = panel.judge("v", "out", List.of("accuracy"), 2, ConsensusMethod.DEBATE, null, SPLIT);
        final var noDebate = JudgePanel.builder()
                .passThreshold(0.5)
                .consensusThreshold(0.5)
                .debateRounds(0)
                .build()
                .judge("v", "out", List.of("accuracy"), 2, ConsensusMethod.DEBATE, null, SPLIT);

        assertAll(
                () -> assertEquals(0.5, verdict.getOverallScore(), 1e-9),
                () -> assertEquals(1 - 4 * 0.0375 * 0.0375, verdict.getConsensus(), 1e-9),
                () -> assertEquals(1 - 4 * 0.09, noDebate.getConsensus(), 1e-9),
                () -> assertTrue(verdict.getConsensus() > noDebate.getConsensus())
                 );
    }

    @Test
    void scoresAreClampedAndCategoriesRequired() {
        final var verdict = panel.judge("v", "out", List.of("accuracy"), 1, ConsensusMethod.MAJORITY, null,
                                        (judge, output, category, context) -> 3.0);

        assertEquals(1.0, verdict.getOverallScore());
        assertThrows(IllegalArgumentException.class,
                     () -> panel.judge("v", "out", List.of(), 3, ConsensusMethod.MAJORITY, null, SPLIT));
    }

    @Test
    void evidenceIsAppendedToACopy() {
        final var verdict = panel.judge("v", "out", List.of("accuracy"), 1, ConsensusMethod.MAJORITY, null, SPLIT);
        final var withEvidence = verdict.withEvidenceAdded(new Evidence("unit tests pass", null));

        assertAll(
                () -> assertTrue(verdict.getEvidence().isEmpty()),
                () -> assertEquals(1, withEvidence.getEvidence().size()),
                () -> assertEquals("unit tests pass", withEvidence.getEvidence().get(0).getContent())
                 );
    }
}
