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

import static org.junit.jupiter.api.Assertions.*;

class HeuristicJudgeScorerTest {

    private final HeuristicJudgeScorer scorer = new HeuristicJudgeScorer();

    @Test
    void shortOutputsScoreLow() {
        assertEquals(0.21, scorer.score(1, "ok", "accuracy", null), 1e-9);
    }

    @Test
    void explainedOutputsRelatedToContextScoreHigher() {
        final var context = "latency of the payment service under heavy load";
        final var explained = "The payment service latency grows under load because the pool is small, "
                + "therefore the result shows requests queueing, which indicates we need more workers.";

        assertTrue(scorer.score(1, explained, "accuracy", context) > scorer.score(1, "ok", "accuracy", context));
    }

    @Test
    void judgesAreOffsetAndBounded() {
        final var output = "Reasonable answer since the given data shows a trend";
        final var low = scorer.score(0, output, "accuracy", null);
        final var mid = scorer.score(1, output, "accuracy", null);
        final var high = scorer.score(2, output, "accuracy", null);

        assertAll(
                () -> assertTrue(low < mid),
                () -> assertTrue(mid < high),
                () -> assertTrue(low >= 0 && high <= 1)
                 );
    }
}
