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

import com.google.common.base.Strings;
import com.phonepe.cortexkernel.core.utils.KernelUtils;

import java.util.Set;

/**
 * Deterministic scorer looking at output length, explanatory keywords and overlap with the context. Each judge is
 * shifted by a small fixed offset so that panels do not vote in lock step.
 */
public class HeuristicJudgeScorer implements JudgeScorer {
    private static final Set<String> REASONING_KEYWORDS = Set.of(
            "because", "therefore", "result", "means", "since", "given", "shows", "indicates");
    private static final double JUDGE_OFFSET = 0.03;

    @Override
    public double score(int judgeIndex, String output, String category, String context) {
        final var text = Strings.nullToEmpty(output);
        final var base = 0.3 * lengthScore(text) + 0.4 * keywordScore(text) + 0.3 * contextScore(text, context);
        return KernelUtils.clamp01(base + ((judgeIndex % 3) - 1) * JUDGE_OFFSET);
    }

    private static double lengthScore(String text) {
        if (text.length() < 10) {
            return 0.2;
        }
        if (text.length() > 5000) {
            return 0.5;
        }
        return Math.min(1.0, text.length() / 500.0);
    }

    private static double keywordScore(String text) {
        final var hits = KernelUtils.words(text)
                .stream()
                .filter(REASONING_KEYWORDS::contains)
                .count();
        return Math.min(1.0, hits / 3.0);
    }

    private static double contextScore(String text, String context) {
        if (Strings.isNullOrEmpty(context)) {
            return 0.5;
        }
        final var contextWords = KernelUtils.keywords(context, 3, Integer.MAX_VALUE);
        final var outputWords = Set.copyOf(KernelUtils.words(text));
        final var overlap = contextWords.stream()
                .filter(outputWords::contains)
                .count();
        return Math.min(1.0, overlap / Math.max(1.0, contextWords.size() * 0.3));
    }
}
