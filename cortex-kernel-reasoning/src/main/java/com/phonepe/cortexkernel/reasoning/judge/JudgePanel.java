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
import com.phonepe.cortexkernel.core.utils.KernelUtils;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects votes from a panel of judges and folds them into a {@link Verdict}
 */
@Builder
public class JudgePanel {
    private static final double DEBATE_CONVERGENCE = 0.01;

    private final double passThreshold;
    private final double consensusThreshold;
    private final int debateRounds;

    private record Consensus(double overallScore, double consensus) {
    }

    public Verdict judge(
            String verdictId,
            String output,
            List<String> categories,
            int numJudges,
            ConsensusMethod method,
            String context,
            JudgeScorer scorer) {
        Preconditions.checkArgument(categories != null && !categories.isEmpty(), "At least one category is needed");
        Preconditions.checkArgument(numJudges >= 1, "numJudges must be at least 1");
        final var votes = new ArrayList<JudgeVote>(numJudges);
        for (int judge = 0; judge < numJudges; judge++) {
            votes.add(vote(judge, output, categories, context, scorer));
        }
        final var categoryScores = new LinkedHashMap<String, Double>();
        for (final var category : categories) {
            categoryScores.put(category, KernelUtils.mean(votes.stream()
                                                                  .map(vote -> vote.getCategoryScores().get(category))
                                                                  .toList()));
        }
        final var result = switch (method) {
            case MAJORITY -> majority(categoryScores, votes);
            case WEIGHTED -> weighted(votes);
            case DEBATE -> debate(votes);
        };
        return Verdict.builder()
                .id(verdictId)
                .output(output)
                .consensusMethod(method)
                .votes(List.copyOf(votes))
                .categoryScores(Collections.unmodifiableMap(categoryScores))
                .overallScore(result.overallScore())
                .consensus(result.consensus())
                .passed(result.overallScore() >= passThreshold && result.consensus() >= consensusThreshold)
                .timestamp(LocalDateTime.now())
                .build();
    }

    private JudgeVote vote(int judge, String output, List<String> categories, String context, JudgeScorer scorer) {
        final var scores = new LinkedHashMap<String, Double>();
        for (final var category : categories) {
            scores.put(category, KernelUtils.clamp01(scorer.score(judge, output, category, context)));
        }
        final var score = KernelUtils.mean(List.copyOf(scores.values()));
        return new JudgeVote("judge_" + judge,
                             Collections.unmodifiableMap(scores),
                             score,
                             "Judge %d evaluated %d categories with avg score %.0f%%"
                                     .formatted(judge, categories.size(), score * 100));
    }

    private Consensus majority(Map<String, Double> categoryScores, List<JudgeVote> votes) {
        final var overall = KernelUtils.mean(List.copyOf(categoryScores.values()));
        final var passing = votes.stream()
                .filter(vote -> vote.getScore() >= passThreshold)
                .count();
        final var majoritySide = Math.max(passing, votes.size() - passing);
        return new Consensus(overall, (double) majoritySide / votes.size());
    }

    private static Consensus weighted(List<JudgeVote> votes) {
        final var totalWeight = votes.stream().mapToDouble(JudgeVote::getScore).sum();
        final var overall = totalWeight > 0
                            ? votes.stream().mapToDouble(vote -> vote.getScore() * vote.getScore()).sum() / totalWeight
                            : 0;
        final var meanDeviation = votes.stream()
                .mapToDouble(vote -> Math.abs(vote.getScore() - overall))
                .average()
                .orElse(0);
        return new Consensus(overall, KernelUtils.clamp01(1 - meanDeviation));
    }

    private Consensus debate(List<JudgeVote> votes) {
        final var positions = votes.stream().mapToDouble(JudgeVote::getScore).toArray();
        for (int round = 0; round < debateRounds && spread(positions) >= DEBATE_CONVERGENCE; round++) {
            final var mean = mean(positions);
            for (int i = 0; i < positions.length; i++) {
                positions[i] += (mean - positions[i]) / 2;
            }
        }
        final var mean = mean(positions);
        var variance = 0.0;
        for (final var position : positions) {
            variance += (position - mean) * (position - mean);
        }
        variance /= positions.length;
        return new Consensus(mean, 1 - Math.min(1, 4 * variance));
    }

    private static double spread(double[] values) {
        var min = Double.MAX_VALUE;
        var max = -Double.MAX_VALUE;
        for (final var value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return max - min;
    }

    private static double mean(double[] values) {
        var sum = 0.0;
        for (final var value : values) {
            sum += value;
        }
        return sum / values.length;
    }
}
