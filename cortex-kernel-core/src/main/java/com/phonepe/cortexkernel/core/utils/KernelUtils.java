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

package com.phonepe.cortexkernel.core.utils;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Small helpers shared by all kernel components
 */
@UtilityClass
public class KernelUtils {
    private static final Splitter WORD_SPLITTER = Splitter.on(Pattern.compile("\\s+")).omitEmptyStrings();

    /**
     * Generate a short id of the form {@code <prefix>_<8 hex chars>}
     */
    public static String id(final String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static Throwable rootCause(final Throwable leaf) {
        Throwable cause = leaf;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double clamp01(double value) {
        return clamp(value, 0, 1);
    }

    /**
     * Lower cased whitespace separated words of the text
     */
    public static List<String> words(final String text) {
        return WORD_SPLITTER.splitToList(Strings.nullToEmpty(text).toLowerCase(Locale.ROOT));
    }

    /**
     * Distinct words longer than {@code minLength}, in order of first appearance, at most {@code limit} of them
     */
    public static Set<String> keywords(final String text, int minLength, int limit) {
        final var keywords = new LinkedHashSet<String>();
        for (final var word : words(text)) {
            if (keywords.size() >= limit) {
                break;
            }
            if (word.length() > minLength) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    public static double mean(final List<Double> values) {
        return values.stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0);
    }
}
