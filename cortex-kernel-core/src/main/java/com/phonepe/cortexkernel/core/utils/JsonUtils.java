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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Json helpers used when memory values and handler outputs have to be rendered as text
 */
@Slf4j
@UtilityClass
public class JsonUtils {
    private static final JsonMapper MAPPER = createMapper();

    public static JsonMapper createMapper() {
        final var mapper = JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
        mapper.findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Strings are returned as is, everything else is serialized to json
     */
    public static String render(final Object value) {
        if (value instanceof String str) {
            return str;
        }
        try {
            return MAPPER.writeValueAsString(value);
        }
        catch (JsonProcessingException e) {
            log.warn("Could not serialize value of type {} to json: {}",
                     value.getClass().getSimpleName(), KernelUtils.rootCause(e).getMessage());
            return Objects.toString(value);
        }
    }

    /**
     * Render the value and cut it down to at most {@code maxLength} characters
     */
    public static String render(final Object value, int maxLength) {
        final var rendered = render(value);
        return rendered.length() > maxLength ? rendered.substring(0, maxLength) : rendered;
    }
}
