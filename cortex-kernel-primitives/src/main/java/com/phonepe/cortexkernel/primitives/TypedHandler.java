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

package com.phonepe.cortexkernel.primitives;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.cortexkernel.core.registry.PrimitiveHandler;
import lombok.NonNull;

import java.util.Map;

/**
 * Adapts a {@link RequestProcessor} to the untyped handler contract of the kernel registry.
 * <p>
 * Input that already is of the request type is passed through. Maps, json trees and json strings are converted
 * with the supplied mapper. Anything else is rejected, which the registry reports as a handler error.
 */
public class TypedHandler<T> implements PrimitiveHandler {
    private final Class<T> requestType;
    private final RequestProcessor<T> processor;
    private final ObjectMapper mapper;

    public TypedHandler(
            @NonNull Class<T> requestType,
            @NonNull RequestProcessor<T> processor,
            @NonNull ObjectMapper mapper) {
        this.requestType = requestType;
        this.processor = processor;
        this.mapper = mapper;
    }

    @Override
    public Object handle(Object input) throws Exception {
        return processor.process(toRequest(input));
    }

    private T toRequest(Object input) throws Exception {
        if (requestType.isInstance(input)) {
            return requestType.cast(input);
        }
        if (input instanceof Map<?, ?> || input instanceof JsonNode) {
            return mapper.convertValue(input, requestType);
        }
        if (input instanceof String json) {
            return mapper.readValue(json, requestType);
        }
        throw new IllegalArgumentException("Expected request of type %s but received %s"
                                                   .formatted(requestType.getSimpleName(),
                                                              input == null
                                                              ? "null"
                                                              : input.getClass().getSimpleName()));
    }
}
