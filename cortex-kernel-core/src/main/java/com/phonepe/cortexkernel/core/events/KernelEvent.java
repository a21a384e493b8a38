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

package com.phonepe.cortexkernel.core.events;

import com.phonepe.cortexkernel.core.catalog.PrimitiveId;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A notification emitted by a kernel component. Primitive specific events carry the primitive id, everything
 * else of interest goes into {@link #details}.
 */
@Value
@Builder
public class KernelEvent {
    EventType type;
    String source;
    @Builder.Default
    String eventId = UUID.randomUUID().toString();
    @Builder.Default
    LocalDateTime timestamp = LocalDateTime.now();
    PrimitiveId primitiveId;
    @Singular
    Map<String, Object> details;

    public Optional<PrimitiveId> primitive() {
        return Optional.ofNullable(primitiveId);
    }

    @SuppressWarnings("unchecked")
    public <T> T detail(final String name) {
        return (T) details.get(name);
    }
}
