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

package com.phonepe.cortexkernel.core.catalog;

import lombok.Getter;

import java.util.Arrays;

/**
 * Identifiers of the 19 kernel primitives. Layer and dependency information lives in {@link PrimitiveCatalog}.
 */
@Getter
public enum PrimitiveId {
    ATTENTION("attention"),
    SCALE("scale"),
    REASON("reason"),
    EXTEND("extend"),
    RETRIEVE("retrieve"),
    REMEMBER("remember"),
    COMPRESS("compress"),
    INDEX("index"),
    EVOLVE_MEMORY("evolve_memory"),
    SEARCH("search"),
    SIMULATE("simulate"),
    ADAPT("adapt"),
    INSTRUCT("instruct"),
    DISTILL("distill"),
    ALIGN("align"),
    CASCADE("cascade"),
    ROUTE("route"),
    SELF_EVOLVE("self_evolve"),
    JUDGE("judge"),
    ;

    private final String id;

    PrimitiveId(String id) {
        this.id = id;
    }

    public static PrimitiveId fromId(final String id) {
        return Arrays.stream(values())
                .filter(primitiveId -> primitiveId.id.equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown kernel primitive: " + id));
    }

    @Override
    public String toString() {
        return id;
    }
}
