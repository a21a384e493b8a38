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

import lombok.Getter;
import lombok.experimental.UtilityClass;

/**
 * Events emitted by the kernel registry, the context memory unit and the reasoning engine
 */
@Getter
public enum EventType {
    STARTED(Values.STARTED),
    STOPPED(Values.STOPPED),
    PRIMITIVE_REGISTERED(Values.PRIMITIVE_REGISTERED),
    PRIMITIVE_UNREGISTERED(Values.PRIMITIVE_UNREGISTERED),
    PRIMITIVE_ENABLED(Values.PRIMITIVE_ENABLED),
    PRIMITIVE_DISABLED(Values.PRIMITIVE_DISABLED),
    PRIMITIVE_CALLED(Values.PRIMITIVE_CALLED),
    PRIMITIVE_COMPLETED(Values.PRIMITIVE_COMPLETED),
    PRIMITIVE_ERROR(Values.PRIMITIVE_ERROR),
    DEPENDENCY_VALIDATED(Values.DEPENDENCY_VALIDATED),
    STORED(Values.STORED),
    RETRIEVED(Values.RETRIEVED),
    EVICTED(Values.EVICTED),
    PROMOTED(Values.PROMOTED),
    DEMOTED(Values.DEMOTED),
    COMPRESSED(Values.COMPRESSED),
    COMPLETED(Values.COMPLETED),
    SEARCHED(Values.SEARCHED),
    SIMULATED(Values.SIMULATED),
    JUDGED(Values.JUDGED),
    EVOLVED(Values.EVOLVED),
    ;

    private final String type;

    EventType(String type) {
        this.type = type;
    }

    @Override
    public String toString() {
        return type;
    }

    @UtilityClass
    public static final class Values {
        public static final String STARTED = "started";
        public static final String STOPPED = "stopped";
        public static final String PRIMITIVE_REGISTERED = "primitive:registered";
        public static final String PRIMITIVE_UNREGISTERED = "primitive:unregistered";
        public static final String PRIMITIVE_ENABLED = "primitive:enabled";
        public static final String PRIMITIVE_DISABLED = "primitive:disabled";
        public static final String PRIMITIVE_CALLED = "primitive:called";
        public static final String PRIMITIVE_COMPLETED = "primitive:completed";
        public static final String PRIMITIVE_ERROR = "primitive:error";
        public static final String DEPENDENCY_VALIDATED = "dependency:validated";
        public static final String STORED = "stored";
        public static final String RETRIEVED = "retrieved";
        public static final String EVICTED = "evicted";
        public static final String PROMOTED = "promoted";
        public static final String DEMOTED = "demoted";
        public static final String COMPRESSED = "compressed";
        public static final String COMPLETED = "completed";
        public static final String SEARCHED = "searched";
        public static final String SIMULATED = "simulated";
        public static final String JUDGED = "judged";
        public static final String EVOLVED = "evolved";
    }
}
