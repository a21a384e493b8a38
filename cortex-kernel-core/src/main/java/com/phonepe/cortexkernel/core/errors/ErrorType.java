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

package com.phonepe.cortexkernel.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Failures surfaced by the kernel dispatch gateway
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    NOT_REGISTERED("Kernel primitive '%s' is not registered"),
    DUPLICATE_REGISTRATION("Kernel primitive '%s' is already registered"),
    DISABLED("Kernel primitive '%s' is disabled"),
    CONCURRENCY_LIMIT_EXCEEDED("Kernel concurrency limit reached (%d). Cannot call '%s'"),
    TIMEOUT("Kernel call '%s' timed out after %d ms"),
    HANDLER_ERROR("Kernel call '%s' failed. Error: %s"),
    ;

    private final String message;
}
