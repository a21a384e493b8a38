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

import com.phonepe.cortexkernel.core.catalog.PrimitiveId;
import com.phonepe.cortexkernel.core.utils.KernelUtils;
import lombok.Getter;

import java.util.Objects;

/**
 * Raised when a kernel primitive cannot be registered, toggled or dispatched.
 * The {@link ErrorType} tells callers which part of the dispatch contract was violated.
 */
@Getter
public class KernelException extends RuntimeException {
    private final ErrorType errorType;
    private final PrimitiveId primitiveId;

    private KernelException(ErrorType errorType, PrimitiveId primitiveId, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.primitiveId = primitiveId;
    }

    public static KernelException notRegistered(PrimitiveId primitiveId) {
        return error(ErrorType.NOT_REGISTERED, primitiveId, primitiveId);
    }

    public static KernelException duplicateRegistration(PrimitiveId primitiveId) {
        return error(ErrorType.DUPLICATE_REGISTRATION, primitiveId, primitiveId);
    }

    public static KernelException disabled(PrimitiveId primitiveId) {
        return error(ErrorType.DISABLED, primitiveId, primitiveId);
    }

    public static KernelException concurrencyLimitExceeded(PrimitiveId primitiveId, int maxConcurrency) {
        return error(ErrorType.CONCURRENCY_LIMIT_EXCEEDED, primitiveId, maxConcurrency, primitiveId);
    }

    public static KernelException timeout(PrimitiveId primitiveId, long timeoutMs) {
        return error(ErrorType.TIMEOUT, primitiveId, primitiveId, timeoutMs);
    }

    public static KernelException handlerError(PrimitiveId primitiveId, Throwable cause) {
        final var root = KernelUtils.rootCause(cause);
        return new KernelException(ErrorType.HANDLER_ERROR,
                                   primitiveId,
                                   ErrorType.HANDLER_ERROR.getMessage()
                                           .formatted(primitiveId,
                                                      Objects.requireNonNullElse(root.getMessage(),
                                                                                 root.getClass().getSimpleName())),
                                   cause);
    }

    private static KernelException error(ErrorType errorType, PrimitiveId primitiveId, Object... args) {
        return new KernelException(errorType, primitiveId, errorType.getMessage().formatted(args), null);
    }
}
