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

package com.phonepe.cortexkernel.core.registry;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Setup for a {@link KernelRegistry}. Everything is optional, defaults are filled in for missing values.
 */
@Value
public class KernelConfig {
    public static final int DEFAULT_MAX_CONCURRENCY = 10;
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_CALL_HISTORY_SIZE = 1000;

    /**
     * Number of calls allowed to be in flight across all primitives. Calls beyond this are rejected, not queued.
     */
    int maxConcurrency;
    /**
     * Maximum time a handler gets to produce a result
     */
    Duration callTimeout;
    /**
     * Record every call in the call history
     */
    boolean tracing;
    /**
     * Whether newly registered primitives are enabled right away
     */
    boolean autoEnable;
    /**
     * Number of call records retained. Oldest records are dropped first.
     */
    int callHistorySize;
    /**
     * Interrupt the handler when a call times out. If false, the handler keeps running in the background and its
     * result is thrown away.
     */
    boolean cancelOnTimeout;
    /**
     * Executor on which handlers are run. If not provided, the registry creates a pool of its own and shuts it down
     * on {@link KernelRegistry#close()}. A supplied executor is never shut down by the registry.
     */
    ExecutorService executorService;

    @Builder
    public KernelConfig(
            Integer maxConcurrency,
            Duration callTimeout,
            Boolean tracing,
            Boolean autoEnable,
            Integer callHistorySize,
            Boolean cancelOnTimeout,
            ExecutorService executorService) {
        this.maxConcurrency = Objects.requireNonNullElse(maxConcurrency, DEFAULT_MAX_CONCURRENCY);
        this.callTimeout = Objects.requireNonNullElse(callTimeout, DEFAULT_CALL_TIMEOUT);
        this.tracing = Objects.requireNonNullElse(tracing, true);
        this.autoEnable = Objects.requireNonNullElse(autoEnable, true);
        this.callHistorySize = Objects.requireNonNullElse(callHistorySize, DEFAULT_CALL_HISTORY_SIZE);
        this.cancelOnTimeout = Objects.requireNonNullElse(cancelOnTimeout, true);
        this.executorService = executorService;
        Preconditions.checkArgument(this.maxConcurrency > 0, "maxConcurrency must be positive");
        Preconditions.checkArgument(!this.callTimeout.isNegative() && !this.callTimeout.isZero(),
                                    "callTimeout must be positive");
        Preconditions.checkArgument(this.callHistorySize > 0, "callHistorySize must be positive");
    }

    public static KernelConfig defaults() {
        return KernelConfig.builder().build();
    }
}
