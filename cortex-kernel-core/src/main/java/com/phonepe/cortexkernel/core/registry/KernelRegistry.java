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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.collect.EvictingQueue;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.phonepe.cortexkernel.core.catalog.KernelLayer;
import com.phonepe.cortexkernel.core.catalog.PrimitiveCatalog;
import com.phonepe.cortexkernel.core.catalog.PrimitiveId;
import com.phonepe.cortexkernel.core.errors.KernelException;
import com.phonepe.cortexkernel.core.events.EventType;
import com.phonepe.cortexkernel.core.events.KernelEventBus;
import com.phonepe.cortexkernel.core.utils.KernelUtils;
import dev.failsafe.Bulkhead;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatch table for kernel primitives. Handlers are bound to primitive ids and invoked through {@link #call}, which
 * enforces enablement, a registry wide concurrency limit and a per call timeout, and keeps call metrics.
 * <p>
 * Registration state and metrics are guarded by the registry monitor. The monitor is never held while a handler
 * runs.
 */
@Slf4j
public class KernelRegistry implements AutoCloseable {
    public static final String SOURCE = "kernel";

    @Getter
    private final KernelConfig config;
    private final KernelEventBus eventBus;
    private final Bulkhead<Object> bulkhead;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;
    private final Map<PrimitiveId, Registration> primitives = new LinkedHashMap<>();
    private final EvictingQueue<CallRecord> callHistory;
    private final Map<PrimitiveId, Long> callsByPrimitive = new EnumMap<>(PrimitiveId.class);
    private long totalCalls;
    private boolean running;

    private static final class Registration {
        private final PrimitiveId id;
        private final PrimitiveHandler handler;
        private final LocalDateTime registeredAt = LocalDateTime.now();
        private boolean enabled;
        private long callCount;
        private long errorCount;
        private long totalDurationMs;

        private Registration(PrimitiveId id, PrimitiveHandler handler, boolean enabled) {
            this.id = id;
            this.handler = handler;
            this.enabled = enabled;
        }
    }

    public KernelRegistry() {
        this(KernelConfig.defaults());
    }

    public KernelRegistry(@NonNull KernelConfig config) {
        this(config, new KernelEventBus(SOURCE));
    }

    public KernelRegistry(@NonNull KernelConfig config, @NonNull KernelEventBus eventBus) {
        this.config = config;
        this.eventBus = eventBus;
        this.bulkhead = Bulkhead.of(config.getMaxConcurrency());
        this.ownsExecutor = config.getExecutorService() == null;
        this.executorService = ownsExecutor
                               ? Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                                                                       .setNameFormat("kernel-call-%d")
                                                                       .setDaemon(true)
                                                                       .build())
                               : config.getExecutorService();
        this.callHistory = EvictingQueue.create(config.getCallHistorySize());
    }

    /**
     * @return Event bus on which all registry events are published
     */
    public KernelEventBus events() {
        return eventBus;
    }

    public void start() {
        synchronized (this) {
            if (running) {
                return;
            }
            running = true;
        }
        log.info("Kernel registry started with max concurrency {} and call timeout {}",
                 config.getMaxConcurrency(), config.getCallTimeout());
        eventBus.emit(EventType.STARTED);
    }

    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }
        log.info("Kernel registry stopped");
        eventBus.emit(EventType.STOPPED);
    }

    /**
     * Stop the registry and shut down the handler pool if the registry created it. Calls made after this fail
     * with HANDLER_ERROR.
     */
    @Override
    public void close() {
        stop();
        if (ownsExecutor && !executorService.isShutdown()) {
            log.debug("Shutting down kernel call executor");
            executorService.shutdownNow();
        }
    }

    @VisibleForTesting
    ExecutorService executor() {
        return executorService;
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * Bind a handler to a primitive. Layer and dependencies are taken from the primitive catalog.
     *
     * @throws KernelException of type DUPLICATE_REGISTRATION if the primitive already has a handler
     */
    public void register(@NonNull PrimitiveId primitiveId, @NonNull PrimitiveHandler handler) {
        final var layer = PrimitiveCatalog.layer(primitiveId);
        synchronized (this) {
            if (primitives.containsKey(primitiveId)) {
                throw KernelException.duplicateRegistration(primitiveId);
            }
            primitives.put(primitiveId, new Registration(primitiveId, handler, config.isAutoEnable()));
        }
        log.info("Registered kernel primitive {} at layer {}", primitiveId, layer.getLevel());
        eventBus.emit(EventType.PRIMITIVE_REGISTERED, primitiveId, Map.of("layer", layer.getLevel()));
    }

    public boolean unregister(@NonNull PrimitiveId primitiveId) {
        final boolean existed;
        synchronized (this) {
            existed = primitives.remove(primitiveId) != null;
        }
        if (existed) {
            log.info("Unregistered kernel primitive {}", primitiveId);
            eventBus.emit(EventType.PRIMITIVE_UNREGISTERED, primitiveId, Map.of());
        }
        return existed;
    }

    public synchronized boolean has(PrimitiveId primitiveId) {
        return primitives.containsKey(primitiveId);
    }

    public synchronized boolean isEnabled(PrimitiveId primitiveId) {
        final var registration = primitives.get(primitiveId);
        return registration != null && registration.enabled;
    }

    /**
     * @throws KernelException of type NOT_REGISTERED if no handler is bound to the primitive
     */
    public void setEnabled(@NonNull PrimitiveId primitiveId, boolean enabled) {
        synchronized (this) {
            final var registration = primitives.get(primitiveId);
            if (registration == null) {
                throw KernelException.notRegistered(primitiveId);
            }
            registration.enabled = enabled;
        }
        log.info("Kernel primitive {} {}", primitiveId, enabled ? "enabled" : "disabled");
        eventBus.emit(enabled ? EventType.PRIMITIVE_ENABLED : EventType.PRIMITIVE_DISABLED, primitiveId, Map.of());
    }

    /**
     * Dispatch input to the handler bound to the primitive.
     *
     * @return Whatever the handler returned
     * @throws KernelException NOT_REGISTERED, DISABLED or CONCURRENCY_LIMIT_EXCEEDED before the handler is invoked,
     *                         TIMEOUT or HANDLER_ERROR after
     */
    public Object call(@NonNull PrimitiveId primitiveId, Object input) {
        final Registration registration;
        synchronized (this) {
            registration = primitives.get(primitiveId);
            if (registration == null) {
                throw KernelException.notRegistered(primitiveId);
            }
            if (!registration.enabled) {
                throw KernelException.disabled(primitiveId);
            }
        }
        if (!bulkhead.tryAcquirePermit()) {
            log.warn("Rejecting call to {}. Concurrency limit of {} reached", primitiveId, config.getMaxConcurrency());
            throw KernelException.concurrencyLimitExceeded(primitiveId, config.getMaxConcurrency());
        }
        final var callId = KernelUtils.id("call");
        final var startedAt = LocalDateTime.now();
        final var stopwatch = Stopwatch.createStarted();
        log.debug("Calling kernel primitive {} with call id {}", primitiveId, callId);
        final Object result;
        try {
            eventBus.emit(EventType.PRIMITIVE_CALLED, primitiveId, Map.of("callId", callId));
            result = invoke(registration, input);
        }
        catch (KernelException e) {
            final var durationMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);
            try {
                record(registration, CallRecord.builder()
                        .callId(callId)
                        .primitiveId(primitiveId)
                        .timestamp(startedAt)
                        .durationMs(durationMs)
                        .success(false)
                        .errorType(e.getErrorType())
                        .error(e.getMessage())
                        .build());
            }
            finally {
                bulkhead.releasePermit();
            }
            eventBus.emit(EventType.PRIMITIVE_ERROR,
                          primitiveId,
                          Map.of("callId", callId,
                                 "durationMs", durationMs,
                                 "errorType", e.getErrorType(),
                                 "error", e.getMessage()));
            throw e;
        }
        catch (RuntimeException e) {
            bulkhead.releasePermit();
            throw e;
        }
        final var durationMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        try {
            record(registration, CallRecord.builder()
                    .callId(callId)
                    .primitiveId(primitiveId)
                    .timestamp(startedAt)
                    .durationMs(durationMs)
                    .success(true)
                    .build());
        }
        finally {
            bulkhead.releasePermit();
        }
        log.debug("Kernel call {} to {} completed in {} ms", callId, primitiveId, durationMs);
        eventBus.emit(EventType.PRIMITIVE_COMPLETED,
                      primitiveId,
                      Map.of("callId", callId, "durationMs", durationMs));
        return result;
    }

    /**
     * Same as {@link #call(PrimitiveId, Object)} with the result cast to the expected type
     */
    public <T> T call(@NonNull PrimitiveId primitiveId, Object input, @NonNull Class<T> resultType) {
        return resultType.cast(call(primitiveId, input));
    }

    /**
     * Check every registered primitive for dependencies that have no handler and for dependency cycles among
     * registered primitives.
     */
    public DependencyValidation validateDependencies() {
        final List<MissingDependency> missingDependencies = new ArrayList<>();
        final List<List<PrimitiveId>> cycles;
        synchronized (this) {
            for (final var primitiveId : primitives.keySet()) {
                final var missing = PrimitiveCatalog.dependencies(primitiveId)
                        .stream()
                        .filter(dependency -> !primitives.containsKey(dependency))
                        .toList();
                if (!missing.isEmpty()) {
                    missingDependencies.add(new MissingDependency(primitiveId, missing));
                }
            }
            cycles = detectCycles();
        }
        final var validation = new DependencyValidation(List.copyOf(missingDependencies), List.copyOf(cycles));
        missingDependencies.forEach(missing -> log.warn("Kernel primitive {} is missing dependencies: {}",
                                                        missing.getPrimitive(), missing.getMissing()));
        eventBus.emit(EventType.DEPENDENCY_VALIDATED, Map.of("valid", validation.isValid()));
        return validation;
    }

    /**
     * Registered primitives ordered so that every primitive comes after the registered primitives it depends on.
     * Lower layers come first, ties are broken by id.
     */
    public synchronized List<PrimitiveId> getInitializationOrder() {
        final var visited = new HashSet<PrimitiveId>();
        final var order = new ArrayList<PrimitiveId>();
        primitives.keySet()
                .stream()
                .sorted(Comparator.comparing((PrimitiveId id) -> PrimitiveCatalog.layer(id).getLevel())
                                .thenComparing(PrimitiveId::getId))
                .forEach(id -> visitForOrder(id, visited, order));
        return List.copyOf(order);
    }

    public synchronized Map<KernelLayer, LayerStats> getLayerStats() {
        final var stats = new EnumMap<KernelLayer, LayerStats>(KernelLayer.class);
        for (final var layer : KernelLayer.values()) {
            final var inLayer = primitives.values()
                    .stream()
                    .filter(registration -> PrimitiveCatalog.layer(registration.id) == layer)
                    .toList();
            final var calls = inLayer.stream().mapToLong(registration -> registration.callCount).sum();
            final var errors = inLayer.stream().mapToLong(registration -> registration.errorCount).sum();
            final var duration = inLayer.stream().mapToLong(registration -> registration.totalDurationMs).sum();
            stats.put(layer, LayerStats.builder()
                    .layer(layer)
                    .registeredCount(inLayer.size())
                    .enabledCount((int) inLayer.stream().filter(registration -> registration.enabled).count())
                    .totalCalls(calls)
                    .avgDurationMs(ratio(duration, calls))
                    .errorRate(ratio(errors, calls))
                    .build());
        }
        return stats;
    }

    public synchronized KernelBudget getBudget() {
        return new KernelBudget(totalCalls, Map.copyOf(callsByPrimitive));
    }

    public synchronized Optional<PrimitiveInfo> getPrimitiveInfo(PrimitiveId primitiveId) {
        return Optional.ofNullable(primitives.get(primitiveId))
                .map(registration -> PrimitiveInfo.builder()
                        .id(registration.id)
                        .layer(PrimitiveCatalog.layer(registration.id))
                        .enabled(registration.enabled)
                        .registeredAt(registration.registeredAt)
                        .callCount(registration.callCount)
                        .errorCount(registration.errorCount)
                        .avgDurationMs(ratio(registration.totalDurationMs, registration.callCount))
                        .build());
    }

    /**
     * @return Registered primitives in registration order
     */
    public synchronized List<PrimitiveId> getRegisteredPrimitives() {
        return List.copyOf(primitives.keySet());
    }

    public synchronized KernelRegistryStats getStats() {
        final var all = primitives.values();
        final var calls = all.stream().mapToLong(registration -> registration.callCount).sum();
        final var errors = all.stream().mapToLong(registration -> registration.errorCount).sum();
        final var duration = all.stream().mapToLong(registration -> registration.totalDurationMs).sum();
        return KernelRegistryStats.builder()
                .running(running)
                .registeredPrimitives(primitives.size())
                .enabledPrimitives((int) all.stream().filter(registration -> registration.enabled).count())
                .totalCalls(calls)
                .totalErrors(errors)
                .errorRate(ratio(errors, calls))
                .avgCallDurationMs(ratio(duration, calls))
                .layerStats(getLayerStats())
                .callHistory(List.copyOf(callHistory))
                .config(config)
                .build();
    }

    public static List<PrimitiveId> getAllPrimitiveIds() {
        return PrimitiveCatalog.allPrimitiveIds();
    }

    public static KernelLayer getLayer(PrimitiveId primitiveId) {
        return PrimitiveCatalog.layer(primitiveId);
    }

    public static Set<PrimitiveId> getDependencies(PrimitiveId primitiveId) {
        return PrimitiveCatalog.dependencies(primitiveId);
    }

    private Object invoke(Registration registration, Object input) {
        final var primitiveId = registration.id;
        final var timeoutMs = config.getCallTimeout().toMillis();
        final Future<Object> future;
        try {
            future = executorService.submit(() -> registration.handler.handle(input));
        }
        catch (RejectedExecutionException e) {
            log.error("Could not schedule call to kernel primitive {}: {}", primitiveId, e.getMessage());
            throw KernelException.handlerError(primitiveId, e);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            if (config.isCancelOnTimeout()) {
                future.cancel(true);
            }
            log.warn("Call to kernel primitive {} timed out after {} ms", primitiveId, timeoutMs);
            throw KernelException.timeout(primitiveId, timeoutMs);
        }
        catch (ExecutionException e) {
            final var cause = e.getCause() != null ? e.getCause() : e;
            log.error("Error calling kernel primitive {}: {}", primitiveId, KernelUtils.rootCause(cause).getMessage());
            throw KernelException.handlerError(primitiveId, cause);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.error("Interrupted while waiting for kernel primitive {}", primitiveId);
            throw KernelException.handlerError(primitiveId, e);
        }
    }

    private synchronized void record(Registration registration, CallRecord callRecord) {
        registration.callCount++;
        registration.totalDurationMs += callRecord.getDurationMs();
        if (!callRecord.isSuccess()) {
            registration.errorCount++;
        }
        totalCalls++;
        callsByPrimitive.merge(registration.id, 1L, Long::sum);
        if (config.isTracing()) {
            callHistory.add(callRecord);
        }
    }

    private void visitForOrder(PrimitiveId id, Set<PrimitiveId> visited, List<PrimitiveId> order) {
        if (!visited.add(id)) {
            return;
        }
        PrimitiveCatalog.dependencies(id)
                .stream()
                .filter(primitives::containsKey)
                .forEach(dependency -> visitForOrder(dependency, visited, order));
        order.add(id);
    }

    private List<List<PrimitiveId>> detectCycles() {
        final List<List<PrimitiveId>> cycles = new ArrayList<>();
        for (final var start : primitives.keySet()) {
            findCycles(start, new HashMap<>(), new LinkedHashSet<>(), cycles);
        }
        return cycles;
    }

    private void findCycles(
            PrimitiveId node,
            Map<PrimitiveId, Boolean> visited,
            LinkedHashSet<PrimitiveId> path,
            List<List<PrimitiveId>> cycles) {
        if (path.contains(node)) {
            final var cycle = new ArrayList<PrimitiveId>();
            var inCycle = false;
            for (final var onPath : path) {
                inCycle |= onPath == node;
                if (inCycle) {
                    cycle.add(onPath);
                }
            }
            cycle.add(node);
            cycles.add(List.copyOf(cycle));
            return;
        }
        if (visited.putIfAbsent(node, Boolean.TRUE) != null) {
            return;
        }
        path.add(node);
        PrimitiveCatalog.dependencies(node)
                .stream()
                .filter(primitives::containsKey)
                .forEach(dependency -> findCycles(dependency, visited, path, cycles));
        path.remove(node);
    }

    private static double ratio(long numerator, long denominator) {
        return denominator > 0 ? (double) numerator / denominator : 0;
    }
}
