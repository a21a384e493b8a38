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

import com.google.common.util.concurrent.MoreExecutors;
import com.phonepe.cortexkernel.core.catalog.KernelLayer;
import com.phonepe.cortexkernel.core.catalog.PrimitiveId;
import com.phonepe.cortexkernel.core.errors.ErrorType;
import com.phonepe.cortexkernel.core.errors.KernelException;
import com.phonepe.cortexkernel.core.events.EventType;
import com.phonepe.cortexkernel.core.events.KernelEvent;
import com.phonepe.cortexkernel.core.events.KernelEventBus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phonepe.cortexkernel.core.catalog.PrimitiveId.*;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class KernelRegistryTest {

    @Test
    void registersAndDispatches() throws Exception {
        final var registry = new KernelRegistry();
        final var handler = mock(PrimitiveHandler.class);
        when(handler.handle(any())).thenAnswer(invocation -> "echo:" + invocation.getArgument(0));

        registry.register(REASON, handler);
        assertEquals("echo:hi", registry.call(REASON, "hi", String.class));

        final var info = registry.getPrimitiveInfo(REASON).orElseThrow();
        final var budget = registry.getBudget();
        final var history = registry.getStats().getCallHistory();
        assertAll(
                () -> assertTrue(registry.has(REASON)),
                () -> assertTrue(registry.isEnabled(REASON)),
                () -> assertEquals(KernelLayer.CORE_EXECUTION, info.getLayer()),
                () -> assertEquals(1, info.getCallCount()),
                () -> assertEquals(0, info.getErrorCount()),
                () -> assertEquals(1, budget.getTotalCalls()),
                () -> assertEquals(1, budget.callsTo(REASON)),
                () -> assertEquals(1, history.size()),
                () -> assertTrue(history.get(0).isSuccess()),
                () -> assertTrue(registry.getPrimitiveInfo(JUDGE).isEmpty())
                 );
        verify(handler).handle("hi");
    }

    @Test
    void rejectsDuplicateAndUnknownPrimitives() {
        final var registry = new KernelRegistry();
        registry.register(ATTENTION, input -> input);

        final var duplicate = assertThrows(KernelException.class,
                                           () -> registry.register(ATTENTION, input -> input));
        final var unknown = assertThrows(KernelException.class, () -> registry.call(SEARCH, "x"));
        final var toggleUnknown = assertThrows(KernelException.class, () -> registry.setEnabled(SEARCH, false));
        assertAll(
                () -> assertEquals(ErrorType.DUPLICATE_REGISTRATION, duplicate.getErrorType()),
                () -> assertEquals(ErrorType.NOT_REGISTERED, unknown.getErrorType()),
                () -> assertEquals(SEARCH, unknown.getPrimitiveId()),
                () -> assertEquals(ErrorType.NOT_REGISTERED, toggleUnknown.getErrorType()),
                () -> assertTrue(registry.unregister(ATTENTION)),
                () -> assertFalse(registry.unregister(ATTENTION)),
                () -> assertFalse(registry.isEnabled(ATTENTION))
                 );
    }

    @Test
    void disabledPrimitivesNeverReachTheHandler() throws Exception {
        final var registry = new KernelRegistry();
        final var handler = mock(PrimitiveHandler.class);
        registry.register(INDEX, handler);
        registry.setEnabled(INDEX, false);

        final var error = assertThrows(KernelException.class, () -> registry.call(INDEX, "x"));
        assertAll(
                () -> assertEquals(ErrorType.DISABLED, error.getErrorType()),
                () -> assertEquals(0, registry.getBudget().getTotalCalls()),
                () -> assertEquals(0, registry.getPrimitiveInfo(INDEX).orElseThrow().getCallCount())
                 );
        verifyNoInteractions(handler);

        registry.setEnabled(INDEX, true);
        registry.call(INDEX, "x");
        verify(handler).handle("x");
    }

    @Test
    void autoEnableCanBeSwitchedOff() {
        final var registry = new KernelRegistry(KernelConfig.builder().autoEnable(false).build());
        registry.register(ATTENTION, input -> input);
        assertFalse(registry.isEnabled(ATTENTION));
    }

    @Test
    void handlerFailuresAreWrappedAndCounted() {
        final var registry = new KernelRegistry();
        final var events = collectEvents(registry);
        registry.register(COMPRESS, input -> {
            throw new IllegalStateException("boom");
        });

        final var error = assertThrows(KernelException.class, () -> registry.call(COMPRESS, null));
        final var info = registry.getPrimitiveInfo(COMPRESS).orElseThrow();
        final var stats = registry.getStats();
        assertAll(
                () -> assertEquals(ErrorType.HANDLER_ERROR, error.getErrorType()),
                () -> assertInstanceOf(IllegalStateException.class, error.getCause()),
                () -> assertTrue(error.getMessage().contains("boom")),
                () -> assertEquals(1, info.getCallCount()),
                () -> assertEquals(1, info.getErrorCount()),
                () -> assertEquals(1.0, stats.getErrorRate()),
                () -> assertFalse(stats.getCallHistory().get(0).isSuccess()),
                () -> assertEquals(ErrorType.HANDLER_ERROR, stats.getCallHistory().get(0).getErrorType()),
                () -> assertEquals(1, registry.getBudget().callsTo(COMPRESS))
                 );
        await().atMost(Duration.ofSeconds(5))
                .until(() -> events.stream().anyMatch(event -> event.getType() == EventType.PRIMITIVE_ERROR));
        final var errorEvent = events.stream()
                .filter(event -> event.getType() == EventType.PRIMITIVE_ERROR)
                .findFirst()
                .orElseThrow();
        assertTrue(errorEvent.<String>detail("error").contains("boom"));
    }

    @Test
    void emitsLifecycleAndCallEvents() {
        final var registry = new KernelRegistry();
        final var events = collectEvents(registry);

        registry.start();
        registry.start();
        registry.register(ATTENTION, input -> "attended");
        registry.call(ATTENTION, "tokens");
        registry.stop();

        final var expected = List.of(EventType.STARTED,
                                     EventType.PRIMITIVE_REGISTERED,
                                     EventType.PRIMITIVE_CALLED,
                                     EventType.PRIMITIVE_COMPLETED,
                                     EventType.STOPPED);
        await().atMost(Duration.ofSeconds(5)).until(() -> events.size() == expected.size());
        assertEquals(expected, events.stream().map(KernelEvent::getType).toList());
        assertEquals(Integer.valueOf(0), events.get(1).<Integer>detail("layer"));
        assertFalse(registry.isRunning());
    }

    @Test
    void callsTimeOutAndHandlerIsInterrupted() {
        final var registry = new KernelRegistry(KernelConfig.builder()
                                                        .callTimeout(Duration.ofMillis(100))
                                                        .build());
        final var interrupted = new AtomicBoolean();
        registry.register(SIMULATE, input -> {
            try {
                Thread.sleep(10_000);
            }
            catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
            }
            return "late";
        });

        final var error = assertThrows(KernelException.class, () -> registry.call(SIMULATE, "s0"));
        assertEquals(ErrorType.TIMEOUT, error.getErrorType());
        await().atMost(Duration.ofSeconds(5)).untilTrue(interrupted);
        final var info = registry.getPrimitiveInfo(SIMULATE).orElseThrow();
        assertAll(
                () -> assertEquals(1, info.getCallCount()),
                () -> assertEquals(1, info.getErrorCount()),
                () -> assertEquals(ErrorType.TIMEOUT, registry.getStats().getCallHistory().get(0).getErrorType())
                 );
    }

    @Test
    void timedOutHandlersCanBeLeftRunning() {
        final var registry = new KernelRegistry(KernelConfig.builder()
                                                        .callTimeout(Duration.ofMillis(100))
                                                        .cancelOnTimeout(false)
                                                        .build());
        final var finished = new AtomicBoolean();
        final var interrupted = new AtomicBoolean();
        registry.register(SIMULATE, input -> {
            try {
                Thread.sleep(400);
                finished.set(true);
            }
            catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
            }
            return "late";
        });

        final var error = assertThrows(KernelException.class, () -> registry.call(SIMULATE, "s0"));
        assertEquals(ErrorType.TIMEOUT, error.getErrorType());
        await().atMost(Duration.ofSeconds(5)).untilTrue(finished);
        assertFalse(interrupted.get());
    }

    @Test
    void concurrencyLimitFailsFast() throws Exception {
        final var registry = new KernelRegistry(KernelConfig.builder().maxConcurrency(2).build());
        final var release = new CountDownLatch(1);
        final var inFlight = new AtomicInteger();
        registry.register(SEARCH, input -> {
            inFlight.incrementAndGet();
            release.await(10, TimeUnit.SECONDS);
            return input;
        });
        registry.register(REASON, input -> input);

        final var pool = Executors.newFixedThreadPool(2);
        final List<Future<Object>> pending = new ArrayList<>();
        try {
            pending.add(pool.submit(() -> registry.call(SEARCH, "a")));
            pending.add(pool.submit(() -> registry.call(SEARCH, "b")));
            await().atMost(Duration.ofSeconds(5)).until(() -> inFlight.get() == 2);

            final var rejected = assertThrows(KernelException.class, () -> registry.call(REASON, "c"));
            assertEquals(ErrorType.CONCURRENCY_LIMIT_EXCEEDED, rejected.getErrorType());
            assertEquals(0, registry.getBudget().callsTo(REASON));

            release.countDown();
            for (final var future : pending) {
                assertNotNull(future.get(5, TimeUnit.SECONDS));
            }
        }
        finally {
            pool.shutdownNow();
        }
        assertEquals("c", registry.call(REASON, "c"));
        assertEquals(3, registry.getBudget().getTotalCalls());
    }

    @Test
    void initializationOrderFollowsLayersAndDependencies() {
        final var registry = new KernelRegistry();
        for (final var id : List.of(SEARCH, JUDGE, RETRIEVE, REASON, ATTENTION)) {
            registry.register(id, input -> input);
        }
        assertEquals(List.of(ATTENTION, REASON, RETRIEVE, SEARCH, JUDGE), registry.getInitializationOrder());
        assertEquals(List.of(SEARCH, JUDGE, RETRIEVE, REASON, ATTENTION), registry.getRegisteredPrimitives());
    }

    @Test
    void reportsMissingDependencies() {
        final var registry = new KernelRegistry();
        registry.register(SEARCH, input -> input);
        registry.register(ATTENTION, input -> input);

        final var validation = registry.validateDependencies();
        assertAll(
                () -> assertFalse(validation.isValid()),
                () -> assertEquals(1, validation.getMissingDependencies().size()),
                () -> assertEquals(SEARCH, validation.getMissingDependencies().get(0).getPrimitive()),
                () -> assertEquals(2, validation.getMissingDependencies().get(0).getMissing().size()),
                () -> assertTrue(validation.getCircularDependencies().isEmpty())
                 );

        registry.register(REASON, input -> input);
        registry.register(RETRIEVE, input -> input);
        assertTrue(registry.validateDependencies().isValid());
    }

    @Test
    void layerStatsCoverAllLayers() {
        final var registry = new KernelRegistry();
        registry.register(SCALE, input -> input);
        registry.register(REASON, input -> {
            throw new IllegalArgumentException("bad input");
        });
        registry.register(EXTEND, input -> input);
        registry.setEnabled(EXTEND, false);
        registry.call(SCALE, 1);
        assertThrows(KernelException.class, () -> registry.call(REASON, 1));

        final var layerStats = registry.getLayerStats();
        final var core = layerStats.get(KernelLayer.CORE_EXECUTION);
        assertAll(
                () -> assertEquals(6, layerStats.size()),
                () -> assertEquals(3, core.getRegisteredCount()),
                () -> assertEquals(2, core.getEnabledCount()),
                () -> assertEquals(2, core.getTotalCalls()),
                () -> assertEquals(0.5, core.getErrorRate()),
                () -> assertEquals(0, layerStats.get(KernelLayer.MODEL_LIFECYCLE).getRegisteredCount()),
                () -> assertEquals(2, registry.getStats().getEnabledPrimitives())
                 );
    }

    @Test
    void callHistoryIsBoundedAndCanBeSwitchedOff() {
        final var bounded = new KernelRegistry(KernelConfig.builder().callHistorySize(3).build());
        bounded.register(ATTENTION, input -> input);
        for (int i = 0; i < 5; i++) {
            bounded.call(ATTENTION, i);
        }
        final var history = bounded.getStats().getCallHistory();
        assertEquals(3, history.size());
        assertEquals(5, bounded.getBudget().getTotalCalls());

        final var untraced = new KernelRegistry(KernelConfig.builder().tracing(false).build());
        untraced.register(ATTENTION, input -> input);
        untraced.call(ATTENTION, 1);
        assertTrue(untraced.getStats().getCallHistory().isEmpty());
        assertEquals(1, untraced.getStats().getTotalCalls());
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> KernelConfig.builder().maxConcurrency(0).build());
        assertThrows(IllegalArgumentException.class,
                     () -> KernelConfig.builder().callTimeout(Duration.ZERO).build());
    }

    @Test
    void closeShutsDownOwnExecutorOnly() {
        final var registry = new KernelRegistry();
        registry.register(RETRIEVE, input -> input);
        registry.start();
        assertEquals("x", registry.call(RETRIEVE, "x"));

        registry.close();

        final var afterClose = assertThrows(KernelException.class, () -> registry.call(RETRIEVE, "x"));
        assertAll(
                () -> assertTrue(registry.executor().isShutdown()),
                () -> assertFalse(registry.isRunning()),
                () -> assertEquals(ErrorType.HANDLER_ERROR, afterClose.getErrorType())
                 );

        final var supplied = Executors.newSingleThreadExecutor();
        try {
            final var sharing = new KernelRegistry(KernelConfig.builder().executorService(supplied).build());
            sharing.close();
            assertFalse(supplied.isShutdown());
            assertSame(supplied, sharing.executor());
        }
        finally {
            supplied.shutdownNow();
        }
    }

    @Test
    void permitIsReleasedWhenEventDispatchIsRejected() {
        final var eventExecutor = MoreExecutors.newDirectExecutorService();
        final var registry = new KernelRegistry(KernelConfig.builder().maxConcurrency(1).build(),
                                                new KernelEventBus("kernel", eventExecutor));
        registry.register(RETRIEVE, input -> input);
        eventExecutor.shutdown();

        // a leaked permit would turn the second attempt into CONCURRENCY_LIMIT_EXCEEDED
        for (int i = 0; i < 3; i++) {
            try {
                assertEquals("x", registry.call(RETRIEVE, "x"));
            }
            catch (RejectedExecutionException e) {
                assertNotNull(e);
            }
        }
        registry.close();
    }

    private static List<KernelEvent> collectEvents(KernelRegistry registry) {
        final List<KernelEvent> events = new CopyOnWriteArrayList<>();
        registry.events().onEvent().connect(events::add);
        return events;
    }
}
