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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.MoreExecutors;
import com.phonepe.cortexkernel.core.catalog.PrimitiveId;
import io.appform.signals.signals.ConsumingFireForgetSignal;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Per component event broadcaster. Listeners run on the emitting thread unless an executor is supplied.
 */
public class KernelEventBus {
    private final String source;
    private final ConsumingFireForgetSignal<KernelEvent> eventSignal;

    /**
     * Create a synchronous event bus
     * @param source Name of the component emitting events on this bus
     */
    public KernelEventBus(final String source) {
        this(source, MoreExecutors.newDirectExecutorService());
    }

    /**
     * Create event bus with custom executor service
     * @param source Name of the component emitting events on this bus
     * @param executorService The executor service to use for handling events
     */
    public KernelEventBus(final String source, final ExecutorService executorService) {
        this(source,
             ConsumingFireForgetSignal.<KernelEvent>builder()
                     .executorService(executorService)
                     .build());
    }

    @VisibleForTesting
    KernelEventBus(String source, ConsumingFireForgetSignal<KernelEvent> eventSignal) {
        this.source = source;
        this.eventSignal = eventSignal;
    }

    /**
     * @return The signal to listen to events. Use Signal.connect to connect event handlers.
     */
    public ConsumingFireForgetSignal<KernelEvent> onEvent() {
        return eventSignal;
    }

    /**
     * Listen to a single type of event
     */
    public void subscribe(final EventType type, final Consumer<KernelEvent> listener) {
        eventSignal.connect(event -> {
            if (event.getType() == type) {
                listener.accept(event);
            }
        });
    }

    public void notify(final KernelEvent event) {
        eventSignal.dispatch(event);
    }

    public void emit(final EventType type) {
        emit(type, Map.of());
    }

    public void emit(final EventType type, final Map<String, Object> details) {
        emit(type, null, details);
    }

    public void emit(final EventType type, final PrimitiveId primitiveId, final Map<String, Object> details) {
        notify(KernelEvent.builder()
                       .type(type)
                       .source(source)
                       .primitiveId(primitiveId)
                       .details(details)
                       .build());
    }

    public String getSource() {
        return source;
    }
}
