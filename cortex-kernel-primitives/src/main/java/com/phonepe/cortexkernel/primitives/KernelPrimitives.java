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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.phonepe.cortexkernel.core.catalog.PrimitiveId;
import com.phonepe.cortexkernel.core.errors.KernelException;
import com.phonepe.cortexkernel.core.registry.DependencyValidation;
import com.phonepe.cortexkernel.core.registry.KernelRegistry;
import com.phonepe.cortexkernel.core.registry.PrimitiveHandler;
import com.phonepe.cortexkernel.core.utils.JsonUtils;
import com.phonepe.cortexkernel.memory.ContextMemoryUnit;
import com.phonepe.cortexkernel.primitives.requests.IndexRequest;
import com.phonepe.cortexkernel.primitives.requests.JudgeRequest;
import com.phonepe.cortexkernel.primitives.requests.ReasonRequest;
import com.phonepe.cortexkernel.primitives.requests.ReinforceRequest;
import com.phonepe.cortexkernel.primitives.requests.RememberRequest;
import com.phonepe.cortexkernel.primitives.requests.RetrieveRequest;
import com.phonepe.cortexkernel.primitives.requests.SearchRequest;
import com.phonepe.cortexkernel.primitives.requests.SelfEvolveRequest;
import com.phonepe.cortexkernel.primitives.requests.SimulateRequest;
import com.phonepe.cortexkernel.reasoning.ReasoningEngine;
import com.phonepe.cortexkernel.reasoning.judge.HeuristicJudgeScorer;
import com.phonepe.cortexkernel.reasoning.simulation.SimulationState;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Exposes the context memory unit and the reasoning engine as kernel primitives
 */
@Slf4j
public class KernelPrimitives {
    private static final String SEARCH_CATEGORY = "search";
    private static final int NEUTRAL_JUDGE = 1;

    private final ContextMemoryUnit memory;
    private final ReasoningEngine reasoning;
    private final ObjectMapper mapper;
    private final HeuristicJudgeScorer stateScorer = new HeuristicJudgeScorer();

    @Builder
    public KernelPrimitives(@NonNull ContextMemoryUnit memory, @NonNull ReasoningEngine reasoning, ObjectMapper mapper) {
        this.memory = memory;
        this.reasoning = reasoning;
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    /**
     * Handlers for every primitive backed by the memory unit or the reasoning engine
     */
    public Map<PrimitiveId, PrimitiveHandler> handlers() {
        final var handlers = new EnumMap<PrimitiveId, PrimitiveHandler>(PrimitiveId.class);
        handlers.put(PrimitiveId.REMEMBER, typed(RememberRequest.class,
                                                 request -> memory.store(request.getKey(),
                                                                         request.getValue(),
                                                                         request.toStoreOptions())));
        handlers.put(PrimitiveId.RETRIEVE, typed(RetrieveRequest.class,
                                                 request -> memory.retrieve(request.getQuery(),
                                                                            request.toRetrieveOptions())));
        handlers.put(PrimitiveId.COMPRESS, input -> memory.compress());
        handlers.put(PrimitiveId.INDEX, typed(IndexRequest.class,
                                              request -> memory.searchIndex(
                                                      request.getQuery(),
                                                      Objects.requireNonNullElse(
                                                              request.getTopK(),
                                                              ContextMemoryUnit.DEFAULT_INDEX_RESULTS))));
        handlers.put(PrimitiveId.EVOLVE_MEMORY, typed(ReinforceRequest.class,
                                                      request -> memory.batchUpdateQValues(request.getMemoryIds(),
                                                                                           request.getReward())));
        handlers.put(PrimitiveId.REASON, typed(ReasonRequest.class,
                                               request -> reasoning.reason(request.getProblem(),
                                                                           request.toReasonOptions())));
        handlers.put(PrimitiveId.SEARCH, typed(SearchRequest.class,
                                               request -> reasoning.search(request.getProblem(),
                                                                           evaluator(request),
                                                                           request.toSearchOptions())));
        handlers.put(PrimitiveId.SIMULATE, typed(SimulateRequest.class, this::simulate));
        handlers.put(PrimitiveId.JUDGE, typed(JudgeRequest.class,
                                              request -> reasoning.judge(request.getOutput(),
                                                                         request.getCategories(),
                                                                         request.toJudgeOptions())));
        handlers.put(PrimitiveId.SELF_EVOLVE, typed(SelfEvolveRequest.class,
                                                    request -> reasoning.evolveLoop(request.toEvolveLoopOptions())));
        return handlers;
    }

    public DependencyValidation install(KernelRegistry registry) {
        return install(registry, Map.of());
    }

    /**
     * Register the bound primitives along with externally implemented ones, then check dependencies.
     * Missing dependencies are logged, they do not fail the installation. Nothing is registered if any of the
     * primitives already has a handler.
     *
     * @throws KernelException of type DUPLICATE_REGISTRATION if the registry already has a handler for one of them
     */
    public DependencyValidation install(
            @NonNull KernelRegistry registry,
            @NonNull Map<PrimitiveId, PrimitiveHandler> externalHandlers) {
        final var bound = handlers();
        externalHandlers.keySet()
                .forEach(primitiveId -> Preconditions.checkArgument(!bound.containsKey(primitiveId),
                                                                    "Primitive %s is bound internally",
                                                                    primitiveId));
        final var toRegister = new LinkedHashMap<PrimitiveId, PrimitiveHandler>(externalHandlers);
        toRegister.putAll(bound);
        toRegister.keySet()
                .stream()
                .filter(registry::has)
                .findFirst()
                .ifPresent(primitiveId -> {
                    throw KernelException.duplicateRegistration(primitiveId);
                });
        final var registered = new ArrayList<PrimitiveId>(toRegister.size());
        try {
            toRegister.forEach((primitiveId, handler) -> {
                registry.register(primitiveId, handler);
                registered.add(primitiveId);
            });
        }
        catch (KernelException e) {
            log.error("Kernel primitive installation failed, rolling back {} registrations: {}",
                      registered.size(), e.getMessage());
            registered.forEach(registry::unregister);
            throw e;
        }
        final var validation = registry.validateDependencies();
        if (validation.isValid()) {
            log.info("Installed {} kernel primitives", bound.size() + externalHandlers.size());
        }
        else {
            log.warn("Installed {} kernel primitives with unresolved dependencies: {}",
                     bound.size() + externalHandlers.size(), validation.getMissingDependencies());
        }
        return validation;
    }

    private Object simulate(SimulateRequest request) {
        Preconditions.checkArgument(request.getTransition() != null, "A state transition is required to simulate");
        final var initial = SimulationState.initial(Objects.requireNonNullElse(request.getInitialState(), Map.of()));
        return reasoning.simulate(initial, request.getTransition(), request.toSimulateOptions());
    }

    private ToDoubleFunction<String> evaluator(SearchRequest request) {
        if (request.getEvaluator() != null) {
            return request.getEvaluator();
        }
        return state -> stateScorer.score(NEUTRAL_JUDGE, state, SEARCH_CATEGORY, request.getProblem());
    }

    private <T> PrimitiveHandler typed(Class<T> requestType, RequestProcessor<T> processor) {
        return new TypedHandler<>(requestType, processor, mapper);
    }
}
