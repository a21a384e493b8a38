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

import com.phonepe.cortexkernel.core.catalog.PrimitiveId;
import com.phonepe.cortexkernel.core.errors.ErrorType;
import com.phonepe.cortexkernel.core.errors.KernelException;
import com.phonepe.cortexkernel.core.events.EventType;
import com.phonepe.cortexkernel.core.events.KernelEvent;
import com.phonepe.cortexkernel.core.registry.KernelRegistry;
import com.phonepe.cortexkernel.core.registry.MissingDependency;
import com.phonepe.cortexkernel.core.registry.PrimitiveHandler;
import com.phonepe.cortexkernel.memory.ContextMemoryUnit;
import com.phonepe.cortexkernel.memory.IndexHit;
import com.phonepe.cortexkernel.memory.MemoryEntry;
import com.phonepe.cortexkernel.memory.MemoryScope;
import com.phonepe.cortexkernel.primitives.requests.IndexRequest;
import com.phonepe.cortexkernel.primitives.requests.JudgeRequest;
import com.phonepe.cortexkernel.primitives.requests.ReasonRequest;
import com.phonepe.cortexkernel.primitives.requests.ReinforceRequest;
import com.phonepe.cortexkernel.primitives.requests.RememberRequest;
import com.phonepe.cortexkernel.primitives.requests.SearchRequest;
import com.phonepe.cortexkernel.primitives.requests.SelfEvolveRequest;
import com.phonepe.cortexkernel.primitives.requests.SimulateRequest;
import com.phonepe.cortexkernel.reasoning.ReasoningEngine;
import com.phonepe.cortexkernel.reasoning.ReasoningEngineConfig;
import com.phonepe.cortexkernel.reasoning.chain.ReasoningChain;
import com.phonepe.cortexkernel.reasoning.chain.ReasoningStrategy;
import com.phonepe.cortexkernel.reasoning.evolution.DifficultySchedule;
import com.phonepe.cortexkernel.reasoning.judge.Verdict;
import com.phonepe.cortexkernel.reasoning.search.SearchAlgorithm;
import com.phonepe.cortexkernel.reasoning.search.SearchResult;
import com.phonepe.cortexkernel.reasoning.simulation.SimulationResult;
import com.phonepe.cortexkernel.reasoning.simulation.SimulationState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class KernelPrimitivesTest {

    private static final PrimitiveHandler ATTENTION = input -> "focused";

    private KernelRegistry registry;
    private ContextMemoryUnit memory;
    private KernelPrimitives primitives;

    @BeforeEach
    void setUp() {
        registry = new KernelRegistry();
        memory = new ContextMemoryUnit();
        primitives = KernelPrimitives.builder()
                .memory(memory)
                .reasoning(new ReasoningEngine(ReasoningEngineConfig.builder().random(new Random(5)).build()))
                .build();
        registry.start();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void attentionCallEmitsCalledThenCompleted() {
        final var events = new CopyOnWriteArrayList<KernelEvent>();
        registry.events().onEvent().connect(events::add);
        primitives.install(registry, Map.of(PrimitiveId.ATTENTION, ATTENTION));

        assertEquals("focused", registry.call(PrimitiveId.ATTENTION, Map.of("tokens", List.of("a", "b"))));

        await().atMost(Duration.ofSeconds(5))
                .until(() -> events.stream().anyMatch(event -> event.getType() == EventType.PRIMITIVE_COMPLETED));
        final var callEvents = events.stream()
                .filter(event -> event.getType() == EventType.PRIMITIVE_CALLED
                        || event.getType() == EventType.PRIMITIVE_COMPLETED)
                .toList();
        assertEquals(List.of(EventType.PRIMITIVE_CALLED, EventType.PRIMITIVE_COMPLETED),
                     callEvents.stream().map(KernelEvent::getType).toList());
        assertTrue(callEvents.stream().allMatch(event -> event.getPrimitiveId() == PrimitiveId.ATTENTION));
        assertEquals(callEvents.get(0).<String>detail("callId"), callEvents.get(1).<String>detail("callId"));
    }

    @Test
    void installRegistersBoundPrimitivesAndValidatesDependencies() {
        final var validation = primitives.install(registry, Map.of(PrimitiveId.ATTENTION, ATTENTION));

        assertAll(
                () -> assertTrue(validation.isValid()),
                () -> assertEquals(11, registry.getRegisteredPrimitives().size()),
                () -> assertEquals(PrimitiveId.ATTENTION, registry.getInitializationOrder().get(0)),
                () -> assertTrue(registry.has(PrimitiveId.SELF_EVOLVE))
                 );
    }

    @Test
    void missingExternalPrimitivesAreReported() {
        final var validation = primitives.install(registry);

        assertFalse(validation.isValid());
        assertEquals(10, validation.getMissingDependencies().size());
        assertTrue(validation.getMissingDependencies()
                           .stream()
                           .map(MissingDependency::getMissing)
                           .allMatch(missing -> missing.contains(PrimitiveId.ATTENTION)));
    }

    @Test
    void internallyBoundPrimitivesCannotBeOverridden() {
        assertThrows(IllegalArgumentException.class,
                     () -> primitives.install(registry, Map.of(PrimitiveId.REASON, ATTENTION)));
        assertTrue(registry.getRegisteredPrimitives().isEmpty());
    }

    @Test
    void installRegistersNothingWhenAPrimitiveIsAlreadyBound() {
        registry.register(PrimitiveId.JUDGE, input -> "existing");

        final var error = assertThrows(KernelException.class,
                                       () -> primitives.install(registry, Map.of(PrimitiveId.ATTENTION, ATTENTION)));

        assertAll(
                () -> assertEquals(ErrorType.DUPLICATE_REGISTRATION, error.getErrorType()),
                () -> assertEquals(PrimitiveId.JUDGE, error.getPrimitiveId()),
                () -> assertEquals(List.of(PrimitiveId.JUDGE), registry.getRegisteredPrimitives()),
                () -> assertEquals("existing", registry.call(PrimitiveId.JUDGE, "x"))
                 );
    }

    @Test
    void memoryPrimitivesAcceptRequestsMapsAndJson() {
        primitives.install(registry, Map.of(PrimitiveId.ATTENTION, ATTENTION));

        final var stored = registry.call(PrimitiveId.REMEMBER,
                                         RememberRequest.builder()
                                                 .key("greeting")
                                                 .value("hello world")
                                                 .importance(0.9)
                                                 .build(),
                                         MemoryEntry.class);
        final var fromMap = registry.call(PrimitiveId.REMEMBER,
                                          Map.of("key", "farewell", "value", "goodbye", "scope", "ltm"),
                                          MemoryEntry.class);
        @SuppressWarnings("unchecked") final var retrieved = (List<MemoryEntry>) registry.call(
                PrimitiveId.RETRIEVE, "{\"query\": \"hello\", \"target\": \"STM\"}");
        @SuppressWarnings("unchecked") final var hits = (List<IndexHit>) registry.call(
                PrimitiveId.INDEX, IndexRequest.builder().query("hello").build());
        final var reinforced = registry.call(PrimitiveId.EVOLVE_MEMORY,
                                             ReinforceRequest.builder()
                                                     .memoryIds(List.of(stored.getId(), "mem_missing"))
                                                     .reward(1.0)
                                                     .build(),
                                             Integer.class);

        assertAll(
                () -> assertEquals(MemoryScope.LTM, fromMap.getScope()),
                () -> assertEquals("goodbye", memory.getByKey("farewell", MemoryScope.LTM).orElseThrow().getValue()),
                () -> assertEquals(List.of("greeting"), retrieved.stream().map(MemoryEntry::getKey).toList()),
                () -> assertEquals(stored.getId(), hits.get(0).getEntryId()),
                () -> assertEquals(1, reinforced),
                () -> assertEquals(Optional.empty(), registry.call(PrimitiveId.COMPRESS, null))
                 );
    }

    @Test
    void reasoningPrimitivesDispatchToTheEngine() {
        primitives.install(registry, Map.of(PrimitiveId.ATTENTION, ATTENTION));

        final var chain = registry.call(PrimitiveId.REASON,
                                        ReasonRequest.builder()
                                                .problem("How do we shard the ledger?")
                                                .strategy(ReasoningStrategy.LEAST_TO_MOST)
                                                .build(),
                                        ReasoningChain.class);
        final var search = registry.call(PrimitiveId.SEARCH,
                                         SearchRequest.builder()
                                                 .problem("shard the ledger")
                                                 .algorithm(SearchAlgorithm.BEAM)
                                                 .maxNodes(30)
                                                 .build(),
                                         SearchResult.class);
        final var simulation = registry.call(PrimitiveId.SIMULATE,
                                             SimulateRequest.builder()
                                                     .initialState(Map.of("shards", 1))
                                                     .transition(state -> state.getStep() < 3
                                                                          ? List.of(SimulationState.builder()
                                                                                            .reward(1.0)
                                                                                            .build())
                                                                          : List.of())
                                                     .numTrajectories(4)
                                                     .build(),
                                             SimulationResult.class);
        final var verdict = registry.call(PrimitiveId.JUDGE,
                                          Map.of("output", "Sharding by account works because writes are local",
                                                 "categories", List.of("accuracy", "feasibility")),
                                          Verdict.class);
        final var rounds = (List<?>) registry.call(PrimitiveId.SELF_EVOLVE,
                                                   SelfEvolveRequest.builder()
                                                           .maxRounds(2)
                                                           .schedule(DifficultySchedule.LINEAR)
                                                           .build());

        assertAll(
                () -> assertEquals(ReasoningStrategy.LEAST_TO_MOST, chain.getStrategy()),
                () -> assertEquals("shard the ledger", search.getBestPath().get(0)),
                () -> assertTrue(search.getNodesExplored() <= 30),
                () -> assertEquals(3.0, simulation.getExpectedReward(), 1e-9),
                () -> assertEquals(4, simulation.getTrajectories().size()),
                () -> assertEquals(2, verdict.getCategoryScores().size()),
                () -> assertEquals(2, rounds.size())
                 );
    }

    @Test
    void malformedInputSurfacesAsHandlerError() {
        primitives.install(registry, Map.of(PrimitiveId.ATTENTION, ATTENTION));

        final var wrongType = assertThrows(KernelException.class, () -> registry.call(PrimitiveId.REASON, 42));
        final var noTransition = assertThrows(KernelException.class,
                                              () -> registry.call(PrimitiveId.SIMULATE,
                                                                  SimulateRequest.builder().build()));

        assertAll(
                () -> assertEquals(ErrorType.HANDLER_ERROR, wrongType.getErrorType()),
                () -> assertEquals(PrimitiveId.REASON, wrongType.getPrimitiveId()),
                () -> assertTrue(wrongType.getMessage().contains("ReasonRequest")),
                () -> assertEquals(ErrorType.HANDLER_ERROR, noTransition.getErrorType()),
                () -> assertEquals(2, registry.getPrimitiveInfo(PrimitiveId.REASON).orElseThrow().getErrorCount()
                        + registry.getPrimitiveInfo(PrimitiveId.SIMULATE).orElseThrow().getErrorCount())
                 );
    }
}
