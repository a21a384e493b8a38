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

import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import lombok.experimental.UtilityClass;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.phonepe.cortexkernel.core.catalog.KernelLayer.*;
import static com.phonepe.cortexkernel.core.catalog.PrimitiveId.*;

/**
 * Immutable table of all kernel primitives, their layers and their static dependencies.
 * <p>
 * Layer 0: attention<br>
 * Layer 1: scale, reason, extend<br>
 * Layer 2: retrieve, remember, compress, index, evolve_memory<br>
 * Layer 3: search, simulate<br>
 * Layer 4: adapt, instruct, distill, align, cascade<br>
 * Layer 5: route, self_evolve, judge
 */
@UtilityClass
public class PrimitiveCatalog {

    private static final Map<PrimitiveId, PrimitiveMetadata> METADATA = buildCatalog();

    public static PrimitiveMetadata metadata(final PrimitiveId id) {
        return METADATA.get(id);
    }

    public static KernelLayer layer(final PrimitiveId id) {
        return METADATA.get(id).getLayer();
    }

    public static Set<PrimitiveId> dependencies(final PrimitiveId id) {
        return METADATA.get(id).getDependencies();
    }

    public static List<PrimitiveId> allPrimitiveIds() {
        return List.copyOf(METADATA.keySet());
    }

    public static List<PrimitiveMetadata> allMetadata() {
        return List.copyOf(METADATA.values());
    }

    private static Map<PrimitiveId, PrimitiveMetadata> buildCatalog() {
        final var catalog = new EnumMap<PrimitiveId, PrimitiveMetadata>(PrimitiveId.class);
        add(catalog, ATTENTION, "Attention", HARDWARE_ABSTRACTION,
            "Foundational compute primitive (Transformer)",
            "Vaswani et al. 2017, DroPE 2025");
        add(catalog, SCALE, "Scale", CORE_EXECUTION,
            "Test-time compute scaling (RSA, STOP)",
            "arXiv:2509.26626, Microsoft STOP",
            ATTENTION);
        add(catalog, REASON, "Reason", CORE_EXECUTION,
            "Chain-of-thought reasoning (CoT, Reflexion)",
            "Wei et al. 2022, Reflexion 2023",
            ATTENTION);
        add(catalog, EXTEND, "Extend", CORE_EXECUTION,
            "Context window extension (RoPE, DroPE, YaRN)",
            "DroPE 2025, YaRN 2024",
            ATTENTION);
        add(catalog, RETRIEVE, "Retrieve", MEMORY_SUBSYSTEM,
            "Retrieval-augmented generation (RAG, UniversalRAG)",
            "Lewis et al. 2020, UniversalRAG 2025",
            ATTENTION, REASON);
        add(catalog, REMEMBER, "Remember", MEMORY_SUBSYSTEM,
            "Memory storage with Q-value management (MemRL)",
            "MemRL 2025",
            ATTENTION);
        add(catalog, COMPRESS, "Compress", MEMORY_SUBSYSTEM,
            "Context compression by slime mold consolidation (Focus)",
            "Focus 2025",
            ATTENTION, REASON);
        add(catalog, INDEX, "Index", MEMORY_SUBSYSTEM,
            "Memory indexing for efficient retrieval (SimpleMem)",
            "SimpleMem 2025",
            ATTENTION);
        add(catalog, EVOLVE_MEMORY, "Evolve Memory", MEMORY_SUBSYSTEM,
            "Memory evolution and self-curriculum (Dr. Zero)",
            "Dr. Zero 2025",
            ATTENTION, REASON);
        add(catalog, SEARCH, "Search", REASONING_AND_SEARCH,
            "Tree/graph search over reasoning space (ToT, MCTS)",
            "Yao et al. 2023",
            ATTENTION, REASON, RETRIEVE);
        add(catalog, SIMULATE, "Simulate", REASONING_AND_SEARCH,
            "World model simulation using Monte Carlo rollouts",
            "AlphaGo, MuZero",
            ATTENTION, REASON);
        add(catalog, ADAPT, "Adapt", MODEL_LIFECYCLE,
            "LoRA / adapter management (LoRA, QLoRA)",
            "Hu et al. 2021",
            ATTENTION);
        add(catalog, INSTRUCT, "Instruct", MODEL_LIFECYCLE,
            "Instruction tuning / alignment (RLHF, DPO)",
            "InstructGPT 2022",
            ATTENTION, REASON);
        add(catalog, DISTILL, "Distill", MODEL_LIFECYCLE,
            "Knowledge distillation",
            "Hinton et al. 2015",
            ATTENTION, REASON);
        add(catalog, ALIGN, "Align", MODEL_LIFECYCLE,
            "Value alignment (RLHF, Constitutional AI, DPO)",
            "Anthropic 2022",
            ATTENTION, REASON);
        add(catalog, CASCADE, "Cascade", MODEL_LIFECYCLE,
            "Confidence-gated model cascading",
            "CortexOS CRSAE",
            ATTENTION, REASON);
        add(catalog, ROUTE, "Route", COORDINATION_AND_ROUTING,
            "Modality-aware routing (UniversalRAG)",
            "UniversalRAG 2025",
            ATTENTION, REASON, CASCADE);
        add(catalog, SELF_EVOLVE, "Self Evolve", COORDINATION_AND_ROUTING,
            "Meta-RL self-evolution (Goedel Agent, STOP)",
            "Goedel Agent 2024, STOP 2024",
            ATTENTION, REASON, SEARCH);
        add(catalog, JUDGE, "Judge", COORDINATION_AND_ROUTING,
            "Multi-judge evaluation panel (LLM-as-Judge)",
            "Zheng et al. 2023",
            ATTENTION, REASON);
        return Maps.immutableEnumMap(catalog);
    }

    private static void add(
            Map<PrimitiveId, PrimitiveMetadata> catalog,
            PrimitiveId id,
            String name,
            KernelLayer layer,
            String description,
            String researchOrigin,
            PrimitiveId... dependencies) {
        final Set<PrimitiveId> deps = Sets.immutableEnumSet(List.of(dependencies));
        for (final var dependency : deps) {
            final var dependencyMetadata = catalog.get(dependency);
            if (dependencyMetadata == null || !dependencyMetadata.getLayer().isBelow(layer)) {
                throw new IllegalStateException("Primitive %s can only depend on primitives in lower layers. Found: %s"
                                                        .formatted(id, dependency));
            }
        }
        catalog.put(id, new PrimitiveMetadata(id, name, layer, description, deps, researchOrigin));
    }
}
