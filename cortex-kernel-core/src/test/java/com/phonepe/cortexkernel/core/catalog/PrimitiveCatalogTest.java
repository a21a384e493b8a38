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

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PrimitiveCatalogTest {

    @Test
    void everyDependencyLivesInALowerLayer() {
        final var all = PrimitiveCatalog.allMetadata();
        assertEquals(19, all.size());
        for (final var metadata : all) {
            for (final var dependency : metadata.getDependencies()) {
                assertTrue(PrimitiveCatalog.layer(dependency).isBelow(metadata.getLayer()),
                           () -> metadata.getId() + " depends on " + dependency + " which is not in a lower layer");
            }
        }
    }

    @Test
    void layersAndDependenciesMatchTheTable() {
        assertAll(
                () -> assertEquals(KernelLayer.HARDWARE_ABSTRACTION, PrimitiveCatalog.layer(PrimitiveId.ATTENTION)),
                () -> assertTrue(PrimitiveCatalog.dependencies(PrimitiveId.ATTENTION).isEmpty()),
                () -> assertEquals(KernelLayer.MEMORY_SUBSYSTEM, PrimitiveCatalog.layer(PrimitiveId.EVOLVE_MEMORY)),
                () -> assertEquals(KernelLayer.REASONING_AND_SEARCH, PrimitiveCatalog.layer(PrimitiveId.SEARCH)),
                () -> assertEquals(Set.of(PrimitiveId.ATTENTION, PrimitiveId.REASON, PrimitiveId.RETRIEVE),
                                   PrimitiveCatalog.dependencies(PrimitiveId.SEARCH)),
                () -> assertEquals(Set.of(PrimitiveId.ATTENTION, PrimitiveId.REASON, PrimitiveId.CASCADE),
                                   PrimitiveCatalog.dependencies(PrimitiveId.ROUTE)),
                () -> assertEquals(KernelLayer.COORDINATION_AND_ROUTING, PrimitiveCatalog.layer(PrimitiveId.JUDGE)),
                () -> assertEquals("Self Evolve", PrimitiveCatalog.metadata(PrimitiveId.SELF_EVOLVE).getName())
                 );
    }

    @Test
    void resolvesWireIdentifiers() {
        assertAll(
                () -> assertEquals(PrimitiveId.EVOLVE_MEMORY, PrimitiveId.fromId("evolve_memory")),
                () -> assertEquals("self_evolve", PrimitiveId.SELF_EVOLVE.toString()),
                () -> assertThrows(IllegalArgumentException.class, () -> PrimitiveId.fromId("teleport")),
                () -> assertEquals(KernelLayer.MODEL_LIFECYCLE, KernelLayer.ofLevel(4)),
                () -> assertThrows(IllegalArgumentException.class, () -> KernelLayer.ofLevel(6))
                 );
    }
}
