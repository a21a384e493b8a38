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

package com.phonepe.cortexkernel.memory;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;
import com.phonepe.cortexkernel.core.events.EventType;
import com.phonepe.cortexkernel.core.events.KernelEventBus;
import com.phonepe.cortexkernel.core.utils.BoundedMap;
import com.phonepe.cortexkernel.core.utils.JsonUtils;
import com.phonepe.cortexkernel.core.utils.KernelUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Short and long term memory with q-value driven eviction, promotion and compression.
 * <p>
 * Entries are immutable, every mutation swaps in a new {@link MemoryEntry}. All state is guarded by the unit's
 * monitor and no method blocks.
 */
@Slf4j
public class ContextMemoryUnit {
    public static final String SOURCE = "context";
    public static final int DEFAULT_INDEX_RESULTS = 5;

    private static final double COMPRESSION_FRACTION = 0.3;
    private static final int SUMMARY_VALUE_LENGTH = 100;
    private static final int MIN_KEYWORD_LENGTH = 2;
    private static final int MAX_KEYWORDS = 20;
    private static final double RECENCY_WINDOW_MS = Duration.ofHours(24).toMillis();

    /**
     * Lowest q-value first, oldest first among equals
     */
    private static final Comparator<MemoryEntry> EVICTION_ORDER = Comparator
            .comparingDouble(MemoryEntry::getQValue)
            .thenComparingLong(MemoryEntry::getSequence);

    @Getter
    private final ContextMemoryConfig config;
    private final KernelEventBus eventBus;
    private final Map<MemoryScope, Map<String, MemoryEntry>> stores = new EnumMap<>(MemoryScope.class);
    private final Map<MemoryScope, Map<String, String>> keyIndex = new EnumMap<>(MemoryScope.class);
    private final SetMultimap<String, String> tagIndex = HashMultimap.create();
    private final Map<String, Set<String>> semanticIndex = new HashMap<>();
    private final BoundedMap<String, KnowledgeBlock> knowledgeBlocks;

    private boolean running;
    private long sequence;
    private long totalStored;
    private long totalRetrieved;
    private long totalEvicted;
    private long totalCompressed;

    private record ScoredEntry(MemoryEntry entry, double score) {
    }

    public ContextMemoryUnit() {
        this(ContextMemoryConfig.defaults());
    }

    public ContextMemoryUnit(@NonNull ContextMemoryConfig config) {
        this(config, new KernelEventBus(SOURCE));
    }

    public ContextMemoryUnit(@NonNull ContextMemoryConfig config, @NonNull KernelEventBus eventBus) {
        this.config = config;
        this.eventBus = eventBus;
        this.knowledgeBlocks = new BoundedMap<>(config.getKnowledgeBlockCapacity());
        for (final var scope : MemoryScope.values()) {
            stores.put(scope, new LinkedHashMap<>());
            keyIndex.put(scope, new HashMap<>());
        }
    }

    public KernelEventBus events() {
        return eventBus;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        log.info("Context memory unit started. STM capacity: {}, LTM capacity: {}",
                 config.getStmCapacity(), config.getLtmCapacity());
        eventBus.emit(EventType.STARTED);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Context memory unit stopped");
        eventBus.emit(EventType.STOPPED);
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public MemoryEntry store(String key, Object value) {
        return store(key, value, StoreOptions.defaults());
    }

    /**
     * Store a value under a key. An existing entry with the same key in the target scope is updated in place,
     * otherwise a new entry is created, evicting the least useful entry of the scope if it is full.
     */
    public synchronized MemoryEntry store(@NonNull String key, Object value, @NonNull StoreOptions options) {
        final var scope = options.getScope();
        final var now = LocalDateTime.now();
        final var existingId = keyIndex.get(scope).get(key);
        if (existingId != null) {
            final var existing = stores.get(scope).get(existingId);
            var updated = existing.withValue(value)
                    .withAccessCount(existing.getAccessCount() + 1)
                    .withLastAccessedAt(now);
            if (options.getTags() != null) {
                updated = updated.withTags(options.getTags());
            }
            if (options.getImportance() != null) {
                final var importance = KernelUtils.clamp01(options.getImportance());
                updated = updated.withImportance(importance).withQValue(importance);
            }
            remove(existing);
            insert(updated);
            log.debug("Updated memory {} with key {} in {}", updated.getId(), key, scope);
            eventBus.emit(EventType.STORED, details(updated, "updated", true));
            return updated;
        }
        if (stores.get(scope).size() >= capacity(scope)) {
            evictLowest(scope);
        }
        final var importance = KernelUtils.clamp01(Objects.requireNonNullElse(options.getImportance(),
                                                                              config.getDefaultImportance()));
        final var entry = MemoryEntry.builder()
                .id(KernelUtils.id("mem"))
                .key(key)
                .value(value)
                .scope(scope)
                .tags(Objects.requireNonNullElse(options.getTags(), List.of()))
                .importance(importance)
                .qValue(importance)
                .accessCount(0)
                .createdAt(now)
                .lastAccessedAt(now)
                .sequence(++sequence)
                .build();
        insert(entry);
        totalStored++;
        log.debug("Stored memory {} with key {} in {}", entry.getId(), key, scope);
        eventBus.emit(EventType.STORED, details(entry, "updated", false));
        return entry;
    }

    public List<MemoryEntry> retrieve(String query) {
        return retrieve(query, RetrieveOptions.defaults());
    }

    /**
     * Rank entries against a query. Score is a weighted mix of q-value (0.4), keyword relevance (0.3),
     * recency (0.2) and access frequency (0.1). Returned entries have their access metrics bumped.
     */
    public synchronized List<MemoryEntry> retrieve(@NonNull String query, @NonNull RetrieveOptions options) {
        final var queryWords = KernelUtils.words(query);
        final var now = LocalDateTime.now();
        final var tagged = options.getTags().isEmpty()
                           ? null
                           : options.getTags()
                                   .stream()
                                   .flatMap(tag -> tagIndex.get(tag).stream())
                                   .collect(Collectors.toSet());
        final var limit = options.getTopK() == null ? Long.MAX_VALUE : Math.max(0, options.getTopK());
        final var ranked = allEntries()
                .filter(entry -> options.getTarget().includes(entry.getScope()))
                .filter(entry -> tagged == null || tagged.contains(entry.getId()))
                .map(entry -> new ScoredEntry(entry, score(entry, queryWords, now)))
                .filter(scored -> scored.score() >= options.getMinScore())
                .sorted(Comparator.comparingDouble(ScoredEntry::score)
                                .reversed()
                                .thenComparingLong(scored -> scored.entry().getSequence()))
                .limit(limit)
                .toList();
        final var results = new ArrayList<MemoryEntry>(ranked.size());
        for (final var scored : ranked) {
            final var touched = scored.entry()
                    .withAccessCount(scored.entry().getAccessCount() + 1)
                    .withLastAccessedAt(now);
            stores.get(touched.getScope()).put(touched.getId(), touched);
            results.add(touched);
        }
        totalRetrieved += results.size();
        log.debug("Retrieved {} memories for query '{}'", results.size(), query);
        eventBus.emit(EventType.RETRIEVED, Map.of("query", query,
                                                  "resultCount", results.size(),
                                                  "target", options.getTarget()));
        return results;
    }

    public synchronized boolean update(@NonNull String memoryId, Object value) {
        final var existing = find(memoryId).orElse(null);
        if (existing == null) {
            return false;
        }
        final var updated = existing.withValue(value)
                .withAccessCount(existing.getAccessCount() + 1)
                .withLastAccessedAt(LocalDateTime.now());
        stores.get(updated.getScope()).put(memoryId, updated);
        index(updated);
        return true;
    }

    public synchronized boolean discard(@NonNull String memoryId) {
        final var existing = find(memoryId).orElse(null);
        if (existing == null) {
            return false;
        }
        remove(existing);
        log.debug("Discarded memory {}", memoryId);
        return true;
    }

    /**
     * Move the q-value of an entry towards the reward. Short term entries reaching the promotion threshold are
     * moved to long term memory.
     *
     * @return false if the entry is unknown
     */
    public synchronized boolean updateQValue(@NonNull String memoryId, double reward) {
        final var existing = find(memoryId).orElse(null);
        if (existing == null) {
            return false;
        }
        final var qValue = KernelUtils.clamp01(
                existing.getQValue() + config.getQLearningRate() * (reward - existing.getQValue()));
        final var updated = existing.withQValue(qValue);
        stores.get(updated.getScope()).put(memoryId, updated);
        if (updated.getScope() == MemoryScope.STM && qValue >= config.getPromotionQThreshold()) {
            log.debug("Memory {} crossed promotion threshold with q-value {}", memoryId, qValue);
            promote(memoryId);
        }
        return true;
    }

    /**
     * @return Number of entries that were found and updated
     */
    public synchronized int batchUpdateQValues(@NonNull Collection<String> memoryIds, double reward) {
        var updated = 0;
        for (final var memoryId : memoryIds) {
            if (updateQValue(memoryId, reward)) {
                updated++;
            }
        }
        return updated;
    }

    public synchronized boolean promote(@NonNull String memoryId) {
        return move(memoryId, MemoryScope.STM, MemoryScope.LTM, EventType.PROMOTED);
    }

    public synchronized boolean demote(@NonNull String memoryId) {
        return move(memoryId, MemoryScope.LTM, MemoryScope.STM, EventType.DEMOTED);
    }

    /**
     * Fold the least useful 30% of short term memory into a single knowledge block.
     *
     * @return Empty if fewer than two entries would be folded
     */
    public synchronized Optional<KnowledgeBlock> compress() {
        final var stm = stores.get(MemoryScope.STM);
        final var count = (int) Math.floor(stm.size() * COMPRESSION_FRACTION);
        if (count < 2) {
            return Optional.empty();
        }
        final var victims = stm.values()
                .stream()
                .sorted(EVICTION_ORDER)
                .limit(count)
                .toList();
        victims.forEach(this::remove);
        final var block = new KnowledgeBlock(
                KernelUtils.id("kb"),
                victims.stream().map(MemoryEntry::getId).toList(),
                victims.stream()
                        .map(entry -> "[" + entry.getKey() + "]: "
                                + JsonUtils.render(entry.getValue(), SUMMARY_VALUE_LENGTH))
                        .collect(Collectors.joining(" | ")),
                LocalDateTime.now(),
                count);
        knowledgeBlocks.put(block.getId(), block);
        totalCompressed += count;
        log.info("Compressed {} short term memories into knowledge block {}", count, block.getId());
        eventBus.emit(EventType.COMPRESSED, Map.of("blockId", block.getId(), "entriesCompressed", count));
        return Optional.of(block);
    }

    public List<IndexHit> searchIndex(String query) {
        return searchIndex(query, DEFAULT_INDEX_RESULTS);
    }

    /**
     * Keyword lookup over the semantic index. A query word matches a keyword if either contains the other.
     *
     * @return Empty if semantic indexing is disabled
     */
    public synchronized List<IndexHit> searchIndex(@NonNull String query, int topK) {
        if (!config.isEnableSemanticIndex()) {
            return List.of();
        }
        final var queryWords = KernelUtils.words(query);
        if (queryWords.isEmpty()) {
            return List.of();
        }
        return semanticIndex.entrySet()
                .stream()
                .map(indexed -> {
                    final var matches = queryWords.stream()
                            .filter(word -> indexed.getValue()
                                    .stream()
                                    .anyMatch(keyword -> keyword.contains(word) || word.contains(keyword)))
                            .count();
                    return new IndexHit(indexed.getKey(),
                                        Set.copyOf(indexed.getValue()),
                                        (double) matches / queryWords.size());
                })
                .filter(hit -> hit.getScore() > 0)
                .sorted(Comparator.comparingDouble(IndexHit::getScore).reversed())
                .limit(Math.max(0, topK))
                .toList();
    }

    /**
     * Look up by key, short term memory first
     */
    public synchronized Optional<MemoryEntry> getByKey(@NonNull String key) {
        return getByKey(key, MemoryScope.STM).or(() -> getByKey(key, MemoryScope.LTM));
    }

    public synchronized Optional<MemoryEntry> getByKey(@NonNull String key, @NonNull MemoryScope scope) {
        return Optional.ofNullable(keyIndex.get(scope).get(key))
                .map(id -> stores.get(scope).get(id));
    }

    public synchronized Optional<MemoryEntry> getById(@NonNull String memoryId) {
        return find(memoryId);
    }

    public synchronized List<KnowledgeBlock> getKnowledgeBlocks() {
        return List.copyOf(knowledgeBlocks.values());
    }

    public synchronized List<MemoryEntry> exportLTM() {
        return List.copyOf(stores.get(MemoryScope.LTM).values());
    }

    /**
     * Load entries into long term memory. Entries whose key already exists in long term memory or whose id is
     * already known are skipped. Loading stops once long term memory is full.
     *
     * @return Number of entries inserted
     */
    public synchronized int importLTM(@NonNull Collection<MemoryEntry> entries) {
        final var ltm = stores.get(MemoryScope.LTM);
        var imported = 0;
        for (final var entry : entries) {
            if (ltm.size() >= config.getLtmCapacity()) {
                log.warn("Long term memory full at capacity {}. Stopping import", config.getLtmCapacity());
                break;
            }
            if (keyIndex.get(MemoryScope.LTM).containsKey(entry.getKey()) || find(entry.getId()).isPresent()) {
                continue;
            }
            insert(entry.withScope(MemoryScope.LTM)
                           .withTags(Objects.requireNonNullElse(entry.getTags(), List.of()))
                           .withQValue(KernelUtils.clamp01(entry.getQValue()))
                           .withSequence(++sequence));
            imported++;
        }
        totalStored += imported;
        log.info("Imported {} of {} entries into long term memory", imported, entries.size());
        return imported;
    }

    public synchronized void clear(@NonNull MemoryTarget target) {
        for (final var scope : MemoryScope.values()) {
            if (target.includes(scope)) {
                List.copyOf(stores.get(scope).values()).forEach(this::remove);
            }
        }
        if (target == MemoryTarget.ALL) {
            knowledgeBlocks.clear();
        }
        log.info("Cleared {} memory", target);
    }

    public synchronized ContextMemoryStats getStats() {
        return ContextMemoryStats.builder()
                .running(running)
                .stmSize(stores.get(MemoryScope.STM).size())
                .ltmSize(stores.get(MemoryScope.LTM).size())
                .stmCapacity(config.getStmCapacity())
                .ltmCapacity(config.getLtmCapacity())
                .totalStored(totalStored)
                .totalRetrieved(totalRetrieved)
                .totalEvicted(totalEvicted)
                .totalCompressed(totalCompressed)
                .avgQValue(allEntries().mapToDouble(MemoryEntry::getQValue).average().orElse(0))
                .knowledgeBlocks(knowledgeBlocks.size())
                .indexSize(semanticIndex.size())
                .build();
    }

    private boolean move(String memoryId, MemoryScope from, MemoryScope to, EventType eventType) {
        final var entry = stores.get(from).get(memoryId);
        if (entry == null) {
            return false;
        }
        remove(entry);
        final var sameKeyId = keyIndex.get(to).get(entry.getKey());
        if (sameKeyId != null) {
            remove(stores.get(to).get(sameKeyId));
        }
        else if (stores.get(to).size() >= capacity(to)) {
            evictLowest(to);
        }
        final var moved = entry.withScope(to);
        insert(moved);
        log.debug("Moved memory {} from {} to {}", memoryId, from, to);
        eventBus.emit(eventType, details(moved, "from", from));
        return true;
    }

    private void evictLowest(MemoryScope scope) {
        stores.get(scope)
                .values()
                .stream()
                .min(EVICTION_ORDER)
                .ifPresent(victim -> {
                    remove(victim);
                    totalEvicted++;
                    log.warn("{} full at capacity {}. Evicted memory {} with key {} and q-value {}",
                             scope, capacity(scope), victim.getId(), victim.getKey(), victim.getQValue());
                    eventBus.emit(EventType.EVICTED, details(victim, "capacity", capacity(scope)));
                });
    }

    private void insert(MemoryEntry entry) {
        stores.get(entry.getScope()).put(entry.getId(), entry);
        keyIndex.get(entry.getScope()).put(entry.getKey(), entry.getId());
        entry.getTags().forEach(tag -> tagIndex.put(tag, entry.getId()));
        index(entry);
    }

    private void remove(MemoryEntry entry) {
        stores.get(entry.getScope()).remove(entry.getId());
        keyIndex.get(entry.getScope()).remove(entry.getKey(), entry.getId());
        entry.getTags().forEach(tag -> tagIndex.remove(tag, entry.getId()));
        semanticIndex.remove(entry.getId());
    }

    private void index(MemoryEntry entry) {
        if (!config.isEnableSemanticIndex()) {
            return;
        }
        final var text = Stream.concat(
                        Stream.of(entry.getKey(), entry.getValue() instanceof String str ? str : ""),
                        entry.getTags().stream())
                .collect(Collectors.joining(" "));
        semanticIndex.put(entry.getId(), new HashSet<>(KernelUtils.keywords(text, MIN_KEYWORD_LENGTH, MAX_KEYWORDS)));
    }

    private Optional<MemoryEntry> find(String memoryId) {
        return Optional.ofNullable(stores.get(MemoryScope.STM).get(memoryId))
                .or(() -> Optional.ofNullable(stores.get(MemoryScope.LTM).get(memoryId)));
    }

    private Stream<MemoryEntry> allEntries() {
        return stores.values().stream().flatMap(store -> store.values().stream());
    }

    private int capacity(MemoryScope scope) {
        return scope == MemoryScope.STM ? config.getStmCapacity() : config.getLtmCapacity();
    }

    private static double score(MemoryEntry entry, List<String> queryWords, LocalDateTime now) {
        final var text = (entry.getKey() + " "
                + JsonUtils.render(entry.getValue()) + " "
                + String.join(" ", entry.getTags())).toLowerCase();
        final var keywordScore = queryWords.isEmpty()
                                 ? 0
                                 : (double) queryWords.stream().filter(text::contains).count() / queryWords.size();
        final var ageMs = Math.max(0, Duration.between(entry.getLastAccessedAt(), now).toMillis());
        final var recencyScore = 1 / (1 + ageMs / RECENCY_WINDOW_MS);
        final var frequencyScore = Math.log(entry.getAccessCount() + 1) / Math.log(2) / 10;
        return 0.4 * KernelUtils.clamp01(entry.getQValue())
                + 0.3 * keywordScore
                + 0.2 * recencyScore
                + 0.1 * frequencyScore;
    }

    private static Map<String, Object> details(MemoryEntry entry, String extraName, Object extraValue) {
        return Map.of("memoryId", entry.getId(),
                      "key", entry.getKey(),
                      "scope", entry.getScope(),
                      "qValue", entry.getQValue(),
                      extraName, extraValue);
    }
}
