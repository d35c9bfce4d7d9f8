package com.shopstream.state;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Keyed join state: dimension tables holding the latest record per key, and fact buffers
 * holding facts per join key until they are matched, drained or evicted.
 *
 * <p>Tables are declared up front through {@link DimensionDescriptor}s and
 * {@link FactBufferDescriptor}s, which also tell a checkpoint how to read records back.</p>
 *
 * <p>The store has a single writer, the evaluation loop.  Snapshots are taken on that same
 * thread between batches, so no locking is involved.  Memory is bounded by the number of
 * active keys plus the facts inside the lateness window, never by stream volume.</p>
 */
@Slf4j
public class KeyedStateStore {

    private final Map<String, DimensionDescriptor<?>> dimensionDescriptors = new LinkedHashMap<>();
    private final Map<String, FactBufferDescriptor<?>> factDescriptors = new LinkedHashMap<>();

    private final Map<String, Map<String, Object>> dimensions = new HashMap<>();
    private final Map<String, Map<String, List<FactEvent>>> facts = new HashMap<>();

    private final int maxBufferedFacts;
    private int bufferedFacts;

    public KeyedStateStore(Collection<DimensionDescriptor<?>> dimensionTables,
                           Collection<FactBufferDescriptor<?>> factBuffers,
                           int maxBufferedFacts) {
        for (DimensionDescriptor<?> descriptor : dimensionTables) {
            dimensionDescriptors.put(descriptor.getName(), descriptor);
            dimensions.put(descriptor.getName(), new HashMap<>());
        }
        for (FactBufferDescriptor<?> descriptor : factBuffers) {
            factDescriptors.put(descriptor.getName(), descriptor);
            facts.put(descriptor.getName(), new HashMap<>());
        }
        this.maxBufferedFacts = maxBufferedFacts;
    }

    // ── Dimensions ───────────────────────────────────────────────────────

    /**
     * Stores {@code record} as the latest value for {@code key}, replacing any previous one.
     */
    public <V> void upsertDimension(DimensionDescriptor<V> table, String key, V record) {
        dimensionTable(table).put(key, record);
    }

    public <V> Optional<V> getDimension(DimensionDescriptor<V> table, String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.getType().cast(dimensionTable(table).get(key)));
    }

    public int dimensionSize(DimensionDescriptor<?> table) {
        return dimensionTable(table).size();
    }

    // ── Facts ────────────────────────────────────────────────────────────

    /**
     * Appends a fact to the buffer of {@code key}.
     *
     * @throws StateStoreCapacityExceededException if the store is full
     */
    public <F extends FactEvent> void bufferFact(FactBufferDescriptor<F> buffer, String key, F event) {
        if (buffer.isCapacityBound() && bufferedFacts >= maxBufferedFacts) {
            throw new StateStoreCapacityExceededException(buffer.getName(), maxBufferedFacts);
        }
        factBuffer(buffer).computeIfAbsent(key, k -> new ArrayList<>()).add(event);
        if (buffer.isCapacityBound()) {
            bufferedFacts++;
        }
    }

    /**
     * Returns the facts buffered for {@code key}, oldest arrival first.
     */
    public <F extends FactEvent> List<F> getFacts(FactBufferDescriptor<F> buffer, String key) {
        List<FactEvent> list = factBuffer(buffer).get(key);
        if (list == null) {
            return Collections.emptyList();
        }
        List<F> result = new ArrayList<>(list.size());
        for (FactEvent fact : list) {
            result.add(buffer.getType().cast(fact));
        }
        return result;
    }

    /**
     * Removes and returns every fact buffered for {@code key}.
     */
    public <F extends FactEvent> List<F> drainMatchingFacts(FactBufferDescriptor<F> buffer, String key) {
        return drainMatchingFacts(buffer, key, f -> true);
    }

    /**
     * Removes and returns the facts buffered for {@code key} that satisfy {@code filter},
     * oldest arrival first.
     */
    public <F extends FactEvent> List<F> drainMatchingFacts(FactBufferDescriptor<F> buffer, String key,
                                                          Predicate<? super F> filter) {
        Map<String, List<FactEvent>> table = factBuffer(buffer);
        List<FactEvent> list = table.get(key);
        if (list == null) {
            return Collections.emptyList();
        }
        List<F> drained = new ArrayList<>();
        Iterator<FactEvent> it = list.iterator();
        while (it.hasNext()) {
            F fact = buffer.getType().cast(it.next());
            if (filter.test(fact)) {
                drained.add(fact);
                it.remove();
            }
        }
        if (list.isEmpty()) {
            table.remove(key);
        }
        if (buffer.isCapacityBound()) {
            bufferedFacts -= drained.size();
        }
        return drained;
    }

    /**
     * Visits every buffered fact of {@code buffer} (key, fact), in no particular key order.
     */
    public <F extends FactEvent> void forEachFact(FactBufferDescriptor<F> buffer, BiConsumer<String, F> visitor) {
        for (Map.Entry<String, List<FactEvent>> entry : factBuffer(buffer).entrySet()) {
            for (FactEvent fact : entry.getValue()) {
                visitor.accept(entry.getKey(), buffer.getType().cast(fact));
            }
        }
    }

    public int factCount(FactBufferDescriptor<?> buffer) {
        int count = 0;
        for (List<FactEvent> list : factBuffer(buffer).values()) {
            count += list.size();
        }
        return count;
    }

    /**
     * Number of facts counted against {@link #getMaxBufferedFacts()}; buffers declared with
     * {@link FactBufferDescriptor.Retention#EXPIRE_BEHIND} are not included.
     */
    public int getBufferedFactCount() {
        return bufferedFacts;
    }

    public int getMaxBufferedFacts() {
        return maxBufferedFacts;
    }

    /**
     * Evicts, from every evictable buffer, the facts that can no longer be the newest
     * eligible match: per key, of the facts behind {@code watermark + horizon} only the
     * newest (by event time, then by arrival) is kept.  Expiring buffers drop every fact
     * behind their horizon.
     *
     * @return number of facts evicted
     */
    public int evictOlderThan(long watermark) {
        if (watermark == Long.MIN_VALUE) {
            return 0;
        }
        int evicted = 0;
        for (FactBufferDescriptor<?> descriptor : factDescriptors.values()) {
            if (!descriptor.isEvictable()) {
                continue;
            }
            long cutoff = descriptor.cutoff(watermark);
            Map<String, List<FactEvent>> table = facts.get(descriptor.getName());
            if (descriptor.getRetention() == FactBufferDescriptor.Retention.EXPIRE_BEHIND) {
                evicted += expireBehind(table, cutoff);
                continue;
            }
            int superseded = 0;
            for (List<FactEvent> list : table.values()) {
                superseded += evictBehind(list, cutoff);
            }
            bufferedFacts -= superseded;
            evicted += superseded;
        }
        if (evicted > 0) {
            log.debug("Evicted {} buffered facts at watermark={}", evicted, watermark);
        }
        return evicted;
    }

    private static int expireBehind(Map<String, List<FactEvent>> table, long cutoff) {
        int removed = 0;
        Iterator<List<FactEvent>> lists = table.values().iterator();
        while (lists.hasNext()) {
            List<FactEvent> list = lists.next();
            int before = list.size();
            list.removeIf(fact -> fact.getEventTime() < cutoff);
            removed += before - list.size();
            if (list.isEmpty()) {
                lists.remove();
            }
        }
        return removed;
    }

    private static int evictBehind(List<FactEvent> list, long cutoff) {
        FactEvent newestBehind = null;
        int behind = 0;
        for (FactEvent fact : list) {
            if (fact.getEventTime() < cutoff) {
                behind++;
                if (newestBehind == null || fact.getEventTime() >= newestBehind.getEventTime()) {
                    newestBehind = fact;
                }
            }
        }
        if (behind <= 1) {
            return 0;
        }
        int removed = 0;
        Iterator<FactEvent> it = list.iterator();
        while (it.hasNext()) {
            FactEvent fact = it.next();
            if (fact.getEventTime() < cutoff && fact != newestBehind) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    // ── Snapshot / restore ───────────────────────────────────────────────

    /**
     * Copies every table.  Must be called from the writer thread.
     */
    public StateSnapshot snapshot() {
        Map<String, Map<String, Object>> dimensionCopy = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> table : dimensions.entrySet()) {
            dimensionCopy.put(table.getKey(), new HashMap<>(table.getValue()));
        }
        Map<String, Map<String, List<Object>>> factCopy = new HashMap<>();
        for (Map.Entry<String, Map<String, List<FactEvent>>> table : facts.entrySet()) {
            Map<String, List<Object>> keys = new HashMap<>();
            for (Map.Entry<String, List<FactEvent>> entry : table.getValue().entrySet()) {
                keys.put(entry.getKey(), new ArrayList<>(entry.getValue()));
            }
            factCopy.put(table.getKey(), keys);
        }
        return new StateSnapshot(dimensionCopy, factCopy);
    }

    /**
     * Replaces the whole content of the store with {@code snapshot}.  Tables that are not
     * declared on this store are skipped.
     */
    public void restore(StateSnapshot snapshot) {
        dimensions.values().forEach(Map::clear);
        facts.values().forEach(Map::clear);
        bufferedFacts = 0;

        for (Map.Entry<String, Map<String, Object>> table : snapshot.getDimensions().entrySet()) {
            Map<String, Object> target = dimensions.get(table.getKey());
            if (target == null) {
                log.warn("Ignoring undeclared dimension table '{}' in snapshot", table.getKey());
                continue;
            }
            target.putAll(table.getValue());
        }
        for (Map.Entry<String, Map<String, List<Object>>> table : snapshot.getFacts().entrySet()) {
            Map<String, List<FactEvent>> target = facts.get(table.getKey());
            if (target == null) {
                log.warn("Ignoring undeclared fact buffer '{}' in snapshot", table.getKey());
                continue;
            }
            boolean capacityBound = factDescriptors.get(table.getKey()).isCapacityBound();
            for (Map.Entry<String, List<Object>> entry : table.getValue().entrySet()) {
                List<FactEvent> list = new ArrayList<>(entry.getValue().size());
                for (Object fact : entry.getValue()) {
                    list.add((FactEvent) fact);
                }
                if (!list.isEmpty()) {
                    target.put(entry.getKey(), list);
                    if (capacityBound) {
                        bufferedFacts += list.size();
                    }
                }
            }
        }
        log.info("Restored keyed state: {} dimension records, {} buffered facts",
                dimensions.values().stream().mapToInt(Map::size).sum(), bufferedFacts);
    }

    public Collection<DimensionDescriptor<?>> getDimensionDescriptors() {
        return Collections.unmodifiableCollection(dimensionDescriptors.values());
    }

    public Collection<FactBufferDescriptor<?>> getFactDescriptors() {
        return Collections.unmodifiableCollection(factDescriptors.values());
    }

    private Map<String, Object> dimensionTable(DimensionDescriptor<?> table) {
        Map<String, Object> map = dimensions.get(table.getName());
        if (map == null) {
            throw new IllegalArgumentException("Undeclared dimension table: " + table.getName());
        }
        return map;
    }

    private Map<String, List<FactEvent>> factBuffer(FactBufferDescriptor<?> buffer) {
        Map<String, List<FactEvent>> map = facts.get(buffer.getName());
        if (map == null) {
            throw new IllegalArgumentException("Undeclared fact buffer: " + buffer.getName());
        }
        return map;
    }
}
