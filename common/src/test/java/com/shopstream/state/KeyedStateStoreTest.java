package com.shopstream.state;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyedStateStoreTest {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class Item {
        String id;
        String label;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class Tick implements FactEvent {
        String id;
        long eventTime;
    }

    private static final DimensionDescriptor<Item> ITEMS = new DimensionDescriptor<>("items", Item.class);
    private static final FactBufferDescriptor<Tick> TICKS =
            FactBufferDescriptor.keepLatestBehind("ticks", Tick.class, 0L);
    private static final FactBufferDescriptor<Tick> WAITING =
            FactBufferDescriptor.drainedByOwner("waiting", Tick.class);
    private static final FactBufferDescriptor<Tick> SEEN =
            FactBufferDescriptor.expireBehind("seen", Tick.class, -100L);

    private KeyedStateStore store;

    @BeforeEach
    void setUp() {
        store = new KeyedStateStore(List.of(ITEMS), List.of(TICKS, WAITING, SEEN), 10);
    }

    @Test
    void dimensionKeepsLatestWrite() {
        store.upsertDimension(ITEMS, "a", new Item("a", "first"));
        store.upsertDimension(ITEMS, "a", new Item("a", "second"));

        assertThat(store.getDimension(ITEMS, "a")).contains(new Item("a", "second"));
        assertThat(store.getDimension(ITEMS, "b")).isEmpty();
        assertThat(store.getDimension(ITEMS, null)).isEmpty();
        assertThat(store.dimensionSize(ITEMS)).isEqualTo(1);
    }

    @Test
    void drainRemovesOnlyMatchingFacts() {
        store.bufferFact(WAITING, "k", new Tick("1", 10));
        store.bufferFact(WAITING, "k", new Tick("2", 20));
        store.bufferFact(WAITING, "k", new Tick("3", 30));

        List<Tick> drained = store.drainMatchingFacts(WAITING, "k", t -> t.getEventTime() >= 20);

        assertThat(drained).extracting(Tick::getId).containsExactly("2", "3");
        assertThat(store.getFacts(WAITING, "k")).extracting(Tick::getId).containsExactly("1");
        assertThat(store.getBufferedFactCount()).isEqualTo(1);

        assertThat(store.drainMatchingFacts(WAITING, "k")).hasSize(1);
        assertThat(store.getFacts(WAITING, "k")).isEmpty();
        assertThat(store.getBufferedFactCount()).isZero();
    }

    @Test
    void evictionKeepsNewestFactBehindHorizon() {
        store.bufferFact(TICKS, "k", new Tick("old", 10));
        store.bufferFact(TICKS, "k", new Tick("newer", 20));
        store.bufferFact(TICKS, "k", new Tick("ahead", 100));
        store.bufferFact(WAITING, "k", new Tick("pending", 5));

        int evicted = store.evictOlderThan(50);

        assertThat(evicted).isEqualTo(1);
        assertThat(store.getFacts(TICKS, "k")).extracting(Tick::getId).containsExactly("newer", "ahead");
        assertThat(store.getFacts(WAITING, "k")).hasSize(1);
        assertThat(store.getBufferedFactCount()).isEqualTo(3);
    }

    @Test
    void evictionBreaksEventTimeTiesByLaterArrival() {
        store.bufferFact(TICKS, "k", new Tick("first", 10));
        store.bufferFact(TICKS, "k", new Tick("second", 10));

        store.evictOlderThan(50);

        assertThat(store.getFacts(TICKS, "k")).extracting(Tick::getId).containsExactly("second");
    }

    @Test
    void nothingIsEvictedBeforeTheFirstWatermark() {
        store.bufferFact(TICKS, "k", new Tick("a", 1));
        store.bufferFact(TICKS, "k", new Tick("b", 2));

        assertThat(store.evictOlderThan(Long.MIN_VALUE)).isZero();
    }

    @Test
    void capacityIsEnforcedAcrossBuffers() {
        KeyedStateStore small = new KeyedStateStore(List.of(ITEMS), List.of(TICKS, WAITING), 2);
        small.bufferFact(TICKS, "a", new Tick("1", 1));
        small.bufferFact(WAITING, "b", new Tick("2", 2));

        assertThatThrownBy(() -> small.bufferFact(TICKS, "c", new Tick("3", 3)))
                .isInstanceOf(StateStoreCapacityExceededException.class)
                .hasMessageContaining("ticks");

        small.drainMatchingFacts(WAITING, "b");
        small.bufferFact(TICKS, "c", new Tick("3", 3));
        assertThat(small.getBufferedFactCount()).isEqualTo(2);
    }

    @Test
    void expiringBufferDropsEveryFactBehindItsHorizon() {
        store.bufferFact(SEEN, "a", new Tick("1", 10));
        store.bufferFact(SEEN, "a", new Tick("2", 20));
        store.bufferFact(SEEN, "b", new Tick("3", 50));

        assertThat(store.evictOlderThan(121)).isEqualTo(2);

        assertThat(store.getFacts(SEEN, "a")).isEmpty();
        assertThat(store.getFacts(SEEN, "b")).containsExactly(new Tick("3", 50));
        store.forEachFact(SEEN, (key, tick) -> assertThat(key).isEqualTo("b"));
    }

    @Test
    void expiringBufferIsNotCountedAgainstCapacity() {
        for (int i = 0; i < 10; i++) {
            store.bufferFact(WAITING, "k", new Tick(String.valueOf(i), i));
        }
        store.bufferFact(SEEN, "k", new Tick("marker", 5));
        assertThat(store.getBufferedFactCount()).isEqualTo(10);

        KeyedStateStore restored = new KeyedStateStore(List.of(ITEMS), List.of(TICKS, WAITING, SEEN), 10);
        restored.restore(store.snapshot());
        assertThat(restored.getBufferedFactCount()).isEqualTo(10);
        assertThat(restored.factCount(SEEN)).isEqualTo(1);

        restored.evictOlderThan(1_000);
        assertThat(restored.factCount(SEEN)).isZero();
        assertThat(restored.getBufferedFactCount()).isEqualTo(10);
    }

    @Test
    void snapshotIsIsolatedAndRestorable() {
        store.upsertDimension(ITEMS, "a", new Item("a", "x"));
        store.bufferFact(WAITING, "k", new Tick("1", 1));

        StateSnapshot snapshot = store.snapshot();
        store.bufferFact(WAITING, "k", new Tick("2", 2));
        store.upsertDimension(ITEMS, "b", new Item("b", "y"));

        KeyedStateStore restored = new KeyedStateStore(List.of(ITEMS), List.of(TICKS, WAITING, SEEN), 10);
        restored.restore(snapshot);

        assertThat(restored.getDimension(ITEMS, "a")).contains(new Item("a", "x"));
        assertThat(restored.getDimension(ITEMS, "b")).isEmpty();
        assertThat(restored.getFacts(WAITING, "k")).extracting(Tick::getId).containsExactly("1");
        assertThat(restored.getBufferedFactCount()).isEqualTo(1);
    }

    @Test
    void undeclaredTablesAreRejected() {
        DimensionDescriptor<Item> other = new DimensionDescriptor<>("other", Item.class);

        assertThatThrownBy(() -> store.upsertDimension(other, "a", new Item()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
