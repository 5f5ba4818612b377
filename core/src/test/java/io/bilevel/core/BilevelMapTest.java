package io.bilevel.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.bilevel.core.Grouping.*;
import static org.junit.jupiter.api.Assertions.*;

class BilevelMapTest {

    private static Map<Pair<Integer, Integer>, Integer> counts(BilevelMap<Integer, Integer, AtomicInteger> map) {
        Map<Pair<Integer, Integer>, Integer> out = new HashMap<>();
        for (var e : map) {
            out.put(new Pair<>(e.group(), e.key()), e.value().get());
        }
        return out;
    }

    @Test
    void add_or_get_accumulates_per_pair() {
        List<BilevelMap<Integer, Integer, AtomicInteger>> maps = List.of(
                BilevelMap.create(AtomicInteger::new),
                BilevelMap.withCapacity(new Capacity(4, 4, 8), AtomicInteger::new)
        );
        for (var map : maps) {
            for (int[] p : SCENARIO) {
                map.addOrGet(p[0], p[1]).incrementAndGet();
            }

            var counts = counts(map);
            assertEquals(DISTINCT, counts.size());
            assertEquals(DISTINCT, map.size());
            for (var e : counts.entrySet()) {
                var pair = e.getKey();
                boolean repeated = pair.equals(new Pair<>(3, 3)) || pair.equals(new Pair<>(5, 5));
                assertEquals(repeated ? 2 : 1, e.getValue().intValue(), "count for " + pair);
            }

            List<Integer> groups = new ArrayList<>();
            map.forEach(e -> groups.add(e.group()));
            assertContiguous(groups);
        }
    }

    @Test
    void first_access_returns_the_factory_default() {
        var map = BilevelMap.<String, String, List<String>>create(ArrayList::new);
        List<String> payload = map.addOrGet("g", "k");
        assertTrue(payload.isEmpty());

        payload.add("seen");
        assertSame(payload, map.addOrGet("g", "k"));
        assertEquals(List.of("seen"), map.get("g", "k"));
    }

    @Test
    void stored_payload_is_never_replaced() {
        var map = BilevelMap.<String, String, AtomicInteger>create(AtomicInteger::new);
        AtomicInteger handle = map.addOrGet("g", "k");

        handle.incrementAndGet();
        map.addOrGet("g", "k").incrementAndGet();
        map.addOrGet("g", "other");
        handle.incrementAndGet();

        assertSame(handle, map.get("g", "k"));
        assertEquals(3, map.get("g", "k").get());
        for (var e : map) {
            if (e.key().equals("k")) assertSame(handle, e.value());
        }
    }

    @Test
    void failing_factory_leaves_no_pair_behind() {
        var calls = new AtomicInteger();
        var map = BilevelMap.<String, String, AtomicInteger>create(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("factory down");
            }
            return new AtomicInteger();
        });

        assertThrows(IllegalStateException.class, () -> map.addOrGet("g", "k"));
        assertEquals(0, map.size());
        assertEquals(0, map.groupCount());
        assertEquals(0, map.keyCount());
        assertFalse(map.iterator().hasNext());
        assertNull(map.get("g", "k"));

        map.addOrGet("g", "k").incrementAndGet();
        map.addOrGet("g", "k").incrementAndGet();

        int entries = 0;
        for (var e : map) {
            entries++;
            assertEquals(2, e.value().get());
        }
        assertEquals(1, entries);
        assertEquals(1, map.size());
    }

    @Test
    void null_from_factory_leaves_no_pair_behind() {
        var map = BilevelMap.<String, String, AtomicInteger>create(() -> null);

        assertThrows(NullPointerException.class, () -> map.addOrGet("g", "k"));
        assertEquals(0, map.size());
        assertEquals(0, map.groupCount());
        assertFalse(map.iterator().hasNext());
    }

    @Test
    void get_and_contains_never_create_payloads() {
        var created = new AtomicInteger();
        var map = BilevelMap.<String, String, AtomicInteger>create(() -> {
            created.incrementAndGet();
            return new AtomicInteger();
        });

        assertNull(map.get("g", "k"));
        assertFalse(map.contains("g", "k"));
        assertEquals(0, created.get());
        assertEquals(0, map.keyCount());

        map.addOrGet("g", "k");
        map.addOrGet("g", "k");
        assertTrue(map.contains("g", "k"));
        assertEquals(1, created.get());
    }

    @Test
    void for_each_entry_sees_stored_payloads() {
        var map = BilevelMap.<String, String, AtomicInteger>create(AtomicInteger::new);
        map.addOrGet("a", "x").addAndGet(5);
        map.addOrGet("b", "x").addAndGet(7);

        Map<String, Integer> byGroup = new HashMap<>();
        map.forEachEntry((g, k, v) -> byGroup.put(g + "/" + k, v.get()));

        assertEquals(Map.of("a/x", 5, "b/x", 7), byGroup);
        assertEquals(1, map.keyCount());
    }

    @Test
    void drain_empties_the_map() {
        var map = BilevelMap.<Integer, Integer, AtomicInteger>create(AtomicInteger::new);
        for (int[] p : SCENARIO) {
            map.addOrGet(p[0], p[1]).incrementAndGet();
        }

        var drained = map.drain();
        assertTrue(map.isEmpty());
        assertNull(map.get(3, 3));

        int total = 0;
        int entries = 0;
        while (drained.hasNext()) {
            total += drained.next().value().get();
            entries++;
        }
        assertEquals(DISTINCT, entries);
        assertEquals(SCENARIO.length, total);
    }

    @Test
    void new_pair_during_iteration_fails_fast() {
        var map = BilevelMap.<Integer, Integer, AtomicInteger>create(AtomicInteger::new);
        map.addOrGet(1, 1);

        var it = map.iterator();
        map.addOrGet(1, 1).incrementAndGet(); // existing pair: not structural
        assertTrue(it.hasNext());
        it.next();

        map.addOrGet(1, 2);
        assertThrows(ConcurrentModificationException.class, it::hasNext);
    }

    @Test
    void factory_must_not_return_null() {
        var map = BilevelMap.<String, String, Object>create(() -> null);
        assertThrows(NullPointerException.class, () -> map.addOrGet("g", "k"));
    }
}
