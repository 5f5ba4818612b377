package io.bilevel.adapters.scalar;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class LongBilevelMapTest {

    @Test
    void add_or_get_accumulates() {
        var map = new LongBilevelMap<AtomicLong>(AtomicLong::new);
        long[][] calls = {
                {2, 2}, {2, 4}, {2, 8}, {2, 10},
                {3, 3}, {3, 3}, {3, 6}, {3, 9},
                {4, 4}, {4, 8},
                {5, 5}, {5, 5}, {5, 10},
        };
        for (long[] c : calls) {
            map.addOrGet(c[0], c[1]).incrementAndGet();
        }

        Map<LongPair, Long> counts = new HashMap<>();
        for (var e : map) {
            counts.put(new LongPair(e.group(), e.key()), e.value().get());
        }

        assertEquals(11, counts.size());
        assertEquals(2L, counts.get(new LongPair(3, 3)).longValue());
        assertEquals(2L, counts.get(new LongPair(5, 5)).longValue());
        assertEquals(1L, counts.get(new LongPair(2, 10)).longValue());
        assertEquals(11, map.size());
    }

    @Test
    void payload_handles_stay_live() {
        var map = new LongBilevelMap<AtomicLong>(AtomicLong::new);
        AtomicLong handle = map.addOrGet(1, 1);
        handle.addAndGet(5);
        map.addOrGet(1, 1).addAndGet(5);

        assertSame(handle, map.get(1, 1));
        assertEquals(10L, handle.get());
        assertNull(map.get(1, 2));
        assertEquals(1, map.size());

        Map<Long, Long> sums = new HashMap<>();
        map.forEachEntry((g, k, v) -> sums.merge(g, v.get(), Long::sum));
        assertEquals(Map.of(1L, 10L), sums);
    }

    @Test
    void failing_factory_leaves_no_pair_behind() {
        var map = new LongBilevelMap<AtomicLong>(() -> {
            throw new IllegalStateException("factory down");
        });

        assertThrows(IllegalStateException.class, () -> map.addOrGet(7, 7));
        assertEquals(0, map.size());
        assertEquals(0, map.groupCount());
        assertFalse(map.iterator().hasNext());
    }
}
