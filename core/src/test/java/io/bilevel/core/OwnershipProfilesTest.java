package io.bilevel.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiPredicate;
import java.util.function.UnaryOperator;

import static io.bilevel.core.Grouping.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * The same workload through each way of owning keys must give the same
 * results; only the number of copies differs.
 */
class OwnershipProfilesTest {

    /** Counts how often a CharSequence is turned into an owned String. */
    private static final class CountingChars implements KeyForm<CharSequence, String> {
        final AtomicInteger copies = new AtomicInteger();

        @Override public int hash(CharSequence ref) { return KeyForm.stringHash(ref); }
        @Override public boolean matches(CharSequence ref, String key) { return key.contentEquals(ref); }
        @Override public String own(CharSequence ref) {
            copies.incrementAndGet();
            return ref.toString();
        }
    }

    private interface Inserter {
        boolean insert(String g, String k);
    }

    private static void runScenario(Inserter inserter) {
        for (int i = 0; i < SCENARIO.length; i++) {
            String g = Integer.toString(SCENARIO[i][0]);
            String k = Integer.toString(SCENARIO[i][1]);
            assertEquals(expectedInsert(i), inserter.insert(g, k), "call " + (i + 1));
        }
    }

    private static void assertScenarioContents(BilevelSet<String, String> set) {
        assertEquals(DISTINCT, set.size());
        List<String> groups = new ArrayList<>();
        set.forEachPair((g, k) -> groups.add(g));
        assertContiguous(groups);
        for (int[] p : SCENARIO) {
            assertTrue(set.contains(Integer.toString(p[0]), Integer.toString(p[1])));
        }
    }

    @Test
    void identity_keys() {
        var set = BilevelSet.<String, String>create();
        runScenario(set::insert);
        assertScenarioContents(set);
    }

    @Test
    void copied_aggregation_keys_are_copied_once_each() {
        var copies = new AtomicInteger();
        var set = BilevelSet.<String, String>builder()
                .keyForm(KeyForm.copying(k -> {
                    copies.incrementAndGet();
                    return new String(k);
                }))
                .build();

        runScenario(set::insert);

        assertScenarioContents(set);
        assertEquals(set.keyCount(), copies.get());
    }

    @Test
    void borrowed_lookups_copy_only_new_groups_and_keys() {
        var groupForm = new CountingChars();
        var keyForm = new CountingChars();
        var set = BilevelSet.<String, String>withCapacity(new Capacity(4, 4, 8));
        var borrowed = set.using(groupForm, keyForm);

        runScenario((g, k) -> borrowed.insert(new StringBuilder(g), new StringBuilder(k)));

        assertScenarioContents(set);
        assertEquals(4, groupForm.copies.get(), "one copy per distinct group");
        assertEquals(8, keyForm.copies.get(), "one copy per distinct aggregation key");
        assertTrue(borrowed.contains(new StringBuilder("3"), new StringBuilder("9")));
        assertFalse(borrowed.contains(new StringBuilder("3"), new StringBuilder("4")));
    }

    @Test
    void borrowed_map_lookups_accumulate_like_owned_ones() {
        var owned = BilevelMap.<String, String, AtomicInteger>create(AtomicInteger::new);
        var viaChars = BilevelMap.<String, String, AtomicInteger>create(AtomicInteger::new);
        var borrowed = viaChars.using(KeyForm.chars(), KeyForm.chars());

        for (int[] p : SCENARIO) {
            String g = Integer.toString(p[0]);
            String k = Integer.toString(p[1]);
            owned.addOrGet(g, k).incrementAndGet();
            borrowed.addOrGet(new StringBuilder(g), new StringBuilder(k)).incrementAndGet();
        }

        Map<String, Integer> a = new HashMap<>();
        owned.forEachEntry((g, k, v) -> a.put(g + "," + k, v.get()));
        Map<String, Integer> b = new HashMap<>();
        viaChars.forEachEntry((g, k, v) -> b.put(g + "," + k, v.get()));

        assertEquals(a, b);
        assertEquals(2, b.get("3,3").intValue());
        assertEquals(1, borrowed.get(new StringBuilder("2"), new StringBuilder("8")).get());
        assertEquals(2, borrowed.addOrGet(new StringBuilder("2"), new StringBuilder("8")).incrementAndGet());
    }

    @Test
    void copied_keys_are_isolated_from_caller_mutation() {
        var set = BilevelSet.<String, List<String>>builder()
                .keyForm(KeyForm.copying(List::copyOf))
                .build();

        List<String> key = new ArrayList<>(List.of("a", "b"));
        assertTrue(set.insert("g", key));

        key.add("c");
        assertTrue(set.contains("g", List.of("a", "b")));
        assertFalse(set.contains("g", key));
        assertEquals(List.of(List.of("a", "b")), set.keysOf("g"));
    }

    @Test
    void pivot_through_copying_forms_owns_its_own_keys() {
        var copies = new AtomicInteger();
        UnaryOperator<List<String>> copy = l -> {
            copies.incrementAndGet();
            return new ArrayList<>(l);
        };
        var set = BilevelSet.<List<String>, List<String>>builder()
                .groupForm(KeyForm.copying(copy))
                .keyForm(KeyForm.copying(copy))
                .build();
        set.insert(List.of("g"), List.of("k1"));
        set.insert(List.of("g"), List.of("k2"));
        assertEquals(3, copies.get());

        List<String> storedGroup = set.iterator().next().group();
        var pivoted = set.pivot();

        assertEquals(6, copies.get(), "pivot copies each distinct key once more");
        assertEquals(2, pivoted.size());
        for (var p : pivoted) {
            assertEquals(List.of("g"), p.key());
            assertNotSame(storedGroup, p.key());
        }
        assertTrue(pivoted.contains(List.of("k1"), List.of("g")));
    }

    @Test
    void custom_form_groups_case_insensitively() {
        BiPredicate<String, String> sameIgnoringCase = String::equalsIgnoreCase;
        KeyForm<String, String> folded = KeyForm.of(
                s -> s.toLowerCase().hashCode(),
                sameIgnoringCase,
                String::toLowerCase);
        var set = BilevelSet.<String, String>builder().groupForm(folded).build();

        assertTrue(set.insert("Team", "x"));
        assertFalse(set.insert("TEAM", "x"));
        assertTrue(set.insert("team", "y"));

        assertEquals(1, set.groupCount());
        assertEquals(List.of("team", "team"), Grouping.groupsOf(set));
    }
}
