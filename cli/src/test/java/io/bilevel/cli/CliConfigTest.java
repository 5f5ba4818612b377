package io.bilevel.cli;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliConfigTest {

    @Test
    void parses_columns_and_defaults() {
        var cfg = CliConfig.fromArgs(new String[]{"--group-cols", "0,2", "-k", "1"});

        assertEquals(List.of(0, 2), cfg.groupCols());
        assertEquals(List.of(1), cfg.keyCols());
        assertEquals(",", cfg.delimiter());
        assertNull(cfg.input());
        assertNull(cfg.capacityConfigPath());
        assertFalse(cfg.count());
        assertFalse(cfg.pivot());
        assertFalse(cfg.help());
        assertEquals(2, cfg.maxColumn());
    }

    @Test
    void parses_all_options() {
        var cfg = CliConfig.fromArgs(new String[]{
                "-i", "rows.tsv", "-d", "\t", "-g", "3", "-k", "0, 1",
                "--count", "--capacity-config", "cap.json"
        });

        assertEquals("rows.tsv", cfg.input());
        assertEquals("\t", cfg.delimiter());
        assertEquals(List.of(0, 1), cfg.keyCols());
        assertTrue(cfg.count());
        assertEquals("cap.json", cfg.capacityConfigPath());
    }

    @Test
    void help_short_circuits_validation() {
        assertTrue(CliConfig.fromArgs(new String[]{"--help"}).help());
        // an invalid column list before --help is parsed first
        assertThrows(IllegalArgumentException.class,
                () -> CliConfig.fromArgs(new String[]{"-g", "x", "-h"}));
        assertTrue(CliConfig.fromArgs(new String[]{"-k", "1", "-h"}).help());
    }

    @Test
    void missing_required_columns_are_rejected() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> CliConfig.fromArgs(new String[]{"-k", "1"}));
        assertTrue(e.getMessage().contains("--group-cols"));

        assertThrows(IllegalArgumentException.class,
                () -> CliConfig.fromArgs(new String[]{"-g", "1"}));
    }

    @Test
    void bad_values_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CliConfig.fromArgs(new String[]{"-g", "a", "-k", "1"}));
        assertThrows(IllegalArgumentException.class,
                () -> CliConfig.fromArgs(new String[]{"-g", "-1", "-k", "1"}));
        assertThrows(IllegalArgumentException.class,
                () -> CliConfig.fromArgs(new String[]{"-g", "0", "-k", "1", "-d", ""}));
        assertThrows(IllegalArgumentException.class,
                () -> CliConfig.fromArgs(new String[]{"-g", "0", "-k"}));
        assertThrows(IllegalArgumentException.class,
                () -> CliConfig.fromArgs(new String[]{"-g", "0", "-k", "1", "--bogus"}));
    }

    @Test
    void pivot_cannot_be_combined_with_count() {
        assertThrows(IllegalArgumentException.class,
                () -> CliConfig.fromArgs(new String[]{"-g", "0", "-k", "1", "--count", "--pivot"}));
    }

    @Test
    void equal_arguments_give_equal_configs() {
        String[] args = {"-g", "0,2", "-k", "1", "--count"};
        var a = CliConfig.fromArgs(args);
        var b = CliConfig.fromArgs(args.clone());

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertTrue(a.toString().contains("groupCols=[0, 2]"), a.toString());
        assertNotEquals(a, CliConfig.fromArgs(new String[]{"-g", "0,3", "-k", "1", "--count"}));
    }
}
