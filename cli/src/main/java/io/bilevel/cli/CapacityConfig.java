package io.bilevel.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.bilevel.cli.dto.CapacityJson;
import io.bilevel.core.Capacity;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads table size hints from a JSON file:
 * <pre>
 *   { "groups": 1000, "perGroup": 8, "aggKeys": 50000 }
 * </pre>
 * Missing fields keep their defaults (0, {@link Capacity#DEFAULT_PER_GROUP}, 0).
 */
public final class CapacityConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CapacityConfig() {
    }

    public static Capacity fromJsonFile(Path path) {
        try {
            CapacityJson cfg = MAPPER.readValue(path.toFile(), CapacityJson.class);
            return new Capacity(cfg.groups, cfg.perGroup, cfg.aggKeys);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load capacity config from " + path, e);
        }
    }
}
