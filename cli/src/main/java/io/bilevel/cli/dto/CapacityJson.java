package io.bilevel.cli.dto;

import io.bilevel.core.Capacity;

public class CapacityJson {
    public int groups;
    public int perGroup = Capacity.DEFAULT_PER_GROUP;
    public int aggKeys;
}
