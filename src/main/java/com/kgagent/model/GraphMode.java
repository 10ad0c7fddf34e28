package com.kgagent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a query is routed: to the single endpoint of one graph, or to the federation
 * endpoint that fans out across several graphs.
 */
public enum GraphMode {
    SINGLE,
    FEDERATED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static GraphMode fromWireValue(String value) {
        return value == null ? FEDERATED : GraphMode.valueOf(value.trim().toUpperCase());
    }
}
