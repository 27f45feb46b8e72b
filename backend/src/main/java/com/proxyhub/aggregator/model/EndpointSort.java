package com.proxyhub.aggregator.model;

import java.util.Locale;

public enum EndpointSort {
    NONE,
    LATENCY,
    SUCCESS_RATE,
    NAME;

    public static EndpointSort fromParam(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (EndpointSort sort : values()) {
            if (sort.name().equals(normalized)) {
                return sort;
            }
        }
        return NONE;
    }
}
