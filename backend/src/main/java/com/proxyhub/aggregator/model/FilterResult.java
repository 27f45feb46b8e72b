package com.proxyhub.aggregator.model;

import java.util.List;

public record FilterResult(List<EndpointSnapshot> endpoints, Diagnostic diagnostic, String message) {

    public enum Diagnostic {
        MATCHED,
        NO_MATCHES,
        NO_TESTED_ENDPOINTS
    }
}
