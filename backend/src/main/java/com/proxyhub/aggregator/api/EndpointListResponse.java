package com.proxyhub.aggregator.api;

import com.proxyhub.aggregator.model.EndpointSnapshot;
import com.proxyhub.aggregator.model.FilterResult;

import java.util.List;

public record EndpointListResponse(
    int count,
    FilterResult.Diagnostic diagnostic,
    String message,
    List<EndpointSnapshot> endpoints
) {
}
