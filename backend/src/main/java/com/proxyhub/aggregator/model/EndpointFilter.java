package com.proxyhub.aggregator.model;

import java.util.List;

/**
 * Criteria for selecting endpoints across the store. Null or empty fields do not constrain.
 */
public record EndpointFilter(
    List<String> protocols,
    Double minSuccessRate,
    Long maxLatency,
    List<String> subscriptionTags,
    List<String> configTags,
    String nameContainsRegex
) {
    public static EndpointFilter none() {
        return new EndpointFilter(null, null, null, null, null, null);
    }

    public boolean requiresTestHistory() {
        return minSuccessRate != null || maxLatency != null;
    }
}
