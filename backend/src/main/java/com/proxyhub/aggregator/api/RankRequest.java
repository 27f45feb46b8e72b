package com.proxyhub.aggregator.api;

import java.util.List;

/**
 * Store-wide ranking: the filter fields select candidates, the rest shape the probe batch.
 */
public record RankRequest(
    List<String> protocols,
    Double minSuccessRate,
    Long maxLatency,
    List<String> subscriptionTags,
    List<String> configTags,
    String nameContains,
    Integer timeoutSeconds,
    Boolean parallel,
    Integer topN
) {
}
