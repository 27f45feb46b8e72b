package com.proxyhub.aggregator.model;

import java.util.Set;

public record EndpointSnapshot(
    String subscriptionId,
    String descriptor,
    Protocol protocol,
    String name,
    String address,
    int port,
    long lastTestTime,
    long lastLatency,
    long successCount,
    long failureCount,
    Set<String> tags
) {
    public long totalTests() {
        return successCount + failureCount;
    }

    public boolean isTested() {
        return totalTests() > 0;
    }

    public double successRate() {
        long total = totalTests();
        return total == 0 ? 0.0 : (double) successCount / total;
    }
}
