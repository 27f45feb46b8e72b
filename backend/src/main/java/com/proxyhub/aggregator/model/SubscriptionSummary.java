package com.proxyhub.aggregator.model;

import java.util.List;

public record SubscriptionSummary(
    String id,
    String name,
    String url,
    boolean enabled,
    int priority,
    List<String> tags,
    boolean autoUpdate,
    long updateIntervalSeconds,
    long lastUpdateTime,
    boolean lastFetchSuccess,
    String lastErrorMessage,
    long totalUpdates,
    long successfulUpdates,
    long failedUpdates,
    int configCount,
    RefreshState refreshState
) {
}
