package com.proxyhub.aggregator.api;

import java.util.List;

public record SubscriptionSettingsRequest(
    String name,
    Boolean enabled,
    Integer priority,
    List<String> tags,
    Long updateIntervalSeconds
) {
}
