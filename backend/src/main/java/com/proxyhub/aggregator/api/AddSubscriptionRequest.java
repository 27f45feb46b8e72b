package com.proxyhub.aggregator.api;

import java.util.List;

public record AddSubscriptionRequest(
    String url,
    String name,
    Boolean autoUpdate,
    Long updateIntervalSeconds,
    Boolean fetchNow,
    Integer priority,
    List<String> tags
) {
}
