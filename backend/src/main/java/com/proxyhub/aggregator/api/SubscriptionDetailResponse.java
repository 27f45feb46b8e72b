package com.proxyhub.aggregator.api;

import com.proxyhub.aggregator.model.EndpointSnapshot;
import com.proxyhub.aggregator.model.SubscriptionSummary;

import java.util.List;

public record SubscriptionDetailResponse(SubscriptionSummary subscription, List<EndpointSnapshot> endpoints) {
}
