package com.proxyhub.aggregator.api;

import com.proxyhub.aggregator.model.RefreshState;

public record AutoUpdateResponse(String subscriptionId, boolean changed, RefreshState refreshState) {
}
