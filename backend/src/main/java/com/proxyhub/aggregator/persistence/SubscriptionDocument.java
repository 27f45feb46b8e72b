package com.proxyhub.aggregator.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.proxyhub.aggregator.model.EndpointRecord;
import com.proxyhub.aggregator.model.EndpointSnapshot;
import com.proxyhub.aggregator.model.Subscription;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of one subscription, written as {@code <id>.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubscriptionDocument(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("url") String url,
    @JsonProperty("enabled") Boolean enabled,
    @JsonProperty("priority") Integer priority,
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("auto_update") Boolean autoUpdate,
    @JsonProperty("update_interval") Long updateInterval,
    @JsonProperty("last_update_time") Long lastUpdateTime,
    @JsonProperty("last_fetch_success") Boolean lastFetchSuccess,
    @JsonProperty("last_error_message") String lastErrorMessage,
    @JsonProperty("total_updates") Long totalUpdates,
    @JsonProperty("successful_updates") Long successfulUpdates,
    @JsonProperty("failed_updates") Long failedUpdates,
    @JsonProperty("configs") List<EndpointDocument> configs
) {
    static SubscriptionDocument from(Subscription subscription) {
        List<EndpointDocument> configs = new ArrayList<>();
        for (EndpointSnapshot snapshot : subscription.endpointSnapshots()) {
            configs.add(EndpointDocument.from(snapshot));
        }
        return new SubscriptionDocument(
            subscription.id(),
            subscription.name(),
            subscription.url(),
            subscription.isEnabled(),
            subscription.priority(),
            subscription.tags(),
            subscription.isAutoUpdate(),
            subscription.updateIntervalSeconds(),
            subscription.lastUpdateTime(),
            subscription.lastFetchSuccess(),
            subscription.lastErrorMessage(),
            subscription.totalUpdates(),
            subscription.successfulUpdates(),
            subscription.failedUpdates(),
            configs
        );
    }

    Subscription toSubscription(long defaultUpdateIntervalSeconds) {
        List<EndpointRecord> endpoints = new ArrayList<>();
        if (configs != null) {
            for (EndpointDocument config : configs) {
                endpoints.add(config.toRecord());
            }
        }
        return Subscription.restore(
            id,
            url,
            name,
            enabled == null || enabled,
            priority == null ? 0 : priority,
            tags,
            autoUpdate != null && autoUpdate,
            updateInterval == null ? defaultUpdateIntervalSeconds : updateInterval,
            lastUpdateTime == null ? 0L : lastUpdateTime,
            lastFetchSuccess != null && lastFetchSuccess,
            lastErrorMessage,
            totalUpdates == null ? 0L : totalUpdates,
            successfulUpdates == null ? 0L : successfulUpdates,
            failedUpdates == null ? 0L : failedUpdates,
            endpoints
        );
    }
}
