package com.proxyhub.aggregator.model;

import com.proxyhub.aggregator.service.SubscriptionValidationException;
import com.proxyhub.aggregator.util.HashUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A remote feed of endpoint descriptors and everything known about it.
 * The URL and the id derived from it never change; the endpoint list is swapped as a whole on each
 * successful fetch so readers always see either the old list or the new one.
 */
public class Subscription {
    private final String id;
    private final String url;

    private String name;
    private boolean enabled = true;
    private int priority;
    private List<String> tags = List.of();
    private boolean autoUpdate;
    private long updateIntervalSeconds;
    private long lastUpdateTime;
    private boolean lastFetchSuccess;
    private String lastErrorMessage = "";
    private long totalUpdates;
    private long successfulUpdates;
    private long failedUpdates;

    private volatile List<EndpointRecord> endpoints = List.of();

    private Subscription(String id, String url) {
        this.id = id;
        this.url = url;
    }

    public static Subscription create(String url, String name, boolean autoUpdate, long updateIntervalSeconds) {
        String validUrl = validateUrl(url);
        Subscription subscription = new Subscription(idFor(validUrl), validUrl);
        subscription.name = (name == null || name.isBlank()) ? hostOf(validUrl) : name.trim();
        subscription.autoUpdate = autoUpdate;
        subscription.updateIntervalSeconds = Math.max(1, updateIntervalSeconds);
        return subscription;
    }

    public static Subscription restore(
        String id,
        String url,
        String name,
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
        List<EndpointRecord> endpoints
    ) {
        String validUrl = validateUrl(url);
        String safeId = (id == null || id.isBlank()) ? idFor(validUrl) : id;
        Subscription subscription = new Subscription(safeId, validUrl);
        subscription.name = (name == null || name.isBlank()) ? hostOf(validUrl) : name;
        subscription.enabled = enabled;
        subscription.priority = priority;
        subscription.tags = sanitizeTags(tags);
        subscription.autoUpdate = autoUpdate;
        subscription.updateIntervalSeconds = Math.max(1, updateIntervalSeconds);
        subscription.lastUpdateTime = Math.max(0, lastUpdateTime);
        subscription.lastFetchSuccess = lastFetchSuccess;
        subscription.lastErrorMessage = lastErrorMessage == null ? "" : lastErrorMessage;
        subscription.totalUpdates = Math.max(0, totalUpdates);
        subscription.successfulUpdates = Math.max(0, successfulUpdates);
        subscription.failedUpdates = Math.max(0, failedUpdates);
        subscription.endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        return subscription;
    }

    public static String idFor(String url) {
        return HashUtils.md5Hex(url);
    }

    public static String validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new SubscriptionValidationException("Subscription URL is required");
        }
        String trimmed = url.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            throw new SubscriptionValidationException(
                "Invalid subscription URL. Must start with http:// or https://: " + trimmed
            );
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new SubscriptionValidationException("Subscription URL has no host: " + trimmed);
            }
        } catch (URISyntaxException e) {
            throw new SubscriptionValidationException("Malformed subscription URL: " + trimmed);
        }
        return trimmed;
    }

    private static String hostOf(String url) {
        try {
            return new URI(url).getHost();
        } catch (URISyntaxException e) {
            return url;
        }
    }

    private static List<String> sanitizeTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        List<String> clean = new ArrayList<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank() && !clean.contains(tag.trim())) {
                clean.add(tag.trim());
            }
        }
        return List.copyOf(clean);
    }

    public String id() {
        return id;
    }

    public String url() {
        return url;
    }

    public synchronized String name() {
        return name;
    }

    public synchronized void rename(String newName) {
        if (newName != null && !newName.isBlank()) {
            this.name = newName.trim();
        }
    }

    public synchronized boolean isEnabled() {
        return enabled;
    }

    public synchronized void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public synchronized int priority() {
        return priority;
    }

    public synchronized void setPriority(int priority) {
        this.priority = priority;
    }

    public synchronized List<String> tags() {
        return tags;
    }

    public synchronized void setTags(List<String> tags) {
        this.tags = sanitizeTags(tags);
    }

    public synchronized boolean hasAnyTag(List<String> wanted) {
        for (String tag : wanted) {
            if (tags.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    public synchronized boolean isAutoUpdate() {
        return autoUpdate;
    }

    public synchronized void setAutoUpdate(boolean autoUpdate) {
        this.autoUpdate = autoUpdate;
    }

    public synchronized long updateIntervalSeconds() {
        return updateIntervalSeconds;
    }

    public synchronized void setUpdateIntervalSeconds(long updateIntervalSeconds) {
        this.updateIntervalSeconds = Math.max(1, updateIntervalSeconds);
    }

    public synchronized long lastUpdateTime() {
        return lastUpdateTime;
    }

    public synchronized boolean lastFetchSuccess() {
        return lastFetchSuccess;
    }

    public synchronized String lastErrorMessage() {
        return lastErrorMessage;
    }

    public synchronized long totalUpdates() {
        return totalUpdates;
    }

    public synchronized long successfulUpdates() {
        return successfulUpdates;
    }

    public synchronized long failedUpdates() {
        return failedUpdates;
    }

    public List<EndpointRecord> endpoints() {
        return endpoints;
    }

    public List<EndpointRecord> findEndpoints(String descriptor) {
        List<EndpointRecord> matches = new ArrayList<>();
        for (EndpointRecord record : endpoints) {
            if (record.descriptor().equals(descriptor)) {
                matches.add(record);
            }
        }
        return matches;
    }

    /**
     * Folds a probe outcome into every current record with this descriptor. Holds the subscription
     * monitor so the update cannot land on a list that {@link #applyFetchedEndpoints} is replacing.
     *
     * @return the number of records updated
     */
    public synchronized int recordProbeOutcome(String descriptor, boolean success, long latencyMs, long testedAtEpochSeconds) {
        List<EndpointRecord> records = findEndpoints(descriptor);
        for (EndpointRecord record : records) {
            if (success) {
                record.recordSuccess(latencyMs, testedAtEpochSeconds);
            } else {
                record.recordFailure(testedAtEpochSeconds);
            }
        }
        return records.size();
    }

    public synchronized int tagEndpoints(String descriptor, List<String> newTags) {
        List<EndpointRecord> records = findEndpoints(descriptor);
        for (EndpointRecord record : records) {
            record.addTags(newTags);
        }
        return records.size();
    }

    public synchronized void markUpdateAttempt() {
        totalUpdates++;
    }

    public synchronized void markUpdateFailure(String errorMessage) {
        lastFetchSuccess = false;
        lastErrorMessage = errorMessage == null ? "" : errorMessage;
        failedUpdates++;
    }

    /**
     * Carries test history from the current list onto {@code fresh}, then replaces the list in one step.
     */
    public synchronized void applyFetchedEndpoints(
        List<EndpointRecord> fresh,
        MergeStrategy strategy,
        long fetchedAtEpochSeconds
    ) {
        Map<String, EndpointRecord> previous = new HashMap<>();
        for (EndpointRecord old : endpoints) {
            previous.putIfAbsent(mergeKey(old, strategy), old);
        }
        for (EndpointRecord record : fresh) {
            EndpointRecord match = previous.get(mergeKey(record, strategy));
            if (match != null) {
                record.copyHistoryFrom(match);
            }
        }
        endpoints = List.copyOf(fresh);
        lastUpdateTime = fetchedAtEpochSeconds;
        lastFetchSuccess = true;
        lastErrorMessage = "";
        successfulUpdates++;
    }

    private static String mergeKey(EndpointRecord record, MergeStrategy strategy) {
        if (strategy == MergeStrategy.ENDPOINT_IDENTITY) {
            return record.identityKey();
        }
        return record.descriptor();
    }

    public List<EndpointSnapshot> endpointSnapshots() {
        List<EndpointRecord> current = endpoints;
        List<EndpointSnapshot> snapshots = new ArrayList<>(current.size());
        for (EndpointRecord record : current) {
            snapshots.add(record.snapshot(id));
        }
        return snapshots;
    }

    public synchronized SubscriptionSummary summary(RefreshState refreshState) {
        return new SubscriptionSummary(
            id,
            name,
            url,
            enabled,
            priority,
            tags,
            autoUpdate,
            updateIntervalSeconds,
            lastUpdateTime,
            lastFetchSuccess,
            lastErrorMessage,
            totalUpdates,
            successfulUpdates,
            failedUpdates,
            endpoints.size(),
            refreshState
        );
    }
}
