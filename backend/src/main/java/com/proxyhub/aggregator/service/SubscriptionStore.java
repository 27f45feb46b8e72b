package com.proxyhub.aggregator.service;

import com.proxyhub.aggregator.model.EndpointFilter;
import com.proxyhub.aggregator.model.EndpointSnapshot;
import com.proxyhub.aggregator.model.EndpointSort;
import com.proxyhub.aggregator.model.FilterResult;
import com.proxyhub.aggregator.model.RefreshState;
import com.proxyhub.aggregator.model.Subscription;
import com.proxyhub.aggregator.model.SubscriptionSummary;
import com.proxyhub.aggregator.model.UpdateOutcome;
import com.proxyhub.aggregator.persistence.SubscriptionRepository;
import com.proxyhub.aggregator.probe.ProbeResult;
import com.proxyhub.config.HubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Owns every subscription in the process: adding, removing, refreshing, filtering and persisting.
 * The map is only mutated here; readers work on snapshots.
 */
@Service
public class SubscriptionStore {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionStore.class);

    private static final Comparator<Subscription> BY_PRIORITY_THEN_NAME = Comparator
        .comparingInt(Subscription::priority).reversed()
        .thenComparing(subscription -> subscription.name().toLowerCase(Locale.ROOT));

    private final HubProperties properties;
    private final SubscriptionFetcher fetcher;
    private final AutoRefreshScheduler scheduler;
    private final SubscriptionRepository repository;
    private final Clock clock;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final Object mutationLock = new Object();

    public SubscriptionStore(
        HubProperties properties,
        SubscriptionFetcher fetcher,
        AutoRefreshScheduler scheduler,
        SubscriptionRepository repository,
        Clock clock
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.scheduler = scheduler;
        this.repository = repository;
        this.clock = clock;
    }

    @PostConstruct
    public void load() {
        List<Subscription> loaded = repository.loadAll();
        synchronized (mutationLock) {
            for (Subscription subscription : loaded) {
                subscriptions.put(subscription.id(), subscription);
            }
        }
        if (!properties.getSubscription().isResumeAutoUpdate()) {
            return;
        }
        for (Subscription subscription : loaded) {
            if (subscription.isAutoUpdate() && subscription.isEnabled()) {
                scheduler.start(subscription, this::refreshAndSave);
            }
        }
    }

    public Duration defaultFetchTimeout() {
        return Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }

    /**
     * Registers a new subscription. A failed initial fetch is logged and the subscription is kept,
     * so the caller can retry with {@link #update(String, Duration)}.
     *
     * @throws SubscriptionValidationException for a malformed or already registered URL
     */
    public Subscription add(
        String url,
        String name,
        boolean autoUpdate,
        Long updateIntervalSeconds,
        boolean fetchNow,
        Integer priority,
        List<String> tags
    ) {
        String validUrl = Subscription.validateUrl(url);
        long interval = updateIntervalSeconds == null || updateIntervalSeconds <= 0
            ? properties.getSubscription().getDefaultUpdateIntervalSeconds()
            : updateIntervalSeconds;

        Subscription subscription;
        synchronized (mutationLock) {
            if (subscriptions.containsKey(Subscription.idFor(validUrl))) {
                throw new SubscriptionValidationException("Subscription with URL " + validUrl + " already exists");
            }
            subscription = Subscription.create(validUrl, name, autoUpdate, interval);
            if (priority != null) {
                subscription.setPriority(priority);
            }
            if (tags != null) {
                subscription.setTags(tags);
            }
            subscriptions.put(subscription.id(), subscription);
        }
        log.info("Added subscription {} ({})", subscription.name(), subscription.id());

        if (fetchNow) {
            try {
                fetcher.fetch(subscription, defaultFetchTimeout());
            } catch (SubscriptionFetchException | SubscriptionParseException e) {
                log.warn("Initial fetch failed for subscription {}: {}", subscription.name(), e.getMessage());
            }
        }
        if (autoUpdate && isCurrent(subscription)) {
            scheduler.start(subscription, this::refreshAndSave);
        }
        saveIfCurrent(subscription);
        return subscription;
    }

    /**
     * Forgets the subscription in memory and on disk and stops its worker.
     *
     * @return false when no subscription has this id
     */
    public boolean removeById(String subscriptionId) {
        Subscription removed;
        synchronized (mutationLock) {
            removed = subscriptions.remove(subscriptionId);
            if (removed == null) {
                return false;
            }
            repository.delete(removed.id());
        }
        scheduler.stop(removed);
        log.info("Removed subscription {} ({})", removed.name(), removed.id());
        return true;
    }

    public Subscription get(String subscriptionId) {
        Subscription subscription = subscriptionId == null ? null : subscriptions.get(subscriptionId);
        if (subscription == null) {
            throw new SubscriptionNotFoundException(subscriptionId);
        }
        return subscription;
    }

    public List<SubscriptionSummary> list() {
        List<SubscriptionSummary> summaries = new ArrayList<>();
        for (Subscription subscription : ordered(subscriptions.values())) {
            summaries.add(summary(subscription));
        }
        return summaries;
    }

    public SubscriptionSummary summary(Subscription subscription) {
        return subscription.summary(scheduler.state(subscription.id()));
    }

    /**
     * Fetches one subscription now and persists the outcome, including failure counters.
     *
     * @throws SubscriptionNotFoundException for an unknown id
     * @throws SubscriptionFetchException when the feed is unreachable
     * @throws SubscriptionParseException when the feed holds no recognized descriptor
     */
    public List<EndpointSnapshot> update(String subscriptionId, Duration timeout) {
        Subscription subscription = get(subscriptionId);
        refreshAndSave(subscription, timeout);
        return subscription.endpointSnapshots();
    }

    public Map<String, UpdateOutcome> updateAll(Duration timeout) {
        Map<String, UpdateOutcome> outcomes = new LinkedHashMap<>();
        for (Subscription subscription : ordered(subscriptions.values())) {
            if (!subscription.isEnabled()) {
                continue;
            }
            UpdateOutcome outcome = fetcher.tryFetch(subscription, timeout);
            saveIfCurrent(subscription);
            outcomes.put(subscription.id(), outcome);
        }
        long failed = outcomes.values().stream().filter(outcome -> !outcome.isOk()).count();
        log.info("Updated {} subscriptions ({} failed)", outcomes.size(), failed);
        return outcomes;
    }

    public boolean startAutoUpdate(String subscriptionId) {
        Subscription subscription = get(subscriptionId);
        boolean started = scheduler.start(subscription, this::refreshAndSave);
        saveIfCurrent(subscription);
        return started;
    }

    public boolean stopAutoUpdate(String subscriptionId) {
        Subscription subscription = get(subscriptionId);
        boolean stopped = scheduler.stop(subscription);
        saveIfCurrent(subscription);
        return stopped;
    }

    public RefreshState refreshState(String subscriptionId) {
        return scheduler.state(get(subscriptionId).id());
    }

    /**
     * Applies the non-null settings. Disabling a subscription also stops its auto-update worker.
     */
    public Subscription updateSettings(
        String subscriptionId,
        String name,
        Boolean enabled,
        Integer priority,
        List<String> tags,
        Long updateIntervalSeconds
    ) {
        Subscription subscription = get(subscriptionId);
        if (name != null) {
            subscription.rename(name);
        }
        if (priority != null) {
            subscription.setPriority(priority);
        }
        if (tags != null) {
            subscription.setTags(tags);
        }
        if (updateIntervalSeconds != null) {
            if (updateIntervalSeconds <= 0) {
                throw new SubscriptionValidationException("updateIntervalSeconds must be positive");
            }
            subscription.setUpdateIntervalSeconds(updateIntervalSeconds);
        }
        if (enabled != null) {
            subscription.setEnabled(enabled);
            if (!enabled) {
                scheduler.stop(subscription);
            }
        }
        saveIfCurrent(subscription);
        return subscription;
    }

    public List<EndpointSnapshot> allEndpoints() {
        List<EndpointSnapshot> endpoints = new ArrayList<>();
        for (Subscription subscription : ordered(subscriptions.values())) {
            if (subscription.isEnabled()) {
                endpoints.addAll(subscription.endpointSnapshots());
            }
        }
        return endpoints;
    }

    /**
     * Selects endpoints of enabled subscriptions. Criteria intersect in this order: subscription tags,
     * protocol, success rate, latency, endpoint tags, name pattern.
     *
     * @throws SubscriptionValidationException when a bound is out of range or the pattern does not compile
     */
    public FilterResult filter(EndpointFilter filter) {
        EndpointFilter criteria = filter == null ? EndpointFilter.none() : filter;
        Pattern namePattern = validate(criteria);
        Set<String> protocols = normalizedProtocols(criteria.protocols());

        List<EndpointSnapshot> scoped = new ArrayList<>();
        for (Subscription subscription : ordered(subscriptions.values())) {
            if (!subscription.isEnabled()) {
                continue;
            }
            if (!isEmpty(criteria.subscriptionTags()) && !subscription.hasAnyTag(criteria.subscriptionTags())) {
                continue;
            }
            scoped.addAll(subscription.endpointSnapshots());
        }

        List<EndpointSnapshot> matches = new ArrayList<>();
        for (EndpointSnapshot endpoint : scoped) {
            if (!protocols.isEmpty() && !protocols.contains(endpoint.protocol().scheme())) {
                continue;
            }
            if (criteria.minSuccessRate() != null
                && (!endpoint.isTested() || endpoint.successRate() < criteria.minSuccessRate())) {
                continue;
            }
            if (criteria.maxLatency() != null
                && (!endpoint.isTested() || endpoint.lastLatency() <= 0 || endpoint.lastLatency() > criteria.maxLatency())) {
                continue;
            }
            if (!isEmpty(criteria.configTags()) && !hasAnyTag(endpoint, criteria.configTags())) {
                continue;
            }
            if (namePattern != null && !namePattern.matcher(endpoint.name()).find()) {
                continue;
            }
            matches.add(endpoint);
        }

        if (!matches.isEmpty()) {
            return new FilterResult(List.copyOf(matches), FilterResult.Diagnostic.MATCHED, null);
        }
        if (criteria.requiresTestHistory() && noEndpointTested()) {
            String message = "No endpoints have been tested yet; latency and success-rate filters need test results";
            log.warn(message);
            return new FilterResult(List.of(), FilterResult.Diagnostic.NO_TESTED_ENDPOINTS, message);
        }
        return new FilterResult(List.of(), FilterResult.Diagnostic.NO_MATCHES, "No endpoints match the filter");
    }

    public List<EndpointSnapshot> sort(List<EndpointSnapshot> endpoints, EndpointSort sort, Integer limit) {
        List<EndpointSnapshot> sorted = new ArrayList<>(endpoints);
        switch (sort == null ? EndpointSort.NONE : sort) {
            case LATENCY -> sorted.sort(Comparator
                .comparing((EndpointSnapshot endpoint) -> endpoint.lastLatency() <= 0)
                .thenComparingLong(EndpointSnapshot::lastLatency));
            case SUCCESS_RATE -> sorted.sort(Comparator
                .comparingDouble(EndpointSnapshot::successRate).reversed()
                .thenComparing(Comparator.comparingLong(EndpointSnapshot::totalTests).reversed()));
            case NAME -> sorted.sort(Comparator.comparing(endpoint -> endpoint.name().toLowerCase(Locale.ROOT)));
            case NONE -> {
            }
        }
        if (limit != null && limit >= 0 && limit < sorted.size()) {
            return List.copyOf(sorted.subList(0, limit));
        }
        return List.copyOf(sorted);
    }

    /**
     * Folds a probe outcome into every record carrying this descriptor and persists the affected subscriptions.
     *
     * @return the number of records updated
     */
    public int recordProbeResult(String descriptor, ProbeResult result) {
        long now = clock.instant().getEpochSecond();
        int updated = 0;
        for (Subscription subscription : subscriptions.values()) {
            int recorded = subscription.recordProbeOutcome(descriptor, result.success(), result.latencyMs(), now);
            if (recorded > 0) {
                updated += recorded;
                saveIfCurrent(subscription);
            }
        }
        return updated;
    }

    public boolean tagEndpoint(String subscriptionId, String descriptor, List<String> tags) {
        Subscription subscription = get(subscriptionId);
        if (subscription.tagEndpoints(descriptor, tags) == 0) {
            return false;
        }
        saveIfCurrent(subscription);
        return true;
    }

    private void refreshAndSave(Subscription subscription) {
        refreshAndSave(subscription, defaultFetchTimeout());
    }

    private void refreshAndSave(Subscription subscription, Duration timeout) {
        try {
            fetcher.fetch(subscription, timeout);
        } finally {
            saveIfCurrent(subscription);
        }
    }

    private boolean isCurrent(Subscription subscription) {
        return subscriptions.get(subscription.id()) == subscription;
    }

    /**
     * Saves only while this instance is still registered; a removed subscription stays deleted on disk.
     */
    private void saveIfCurrent(Subscription subscription) {
        synchronized (mutationLock) {
            if (isCurrent(subscription)) {
                repository.save(subscription);
            }
        }
    }

    private Pattern validate(EndpointFilter criteria) {
        Double minSuccessRate = criteria.minSuccessRate();
        if (minSuccessRate != null && (minSuccessRate.isNaN() || minSuccessRate < 0.0 || minSuccessRate > 1.0)) {
            throw new SubscriptionValidationException("minSuccessRate must be between 0 and 1, got " + minSuccessRate);
        }
        if (criteria.maxLatency() != null && criteria.maxLatency() < 0) {
            throw new SubscriptionValidationException("maxLatency must be non-negative, got " + criteria.maxLatency());
        }
        String regex = criteria.nameContainsRegex();
        if (regex == null || regex.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            throw new SubscriptionValidationException("Invalid name pattern: " + e.getDescription());
        }
    }

    private Set<String> normalizedProtocols(List<String> protocols) {
        if (isEmpty(protocols)) {
            return Set.of();
        }
        return protocols.stream()
            .filter(protocol -> protocol != null && !protocol.isBlank())
            .map(protocol -> protocol.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    }

    private boolean noEndpointTested() {
        for (Subscription subscription : subscriptions.values()) {
            if (!subscription.isEnabled()) {
                continue;
            }
            for (EndpointSnapshot endpoint : subscription.endpointSnapshots()) {
                if (endpoint.isTested()) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean hasAnyTag(EndpointSnapshot endpoint, List<String> wanted) {
        for (String tag : wanted) {
            if (endpoint.tags().contains(tag)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }

    private static List<Subscription> ordered(Collection<Subscription> values) {
        List<Subscription> ordered = new ArrayList<>(values);
        ordered.sort(BY_PRIORITY_THEN_NAME);
        return ordered;
    }
}
