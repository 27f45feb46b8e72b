package com.proxyhub.aggregator.service;

import com.proxyhub.aggregator.http.SubscriptionHttpClient;
import com.proxyhub.aggregator.model.EndpointRecord;
import com.proxyhub.aggregator.model.HttpFetchResult;
import com.proxyhub.aggregator.model.Subscription;
import com.proxyhub.aggregator.model.UpdateOutcome;
import com.proxyhub.aggregator.util.ReasonCodeClassifier;
import com.proxyhub.aggregator.util.SubscriptionContentDecoder;
import com.proxyhub.config.HubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetch, decode and parse pipeline for a single subscription.
 */
@Service
public class SubscriptionFetcher {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionFetcher.class);

    private final HubProperties properties;
    private final SubscriptionHttpClient httpClient;
    private final SubscriptionContentDecoder decoder;
    private final Clock clock;

    public SubscriptionFetcher(HubProperties properties, SubscriptionHttpClient httpClient, Clock clock) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.decoder = new SubscriptionContentDecoder(properties.getSubscription().getBase64MinLength());
        this.clock = clock;
    }

    /**
     * Fetches the feed and replaces the subscription's endpoint list, keeping test history of
     * endpoints that were already known.
     *
     * @throws SubscriptionFetchException when the URL is unreachable or answers with a non-2xx status
     * @throws SubscriptionParseException when the content holds no recognized descriptor
     */
    public List<EndpointRecord> fetch(Subscription subscription, Duration timeout) {
        log.info("Fetching subscription {} ({})", subscription.name(), subscription.id());
        subscription.markUpdateAttempt();

        HttpFetchResult result = httpClient.get(subscription.url(), timeout);
        if (!result.isSuccessful()) {
            String reasonCode = reasonCode(result);
            String message = "Failed to fetch subscription " + subscription.name() + ": " + describe(result);
            subscription.markUpdateFailure(message);
            log.warn("{} (reason={}, after {} ms)", message, reasonCode, result.duration().toMillis());
            throw new SubscriptionFetchException(message, reasonCode, result.failure());
        }

        List<String> descriptors = decoder.decode(result.bodyBytes());
        if (descriptors.isEmpty()) {
            String message = "No valid configurations found in subscription " + subscription.name();
            subscription.markUpdateFailure(message);
            log.warn(message);
            throw new SubscriptionParseException(message);
        }

        List<EndpointRecord> records = new ArrayList<>(descriptors.size());
        for (String descriptor : descriptors) {
            records.add(EndpointRecord.parse(descriptor));
        }
        subscription.applyFetchedEndpoints(
            records,
            properties.getSubscription().getMergeStrategy(),
            clock.instant().getEpochSecond()
        );
        log.info(
            "Parsed {} endpoints from subscription {} ({} in {} ms)",
            records.size(),
            subscription.name(),
            result.finalUrl(),
            result.duration().toMillis()
        );
        return subscription.endpoints();
    }

    public UpdateOutcome tryFetch(Subscription subscription, Duration timeout) {
        try {
            return UpdateOutcome.ok(fetch(subscription, timeout).size());
        } catch (SubscriptionFetchException e) {
            return UpdateOutcome.fetchFailed(e.reasonCode(), e.getMessage());
        } catch (SubscriptionParseException e) {
            return UpdateOutcome.parseFailed(e.getMessage());
        }
    }

    private String reasonCode(HttpFetchResult result) {
        if (result.errorCode() == null) {
            return ReasonCodeClassifier.fromHttpStatus(result.statusCode());
        }
        if (result.failure() != null) {
            String fromException = ReasonCodeClassifier.fromException(result.failure());
            if (!ReasonCodeClassifier.UNKNOWN.equals(fromException)) {
                return fromException;
            }
        }
        return ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage());
    }

    private String describe(HttpFetchResult result) {
        if (result.errorCode() == null) {
            return "HTTP " + result.statusCode();
        }
        if (result.errorMessage() == null || result.errorMessage().isBlank()) {
            return result.errorCode();
        }
        return result.errorCode() + " " + result.errorMessage();
    }
}
