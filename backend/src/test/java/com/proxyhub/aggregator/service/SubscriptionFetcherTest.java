package com.proxyhub.aggregator.service;

import com.proxyhub.aggregator.http.SubscriptionHttpClient;
import com.proxyhub.aggregator.model.EndpointRecord;
import com.proxyhub.aggregator.model.EndpointSnapshot;
import com.proxyhub.aggregator.model.MergeStrategy;
import com.proxyhub.aggregator.model.Subscription;
import com.proxyhub.aggregator.model.UpdateOutcome;
import com.proxyhub.aggregator.util.ReasonCodeClassifier;
import com.proxyhub.config.HubProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SubscriptionFetcherTest {
    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MockWebServer server;
    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private HubProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new HubProperties();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void base64FeedYieldsOnlyRecognizedEndpoints() {
        server.enqueue(feed("vless://user@host:443#NodeA\nvmess://abc@host2:8443#NodeB\ngarbage-line"));
        Subscription subscription = subscription();

        List<EndpointRecord> endpoints = fetcher().fetch(subscription, TIMEOUT);

        assertThat(endpoints).extracting(EndpointRecord::name).containsExactly("NodeA", "NodeB");
        assertThat(subscription.endpointSnapshots()).allSatisfy(snapshot -> assertThat(snapshot.lastLatency()).isEqualTo(-1L));
        assertThat(subscription.lastFetchSuccess()).isTrue();
        assertThat(subscription.lastUpdateTime()).isEqualTo(NOW.getEpochSecond());
        assertThat(subscription.totalUpdates()).isEqualTo(1);
        assertThat(subscription.successfulUpdates()).isEqualTo(1);
    }

    @Test
    void contentWithoutDescriptorsIsParseFailure() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("not a config"));
        Subscription subscription = subscription();

        assertThatThrownBy(() -> fetcher().fetch(subscription, TIMEOUT))
            .isInstanceOf(SubscriptionParseException.class);
        assertThat(subscription.endpoints()).isEmpty();
        assertThat(subscription.lastFetchSuccess()).isFalse();
        assertThat(subscription.failedUpdates()).isEqualTo(1);
        assertThat(subscription.lastErrorMessage()).contains("No valid configurations");
    }

    @Test
    void httpErrorIsFetchFailureWithReasonCode() {
        server.enqueue(new MockResponse().setResponseCode(404));
        Subscription subscription = subscription();

        SubscriptionFetchException error = catchThrowableOfType(
            () -> fetcher().fetch(subscription, TIMEOUT),
            SubscriptionFetchException.class
        );

        assertThat(error).isNotNull();
        assertThat(error.reasonCode()).isEqualTo(ReasonCodeClassifier.HTTP_404);
        assertThat(subscription.failedUpdates()).isEqualTo(1);
    }

    @Test
    void tryFetchReportsCategoriesAsValues() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("not a config"));
        server.enqueue(new MockResponse().setResponseCode(500));
        SubscriptionFetcher fetcher = fetcher();
        Subscription subscription = subscription();

        UpdateOutcome parseFailure = fetcher.tryFetch(subscription, TIMEOUT);
        UpdateOutcome fetchFailure = fetcher.tryFetch(subscription, TIMEOUT);

        assertThat(parseFailure.status()).isEqualTo(UpdateOutcome.Status.PARSE_FAILED);
        assertThat(fetchFailure.status()).isEqualTo(UpdateOutcome.Status.FETCH_FAILED);
        assertThat(fetchFailure.reasonCode()).isEqualTo(ReasonCodeClassifier.HTTP_5XX);
    }

    @Test
    void unchangedFeedKeepsTestHistory() {
        String body = "vless://user@host:443#NodeA\ntrojan://pw@edge:443#NodeC";
        server.enqueue(feed(body));
        server.enqueue(feed(body));
        SubscriptionFetcher fetcher = fetcher();
        Subscription subscription = subscription();

        fetcher.fetch(subscription, TIMEOUT);
        EndpointRecord nodeA = subscription.findEndpoints("vless://user@host:443#NodeA").get(0);
        nodeA.recordSuccess(120, NOW.getEpochSecond());
        nodeA.recordFailure(NOW.getEpochSecond());
        nodeA.recordSuccess(95, NOW.getEpochSecond());
        nodeA.addTags(List.of("fast"));
        EndpointSnapshot before = nodeA.snapshot(subscription.id());

        fetcher.fetch(subscription, TIMEOUT);

        EndpointSnapshot after = subscription.findEndpoints("vless://user@host:443#NodeA").get(0).snapshot(subscription.id());
        assertThat(after.successCount()).isEqualTo(before.successCount());
        assertThat(after.failureCount()).isEqualTo(before.failureCount());
        assertThat(after.lastLatency()).isEqualTo(95L);
        assertThat(after.tags()).isEqualTo(Set.of("fast"));
    }

    @Test
    void cosmeticDescriptorChangeKeepsHistoryOnlyWithIdentityMerge() {
        server.enqueue(feed("vless://user@host:443#NodeA"));
        server.enqueue(feed("vless://user@host:443?security=tls#NodeA"));
        server.enqueue(feed("vless://user@host:443#NodeA"));
        server.enqueue(feed("vless://user@host:443?security=tls#NodeA"));

        Subscription exact = subscription();
        SubscriptionFetcher exactFetcher = fetcher();
        exactFetcher.fetch(exact, TIMEOUT);
        exact.endpoints().get(0).recordSuccess(50, NOW.getEpochSecond());
        exactFetcher.fetch(exact, TIMEOUT);
        assertThat(exact.endpointSnapshots().get(0).successCount()).isZero();

        properties.getSubscription().setMergeStrategy(MergeStrategy.ENDPOINT_IDENTITY);
        Subscription identity = subscription();
        SubscriptionFetcher identityFetcher = fetcher();
        identityFetcher.fetch(identity, TIMEOUT);
        identity.endpoints().get(0).recordSuccess(50, NOW.getEpochSecond());
        identityFetcher.fetch(identity, TIMEOUT);
        assertThat(identity.endpointSnapshots().get(0).successCount()).isEqualTo(1);
        assertThat(identity.endpointSnapshots().get(0).descriptor()).contains("security=tls");
    }

    private SubscriptionFetcher fetcher() {
        SubscriptionHttpClient client = new SubscriptionHttpClient(properties, executor);
        return new SubscriptionFetcher(properties, client, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Subscription subscription() {
        return Subscription.create(server.url("/sub").toString(), null, false, 3600);
    }

    private static MockResponse feed(String plain) {
        String encoded = Base64.getEncoder().encodeToString(plain.getBytes(StandardCharsets.UTF_8));
        return new MockResponse().setResponseCode(200).setBody(encoded);
    }
}
