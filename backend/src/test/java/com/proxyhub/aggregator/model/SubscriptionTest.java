package com.proxyhub.aggregator.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionTest {
    private static final String NODE_A = "vless://user@host:443#NodeA";

    @Test
    void probeOutcomesRecordedDuringRefreshesAreNotLost() throws Exception {
        Subscription subscription = Subscription.create("https://feed.example/sub", "feed", false, 3600);
        subscription.applyFetchedEndpoints(List.of(EndpointRecord.parse(NODE_A)), MergeStrategy.EXACT_DESCRIPTOR, 1L);
        int outcomes = 2_000;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> refresher = pool.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    subscription.applyFetchedEndpoints(
                        List.of(EndpointRecord.parse(NODE_A)),
                        MergeStrategy.EXACT_DESCRIPTOR,
                        i
                    );
                }
                return null;
            });
            Future<?> recorder = pool.submit(() -> {
                start.await();
                for (int i = 0; i < outcomes; i++) {
                    subscription.recordProbeOutcome(NODE_A, true, 10, i);
                }
                return null;
            });
            start.countDown();
            refresher.get(30, TimeUnit.SECONDS);
            recorder.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        EndpointSnapshot snapshot = subscription.endpointSnapshots().get(0);
        assertThat(snapshot.successCount()).isEqualTo(outcomes);
        assertThat(snapshot.lastLatency()).isEqualTo(10);
    }

    @Test
    void recordingAndTaggingUnknownDescriptorTouchesNothing() {
        Subscription subscription = Subscription.create("https://feed.example/sub", "feed", false, 3600);
        subscription.applyFetchedEndpoints(List.of(EndpointRecord.parse(NODE_A)), MergeStrategy.EXACT_DESCRIPTOR, 1L);

        assertThat(subscription.recordProbeOutcome("vless://other:1#B", false, -1, 5)).isZero();
        assertThat(subscription.tagEndpoints("vless://other:1#B", List.of("x"))).isZero();
        assertThat(subscription.tagEndpoints(NODE_A, List.of("fast"))).isEqualTo(1);
        assertThat(subscription.endpointSnapshots().get(0).tags()).containsExactly("fast");
        assertThat(subscription.endpointSnapshots().get(0).totalTests()).isZero();
    }
}
