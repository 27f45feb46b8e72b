package com.proxyhub.aggregator.service;

import com.proxyhub.aggregator.model.MergeStrategy;
import com.proxyhub.aggregator.model.RefreshState;
import com.proxyhub.aggregator.model.Subscription;
import com.proxyhub.config.HubProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AutoRefreshSchedulerTest {
    private static final Instant START = Instant.ofEpochSecond(1_700_000_000L);

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final HubProperties properties = new HubProperties();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void stopRightAfterStartReachesStoppedWithinOneTick() throws Exception {
        AutoRefreshScheduler scheduler = new AutoRefreshScheduler(
            properties,
            executor,
            new MutableClock(START),
            duration -> Thread.sleep(duration.toMillis())
        );
        Subscription subscription = Subscription.create("https://example.com/sub", null, false, 3600);

        assertThat(scheduler.start(subscription, ignored -> { })).isTrue();
        assertThat(scheduler.stop(subscription)).isTrue();

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(1500);
        while (scheduler.state(subscription.id()) != RefreshState.STOPPED && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(scheduler.state(subscription.id())).isEqualTo(RefreshState.STOPPED);
        assertThat(subscription.isAutoUpdate()).isFalse();
    }

    @Test
    void startIsIdempotentPerSubscription() {
        AutoRefreshScheduler scheduler = new AutoRefreshScheduler(
            properties,
            executor,
            new MutableClock(START),
            duration -> Thread.sleep(duration.toMillis())
        );
        Subscription subscription = Subscription.create("https://example.com/sub", null, false, 3600);

        assertThat(scheduler.start(subscription, ignored -> { })).isTrue();
        assertThat(scheduler.start(subscription, ignored -> { })).isFalse();
        assertThat(scheduler.liveWorkerCount()).isEqualTo(1);
        assertThat(scheduler.state(subscription.id())).isEqualTo(RefreshState.RUNNING);

        scheduler.stopAll();
    }

    @Test
    void refreshesOnIntervalUsingVirtualClock() throws Exception {
        MutableClock clock = new MutableClock(START);
        AutoRefreshScheduler scheduler = new AutoRefreshScheduler(properties, executor, clock, clock::advance);
        Subscription subscription = Subscription.create("https://example.com/sub", null, false, 10);
        List<Long> refreshedAt = new CopyOnWriteArrayList<>();
        CountDownLatch threeRefreshes = new CountDownLatch(3);

        scheduler.start(subscription, target -> {
            long now = clock.instant().getEpochSecond();
            refreshedAt.add(now);
            target.applyFetchedEndpoints(List.of(), MergeStrategy.EXACT_DESCRIPTOR, now);
            threeRefreshes.countDown();
            if (threeRefreshes.getCount() == 0) {
                scheduler.stop(target);
            }
        });

        assertThat(threeRefreshes.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(refreshedAt.subList(0, 3)).containsExactly(
            START.getEpochSecond(),
            START.getEpochSecond() + 10,
            START.getEpochSecond() + 20
        );
    }

    @Test
    void failingRefreshDoesNotKillWorker() throws Exception {
        MutableClock clock = new MutableClock(START);
        AutoRefreshScheduler scheduler = new AutoRefreshScheduler(properties, executor, clock, clock::advance);
        Subscription subscription = Subscription.create("https://example.com/sub", null, false, 5);
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch secondAttempt = new CountDownLatch(2);

        scheduler.start(subscription, target -> {
            attempts.incrementAndGet();
            secondAttempt.countDown();
            if (secondAttempt.getCount() == 0) {
                scheduler.stop(target);
            }
            throw new SubscriptionFetchException("unreachable", "TIMEOUT", null);
        });

        assertThat(secondAttempt.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(attempts.get()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void stopWithoutWorkerReturnsFalse() {
        AutoRefreshScheduler scheduler = new AutoRefreshScheduler(
            properties,
            executor,
            new MutableClock(START),
            duration -> { }
        );
        Subscription subscription = Subscription.create("https://example.com/other", null, false, 60);

        assertThat(scheduler.stop(subscription)).isFalse();
        assertThat(scheduler.state(subscription.id())).isEqualTo(RefreshState.STOPPED);
    }
}
