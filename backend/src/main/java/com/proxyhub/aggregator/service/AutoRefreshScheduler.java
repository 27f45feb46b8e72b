package com.proxyhub.aggregator.service;

import com.proxyhub.aggregator.model.RefreshState;
import com.proxyhub.aggregator.model.Subscription;
import com.proxyhub.config.HubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Owns the background refresh workers, at most one per subscription.
 * Workers stop cooperatively: the flag is checked on every one-second tick.
 */
@Service
public class AutoRefreshScheduler {
    private static final Logger log = LoggerFactory.getLogger(AutoRefreshScheduler.class);
    private static final Duration TICK = Duration.ofSeconds(1);

    private final HubProperties properties;
    private final ExecutorService refreshExecutor;
    private final Clock clock;
    private final RefreshSleeper sleeper;
    private final Map<String, RefreshWorker> workers = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();

    public AutoRefreshScheduler(
        HubProperties properties,
        @Qualifier("refreshExecutor") ExecutorService refreshExecutor,
        Clock clock,
        RefreshSleeper sleeper
    ) {
        this.properties = properties;
        this.refreshExecutor = refreshExecutor;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Starts a worker for the subscription. Returns false when one is already live.
     */
    public boolean start(Subscription subscription, Consumer<Subscription> refreshAction) {
        synchronized (lifecycleLock) {
            subscription.setAutoUpdate(true);
            RefreshWorker existing = workers.get(subscription.id());
            if (existing != null) {
                if (existing.revive()) {
                    log.info("Auto-update already running for subscription {}", subscription.name());
                    return false;
                }
                workers.remove(subscription.id(), existing);
            }
            RefreshWorker worker = new RefreshWorker(subscription, refreshAction);
            workers.put(subscription.id(), worker);
            try {
                refreshExecutor.execute(worker);
            } catch (RejectedExecutionException e) {
                workers.remove(subscription.id(), worker);
                throw new IllegalStateException("Refresh executor is shut down", e);
            }
            log.info(
                "Started auto-update for subscription {} (interval: {}s)",
                subscription.name(),
                subscription.updateIntervalSeconds()
            );
            return true;
        }
    }

    /**
     * Signals the worker to stop; it exits within one tick. Returns false when nothing was running.
     */
    public boolean stop(Subscription subscription) {
        synchronized (lifecycleLock) {
            subscription.setAutoUpdate(false);
            RefreshWorker worker = workers.get(subscription.id());
            if (worker == null || !worker.requestStop()) {
                return false;
            }
            log.info("Stopped auto-update for subscription {}", subscription.name());
            return true;
        }
    }

    public RefreshState state(String subscriptionId) {
        RefreshWorker worker = workers.get(subscriptionId);
        return worker != null && !worker.isTerminated() ? RefreshState.RUNNING : RefreshState.STOPPED;
    }

    public int liveWorkerCount() {
        int count = 0;
        for (RefreshWorker worker : workers.values()) {
            if (!worker.isTerminated()) {
                count++;
            }
        }
        return count;
    }

    @PreDestroy
    public void stopAll() {
        synchronized (lifecycleLock) {
            for (RefreshWorker worker : List.copyOf(workers.values())) {
                worker.requestStop();
            }
        }
    }

    private final class RefreshWorker implements Runnable {
        private final Subscription subscription;
        private final Consumer<Subscription> refreshAction;
        private volatile boolean stopRequested;
        private boolean terminated;

        private RefreshWorker(Subscription subscription, Consumer<Subscription> refreshAction) {
            this.subscription = subscription;
            this.refreshAction = refreshAction;
        }

        @Override
        public void run() {
            try {
                while (shouldContinue()) {
                    if (isDue()) {
                        refreshQuietly();
                    }
                    long ticks = Math.min(
                        subscription.updateIntervalSeconds(),
                        properties.getSubscription().getRefreshMaxSleepSeconds()
                    );
                    for (long tick = 0; tick < ticks && !stopRequested; tick++) {
                        sleeper.sleep(TICK);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                markTerminated();
                workers.remove(subscription.id(), this);
                log.debug("Auto-update worker exited for subscription {}", subscription.name());
            }
        }

        private boolean isDue() {
            long now = clock.instant().getEpochSecond();
            return now - subscription.lastUpdateTime() >= subscription.updateIntervalSeconds();
        }

        private void refreshQuietly() {
            try {
                refreshAction.accept(subscription);
            } catch (RuntimeException e) {
                log.error("Auto-update failed for {}: {}", subscription.name(), e.getMessage());
            }
        }

        private synchronized boolean shouldContinue() {
            if (stopRequested) {
                terminated = true;
                return false;
            }
            return true;
        }

        private synchronized boolean revive() {
            if (terminated) {
                return false;
            }
            stopRequested = false;
            return true;
        }

        private synchronized boolean requestStop() {
            if (terminated || stopRequested) {
                return false;
            }
            stopRequested = true;
            return true;
        }

        private synchronized void markTerminated() {
            terminated = true;
        }

        private synchronized boolean isTerminated() {
            return terminated;
        }
    }
}
