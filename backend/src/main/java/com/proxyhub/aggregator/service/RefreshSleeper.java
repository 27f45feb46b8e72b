package com.proxyhub.aggregator.service;

import java.time.Duration;

/**
 * Blocks the calling auto-refresh worker for one tick. Replaced by a virtual clock in tests.
 */
@FunctionalInterface
public interface RefreshSleeper {
    void sleep(Duration duration) throws InterruptedException;
}
