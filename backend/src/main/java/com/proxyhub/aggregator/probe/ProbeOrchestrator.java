package com.proxyhub.aggregator.probe;

import com.proxyhub.aggregator.util.ReasonCodeClassifier;
import com.proxyhub.config.HubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates endpoints with the full, quick and raw tiers in turn, stopping at the first success,
 * and ranks batches of candidates by measured latency.
 */
@Service
public class ProbeOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ProbeOrchestrator.class);
    private static final AtomicInteger BATCH_COUNTER = new AtomicInteger();

    private final HubProperties properties;
    private final EndpointProber prober;
    private final ExecutorService tierExecutor;

    public ProbeOrchestrator(
        HubProperties properties,
        EndpointProber prober,
        @Qualifier("probeTierExecutor") ExecutorService tierExecutor
    ) {
        this.properties = properties;
        this.prober = prober;
        this.tierExecutor = tierExecutor;
    }

    public Duration defaultTimeout() {
        return Duration.ofSeconds(properties.getProbe().getTierTimeoutSeconds());
    }

    /**
     * Evaluates one endpoint. Never throws for an unreachable candidate: the result is a failure
     * with latency -1 and the last tier's error type.
     *
     * @param timeout bound applied to each tier independently
     */
    public ProbeResult evaluate(String descriptor, Duration timeout) {
        Duration tierTimeout = safeTimeout(timeout);
        int attempts = properties.getProbe().getFullProbeAttempts();

        ProbeResult full = runTier(ProbeTier.FULL, tierTimeout, () -> {
            FullProbeReport report = prober.fullProbe(descriptor, attempts);
            if (report == null || !report.success()) {
                return ProbeResult.failure(errorTypeOf(report == null ? null : report.errorType()), ProbeTier.FULL);
            }
            return ProbeResult.fromFull(report);
        });
        if (full.success() || isInterrupted(full)) {
            return full;
        }
        log.debug("Full probe failed for endpoint ({}), trying quick probe", full.errorType());

        ProbeResult quick = runTier(ProbeTier.QUICK, tierTimeout, () -> {
            QuickProbeReport report = prober.quickProbe(descriptor, tierTimeout);
            if (report == null || !report.success()) {
                return ProbeResult.failure(errorTypeOf(report == null ? null : report.errorType()), ProbeTier.QUICK);
            }
            return ProbeResult.fromQuick(report);
        });
        if (quick.success() || isInterrupted(quick)) {
            return quick;
        }
        log.debug("Quick probe failed for endpoint ({}), trying raw connectivity test", quick.errorType());

        ProbeResult raw = runTier(ProbeTier.RAW, tierTimeout, () -> {
            try {
                return ProbeResult.fromRaw(prober.rawConnectivityTest(descriptor, tierTimeout));
            } catch (ProbeException e) {
                return ProbeResult.failure(errorTypeOf(e.errorType()), ProbeTier.RAW);
            }
        });
        if (!raw.success()) {
            log.debug("All probe tiers failed for endpoint, last error {}", raw.errorType());
        }
        return raw;
    }

    /**
     * Evaluates every candidate and returns one result per input, in input order.
     */
    public List<CandidateResult> evaluateAll(List<String> descriptors, Duration timeout, boolean parallel) {
        if (descriptors == null || descriptors.isEmpty()) {
            return List.of();
        }
        if (!parallel || descriptors.size() == 1) {
            List<CandidateResult> results = new ArrayList<>(descriptors.size());
            for (int i = 0; i < descriptors.size(); i++) {
                results.add(new CandidateResult(descriptors.get(i), i, evaluate(descriptors.get(i), timeout)));
            }
            return results;
        }

        int poolSize = Math.min(properties.getProbe().getMaxWorkers(), descriptors.size());
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, batchThreads());
        try {
            List<Future<ProbeResult>> futures = new ArrayList<>(descriptors.size());
            for (String descriptor : descriptors) {
                futures.add(pool.submit(() -> evaluate(descriptor, timeout)));
            }
            List<CandidateResult> results = new ArrayList<>(descriptors.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(new CandidateResult(descriptors.get(i), i, await(futures.get(i))));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Successful candidates sorted ascending by latency. Equal latencies keep input order.
     */
    public List<RankedEndpoint> rank(List<CandidateResult> results) {
        if (results == null || results.isEmpty()) {
            return List.of();
        }
        List<CandidateResult> successes = new ArrayList<>();
        for (CandidateResult candidate : results) {
            if (candidate.result().success()) {
                successes.add(candidate);
            }
        }
        successes.sort(Comparator.comparingLong(candidate -> candidate.result().latencyMs()));
        List<RankedEndpoint> ranked = new ArrayList<>(successes.size());
        for (CandidateResult candidate : successes) {
            ranked.add(new RankedEndpoint(
                candidate.descriptor(),
                candidate.result().latencyMs(),
                candidate.result().tier()
            ));
        }
        log.info("Ranked {} of {} candidates", ranked.size(), results.size());
        return ranked;
    }

    /**
     * The first {@code topN} of {@link #rank(List)}.
     */
    public List<RankedEndpoint> best(List<CandidateResult> results, int topN) {
        List<RankedEndpoint> ranked = rank(results);
        int limit = Math.max(0, Math.min(topN, ranked.size()));
        return List.copyOf(ranked.subList(0, limit));
    }

    private ProbeResult runTier(ProbeTier tier, Duration timeout, Callable<ProbeResult> call) {
        Future<ProbeResult> future;
        try {
            future = tierExecutor.submit(call);
        } catch (RejectedExecutionException e) {
            return ProbeResult.failure(ReasonCodeClassifier.ENGINE_UNAVAILABLE, tier);
        }
        try {
            ProbeResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ProbeResult.failure(ReasonCodeClassifier.UNKNOWN, tier);
            }
            if (result.success() && result.latencyMs() < 0) {
                return ProbeResult.failure(ReasonCodeClassifier.UNKNOWN, tier);
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            return ProbeResult.failure(ReasonCodeClassifier.TIMEOUT, tier);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.debug("{} probe tier raised {}", tier, cause.toString());
            return ProbeResult.failure(ReasonCodeClassifier.fromException(cause), tier);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ProbeResult.failure(ReasonCodeClassifier.INTERRUPTED, tier);
        }
    }

    private ProbeResult await(Future<ProbeResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return ProbeResult.failure(ReasonCodeClassifier.fromException(cause), ProbeTier.RAW);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ProbeResult.failure(ReasonCodeClassifier.INTERRUPTED, ProbeTier.RAW);
        }
    }

    private boolean isInterrupted(ProbeResult result) {
        return ReasonCodeClassifier.INTERRUPTED.equals(result.errorType()) && Thread.currentThread().isInterrupted();
    }

    private Duration safeTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return defaultTimeout();
        }
        return timeout;
    }

    private static String errorTypeOf(String reported) {
        return ReasonCodeClassifier.normalize(reported);
    }

    private static ThreadFactory batchThreads() {
        int batch = BATCH_COUNTER.incrementAndGet();
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("probe-batch-" + batch + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
