package com.proxyhub.aggregator.service;

import com.proxyhub.aggregator.model.EndpointFilter;
import com.proxyhub.aggregator.model.EndpointSnapshot;
import com.proxyhub.aggregator.model.FilterResult;
import com.proxyhub.aggregator.probe.CandidateResult;
import com.proxyhub.aggregator.probe.ProbeOrchestrator;
import com.proxyhub.aggregator.probe.ProbeResult;
import com.proxyhub.aggregator.probe.RankedEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Probes the endpoints held by the store and writes every outcome back into their statistics.
 */
@Service
public class EndpointRankingService {
    private static final Logger log = LoggerFactory.getLogger(EndpointRankingService.class);

    private final SubscriptionStore store;
    private final ProbeOrchestrator orchestrator;

    public EndpointRankingService(SubscriptionStore store, ProbeOrchestrator orchestrator) {
        this.store = store;
        this.orchestrator = orchestrator;
    }

    public ProbeResult probeOne(String descriptor, Duration timeout) {
        ProbeResult result = orchestrator.evaluate(descriptor, timeout);
        store.recordProbeResult(descriptor, result);
        return result;
    }

    /**
     * Probes the given descriptors, records each result, and returns the successes ranked by latency.
     */
    public List<RankedEndpoint> rankDescriptors(List<String> descriptors, Duration timeout, boolean parallel, int topN) {
        List<String> distinct = List.copyOf(new LinkedHashSet<>(descriptors));
        List<CandidateResult> results = orchestrator.evaluateAll(distinct, timeout, parallel);
        for (CandidateResult candidate : results) {
            store.recordProbeResult(candidate.descriptor(), candidate.result());
        }
        List<RankedEndpoint> ranked = orchestrator.best(results, topN);
        log.info("Probed {} endpoints, returning top {}", distinct.size(), ranked.size());
        return ranked;
    }

    /**
     * Filters the store, probes the distinct matching descriptors and returns the best {@code topN}.
     */
    public List<RankedEndpoint> rankStore(EndpointFilter filter, Duration timeout, boolean parallel, int topN) {
        FilterResult selection = store.filter(filter);
        if (selection.endpoints().isEmpty()) {
            log.info("No endpoints to rank: {}", selection.message());
            return List.of();
        }
        Set<String> descriptors = new LinkedHashSet<>();
        for (EndpointSnapshot endpoint : selection.endpoints()) {
            descriptors.add(endpoint.descriptor());
        }
        return rankDescriptors(new ArrayList<>(descriptors), timeout, parallel, topN);
    }
}
