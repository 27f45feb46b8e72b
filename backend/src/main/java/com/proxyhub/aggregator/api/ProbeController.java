package com.proxyhub.aggregator.api;

import com.proxyhub.aggregator.model.EndpointFilter;
import com.proxyhub.aggregator.probe.ProbeResult;
import com.proxyhub.aggregator.probe.RankedEndpoint;
import com.proxyhub.aggregator.service.EndpointRankingService;
import com.proxyhub.aggregator.service.SubscriptionValidationException;
import com.proxyhub.config.HubProperties;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api")
public class ProbeController {
    private final EndpointRankingService rankingService;
    private final HubProperties properties;

    public ProbeController(EndpointRankingService rankingService, HubProperties properties) {
        this.rankingService = rankingService;
        this.properties = properties;
    }

    @PostMapping("/probe")
    public ProbeResult probe(@RequestBody ProbeRequest request) {
        if (request.descriptor() == null || request.descriptor().isBlank()) {
            throw new SubscriptionValidationException("descriptor is required");
        }
        return rankingService.probeOne(request.descriptor().trim(), timeout(request.timeoutSeconds()));
    }

    @PostMapping("/probe/batch")
    public List<RankedEndpoint> probeBatch(@RequestBody BatchProbeRequest request) {
        if (request.descriptors() == null || request.descriptors().isEmpty()) {
            throw new SubscriptionValidationException("descriptors must not be empty");
        }
        List<String> descriptors = request.descriptors().stream()
            .filter(descriptor -> descriptor != null && !descriptor.isBlank())
            .map(String::trim)
            .toList();
        return rankingService.rankDescriptors(
            descriptors,
            timeout(request.timeoutSeconds()),
            request.parallel() == null || request.parallel(),
            topN(request.topN(), descriptors.size())
        );
    }

    @PostMapping("/endpoints/rank")
    public List<RankedEndpoint> rankStore(@RequestBody(required = false) RankRequest request) {
        RankRequest safe = request == null
            ? new RankRequest(null, null, null, null, null, null, null, null, null)
            : request;
        EndpointFilter filter = new EndpointFilter(
            safe.protocols(),
            safe.minSuccessRate(),
            safe.maxLatency(),
            safe.subscriptionTags(),
            safe.configTags(),
            safe.nameContains()
        );
        return rankingService.rankStore(
            filter,
            timeout(safe.timeoutSeconds()),
            safe.parallel() == null || safe.parallel(),
            topN(safe.topN(), properties.getProbe().getDefaultTopN())
        );
    }

    private Duration timeout(Integer timeoutSeconds) {
        int seconds = timeoutSeconds == null || timeoutSeconds <= 0
            ? properties.getProbe().getTierTimeoutSeconds()
            : timeoutSeconds;
        return Duration.ofSeconds(seconds);
    }

    private int topN(Integer requested, int fallback) {
        return requested == null ? fallback : Math.max(0, requested);
    }
}
