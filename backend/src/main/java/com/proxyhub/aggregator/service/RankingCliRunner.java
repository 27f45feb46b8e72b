package com.proxyhub.aggregator.service;

import com.proxyhub.aggregator.model.EndpointFilter;
import com.proxyhub.aggregator.model.UpdateOutcome;
import com.proxyhub.aggregator.probe.RankedEndpoint;
import com.proxyhub.config.HubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Component
public class RankingCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(RankingCliRunner.class);

    private final HubProperties properties;
    private final SubscriptionStore store;
    private final EndpointRankingService rankingService;
    private final ConfigurableApplicationContext applicationContext;

    public RankingCliRunner(
        HubProperties properties,
        SubscriptionStore store,
        EndpointRankingService rankingService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.store = store;
        this.rankingService = rankingService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        if (properties.getCli().isUpdateBeforeRank()) {
            Map<String, UpdateOutcome> outcomes = store.updateAll(store.defaultFetchTimeout());
            outcomes.forEach((id, outcome) -> log.info(
                "Update {}: status={}, endpoints={}, reason={}",
                id,
                outcome.status(),
                outcome.endpointCount(),
                outcome.reasonCode()
            ));
        }

        List<RankedEndpoint> best = rankingService.rankStore(
            EndpointFilter.none(),
            Duration.ofSeconds(properties.getProbe().getTierTimeoutSeconds()),
            properties.getCli().isParallel(),
            properties.getCli().getTopN()
        );
        log.info("Best {} endpoints:", best.size());
        for (int i = 0; i < best.size(); i++) {
            RankedEndpoint endpoint = best.get(i);
            log.info("#{} {}ms via {} probe: {}", i + 1, endpoint.latencyMs(), endpoint.tier(), endpoint.descriptor());
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
