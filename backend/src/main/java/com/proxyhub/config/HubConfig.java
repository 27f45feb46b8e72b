package com.proxyhub.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.proxyhub.aggregator.service.RefreshSleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class HubConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(HubProperties properties) {
        int size = Math.max(2, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size, daemonThreads("subscription-http"));
    }

    @Bean(name = "refreshExecutor", destroyMethod = "shutdownNow")
    public ExecutorService refreshExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("subscription-refresh"));
    }

    @Bean(name = "probeTierExecutor", destroyMethod = "shutdownNow")
    public ExecutorService probeTierExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("probe-tier"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RefreshSleeper refreshSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
