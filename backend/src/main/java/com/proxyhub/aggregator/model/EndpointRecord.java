package com.proxyhub.aggregator.model;

import com.proxyhub.aggregator.util.DescriptorParser;
import com.proxyhub.aggregator.util.ParsedDescriptor;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One endpoint descriptor from a subscription feed plus its rolling test statistics.
 * The raw descriptor is the identity; everything else is derived from it or mutated by tests.
 */
public class EndpointRecord {
    public static final int DEFAULT_PORT = 443;
    public static final long UNTESTED_LATENCY = -1L;

    private final String descriptor;
    private final Protocol protocol;
    private final String name;
    private final String address;
    private final int port;

    private long lastTestTime;
    private long lastLatency = UNTESTED_LATENCY;
    private long successCount;
    private long failureCount;
    private final Set<String> tags = new LinkedHashSet<>();

    private EndpointRecord(String descriptor, Protocol protocol, String name, String address, int port) {
        this.descriptor = descriptor;
        this.protocol = protocol;
        this.name = name;
        this.address = address;
        this.port = port;
    }

    public static EndpointRecord parse(String descriptor) {
        ParsedDescriptor parsed = DescriptorParser.parse(descriptor);
        return new EndpointRecord(
            descriptor == null ? "" : descriptor,
            parsed.protocol(),
            parsed.name(),
            parsed.address(),
            parsed.port()
        );
    }

    public static EndpointRecord restore(
        String descriptor,
        Protocol protocol,
        String name,
        String address,
        int port,
        long lastTestTime,
        long lastLatency,
        long successCount,
        long failureCount,
        Collection<String> tags
    ) {
        EndpointRecord record = new EndpointRecord(descriptor, protocol, name, address, port);
        record.lastTestTime = Math.max(0, lastTestTime);
        record.lastLatency = lastLatency;
        record.successCount = Math.max(0, successCount);
        record.failureCount = Math.max(0, failureCount);
        if (tags != null) {
            record.tags.addAll(tags);
        }
        return record;
    }

    public String descriptor() {
        return descriptor;
    }

    public Protocol protocol() {
        return protocol;
    }

    public String name() {
        return name;
    }

    public String address() {
        return address;
    }

    public int port() {
        return port;
    }

    /**
     * Key used by {@link MergeStrategy#ENDPOINT_IDENTITY}.
     */
    public String identityKey() {
        return protocol.scheme() + "|" + address + "|" + port + "|" + name;
    }

    public synchronized void recordSuccess(long latencyMs, long testedAtEpochSeconds) {
        successCount++;
        lastLatency = latencyMs;
        lastTestTime = testedAtEpochSeconds;
    }

    public synchronized void recordFailure(long testedAtEpochSeconds) {
        failureCount++;
        lastLatency = UNTESTED_LATENCY;
        lastTestTime = testedAtEpochSeconds;
    }

    public synchronized void addTags(Collection<String> newTags) {
        if (newTags == null) {
            return;
        }
        for (String tag : newTags) {
            if (tag != null && !tag.isBlank()) {
                tags.add(tag.trim());
            }
        }
    }

    public void copyHistoryFrom(EndpointRecord previous) {
        if (previous == null || previous == this) {
            return;
        }
        EndpointSnapshot history = previous.snapshot(null);
        synchronized (this) {
            lastTestTime = history.lastTestTime();
            lastLatency = history.lastLatency();
            successCount = Math.max(successCount, history.successCount());
            failureCount = Math.max(failureCount, history.failureCount());
            tags.addAll(history.tags());
        }
    }

    public synchronized EndpointSnapshot snapshot(String subscriptionId) {
        return new EndpointSnapshot(
            subscriptionId,
            descriptor,
            protocol,
            name,
            address,
            port,
            lastTestTime,
            lastLatency,
            successCount,
            failureCount,
            Collections.unmodifiableSet(new LinkedHashSet<>(tags))
        );
    }
}
