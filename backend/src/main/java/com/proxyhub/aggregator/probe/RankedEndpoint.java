package com.proxyhub.aggregator.probe;

public record RankedEndpoint(String descriptor, long latencyMs, ProbeTier tier) {
}
