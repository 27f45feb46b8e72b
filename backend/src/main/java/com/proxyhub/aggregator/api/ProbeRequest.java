package com.proxyhub.aggregator.api;

public record ProbeRequest(String descriptor, Integer timeoutSeconds) {
}
