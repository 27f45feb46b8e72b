package com.proxyhub.aggregator.api;

import java.util.List;

public record BatchProbeRequest(
    List<String> descriptors,
    Integer timeoutSeconds,
    Boolean parallel,
    Integer topN
) {
}
