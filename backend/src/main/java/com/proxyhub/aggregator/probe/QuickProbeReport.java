package com.proxyhub.aggregator.probe;

public record QuickProbeReport(
    boolean success,
    Integer totalMs,
    Integer dnsMs,
    Integer tcpMs,
    String errorType
) {
    public static QuickProbeReport failed(String errorType) {
        return new QuickProbeReport(false, null, null, null, errorType);
    }
}
