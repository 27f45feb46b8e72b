package com.proxyhub.aggregator.probe;

/**
 * Application-level round trip through a candidate. Timings are null when the prober did not reach that phase.
 */
public record FullProbeReport(
    boolean success,
    Integer totalMs,
    Integer dnsMs,
    Integer tcpMs,
    Integer ttfbMs,
    Double score,
    String errorType
) {
    public static FullProbeReport failed(String errorType) {
        return new FullProbeReport(false, null, null, null, null, null, errorType);
    }
}
