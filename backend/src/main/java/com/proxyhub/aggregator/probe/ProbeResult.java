package com.proxyhub.aggregator.probe;

import com.proxyhub.aggregator.model.EndpointRecord;

/**
 * Normalized outcome of evaluating one endpoint. A failure carries latency -1 and the
 * classification of the last tier attempted; a success always carries at least 1 ms.
 */
public record ProbeResult(
    boolean success,
    long latencyMs,
    Integer totalMs,
    Integer dnsMs,
    Integer tcpMs,
    Integer ttfbMs,
    Double score,
    String errorType,
    ProbeTier tier
) {
    public static ProbeResult failure(String errorType, ProbeTier tier) {
        return new ProbeResult(false, EndpointRecord.UNTESTED_LATENCY, null, null, null, null, null, errorType, tier);
    }

    public static ProbeResult fromFull(FullProbeReport report) {
        long latency = report.ttfbMs() != null && report.ttfbMs() > 0
            ? report.ttfbMs()
            : measured(report.totalMs());
        return new ProbeResult(
            true,
            latency,
            report.totalMs(),
            report.dnsMs(),
            report.tcpMs(),
            report.ttfbMs(),
            report.score(),
            null,
            ProbeTier.FULL
        );
    }

    public static ProbeResult fromQuick(QuickProbeReport report) {
        long latency = measured(report.totalMs());
        return new ProbeResult(
            true,
            latency,
            report.totalMs(),
            report.dnsMs(),
            report.tcpMs(),
            null,
            null,
            null,
            ProbeTier.QUICK
        );
    }

    public static ProbeResult fromRaw(long latencyMs) {
        long latency = latencyMs < 0 ? EndpointRecord.UNTESTED_LATENCY : Math.max(1, latencyMs);
        int total = (int) Math.min(Integer.MAX_VALUE, latencyMs);
        return new ProbeResult(true, latency, total, null, null, null, null, null, ProbeTier.RAW);
    }

    private static long measured(Integer totalMs) {
        if (totalMs == null || totalMs < 0) {
            return EndpointRecord.UNTESTED_LATENCY;
        }
        return Math.max(1, totalMs);
    }
}
