package com.proxyhub.aggregator.probe;

import java.time.Duration;

/**
 * Measures one endpoint descriptor. Implementations bound their own work; callers still apply
 * an outer timeout per call.
 */
public interface EndpointProber {

    /**
     * Full round trip through the candidate, measuring time to first byte.
     */
    FullProbeReport fullProbe(String descriptor, int attempts);

    /**
     * DNS resolution plus TCP connect against the candidate's address.
     */
    QuickProbeReport quickProbe(String descriptor);

    /**
     * Quick probe whose connect is bounded by {@code timeout}. The default ignores the bound.
     */
    default QuickProbeReport quickProbe(String descriptor, Duration timeout) {
        return quickProbe(descriptor);
    }

    /**
     * Last-resort reachability check.
     *
     * @return latency in milliseconds
     * @throws ProbeException when the candidate is unreachable
     */
    long rawConnectivityTest(String descriptor, Duration timeout) throws ProbeException;
}
