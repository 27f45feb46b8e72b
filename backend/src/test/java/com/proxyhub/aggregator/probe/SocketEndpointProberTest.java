package com.proxyhub.aggregator.probe;

import com.proxyhub.aggregator.util.ReasonCodeClassifier;
import com.proxyhub.config.HubProperties;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SocketEndpointProberTest {

    private final SocketEndpointProber prober = new SocketEndpointProber(new HubProperties());

    @Test
    void fullProbeReportsMissingEngine() {
        FullProbeReport report = prober.fullProbe("vless://user@127.0.0.1:443#A", 1);

        assertThat(report.success()).isFalse();
        assertThat(report.errorType()).isEqualTo(ReasonCodeClassifier.ENGINE_UNAVAILABLE);
    }

    @Test
    void connectsToListeningSocket() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 10, InetAddress.getLoopbackAddress())) {
            String descriptor = "trojan://secret@127.0.0.1:" + server.getLocalPort() + "#Local";

            QuickProbeReport quick = prober.quickProbe(descriptor, Duration.ofSeconds(2));
            long raw = prober.rawConnectivityTest(descriptor, Duration.ofSeconds(2));

            assertThat(quick.success()).isTrue();
            assertThat(quick.totalMs()).isGreaterThanOrEqualTo(1);
            assertThat(raw).isPositive();
        }
    }

    @Test
    void unusableDescriptorFailsAsParsingFailure() {
        ProbeException error = catchThrowableOfType(
            () -> prober.rawConnectivityTest("vless://", Duration.ofSeconds(1)),
            ProbeException.class
        );

        assertThat(error.errorType()).isEqualTo(ReasonCodeClassifier.PARSING_FAILED);
        assertThat(prober.quickProbe("").errorType()).isEqualTo(ReasonCodeClassifier.PARSING_FAILED);
    }

    @Test
    void quickProbeHonoursCallerTimeoutOverConfiguredTierTimeout() {
        HubProperties properties = new HubProperties();
        properties.getProbe().setTierTimeoutSeconds(30);
        SocketEndpointProber slowConfigured = new SocketEndpointProber(properties);

        long startedAt = System.nanoTime();
        QuickProbeReport report = slowConfigured.quickProbe("vless://u@10.255.255.1:443#Blackhole", Duration.ofMillis(200));

        assertThat(report.success()).isFalse();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt)).isLessThan(5_000);
    }
}
