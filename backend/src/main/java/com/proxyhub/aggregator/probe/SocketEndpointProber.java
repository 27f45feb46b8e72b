package com.proxyhub.aggregator.probe;

import com.proxyhub.aggregator.util.DescriptorParser;
import com.proxyhub.aggregator.util.ParsedDescriptor;
import com.proxyhub.aggregator.util.ReasonCodeClassifier;
import com.proxyhub.config.HubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.time.Duration;

/**
 * Default prober that talks to the endpoint's address directly. It has no tunnel engine, so the
 * full round trip always reports {@code ENGINE_UNAVAILABLE} and evaluation falls through to the
 * socket-level tiers.
 */
@Component
public class SocketEndpointProber implements EndpointProber {
    private static final Logger log = LoggerFactory.getLogger(SocketEndpointProber.class);

    private final HubProperties properties;

    public SocketEndpointProber(HubProperties properties) {
        this.properties = properties;
    }

    @Override
    public FullProbeReport fullProbe(String descriptor, int attempts) {
        return FullProbeReport.failed(ReasonCodeClassifier.ENGINE_UNAVAILABLE);
    }

    @Override
    public QuickProbeReport quickProbe(String descriptor) {
        return quickProbe(descriptor, Duration.ofSeconds(properties.getProbe().getTierTimeoutSeconds()));
    }

    @Override
    public QuickProbeReport quickProbe(String descriptor, Duration timeout) {
        ParsedDescriptor parsed = DescriptorParser.parse(descriptor);
        if (!isAddressable(parsed)) {
            return QuickProbeReport.failed(ReasonCodeClassifier.PARSING_FAILED);
        }
        long startedAt = System.nanoTime();
        InetAddress resolved;
        try {
            resolved = InetAddress.getByName(parsed.address());
        } catch (UnknownHostException e) {
            return QuickProbeReport.failed(ReasonCodeClassifier.DNS_FAILURE);
        }
        long resolvedAt = System.nanoTime();
        int timeoutMs = connectTimeoutMillis(timeout);
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(resolved, parsed.port()), timeoutMs);
        } catch (IOException e) {
            log.debug("Quick probe connect to {}:{} failed: {}", parsed.address(), parsed.port(), e.getMessage());
            return QuickProbeReport.failed(ReasonCodeClassifier.fromException(e));
        }
        long connectedAt = System.nanoTime();
        return new QuickProbeReport(
            true,
            Math.max(1, millisBetween(startedAt, connectedAt)),
            millisBetween(startedAt, resolvedAt),
            millisBetween(resolvedAt, connectedAt),
            null
        );
    }

    @Override
    public long rawConnectivityTest(String descriptor, Duration timeout) throws ProbeException {
        ParsedDescriptor parsed = DescriptorParser.parse(descriptor);
        if (!isAddressable(parsed)) {
            throw new ProbeException(ReasonCodeClassifier.PARSING_FAILED, "Descriptor has no usable address");
        }
        long startedAt = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(parsed.address(), parsed.port()), connectTimeoutMillis(timeout));
        } catch (IOException e) {
            throw new ProbeException(
                ReasonCodeClassifier.fromException(e),
                "Connect to " + parsed.address() + ":" + parsed.port() + " failed",
                e
            );
        }
        return Math.max(1, millisBetween(startedAt, System.nanoTime()));
    }

    private static int connectTimeoutMillis(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return 1;
        }
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    }

    private boolean isAddressable(ParsedDescriptor parsed) {
        return !DescriptorParser.UNKNOWN_ADDRESS.equals(parsed.address());
    }

    private static int millisBetween(long fromNanos, long toNanos) {
        return (int) Math.max(0, (toNanos - fromNanos) / 1_000_000L);
    }
}
