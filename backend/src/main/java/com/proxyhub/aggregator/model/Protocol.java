package com.proxyhub.aggregator.model;

import java.util.Locale;

public enum Protocol {
    VMESS("vmess"),
    VLESS("vless"),
    TROJAN("trojan"),
    SS("ss"),
    SSR("ssr"),
    UNKNOWN("unknown");

    private final String scheme;

    Protocol(String scheme) {
        this.scheme = scheme;
    }

    public String scheme() {
        return scheme;
    }

    public String prefix() {
        return scheme + "://";
    }

    public boolean isRecognized() {
        return this != UNKNOWN;
    }

    /**
     * Resolves the protocol from a descriptor's scheme prefix, ignoring case.
     * Never throws; anything unmatched is {@link #UNKNOWN}.
     */
    public static Protocol fromDescriptor(String descriptor) {
        if (descriptor == null) {
            return UNKNOWN;
        }
        String lower = descriptor.trim().toLowerCase(Locale.ROOT);
        for (Protocol protocol : values()) {
            if (protocol.isRecognized() && lower.startsWith(protocol.prefix())) {
                return protocol;
            }
        }
        return UNKNOWN;
    }

    public static Protocol fromName(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        for (Protocol protocol : values()) {
            if (protocol.scheme.equals(lower)) {
                return protocol;
            }
        }
        return UNKNOWN;
    }
}
