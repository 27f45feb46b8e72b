package com.proxyhub.aggregator.util;

import com.proxyhub.aggregator.model.Protocol;

public record ParsedDescriptor(Protocol protocol, String address, int port, String name) {
}
