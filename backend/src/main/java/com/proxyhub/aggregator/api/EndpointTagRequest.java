package com.proxyhub.aggregator.api;

import java.util.List;

public record EndpointTagRequest(String descriptor, List<String> tags) {
}
