package com.proxyhub.aggregator.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.proxyhub.aggregator.model.EndpointRecord;
import com.proxyhub.aggregator.model.EndpointSnapshot;
import com.proxyhub.aggregator.model.Protocol;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointDocument(
    @JsonProperty("config_string") String configString,
    @JsonProperty("protocol") String protocol,
    @JsonProperty("name") String name,
    @JsonProperty("address") String address,
    @JsonProperty("port") Integer port,
    @JsonProperty("last_test_time") Long lastTestTime,
    @JsonProperty("last_latency") Long lastLatency,
    @JsonProperty("success_count") Long successCount,
    @JsonProperty("failure_count") Long failureCount,
    @JsonProperty("tags") List<String> tags
) {
    static EndpointDocument from(EndpointSnapshot snapshot) {
        return new EndpointDocument(
            snapshot.descriptor(),
            snapshot.protocol().scheme(),
            snapshot.name(),
            snapshot.address(),
            snapshot.port(),
            snapshot.lastTestTime(),
            snapshot.lastLatency(),
            snapshot.successCount(),
            snapshot.failureCount(),
            List.copyOf(snapshot.tags())
        );
    }

    EndpointRecord toRecord() {
        if (configString == null || configString.isBlank()) {
            throw new IllegalArgumentException("Endpoint entry without config_string");
        }
        EndpointRecord parsed = EndpointRecord.parse(configString);
        Protocol storedProtocol = Protocol.fromName(protocol);
        return EndpointRecord.restore(
            configString,
            storedProtocol.isRecognized() ? storedProtocol : parsed.protocol(),
            name == null || name.isBlank() ? parsed.name() : name,
            address == null || address.isBlank() ? parsed.address() : address,
            port == null ? parsed.port() : port,
            lastTestTime == null ? 0L : lastTestTime,
            lastLatency == null ? EndpointRecord.UNTESTED_LATENCY : lastLatency,
            successCount == null ? 0L : successCount,
            failureCount == null ? 0L : failureCount,
            tags
        );
    }
}
