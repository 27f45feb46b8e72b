package com.proxyhub.aggregator.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionContentDecoderTest {
    private final SubscriptionContentDecoder decoder = new SubscriptionContentDecoder(16);

    @Test
    void decodesBase64FeedAndDropsUnrecognizedLines() {
        String feed = "vless://user@host:443#NodeA\nvmess://abc@host2:8443#NodeB\ngarbage-line";
        byte[] payload = Base64.getEncoder().encode(feed.getBytes(StandardCharsets.UTF_8));

        assertThat(decoder.decode(payload))
            .containsExactly("vless://user@host:443#NodeA", "vmess://abc@host2:8443#NodeB");
    }

    @Test
    void plaintextFeedIsTrimmedAndDeduplicatedInOrder() {
        String feed = "  trojan://a@b:1#One \r\nVLESS://x@y:2#Two\r\n\r\ntrojan://a@b:1#One\nhttps://not-a-descriptor\n";

        List<String> descriptors = decoder.decode(feed.getBytes(StandardCharsets.UTF_8));

        assertThat(descriptors).containsExactly("trojan://a@b:1#One", "VLESS://x@y:2#Two");
    }

    @Test
    void feedWithoutDescriptorsYieldsEmptyList() {
        assertThat(decoder.decode("not a config".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(decoder.decode(new byte[0])).isEmpty();
    }

    @Test
    void stripsByteOrderMark() {
        byte[] body = "\uFEFFss://YWVzOnB3QGhvc3Q6MQ#Bom".getBytes(StandardCharsets.UTF_8);

        assertThat(decoder.decode(body)).containsExactly("ss://YWVzOnB3QGhvc3Q6MQ#Bom");
    }

    @Test
    void fallsBackToLatin1ForInvalidUtf8() {
        byte[] body = "vless://u@h:1#Café\n".getBytes(StandardCharsets.ISO_8859_1);

        assertThat(decoder.decode(body)).containsExactly("vless://u@h:1#Café");
    }

    @Test
    void shortWhitespaceFreeTextIsNotTreatedAsBase64() {
        assertThat(decoder.looksLikeBase64Blob("dmxlc3M6")).isFalse();
        assertThat(decoder.looksLikeBase64Blob("abc def ghi jkl mno")).isFalse();
        assertThat(decoder.looksLikeBase64Blob("dmxlc3M6Ly91QGg6MQ==")).isTrue();
    }
}
