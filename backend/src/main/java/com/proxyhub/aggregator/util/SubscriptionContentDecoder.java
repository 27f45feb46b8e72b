package com.proxyhub.aggregator.util;

import com.proxyhub.aggregator.model.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a raw subscription payload into the list of recognized endpoint descriptors.
 */
public class SubscriptionContentDecoder {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionContentDecoder.class);
    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private final int base64MinLength;

    public SubscriptionContentDecoder(int base64MinLength) {
        this.base64MinLength = Math.max(1, base64MinLength);
    }

    /**
     * UTF-8, then UTF-8 with a byte order mark, then ISO-8859-1, which accepts any byte sequence.
     */
    public String decodeText(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return "";
        }
        String text = Base64Support.strictUtf8(payload);
        if (text == null && startsWithBom(payload)) {
            text = Base64Support.strictUtf8(Arrays.copyOfRange(payload, UTF8_BOM.length, payload.length));
        }
        if (text == null) {
            text = new String(payload, StandardCharsets.ISO_8859_1);
        }
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text.trim();
    }

    public boolean looksLikeBase64Blob(String text) {
        if (text == null || text.length() < base64MinLength) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the distinct, trimmed lines that start with a recognized scheme, in feed order.
     * An empty result means the feed carried nothing usable.
     */
    public List<String> extractDescriptors(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String content = text.trim();
        if (looksLikeBase64Blob(content)) {
            byte[] decoded = Base64Support.decode(content);
            String decodedText = decoded == null ? null : Base64Support.strictUtf8(decoded);
            if (decodedText != null) {
                content = decodedText;
            } else {
                log.debug("Payload looked like base64 but did not decode, parsing as plaintext");
            }
        }
        Set<String> descriptors = new LinkedHashSet<>();
        for (String line : content.split("\\r?\\n|\\r")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && isRecognized(trimmed)) {
                descriptors.add(trimmed);
            }
        }
        return new ArrayList<>(descriptors);
    }

    public List<String> decode(byte[] payload) {
        return extractDescriptors(decodeText(payload));
    }

    static boolean isRecognized(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (Protocol protocol : Protocol.values()) {
            if (protocol.isRecognized() && lower.startsWith(protocol.prefix())) {
                return true;
            }
        }
        return false;
    }

    private static boolean startsWithBom(byte[] payload) {
        return payload.length >= UTF8_BOM.length
            && payload[0] == UTF8_BOM[0]
            && payload[1] == UTF8_BOM[1]
            && payload[2] == UTF8_BOM[2];
    }
}
