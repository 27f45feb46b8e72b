package com.proxyhub.aggregator.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

public final class Base64Support {
    private static final Pattern BASE64_CHARS = Pattern.compile("[A-Za-z0-9+/_=-]+");

    private Base64Support() {
    }

    public static String pad(String value) {
        int remainder = value.length() % 4;
        return remainder == 0 ? value : value + "=".repeat(4 - remainder);
    }

    public static boolean looksLikeBase64(String value) {
        return value != null && !value.isEmpty() && BASE64_CHARS.matcher(value).matches();
    }

    /**
     * Decodes with the standard alphabet, then the URL-safe one. Returns null when neither works.
     */
    public static byte[] decode(String value) {
        if (!looksLikeBase64(value)) {
            return null;
        }
        String padded = pad(value);
        try {
            return Base64.getDecoder().decode(padded);
        } catch (IllegalArgumentException standardFailure) {
            try {
                return Base64.getUrlDecoder().decode(padded);
            } catch (IllegalArgumentException urlSafeFailure) {
                return null;
            }
        }
    }

    /**
     * Decodes base64 and requires the bytes to be well-formed UTF-8 without control characters,
     * so that plain words that happen to be valid base64 are not mangled.
     */
    public static String decodeUtf8(String value) {
        byte[] bytes = decode(value);
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        String text = strictUtf8(bytes);
        if (text == null) {
            return null;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t') {
                return null;
            }
        }
        return text;
    }

    public static String strictUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
