package com.proxyhub.aggregator.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxyhub.aggregator.model.EndpointRecord;
import com.proxyhub.aggregator.model.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one endpoint descriptor into protocol, address, port and display name.
 * Parsing is total: feeds are untrusted, so malformed input degrades to placeholder values.
 */
public final class DescriptorParser {
    private static final Logger log = LoggerFactory.getLogger(DescriptorParser.class);

    public static final String UNKNOWN_ADDRESS = "unknown";
    public static final String UNNAMED = "Unnamed";

    private static final Pattern REMARK_PARAM = Pattern.compile("[?&]remarks?=([^&#]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOST_CHARS = Pattern.compile("[A-Za-z0-9._-]+");
    private static final Pattern IPV6_CHARS = Pattern.compile("[0-9A-Fa-f:.%]+");
    private static final ObjectMapper JSON = new ObjectMapper();

    private DescriptorParser() {
    }

    public static ParsedDescriptor parse(String descriptor) {
        Protocol protocol = Protocol.fromDescriptor(descriptor);
        if (descriptor == null || descriptor.isBlank()) {
            return new ParsedDescriptor(protocol, UNKNOWN_ADDRESS, EndpointRecord.DEFAULT_PORT, UNNAMED);
        }
        try {
            return parseDescriptor(descriptor.trim(), protocol);
        } catch (RuntimeException e) {
            log.debug("Descriptor could not be parsed, using placeholders: {}", e.getMessage());
            return new ParsedDescriptor(protocol, UNKNOWN_ADDRESS, EndpointRecord.DEFAULT_PORT, UNNAMED);
        }
    }

    private static ParsedDescriptor parseDescriptor(String raw, Protocol protocol) {
        String body = stripScheme(raw);
        int hashIndex = body.indexOf('#');
        String fragment = hashIndex >= 0 ? body.substring(hashIndex + 1) : null;
        String withoutFragment = hashIndex >= 0 ? body.substring(0, hashIndex) : body;

        HostPort hostPort = null;
        String embeddedName = null;
        switch (protocol) {
            case VMESS -> {
                JsonNode vmess = decodeVmessJson(withoutFragment);
                if (vmess != null) {
                    hostPort = hostPortFromVmess(vmess);
                    embeddedName = textOrNull(vmess.get("ps"));
                }
            }
            case SS -> hostPort = hostPortFromLegacyShadowsocks(withoutFragment);
            case SSR -> {
                String decoded = Base64Support.decodeUtf8(cutAt(withoutFragment, '?'));
                if (decoded != null) {
                    hostPort = hostPortFromSsr(decoded);
                    embeddedName = remarkName(decoded);
                }
            }
            default -> {
            }
        }
        if (hostPort == null) {
            hostPort = extractHostPort(withoutFragment);
        }

        String name = fragmentName(fragment);
        if (name == null) {
            name = remarkName(raw);
        }
        if (name == null) {
            name = embeddedName == null || embeddedName.isBlank() ? UNNAMED : embeddedName.trim();
        }
        return new ParsedDescriptor(protocol, hostPort.host(), hostPort.port(), name);
    }

    private static String stripScheme(String raw) {
        int index = raw.indexOf("://");
        return index >= 0 ? raw.substring(index + 3) : raw;
    }

    private static String fragmentName(String fragment) {
        if (fragment == null || fragment.isBlank()) {
            return null;
        }
        String decoded = percentDecode(fragment).trim();
        return decoded.isEmpty() ? null : decoded;
    }

    static String remarkName(String value) {
        Matcher matcher = REMARK_PARAM.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        String remark = matcher.group(1);
        if (remark.isBlank()) {
            return null;
        }
        String decoded = Base64Support.decodeUtf8(remark);
        String name = decoded != null ? decoded : percentDecode(remark);
        return name.isBlank() ? null : name.trim();
    }

    static HostPort extractHostPort(String value) {
        String rest = cutAt(cutAt(value, '#'), '?');
        int at = rest.lastIndexOf('@');
        if (at >= 0) {
            rest = rest.substring(at + 1);
        }
        rest = cutAt(rest, '/');
        if (rest.isEmpty()) {
            return HostPort.UNKNOWN;
        }
        if (rest.startsWith("[")) {
            int close = rest.indexOf(']');
            if (close < 0) {
                return HostPort.UNKNOWN;
            }
            String host = rest.substring(1, close);
            String tail = rest.substring(close + 1);
            if (host.isEmpty() || !IPV6_CHARS.matcher(host).matches()) {
                return HostPort.UNKNOWN;
            }
            if (tail.isEmpty()) {
                return new HostPort(host, EndpointRecord.DEFAULT_PORT);
            }
            if (!tail.startsWith(":")) {
                return HostPort.UNKNOWN;
            }
            return withPort(host, tail.substring(1));
        }
        int colon = rest.lastIndexOf(':');
        if (colon < 0) {
            return validHost(rest) ? new HostPort(rest, EndpointRecord.DEFAULT_PORT) : HostPort.UNKNOWN;
        }
        String host = rest.substring(0, colon);
        if (!validHost(host)) {
            return HostPort.UNKNOWN;
        }
        return withPort(host, rest.substring(colon + 1));
    }

    private static HostPort withPort(String host, String portText) {
        if (portText.isEmpty()) {
            return new HostPort(host, EndpointRecord.DEFAULT_PORT);
        }
        Integer port = parsePort(portText);
        return port == null ? HostPort.UNKNOWN : new HostPort(host, port);
    }

    private static Integer parsePort(String text) {
        if (text == null || text.isEmpty() || text.length() > 5) {
            return null;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return null;
            }
        }
        int port = Integer.parseInt(text);
        return port >= 1 && port <= 65535 ? port : null;
    }

    private static boolean validHost(String host) {
        return host != null && !host.isEmpty() && HOST_CHARS.matcher(host).matches();
    }

    private static JsonNode decodeVmessJson(String body) {
        String decoded = Base64Support.decodeUtf8(cutAt(body, '?'));
        if (decoded == null || !decoded.trim().startsWith("{")) {
            return null;
        }
        try {
            JsonNode node = JSON.readTree(decoded);
            return node != null && node.isObject() ? node : null;
        } catch (IOException e) {
            return null;
        }
    }

    private static HostPort hostPortFromVmess(JsonNode vmess) {
        String host = textOrNull(vmess.get("add"));
        if (host == null || host.isBlank()) {
            return null;
        }
        JsonNode portNode = vmess.get("port");
        String portText = portNode == null || portNode.isNull() ? "" : portNode.asText().trim();
        if (host.contains(":") && !host.startsWith("[")) {
            return IPV6_CHARS.matcher(host).matches() ? withPort(host, portText) : HostPort.UNKNOWN;
        }
        return validHost(host.trim()) ? withPort(host.trim(), portText) : HostPort.UNKNOWN;
    }

    private static HostPort hostPortFromLegacyShadowsocks(String body) {
        if (body.contains("@")) {
            // SIP002 form: base64 user info before '@', host:port after it
            return null;
        }
        String encoded = cutAt(body, '?');
        if (encoded.endsWith("/")) {
            encoded = encoded.substring(0, encoded.length() - 1);
        }
        String decoded = Base64Support.decodeUtf8(encoded);
        if (decoded == null || !decoded.contains("@")) {
            return null;
        }
        HostPort hostPort = extractHostPort(decoded);
        return hostPort == HostPort.UNKNOWN ? null : hostPort;
    }

    private static HostPort hostPortFromSsr(String decoded) {
        String main = cutAt(decoded, '/');
        String[] parts = main.split(":");
        if (parts.length < 6) {
            return null;
        }
        String host = parts[0];
        if (!validHost(host)) {
            return null;
        }
        Integer port = parsePort(parts[1]);
        return port == null ? null : new HostPort(host, port);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String cutAt(String value, char marker) {
        int index = value.indexOf(marker);
        return index >= 0 ? value.substring(0, index) : value;
    }

    private static String percentDecode(String value) {
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    record HostPort(String host, int port) {
        static final HostPort UNKNOWN = new HostPort(UNKNOWN_ADDRESS, EndpointRecord.DEFAULT_PORT);
    }
}
