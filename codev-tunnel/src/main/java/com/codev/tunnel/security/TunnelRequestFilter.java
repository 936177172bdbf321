package com.codev.tunnel.security;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Request checks applied to every stream the relay opens: reserved local-only paths
 * and hop-by-hop header stripping.
 */
public final class TunnelRequestFilter {

    private TunnelRequestFilter() {
    }

    /** Tunnel management endpoints of the local tower; never reachable through the tunnel. */
    public static final String BLOCKED_PATH_PREFIX = "/api/tunnel/";

    /** Path the relay polls for the tower metadata snapshot; answered locally. */
    public static final String METADATA_PATH = "/__tower/metadata";

    /** Headers meaningful only for a single connection leg. */
    public static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailers",
            "transfer-encoding",
            "upgrade");

    // =========================================================================
    // Path blocking
    // =========================================================================

    /**
     * Whether a request path targets the local tunnel management endpoints.
     * The path is percent-decoded and its dot segments collapsed before the prefix
     * check, so {@code /api%2Ftunnel/status} and {@code /api/x/../tunnel/status} are
     * caught. A path that cannot be decoded falls back to the raw prefix check.
     */
    public static boolean isBlockedPath(String path) {
        if (path == null) {
            return false;
        }
        try {
            return canonicalizePath(path).startsWith(BLOCKED_PATH_PREFIX);
        } catch (IllegalArgumentException e) {
            return path.startsWith(BLOCKED_PATH_PREFIX);
        }
    }

    /**
     * Decode percent-escapes, drop query and fragment, and resolve {@code .}, {@code ..}
     * and empty segments.
     *
     * @throws IllegalArgumentException on a malformed escape or invalid UTF-8
     */
    static String canonicalizePath(String path) {
        String decoded = percentDecode(path);
        int end = decoded.length();
        for (int i = 0; i < decoded.length(); i++) {
            char c = decoded.charAt(i);
            if (c == '?' || c == '#') {
                end = i;
                break;
            }
        }
        String raw = decoded.substring(0, end).replace('\\', '/');

        Deque<String> segments = new ArrayDeque<>();
        String[] parts = raw.split("/", -1);
        boolean trailingSlash = false;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            boolean last = i == parts.length - 1;
            if (part.isEmpty() || ".".equals(part)) {
                trailingSlash = last;
            } else if ("..".equals(part)) {
                segments.pollLast();
                trailingSlash = last;
            } else {
                segments.addLast(part);
                trailingSlash = false;
            }
        }
        if (segments.isEmpty()) {
            return "/";
        }
        return "/" + String.join("/", segments) + (trailingSlash ? "/" : "");
    }

    private static String percentDecode(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '%') {
                if (i + 2 >= value.length()) {
                    throw new IllegalArgumentException("Truncated percent-escape in " + value);
                }
                int hi = Character.digit(value.charAt(i + 1), 16);
                int lo = Character.digit(value.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    throw new IllegalArgumentException("Malformed percent-escape in " + value);
                }
                bytes.write((hi << 4) | lo);
                i += 3;
            } else {
                byte[] encoded = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
                bytes.write(encoded, 0, encoded.length);
                i++;
            }
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes.toByteArray()))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Invalid UTF-8 in " + value, e);
        }
    }

    // =========================================================================
    // Header filtering
    // =========================================================================

    public static boolean isHopByHopHeader(CharSequence name) {
        return name != null && HOP_BY_HOP_HEADERS.contains(name.toString().toLowerCase(Locale.ROOT));
    }

    /**
     * Copy of {@code headers} without hop-by-hop entries (matched case-insensitively).
     * Multi-valued entries are kept as-is; entries with a null value are dropped.
     * Insertion order is preserved.
     */
    public static Map<String, List<String>> filterHopByHopHeaders(Map<String, List<String>> headers) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (headers == null) {
            return result;
        }
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getValue() != null && !isHopByHopHeader(entry.getKey())) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }
}
