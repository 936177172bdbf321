package com.codev.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sensitive information redaction for log output.
 * Tower API keys and bearer tokens never reach the log unmasked.
 */
public final class LogRedact {

    private LogRedact() {
    }

    // -----------------------------------------------------------------------
    // Constants
    // -----------------------------------------------------------------------

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    private static final List<Pattern> PATTERNS = List.of(
            // JSON fields
            Pattern.compile("\"(?:apiKey|api_key|token|secret)\"\\s*:\\s*\"([^\"]+)\"",
                    Pattern.CASE_INSENSITIVE),
            // Authorization headers
            Pattern.compile("\\bBearer\\s+([A-Za-z0-9._\\-+=]+)", Pattern.CASE_INSENSITIVE),
            // Tower API keys
            Pattern.compile("\\b(ctk_[A-Za-z0-9_-]{8,})\\b"));

    // -----------------------------------------------------------------------
    // Public API
    // -----------------------------------------------------------------------

    /**
     * Mask a single token, preserving start/end characters.
     */
    public static String maskToken(String token) {
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        String start = token.substring(0, KEEP_START);
        String end = token.substring(token.length() - KEEP_END);
        return start + "…" + end;
    }

    /**
     * Redact API keys and bearer tokens embedded in free text.
     */
    public static String redactSensitiveText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Pattern pattern : PATTERNS) {
            result = redactWithPattern(result, pattern);
        }
        return result;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private static String redactWithPattern(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String fullMatch = matcher.group(0);
            String token = matcher.group(1);
            String replacement = fullMatch.replace(token, maskToken(token));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
