package com.codev.tunnel.handshake;

/**
 * Error tags the relay attaches to a rejected auth frame.
 */
public enum AuthErrorReason {

    /** API key invalid or revoked. Terminal: the circuit breaker opens. */
    INVALID_API_KEY("invalid_api_key", false),

    INVALID_AUTH_FRAME("invalid_auth_frame", true),

    RATE_LIMITED("rate_limited", true),

    INTERNAL_ERROR("internal_error", true),

    /** Any tag this client does not know; treated as transient. */
    UNKNOWN("unknown", true);

    private final String wireName;
    private final boolean retryable;

    AuthErrorReason(String wireName, boolean retryable) {
        this.wireName = wireName;
        this.retryable = retryable;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static AuthErrorReason fromWire(String value) {
        if (value != null) {
            for (AuthErrorReason reason : values()) {
                if (reason.wireName.equals(value)) {
                    return reason;
                }
            }
        }
        return UNKNOWN;
    }
}
