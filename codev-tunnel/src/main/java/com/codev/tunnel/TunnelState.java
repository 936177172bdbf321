package com.codev.tunnel;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of the tunnel connection.
 */
public enum TunnelState {

    /** Initial state, and the state after {@code disconnect()} or a retryable failure. */
    DISCONNECTED("disconnected"),

    /** Transport open or auth handshake in flight. */
    CONNECTING("connecting"),

    /** Authenticated; heartbeat active and the relay may open streams. */
    CONNECTED("connected"),

    /** The relay rejected the API key. No automatic retry until the circuit breaker is reset. */
    AUTH_FAILED("auth_failed");

    private final String wireName;

    TunnelState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
