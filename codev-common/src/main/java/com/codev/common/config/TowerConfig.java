package com.codev.common.config;

import lombok.Data;

/**
 * Root configuration type for the tower process.
 * Credentials are not part of this file; they come from the credential store.
 */
@Data
public class TowerConfig {

    /** Port of the local tower HTTP service that tunneled traffic is forwarded to. */
    private int port = 4100;

    /** Tunnel settings. */
    private TunnelConfig tunnel;

    // --- Nested config types ---

    @Data
    public static class TunnelConfig {
        /** Relay host the tunnel dials out to. */
        private String serverHost;
        /** Relay tunnel ingress port. */
        private int tunnelPort = 443;
        /** Skip TLS (plaintext relays and tests). */
        private boolean usePlainTcp;
        /** HTTPS origin of the relay API, used for the metadata push; null disables the push. */
        private String serverUrl;
        /** Host of the local tower service. */
        private String localHost = "127.0.0.1";
        private long pingIntervalMs = 30_000;
        private long pongTimeoutMs = 10_000;
        private long connectTimeoutMs = 10_000;
        private long handshakeTimeoutMs = 10_000;
    }
}
