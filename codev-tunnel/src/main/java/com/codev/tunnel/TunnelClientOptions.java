package com.codev.tunnel;

import com.codev.common.config.ConfigService;
import com.codev.common.config.TowerConfig;
import com.codev.common.logging.LogRedact;
import lombok.Builder;
import lombok.Getter;

import java.util.Objects;

/**
 * Immutable connection parameters of one {@link TunnelClient}.
 * A credential rotation means building new options and a new client.
 */
@Getter
@Builder
public class TunnelClientOptions {

    public static final long DEFAULT_PING_INTERVAL_MS = 30_000;
    public static final long DEFAULT_PONG_TIMEOUT_MS = 10_000;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000;
    public static final long DEFAULT_HANDSHAKE_TIMEOUT_MS = 10_000;

    private final String serverHost;
    private final int tunnelPort;
    private final String apiKey;
    private final String towerId;
    private final int localPort;
    private final boolean usePlainTcp;

    @Builder.Default
    private final String localHost = "127.0.0.1";

    /** HTTPS origin of the relay API for the metadata push; null disables the push. */
    private final String serverUrl;

    @Builder.Default
    private final long pingIntervalMs = DEFAULT_PING_INTERVAL_MS;
    @Builder.Default
    private final long pongTimeoutMs = DEFAULT_PONG_TIMEOUT_MS;
    @Builder.Default
    private final long connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
    @Builder.Default
    private final long handshakeTimeoutMs = DEFAULT_HANDSHAKE_TIMEOUT_MS;

    /**
     * Resolve options from the loaded tower configuration and credentials supplied by
     * the credential store.
     */
    public static TunnelClientOptions resolve(ConfigService configService, String apiKey, String towerId) {
        return resolve(configService.loadConfig(), apiKey, towerId);
    }

    /**
     * Resolve options from a tower configuration and externally supplied credentials.
     */
    public static TunnelClientOptions resolve(TowerConfig config, String apiKey, String towerId) {
        TowerConfig.TunnelConfig tunnel = config.getTunnel() != null
                ? config.getTunnel()
                : new TowerConfig.TunnelConfig();
        return TunnelClientOptions.builder()
                .serverHost(tunnel.getServerHost())
                .tunnelPort(tunnel.getTunnelPort())
                .usePlainTcp(tunnel.isUsePlainTcp())
                .serverUrl(tunnel.getServerUrl())
                .localHost(tunnel.getLocalHost())
                .localPort(config.getPort())
                .apiKey(apiKey)
                .towerId(towerId)
                .pingIntervalMs(tunnel.getPingIntervalMs())
                .pongTimeoutMs(tunnel.getPongTimeoutMs())
                .connectTimeoutMs(tunnel.getConnectTimeoutMs())
                .handshakeTimeoutMs(tunnel.getHandshakeTimeoutMs())
                .build();
    }

    /**
     * Check the parameters a connection attempt cannot do without.
     *
     * @throws IllegalArgumentException on a missing host or an out-of-range port
     */
    void validate() {
        if (serverHost == null || serverHost.isBlank()) {
            throw new IllegalArgumentException("serverHost is required");
        }
        if (!isValidPort(tunnelPort)) {
            throw new IllegalArgumentException("tunnelPort out of range: " + tunnelPort);
        }
        if (!isValidPort(localPort)) {
            throw new IllegalArgumentException("localPort out of range: " + localPort);
        }
        Objects.requireNonNull(localHost, "localHost");
        if (pingIntervalMs <= 0 || pongTimeoutMs <= 0) {
            throw new IllegalArgumentException("heartbeat intervals must be positive");
        }
    }

    static boolean isValidPort(int port) {
        return port > 0 && port <= 65535;
    }

    @Override
    public String toString() {
        return "TunnelClientOptions{" + serverHost + ":" + tunnelPort
                + (usePlainTcp ? " (plain tcp)" : " (tls)")
                + ", towerId=" + towerId
                + ", apiKey=" + LogRedact.maskToken(apiKey)
                + ", local=" + localHost + ":" + localPort + "}";
    }
}
