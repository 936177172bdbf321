package com.codev.tunnel;

import com.codev.common.infra.Backoff;
import com.codev.common.infra.ErrorUtils;
import com.codev.common.logging.LogRedact;
import com.codev.tunnel.handshake.AuthErrorReason;
import com.codev.tunnel.handshake.AuthFrame;
import com.codev.tunnel.handshake.AuthHandshakeHandler;
import com.codev.tunnel.heartbeat.TunnelHeartbeat;
import com.codev.tunnel.proxy.LocalServiceTarget;
import com.codev.tunnel.proxy.StreamProxyHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http2.Http2FrameCodec;
import io.netty.handler.codec.http2.Http2FrameCodecBuilder;
import io.netty.handler.codec.http2.Http2MultiplexHandler;
import io.netty.handler.codec.http2.Http2Settings;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound tunnel from the tower to the relay.
 * <p>
 * Dials the relay over TLS (or plain TCP), authenticates with one JSON line, then runs
 * the HTTP/2 server side over that connection: the relay opens one stream per
 * request and the tower proxies it to the local service. A heartbeat watches the
 * connection; transient failures reconnect with exponential backoff, an invalid API
 * key opens the circuit breaker until {@link #resetCircuitBreaker()}.
 * <p>
 * All state lives on one event loop. Public methods may be called from any thread;
 * they run on the loop and return once the state change has been applied.
 * Every transport gets a generation number; callbacks and timers of an older
 * generation are ignored.
 */
@Slf4j
public class TunnelClient implements AutoCloseable {

    /** Extended CONNECT (RFC 8441) settings identifier. */
    private static final char SETTINGS_ENABLE_CONNECT_PROTOCOL = 0x8;

    private final TunnelClientOptions options;
    private final EventLoopGroup group;
    private final boolean ownsGroup;
    private final EventLoop loop;
    private final ObjectMapper mapper = new ObjectMapper();
    private final LocalServiceTarget localTarget;
    private final MetadataPublisher metadataPublisher;
    private final TunnelHeartbeat heartbeat;
    private final SslContext sslContext;
    private final List<TunnelStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile TunnelState state = TunnelState.DISCONNECTED;
    private volatile long connectedAtNanos;
    private volatile TowerMetadata metadata = TowerMetadata.EMPTY;
    private volatile int consecutiveFailures;
    private volatile String confirmedTowerId;

    // loop-confined
    private Channel transport;
    private long generation;
    private boolean destroyed;
    private ScheduledFuture<?> reconnectTimer;

    public TunnelClient(TunnelClientOptions options) {
        this(options, new NioEventLoopGroup(1), true);
    }

    /**
     * Client running on a loop of {@code group}. The group is not shut down by
     * {@link #close()}.
     */
    public TunnelClient(TunnelClientOptions options, EventLoopGroup group) {
        this(options, group, false);
    }

    private TunnelClient(TunnelClientOptions options, EventLoopGroup group, boolean ownsGroup) {
        options.validate();
        this.options = options;
        this.group = group;
        this.ownsGroup = ownsGroup;
        this.loop = group.next();
        this.localTarget = new LocalServiceTarget(options.getLocalHost(), options.getLocalPort(),
                NioSocketChannel.class, (int) options.getConnectTimeoutMs());
        this.metadataPublisher = options.getServerUrl() != null
                ? new MetadataPublisher(options.getServerUrl(), options.getApiKey(), mapper)
                : null;
        this.heartbeat = new TunnelHeartbeat(loop, options.getPingIntervalMs(), options.getPongTimeoutMs(),
                () -> generation, this::onPongTimeout);
        this.sslContext = options.isUsePlainTcp() ? null : buildSslContext();
    }

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Start connecting. Returns once the client is {@code connecting}; progress is
     * observable through {@link #getState()} and state listeners.
     */
    public void connect() {
        runOnLoop(() -> {
            if (state == TunnelState.CONNECTING || state == TunnelState.CONNECTED) {
                return;
            }
            if (state == TunnelState.AUTH_FAILED) {
                log.warn("Tunnel connect refused: API key was rejected, reset the circuit breaker first");
                return;
            }
            destroyed = false;
            cancelReconnect();
            openTransport();
        });
    }

    /**
     * Close the tunnel and stop reconnecting. Idempotent.
     */
    public void disconnect() {
        runOnLoop(() -> {
            destroyed = true;
            cancelReconnect();
            teardownTransport();
            setState(TunnelState.DISCONNECTED);
        });
    }

    /**
     * Clear the failure counter; leaves {@code auth_failed} for {@code disconnected}.
     */
    public void resetCircuitBreaker() {
        runOnLoop(() -> {
            consecutiveFailures = 0;
            if (state == TunnelState.AUTH_FAILED) {
                setState(TunnelState.DISCONNECTED);
            }
        });
    }

    /**
     * Replace the cached metadata snapshot served on the metadata poll path.
     */
    public void sendMetadata(TowerMetadata snapshot) {
        this.metadata = snapshot != null ? snapshot : TowerMetadata.EMPTY;
    }

    public TowerMetadata getMetadata() {
        return metadata;
    }

    public TunnelState getState() {
        return state;
    }

    /**
     * Milliseconds since the tunnel entered {@code connected}, or null when not connected.
     */
    public Long getUptime() {
        long since = connectedAtNanos;
        if (state != TunnelState.CONNECTED || since == 0) {
            return null;
        }
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - since);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * Tower id confirmed by the relay, or the configured one before the first auth.
     */
    public String getTowerId() {
        String confirmed = confirmedTowerId;
        return confirmed != null ? confirmed : options.getTowerId();
    }

    public TunnelClientOptions getOptions() {
        return options;
    }

    public void onStateChange(TunnelStateListener listener) {
        listeners.add(listener);
    }

    public void removeStateListener(TunnelStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Public URL under which the relay serves a tower.
     */
    public static String buildAccessUrl(String serverUrl, String towerName) {
        String base = serverUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/t/" + towerName + "/";
    }

    @Override
    public void close() {
        disconnect();
        if (ownsGroup) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
    }

    // =========================================================================
    // Transport lifecycle (event loop only)
    // =========================================================================

    private void openTransport() {
        long gen = ++generation;
        setState(TunnelState.CONNECTING);
        log.info("Connecting tunnel to {}:{} ({})", options.getServerHost(), options.getTunnelPort(),
                options.isUsePlainTcp() ? "plain tcp" : "tls");

        AuthHandshakeHandler auth = new AuthHandshakeHandler(mapper,
                AuthFrame.of(options.getApiKey(), options.getTowerId()),
                options.getHandshakeTimeoutMs(), new HandshakeListener(gen));

        ChannelFuture connectFuture = new Bootstrap()
                .group(loop)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) options.getConnectTimeoutMs())
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (sslContext != null) {
                            ch.pipeline().addLast("tls", newSslHandler(ch));
                        }
                        auth.install(ch.pipeline());
                    }
                })
                .connect(options.getServerHost(), options.getTunnelPort());
        transport = connectFuture.channel();

        connectFuture.addListener((ChannelFutureListener) future -> {
            if (gen != generation) {
                return;
            }
            if (!future.isSuccess()) {
                log.warn("Tunnel connection to {}:{} failed: {}", options.getServerHost(),
                        options.getTunnelPort(), ErrorUtils.formatRootCause(future.cause()));
                teardownTransport();
                failTransient();
                return;
            }
            future.channel().closeFuture().addListener(f -> onTransportClosed(gen));
        });
    }

    private void onAuthenticated(long gen, ChannelHandlerContext ctx, String towerId) {
        Http2Settings settings = Http2Settings.defaultSettings();
        settings.put(SETTINGS_ENABLE_CONNECT_PROTOCOL, Long.valueOf(1L));
        Http2FrameCodec codec = Http2FrameCodecBuilder.forServer()
                .initialSettings(settings)
                // :protocol (extended CONNECT) must pass header decoding
                .validateHeaders(false)
                .build();
        Http2MultiplexHandler multiplex = new Http2MultiplexHandler(
                StreamProxyHandler.initializer(localTarget, this::getMetadata, mapper));
        TunnelConnectionHandler connection = new TunnelConnectionHandler(() -> heartbeat.onPong(gen));
        AuthHandshakeHandler.replaceWith(ctx, codec, multiplex, connection);

        confirmedTowerId = towerId != null ? towerId : options.getTowerId();
        consecutiveFailures = 0;
        connectedAtNanos = System.nanoTime();
        heartbeat.start(ctx.channel(), gen);
        setState(TunnelState.CONNECTED);
        if (gen != generation) {
            // a listener disconnected or replaced the transport
            return;
        }
        log.info("Tunnel connected as tower {}", confirmedTowerId);

        if (metadataPublisher != null) {
            metadataPublisher.publish(metadata);
        }
    }

    private void onTransportClosed(long gen) {
        if (gen != generation) {
            return;
        }
        log.warn("Tunnel connection closed by peer");
        teardownTransport();
        failTransient();
    }

    private void onPongTimeout(long gen) {
        if (gen != generation) {
            return;
        }
        teardownTransport();
        failTransient();
    }

    private void teardownTransport() {
        generation++;
        heartbeat.stop();
        connectedAtNanos = 0;
        if (transport != null) {
            transport.close();
            transport = null;
        }
    }

    /**
     * Retryable failure: count it and schedule a reconnect. No-op once the circuit
     * breaker is open.
     */
    private void failTransient() {
        if (state == TunnelState.AUTH_FAILED) {
            return;
        }
        consecutiveFailures++;
        setState(TunnelState.DISCONNECTED);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        cancelReconnect();
        if (destroyed) {
            return;
        }
        int attempt = consecutiveFailures;
        long delay = Backoff.calculateBackoff(attempt);
        log.info("Reconnecting tunnel in {}ms (consecutive failures: {})", delay, attempt);
        reconnectTimer = loop.schedule(() -> {
            reconnectTimer = null;
            if (!destroyed && state == TunnelState.DISCONNECTED) {
                openTransport();
            }
        }, delay, TimeUnit.MILLISECONDS);
    }

    private void cancelReconnect() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel(false);
            reconnectTimer = null;
        }
    }

    private void setState(TunnelState next) {
        TunnelState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        log.debug("Tunnel state {} -> {}", previous.wireName(), next.wireName());
        for (TunnelStateListener listener : listeners) {
            try {
                listener.onStateChange(next, previous);
            } catch (Exception | AssertionError e) {
                log.debug("Tunnel state listener failed: {}", e.toString());
            }
        }
    }

    boolean isHeartbeatActive() {
        AtomicBoolean active = new AtomicBoolean();
        runOnLoop(() -> active.set(heartbeat.isActive()));
        return active.get();
    }

    private void runOnLoop(Runnable task) {
        if (loop.inEventLoop() || loop.isShuttingDown()) {
            task.run();
        } else {
            loop.submit(task).syncUninterruptibly();
        }
    }

    // =========================================================================
    // TLS
    // =========================================================================

    private static SslContext buildSslContext() {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to initialize TLS for the tunnel", e);
        }
    }

    private SslHandler newSslHandler(SocketChannel ch) {
        SslHandler handler = sslContext.newHandler(ch.alloc(), options.getServerHost(), options.getTunnelPort());
        SSLEngine engine = handler.engine();
        SSLParameters parameters = engine.getSSLParameters();
        parameters.setEndpointIdentificationAlgorithm("HTTPS");
        engine.setSSLParameters(parameters);
        handler.setHandshakeTimeoutMillis(options.getHandshakeTimeoutMs());
        return handler;
    }

    private final class HandshakeListener implements AuthHandshakeHandler.Listener {

        private final long gen;

        HandshakeListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onAuthenticated(ChannelHandlerContext ctx, String towerId) {
            if (gen != generation) {
                ctx.close();
                return;
            }
            TunnelClient.this.onAuthenticated(gen, ctx, towerId);
        }

        @Override
        public void onRejected(AuthErrorReason reason) {
            if (gen != generation) {
                return;
            }
            if (!reason.isRetryable()) {
                log.error("Tunnel auth rejected ({}); not retrying until the circuit breaker is reset",
                        reason.wireName());
                cancelReconnect();
                teardownTransport();
                setState(TunnelState.AUTH_FAILED);
                return;
            }
            log.warn("Tunnel auth rejected ({}), will retry", reason.wireName());
            teardownTransport();
            failTransient();
        }

        @Override
        public void onFailed(Throwable cause) {
            if (gen != generation) {
                return;
            }
            log.warn("Tunnel handshake failed: {}", LogRedact.redactSensitiveText(ErrorUtils.formatRootCause(cause)));
            teardownTransport();
            failTransient();
        }
    }
}
