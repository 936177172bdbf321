package com.codev.tunnel.heartbeat;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http2.DefaultHttp2PingFrame;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongConsumer;
import java.util.function.LongSupplier;

/**
 * Liveness check of the tunnel transport.
 * <p>
 * Sends an HTTP/2 PING every ping interval and arms a pong timeout; an acknowledged
 * PING disarms it. A missing pong hands the transport generation to the timeout
 * callback, which reconnects.
 * <p>
 * Every scheduled task captures the transport generation it was started for and does
 * nothing once the client has moved on to another transport. All methods must be
 * called on {@code executor}.
 */
@Slf4j
public class TunnelHeartbeat {

    static final Consumer<Channel> HTTP2_PINGER = channel ->
            channel.writeAndFlush(new DefaultHttp2PingFrame(System.nanoTime()))
                    .addListener((ChannelFutureListener) f -> {
                        if (!f.isSuccess()) {
                            log.debug("Ping write failed: {}", f.cause().getMessage());
                        }
                    });

    private final EventExecutor executor;
    private final long pingIntervalMs;
    private final long pongTimeoutMs;
    private final LongSupplier currentGeneration;
    private final LongConsumer onPongTimeout;
    private final Consumer<Channel> pinger;

    private ScheduledFuture<?> pingTask;
    private ScheduledFuture<?> pongTimeout;
    private Channel channel;
    private long generation = -1;

    public TunnelHeartbeat(EventExecutor executor, long pingIntervalMs, long pongTimeoutMs,
                           LongSupplier currentGeneration, LongConsumer onPongTimeout) {
        this(executor, pingIntervalMs, pongTimeoutMs, currentGeneration, onPongTimeout, HTTP2_PINGER);
    }

    TunnelHeartbeat(EventExecutor executor, long pingIntervalMs, long pongTimeoutMs,
                    LongSupplier currentGeneration, LongConsumer onPongTimeout,
                    Consumer<Channel> pinger) {
        this.executor = executor;
        this.pingIntervalMs = pingIntervalMs;
        this.pongTimeoutMs = pongTimeoutMs;
        this.currentGeneration = currentGeneration;
        this.onPongTimeout = onPongTimeout;
        this.pinger = pinger;
    }

    /**
     * Start pinging {@code channel}. Any previous schedule is cancelled first, so a
     * restart never leaves two ping loops running.
     */
    public void start(Channel channel, long generation) {
        stop();
        this.channel = channel;
        this.generation = generation;
        pingTask = executor.scheduleAtFixedRate(() -> tick(generation),
                pingIntervalMs, pingIntervalMs, TimeUnit.MILLISECONDS);
        log.debug("Heartbeat started (ping {}ms, pong timeout {}ms)", pingIntervalMs, pongTimeoutMs);
    }

    public void stop() {
        cancelPongTimeout();
        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
        channel = null;
    }

    /**
     * PING acknowledged by the relay. A pong for another generation is ignored.
     */
    public void onPong(long generation) {
        if (generation != this.generation) {
            return;
        }
        cancelPongTimeout();
    }

    public boolean isActive() {
        return pingTask != null;
    }

    private void tick(long generation) {
        if (generation != currentGeneration.getAsLong()) {
            return;
        }
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return;
        }
        try {
            pinger.accept(ch);
        } catch (RuntimeException e) {
            // the pong timeout below still fires and replaces the transport
            log.debug("Ping failed: {}", e.getMessage());
        }
        // an unanswered earlier ping keeps its deadline
        if (pongTimeout == null || pongTimeout.isDone()) {
            pongTimeout = executor.schedule(() -> expire(generation), pongTimeoutMs, TimeUnit.MILLISECONDS);
        }
    }

    private void expire(long generation) {
        if (generation != currentGeneration.getAsLong()) {
            return;
        }
        log.warn("No pong within {}ms, dropping tunnel transport", pongTimeoutMs);
        stop();
        onPongTimeout.accept(generation);
    }

    private void cancelPongTimeout() {
        if (pongTimeout != null) {
            pongTimeout.cancel(false);
            pongTimeout = null;
        }
    }
}
