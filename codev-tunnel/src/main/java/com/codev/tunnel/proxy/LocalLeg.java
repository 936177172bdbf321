package com.codev.tunnel.proxy;

import com.codev.common.infra.ErrorUtils;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoop;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

import java.nio.channels.ClosedChannelException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Local-service side of one proxied stream: a fresh connection to the tower service,
 * opened on the stream's event loop.
 * <p>
 * Relay bytes that arrive before the leg is ready for them are queued and flushed in
 * order once the subclass calls {@link #markReady()}. Local responses are relayed
 * chunk by chunk; a response that arrives after the relay dropped the stream is read
 * to its end and discarded.
 */
@Slf4j
abstract class LocalLeg {

    static final String BAD_GATEWAY_MESSAGE = "Bad Gateway: local server unavailable";

    protected final ProxiedStream stream;
    protected final LocalServiceTarget target;

    protected Channel local;
    private final Deque<Object> pending = new ArrayDeque<>();
    private boolean ready;
    private boolean aborted;

    private boolean informational;
    private boolean draining;
    private boolean responseComplete;

    LocalLeg(ProxiedStream stream, LocalServiceTarget target) {
        this.stream = stream;
        this.target = target;
    }

    /** Install the protocol handlers of the local connection. */
    protected abstract void initLocalPipeline(ChannelPipeline pipeline);

    /** The local connection is up; send the request head. */
    protected abstract void onLocalConnected();

    /** One chunk of request body (or raw tunnel bytes) from the relay. Takes ownership. */
    abstract void onRelayData(ByteBuf data, boolean endStream);

    void start(EventLoop loop) {
        new Bootstrap()
                .group(loop)
                .channel(target.channelClass())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, target.connectTimeoutMs())
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        initLocalPipeline(ch.pipeline());
                    }
                })
                .connect(target.host(), target.port())
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        log.debug("Local service {}:{} unreachable: {}", target.host(), target.port(),
                                ErrorUtils.formatRootCause(future.cause()));
                        failLocal(future.cause());
                        return;
                    }
                    local = future.channel();
                    if (aborted) {
                        local.close();
                        return;
                    }
                    local.closeFuture().addListener(f -> onLocalClosed());
                    onLocalConnected();
                });
    }

    /**
     * Queue or forward a message to the local service.
     */
    protected void sendToLocal(Object msg) {
        if (aborted) {
            ReferenceCountUtil.release(msg);
            return;
        }
        if (ready && local != null) {
            local.writeAndFlush(msg);
        } else {
            pending.addLast(msg);
        }
    }

    protected void markReady() {
        ready = true;
        boolean wrote = false;
        Object msg;
        while ((msg = pending.pollFirst()) != null) {
            local.write(msg);
            wrote = true;
        }
        if (wrote) {
            local.flush();
        }
    }

    /**
     * The relay side is gone; close the local connection and drop queued bytes.
     */
    void abort() {
        if (aborted) {
            return;
        }
        aborted = true;
        releasePending();
        if (local != null) {
            local.close();
        }
    }

    boolean isAborted() {
        return aborted;
    }

    /** Relay stream writability changed; resume local reads once it drained. */
    void onRelayWritabilityChanged() {
        if (local != null && stream.channel().isWritable()) {
            local.config().setAutoRead(true);
        }
    }

    /**
     * Relay one local HTTP response object to the stream.
     */
    protected void relayResponse(ChannelHandlerContext ctx, HttpObject msg) {
        if (msg instanceof HttpResponse response) {
            int code = response.status().code();
            if (code >= 100 && code < 200) {
                informational = true;
                return;
            }
            if (stream.isOpen()) {
                stream.respond(code, toHeaderMap(response.headers()), false);
            } else {
                draining = true;
            }
        }
        if (msg instanceof HttpContent content) {
            boolean last = msg instanceof LastHttpContent;
            if (informational) {
                informational = !last;
                return;
            }
            if (!draining && stream.isOpen() && (last || content.content().isReadable())) {
                stream.writeData(content.content().retain(), last);
                if (!stream.channel().isWritable()) {
                    ctx.channel().config().setAutoRead(false);
                }
            }
            if (last) {
                responseComplete = true;
                ctx.close();
            }
        }
    }

    protected boolean isResponseComplete() {
        return responseComplete;
    }

    /**
     * Local connection or exchange failed: answer 502 if nothing was sent yet,
     * otherwise reset the stream.
     */
    protected void failLocal(Throwable cause) {
        releasePending();
        if (!stream.isOpen()) {
            return;
        }
        log.debug("Local leg failed: {}", ErrorUtils.formatErrorMessage(cause));
        if (!stream.hasResponded()) {
            stream.respondError(502, BAD_GATEWAY_MESSAGE);
        } else {
            stream.destroy();
        }
    }

    /** The local connection closed. An unfinished response fails the stream. */
    protected void onLocalClosed() {
        releasePending();
        if (!responseComplete) {
            failLocal(new ClosedChannelException());
        }
    }

    static Map<String, List<String>> toHeaderMap(HttpHeaders headers) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : headers) {
            result.computeIfAbsent(entry.getKey().toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                    .add(entry.getValue());
        }
        return result;
    }

    private void releasePending() {
        Object msg;
        while ((msg = pending.pollFirst()) != null) {
            ReferenceCountUtil.release(msg);
        }
    }
}
