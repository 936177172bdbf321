package com.codev.tunnel.handshake;

import com.codev.common.logging.LogRedact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Client side of the tunnel auth handshake.
 * <p>
 * Sends one JSON {@link AuthFrame} line as soon as the transport is active and waits for
 * one JSON {@link AuthResponse} line. On {@code auth_ok} the listener switches the
 * pipeline to the tunnel protocol through {@link #replaceWith}; the line decoder is
 * removed last so that bytes the relay sent right behind the auth line reach the new
 * protocol handlers.
 */
@Slf4j
public class AuthHandshakeHandler extends ChannelInboundHandlerAdapter {

    public static final String NAME = "tunnel-auth";
    public static final String LINE_DECODER_NAME = "tunnel-auth-lines";
    public static final int MAX_LINE_LENGTH = 8192;

    /**
     * Outcome callbacks, invoked on the channel's event loop at most once per handshake.
     */
    public interface Listener {

        /** Credentials accepted; {@code ctx} is this handler's context. */
        void onAuthenticated(ChannelHandlerContext ctx, String towerId);

        /** The relay answered {@code auth_error}. The channel is closed by the relay or the listener. */
        void onRejected(AuthErrorReason reason);

        /** Transport error, malformed answer or timeout. The channel is being closed. */
        void onFailed(Throwable cause);
    }

    private final ObjectMapper mapper;
    private final AuthFrame frame;
    private final long timeoutMs;
    private final Listener listener;

    private ScheduledFuture<?> timeout;
    private boolean completed;

    public AuthHandshakeHandler(ObjectMapper mapper, AuthFrame frame, long timeoutMs, Listener listener) {
        this.mapper = mapper;
        this.frame = frame;
        this.timeoutMs = timeoutMs;
        this.listener = listener;
    }

    /**
     * Append the line decoder and this handler to a pipeline.
     */
    public void install(ChannelPipeline pipeline) {
        pipeline.addLast(LINE_DECODER_NAME, new LineBasedFrameDecoder(MAX_LINE_LENGTH));
        pipeline.addLast(NAME, this);
    }

    /**
     * Replace the handshake handlers with the given protocol handlers, in order.
     * Must be called from {@link Listener#onAuthenticated}.
     */
    public static void replaceWith(ChannelHandlerContext ctx, ChannelHandler... handlers) {
        ChannelPipeline pipeline = ctx.pipeline();
        String previous = ctx.name();
        for (ChannelHandler handler : handlers) {
            pipeline.addAfter(previous, null, handler);
            previous = pipeline.context(handler).name();
        }
        pipeline.remove(ctx.handler());
        pipeline.remove(LINE_DECODER_NAME);
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        byte[] json = mapper.writeValueAsBytes(frame);
        ByteBuf line = Unpooled.buffer(json.length + 1).writeBytes(json).writeByte('\n');
        ctx.writeAndFlush(line).addListener(f -> {
            if (!f.isSuccess()) {
                fail(ctx, f.cause());
            }
        });
        timeout = ctx.executor().schedule(
                () -> fail(ctx, new TunnelHandshakeException("No auth response within " + timeoutMs + "ms")),
                timeoutMs, TimeUnit.MILLISECONDS);
        super.channelActive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        String line;
        ByteBuf buf = (ByteBuf) msg;
        try {
            line = buf.toString(StandardCharsets.UTF_8).trim();
        } finally {
            buf.release();
        }
        if (completed) {
            return;
        }

        AuthResponse response;
        try {
            response = mapper.readValue(line, AuthResponse.class);
        } catch (JsonProcessingException e) {
            fail(ctx, new TunnelHandshakeException(
                    "Invalid auth response: " + abbreviate(LogRedact.redactSensitiveText(line)), e));
            return;
        }

        if (response.isOk()) {
            complete();
            listener.onAuthenticated(ctx, response.towerId());
        } else if (response.isError()) {
            complete();
            listener.onRejected(AuthErrorReason.fromWire(response.reason()));
        } else {
            fail(ctx, new TunnelHandshakeException("Unexpected auth response type: " + response.type()));
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        fail(ctx, cause);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        cancelTimeout();
        super.channelInactive(ctx);
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        cancelTimeout();
    }

    private void fail(ChannelHandlerContext ctx, Throwable cause) {
        if (completed) {
            log.debug("Ignoring handshake error after completion: {}", cause.getMessage());
            return;
        }
        complete();
        listener.onFailed(cause);
        ctx.close();
    }

    private void complete() {
        completed = true;
        cancelTimeout();
    }

    private void cancelTimeout() {
        if (timeout != null) {
            timeout.cancel(false);
            timeout = null;
        }
    }

    private static String abbreviate(String line) {
        return line.length() <= 120 ? line : line.substring(0, 120) + "…";
    }
}
