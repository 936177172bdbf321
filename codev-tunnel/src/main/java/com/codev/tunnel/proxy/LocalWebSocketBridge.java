package com.codev.tunnel.proxy;

import com.codev.tunnel.security.TunnelRequestFilter;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.http.DefaultHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extended CONNECT ({@code :protocol websocket}) bridged to a local HTTP/1.1 WebSocket
 * upgrade. After the local {@code 101} the stream is answered {@code 200} and raw bytes
 * are piped both ways; WebSocket frames are not interpreted.
 * A non-upgrade answer (for example 404) is relayed as a regular response.
 */
@Slf4j
class LocalWebSocketBridge extends LocalLeg {

    private static final SecureRandom RANDOM = new SecureRandom();

    /** Set on the upgrade request itself; never copied from the relay. */
    private static final Set<String> UPGRADE_HEADERS = Set.of(
            "host", "sec-websocket-key", "sec-websocket-version");

    private final HttpRequest upgradeRequest;
    private HttpClientCodec codec;
    private boolean upgraded;

    LocalWebSocketBridge(ProxiedStream stream, LocalServiceTarget target, Http2Headers headers) {
        super(stream, target);
        this.upgradeRequest = toUpgradeRequest(headers, target);
    }

    static HttpRequest toUpgradeRequest(Http2Headers headers, LocalServiceTarget target) {
        String path = headers.path() != null ? headers.path().toString() : "/";
        String host = headers.authority() != null ? headers.authority().toString() : target.hostHeader();
        HttpRequest request = new DefaultHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, path);
        request.headers()
                .set(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET)
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.UPGRADE)
                .set(HttpHeaderNames.SEC_WEBSOCKET_VERSION, "13")
                .set(HttpHeaderNames.SEC_WEBSOCKET_KEY, newWebSocketKey())
                .set(HttpHeaderNames.HOST, host);
        for (Map.Entry<CharSequence, CharSequence> entry : headers) {
            String name = entry.getKey().toString();
            if (name.startsWith(":") || TunnelRequestFilter.isHopByHopHeader(name)
                    || UPGRADE_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            request.headers().add(name, entry.getValue());
        }
        return request;
    }

    static String newWebSocketKey() {
        byte[] nonce = new byte[16];
        RANDOM.nextBytes(nonce);
        return Base64.getEncoder().encodeToString(nonce);
    }

    @Override
    protected void initLocalPipeline(ChannelPipeline pipeline) {
        codec = new HttpClientCodec();
        pipeline.addLast("http", codec);
        pipeline.addLast("bridge", new UpgradeRelay());
    }

    @Override
    protected void onLocalConnected() {
        local.writeAndFlush(upgradeRequest);
    }

    @Override
    void onRelayData(ByteBuf data, boolean endStream) {
        if (!data.isReadable()) {
            data.release();
            return;
        }
        sendToLocal(data);
    }

    @Override
    protected void onLocalClosed() {
        if (upgraded) {
            stream.destroy();
            return;
        }
        super.onLocalClosed();
    }

    private void completeUpgrade(ChannelHandlerContext ctx) {
        upgraded = true;
        if (!stream.isOpen()) {
            ctx.close();
            return;
        }
        stream.respond(200, Map.of(), false);

        // bytes buffered behind the 101 reach the bridge as raw buffers once the codec is gone
        codec.removeOutboundHandler();
        ChannelPipeline pipeline = ctx.pipeline();
        ctx.channel().eventLoop().execute(() -> {
            if (pipeline.get(HttpClientCodec.class) != null) {
                pipeline.remove(codec);
            }
        });
        markReady();
    }

    private class UpgradeRelay extends ChannelInboundHandlerAdapter {

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            if (upgraded) {
                if (msg instanceof ByteBuf buf && buf.isReadable()) {
                    stream.writeData(buf, false);
                    if (!stream.channel().isWritable()) {
                        ctx.channel().config().setAutoRead(false);
                    }
                } else {
                    ReferenceCountUtil.release(msg);
                }
                return;
            }
            if (!(msg instanceof HttpObject)) {
                ReferenceCountUtil.release(msg);
                return;
            }
            try {
                if (msg instanceof HttpResponse response
                        && response.status().code() == HttpResponseStatus.SWITCHING_PROTOCOLS.code()) {
                    completeUpgrade(ctx);
                    return;
                }
                relayResponse(ctx, (HttpObject) msg);
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("Local WebSocket leg failed: {}", cause.getMessage());
            failLocal(cause);
            ctx.close();
        }
    }
}
