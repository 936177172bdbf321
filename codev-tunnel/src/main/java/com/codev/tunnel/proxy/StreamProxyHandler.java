package com.codev.tunnel.proxy;

import com.codev.tunnel.TowerMetadata;
import com.codev.tunnel.security.TunnelRequestFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.handler.codec.http2.Http2DataFrame;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.handler.codec.http2.Http2HeadersFrame;
import io.netty.handler.codec.http2.Http2ResetFrame;
import io.netty.handler.codec.http2.Http2StreamChannel;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Handles one relay-initiated HTTP/2 stream.
 * <p>
 * Order of checks on the request headers: reserved management prefix (403), metadata
 * poll path (answered from the cache), WebSocket extended CONNECT (bridged), anything
 * else forwarded to the local service. Failures stay inside the stream.
 */
@Slf4j
public class StreamProxyHandler extends ChannelInboundHandlerAdapter {

    public static final String FORBIDDEN_MESSAGE = "Forbidden: tunnel management endpoints are local-only";

    private static final String PROTOCOL_PSEUDO_HEADER = ":protocol";

    private final LocalServiceTarget target;
    private final Supplier<TowerMetadata> metadata;
    private final ObjectMapper mapper;

    private ProxiedStream stream;
    private LocalLeg leg;

    public StreamProxyHandler(LocalServiceTarget target, Supplier<TowerMetadata> metadata, ObjectMapper mapper) {
        this.target = target;
        this.metadata = metadata;
        this.mapper = mapper;
    }

    /**
     * Initializer for {@link io.netty.handler.codec.http2.Http2MultiplexHandler}: one
     * handler per inbound stream.
     */
    public static ChannelInitializer<Http2StreamChannel> initializer(LocalServiceTarget target,
                                                                     Supplier<TowerMetadata> metadata,
                                                                     ObjectMapper mapper) {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(Http2StreamChannel ch) {
                ch.pipeline().addLast(new StreamProxyHandler(target, metadata, mapper));
            }
        };
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof Http2HeadersFrame headersFrame) {
            if (stream == null) {
                onRequest(ctx, headersFrame);
            } else if (headersFrame.isEndStream() && leg != null) {
                // trailers end the request body
                leg.onRelayData(Unpooled.EMPTY_BUFFER, true);
            }
            ReferenceCountUtil.release(msg);
        } else if (msg instanceof Http2DataFrame dataFrame) {
            if (leg != null) {
                leg.onRelayData(dataFrame.content(), dataFrame.isEndStream());
            } else {
                dataFrame.release();
            }
        } else {
            ReferenceCountUtil.release(msg);
        }
    }

    private void onRequest(ChannelHandlerContext ctx, Http2HeadersFrame frame) {
        Http2Headers headers = frame.headers();
        String method = headers.method() != null ? headers.method().toString() : "";
        String path = headers.path() != null ? headers.path().toString() : null;
        stream = new ProxiedStream(ctx.channel(), mapper);

        if (TunnelRequestFilter.isBlockedPath(path)) {
            log.info("Blocked tunneled request to local-only path: {} {}", method, path);
            stream.respondError(403, FORBIDDEN_MESSAGE);
            return;
        }

        if (path != null && TunnelRequestFilter.METADATA_PATH.equals(stripQuery(path))) {
            stream.respondJson(200, metadata.get());
            return;
        }

        CharSequence protocol = headers.get(PROTOCOL_PSEUDO_HEADER);
        if ("CONNECT".equals(method) && protocol != null && "websocket".contentEquals(protocol)) {
            log.debug("WebSocket stream {} -> local {}", path, target.hostHeader());
            leg = new LocalWebSocketBridge(stream, target, headers);
        } else {
            log.debug("HTTP stream {} {}", method, path);
            leg = new LocalHttpExchange(stream, target, headers, frame.isEndStream());
        }
        leg.start(ctx.channel().eventLoop());
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof Http2ResetFrame reset) {
            log.debug("Stream reset by relay (error code {})", reset.errorCode());
            onRelayGone();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (leg != null) {
            leg.onRelayWritabilityChanged();
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        onRelayGone();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Stream error: {}", cause.getMessage());
        if (stream != null) {
            stream.destroy();
        }
        onRelayGone();
        ctx.close();
    }

    private void onRelayGone() {
        if (stream != null) {
            stream.markDestroyed();
        }
        if (leg != null) {
            leg.abort();
        }
    }

    private static String stripQuery(String path) {
        int q = path.indexOf('?');
        return q < 0 ? path : path.substring(0, q);
    }
}
