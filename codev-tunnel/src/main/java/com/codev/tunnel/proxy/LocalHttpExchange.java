package com.codev.tunnel.proxy;

import com.codev.tunnel.security.TunnelRequestFilter;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpRequest;
import io.netty.handler.codec.http.DefaultLastHttpContent;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.codec.http2.Http2Headers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plain HTTP request forwarded to the local service over HTTP/1.1, one connection per
 * stream. The request body streams through as it arrives from the relay.
 */
class LocalHttpExchange extends LocalLeg {

    LocalHttpExchange(ProxiedStream stream, LocalServiceTarget target, Http2Headers headers, boolean endStream) {
        super(stream, target);
        sendToLocal(toHttpRequest(headers, target, !endStream));
        if (endStream) {
            sendToLocal(LastHttpContent.EMPTY_LAST_CONTENT);
        }
    }

    /**
     * HTTP/1.1 request head for an HTTP/2 request: pseudo-headers and hop-by-hop headers
     * dropped, split cookie headers joined, {@code Host} defaulted to the local service.
     */
    static HttpRequest toHttpRequest(Http2Headers headers, LocalServiceTarget target, boolean hasBody) {
        String method = headers.method() != null ? headers.method().toString() : "GET";
        String path = headers.path() != null ? headers.path().toString() : "/";
        HttpRequest request = new DefaultHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.valueOf(method), path);

        List<String> cookies = new ArrayList<>();
        for (Map.Entry<CharSequence, CharSequence> entry : headers) {
            String name = entry.getKey().toString();
            if (name.startsWith(":") || TunnelRequestFilter.isHopByHopHeader(name)) {
                continue;
            }
            if (HttpHeaderNames.COOKIE.contentEqualsIgnoreCase(name)) {
                cookies.add(entry.getValue().toString());
                continue;
            }
            request.headers().add(name, entry.getValue());
        }
        if (!cookies.isEmpty()) {
            request.headers().set(HttpHeaderNames.COOKIE, String.join("; ", cookies));
        }
        if (!request.headers().contains(HttpHeaderNames.HOST)) {
            request.headers().set(HttpHeaderNames.HOST, target.hostHeader());
        }
        if (hasBody && !request.headers().contains(HttpHeaderNames.CONTENT_LENGTH)) {
            request.headers().set(HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderValues.CHUNKED);
        }
        return request;
    }

    @Override
    protected void initLocalPipeline(ChannelPipeline pipeline) {
        pipeline.addLast("http", new HttpClientCodec());
        pipeline.addLast("response", new ResponseRelay());
    }

    @Override
    protected void onLocalConnected() {
        markReady();
    }

    @Override
    void onRelayData(ByteBuf data, boolean endStream) {
        sendToLocal(endStream ? new DefaultLastHttpContent(data) : new DefaultHttpContent(data));
    }

    private class ResponseRelay extends SimpleChannelInboundHandler<HttpObject> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, HttpObject msg) {
            relayResponse(ctx, msg);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            failLocal(cause);
            ctx.close();
        }
    }
}
