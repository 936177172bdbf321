package com.codev.tunnel.proxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.DefaultLastHttpContent;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.Http2DataFrame;
import io.netty.handler.codec.http2.Http2HeadersFrame;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class LocalLegTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final LocalServiceTarget target = LocalServiceTarget.of("127.0.0.1", 4100);
    private EmbeddedChannel relayChannel;
    private EmbeddedChannel localChannel;
    private ChannelHandlerContext localCtx;

    @BeforeEach
    void setUp() {
        relayChannel = new EmbeddedChannel();
        localChannel = new EmbeddedChannel(new ChannelInboundHandlerAdapter());
        localCtx = localChannel.pipeline().firstContext();
    }

    @AfterEach
    void tearDown() {
        relayChannel.finishAndReleaseAll();
        localChannel.finishAndReleaseAll();
    }

    private LocalHttpExchange exchange(ProxiedStream stream) {
        return new LocalHttpExchange(stream, target,
                new DefaultHttp2Headers().method("GET").path("/events"), true);
    }

    private static HttpResponse head() {
        return new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
    }

    private static HttpContent chunk(String text) {
        return new DefaultHttpContent(Unpooled.copiedBuffer(text, StandardCharsets.UTF_8));
    }

    private static LastHttpContent lastChunk(String text) {
        return new DefaultLastHttpContent(Unpooled.copiedBuffer(text, StandardCharsets.UTF_8));
    }

    @Test
    void responseStartingAfterStreamIsGoneIsDrained() {
        ProxiedStream stream = new ProxiedStream(relayChannel, mapper);
        stream.markDestroyed();
        LocalHttpExchange exchange = exchange(stream);
        HttpContent first = chunk("data: one\n\n");
        LastHttpContent last = lastChunk("data: two\n\n");

        exchange.relayResponse(localCtx, head());
        exchange.relayResponse(localCtx, first);
        assertTrue(localChannel.isActive());
        exchange.relayResponse(localCtx, last);

        assertNull(relayChannel.readOutbound());
        assertEquals(1, first.refCnt());
        assertTrue(exchange.isResponseComplete());
        assertFalse(localChannel.isActive());
        first.release();
        last.release();
    }

    @Test
    void chunksAfterRelayResetAreDiscarded() {
        ProxiedStream stream = new ProxiedStream(relayChannel, mapper);
        LocalHttpExchange exchange = exchange(stream);
        HttpContent first = chunk("data: one\n\n");
        LastHttpContent last = lastChunk("data: two\n\n");

        exchange.relayResponse(localCtx, head());
        Http2HeadersFrame sent = relayChannel.readOutbound();
        assertEquals("200", sent.headers().status().toString());

        stream.markDestroyed();
        exchange.relayResponse(localCtx, first);
        exchange.relayResponse(localCtx, last);

        assertNull(relayChannel.readOutbound());
        assertFalse(localChannel.isActive());
        first.release();
        last.release();
    }

    @Test
    void liveStreamReceivesChunks() {
        ProxiedStream stream = new ProxiedStream(relayChannel, mapper);
        LocalHttpExchange exchange = exchange(stream);
        HttpContent first = chunk("data: one\n\n");

        exchange.relayResponse(localCtx, head());
        exchange.relayResponse(localCtx, first);

        Http2HeadersFrame headers = relayChannel.readOutbound();
        assertFalse(headers.isEndStream());
        Http2DataFrame data = relayChannel.readOutbound();
        assertEquals("data: one\n\n", data.content().toString(StandardCharsets.UTF_8));
        data.release();
        assertTrue(localChannel.isActive());
        assertFalse(exchange.isResponseComplete());
        first.release();
    }
}
