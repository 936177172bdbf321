package com.codev.tunnel.proxy;

import com.codev.tunnel.security.TunnelRequestFilter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.handler.codec.http2.DefaultHttp2DataFrame;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.DefaultHttp2HeadersFrame;
import io.netty.handler.codec.http2.DefaultHttp2ResetFrame;
import io.netty.handler.codec.http2.Http2Error;
import io.netty.handler.codec.http2.Http2Headers;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Relay-facing side of one proxied stream.
 * <p>
 * Every write goes through {@link #isOpen()}: once the relay has reset the stream or
 * the transport is gone, writes are dropped and their buffers released.
 */
@Slf4j
public class ProxiedStream {

    public enum State {
        /** Accepting response headers and data. */
        OPEN,
        /** Response ended; waiting for the stream to close. */
        CLOSING,
        /** Reset by either side or closed with the transport. */
        DESTROYED
    }

    private final Channel channel;
    private final ObjectMapper mapper;
    private State state = State.OPEN;
    private boolean responded;

    public ProxiedStream(Channel channel, ObjectMapper mapper) {
        this.channel = channel;
        this.mapper = mapper;
    }

    public boolean isOpen() {
        return state == State.OPEN && channel.isActive();
    }

    public State getState() {
        return state;
    }

    public boolean hasResponded() {
        return responded;
    }

    public Channel channel() {
        return channel;
    }

    /**
     * Send response headers. Hop-by-hop headers are dropped and names lowercased.
     */
    public void respond(int status, Map<String, List<String>> headers, boolean endStream) {
        if (!isOpen() || responded) {
            return;
        }
        responded = true;
        Http2Headers h2 = new DefaultHttp2Headers().status(Integer.toString(status));
        for (Map.Entry<String, List<String>> entry : TunnelRequestFilter.filterHopByHopHeaders(headers).entrySet()) {
            String name = entry.getKey().toLowerCase(Locale.ROOT);
            for (String value : entry.getValue()) {
                h2.add(name, value);
            }
        }
        channel.writeAndFlush(new DefaultHttp2HeadersFrame(h2, endStream));
        if (endStream) {
            state = State.CLOSING;
        }
    }

    /**
     * Send a body chunk. Takes ownership of {@code data}.
     */
    public void writeData(ByteBuf data, boolean endStream) {
        if (!isOpen()) {
            data.release();
            return;
        }
        channel.writeAndFlush(new DefaultHttp2DataFrame(data, endStream));
        if (endStream) {
            state = State.CLOSING;
        }
    }

    public void respondJson(int status, Object body) {
        if (!isOpen() || responded) {
            return;
        }
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize response body: {}", e.getMessage(), e);
            destroy();
            return;
        }
        respond(status, Map.of("content-type", List.of("application/json")), false);
        writeData(Unpooled.wrappedBuffer(json), true);
    }

    public void respondError(int status, String message) {
        respondJson(status, Map.of("error", message));
    }

    /**
     * Reset the stream towards the relay. Idempotent.
     */
    public void destroy() {
        if (state == State.DESTROYED) {
            return;
        }
        boolean active = channel.isActive();
        state = State.DESTROYED;
        if (active) {
            channel.writeAndFlush(new DefaultHttp2ResetFrame(Http2Error.CANCEL));
        }
    }

    /** The relay reset the stream or it closed with the transport. */
    void markDestroyed() {
        state = State.DESTROYED;
    }
}
