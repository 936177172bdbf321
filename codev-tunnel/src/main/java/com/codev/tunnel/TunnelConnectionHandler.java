package com.codev.tunnel;

import com.codev.common.infra.ErrorUtils;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http2.Http2GoAwayFrame;
import io.netty.handler.codec.http2.Http2PingFrame;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

/**
 * Connection-level frames of an authenticated tunnel: PING acks feed the heartbeat,
 * GOAWAY and transport errors close the connection so the client reconnects.
 */
@Slf4j
class TunnelConnectionHandler extends ChannelInboundHandlerAdapter {

    private final Runnable onPong;

    TunnelConnectionHandler(Runnable onPong) {
        this.onPong = onPong;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            if (msg instanceof Http2PingFrame ping) {
                if (ping.ack()) {
                    onPong.run();
                }
            } else if (msg instanceof Http2GoAwayFrame goAway) {
                log.info("Relay sent GOAWAY (error code {}), closing tunnel", goAway.errorCode());
                ctx.close();
            }
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Tunnel transport error: {}", ErrorUtils.formatRootCause(cause));
        ctx.close();
    }
}
