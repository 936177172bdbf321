package com.codev.tunnel.proxy;

import io.netty.channel.Channel;
import io.netty.channel.socket.nio.NioSocketChannel;

/**
 * Address of the local tower service that tunneled streams are forwarded to.
 */
public record LocalServiceTarget(String host, int port, Class<? extends Channel> channelClass,
                                 int connectTimeoutMs) {

    public static LocalServiceTarget of(String host, int port) {
        return new LocalServiceTarget(host, port, NioSocketChannel.class, 10_000);
    }

    /** Value for a {@code Host} header when the relay did not supply one. */
    public String hostHeader() {
        return host + ":" + port;
    }
}
