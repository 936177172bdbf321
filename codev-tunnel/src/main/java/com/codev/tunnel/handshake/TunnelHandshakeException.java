package com.codev.tunnel.handshake;

/**
 * The relay answered the auth frame with something this client cannot interpret,
 * or did not answer in time.
 */
public class TunnelHandshakeException extends RuntimeException {

    public TunnelHandshakeException(String message) {
        super(message);
    }

    public TunnelHandshakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
