package com.codev.tunnel;

/**
 * Observer of tunnel state transitions.
 * Invoked on the tunnel event loop; implementations must not block.
 */
@FunctionalInterface
public interface TunnelStateListener {

    void onStateChange(TunnelState state, TunnelState previousState);
}
