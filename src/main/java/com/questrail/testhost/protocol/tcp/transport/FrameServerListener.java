package com.questrail.testhost.protocol.tcp.transport;

/**
 * Callback for the single connection accepted by a {@link FrameServer}.
 */
@FunctionalInterface
public interface FrameServerListener
{
    /**
     * Called once, when the peer's connection has been accepted.
     *
     * <p>The connection does not deliver frames until
     * {@link FrameConnection#start(FrameConnectionListener)} is called.</p>
     */
    void onAccepted(FrameConnection connection);
}
