package com.questrail.testhost.protocol.tcp.transport;

import java.net.InetSocketAddress;

/**
 * FrameServer
 * -----------------------------------------------------------------------------
 * Listening half of the framing primitive, used by the runner.
 *
 * <p>A server accepts <strong>at most one</strong> connection over its lifetime.
 * Once that connection is handed to the listener the server stops accepting.</p>
 */
public interface FrameServer
{
    /**
     * Bind and begin listening, then accept one connection asynchronously.
     *
     * <p>Returns once the socket is bound. The accepted connection is reported
     * through {@link FrameServerListener#onAccepted(FrameConnection)} on a
     * transport thread, with reads still disabled.</p>
     *
     * @return the bound local address (the port is chosen by the OS)
     * @throws FrameTransportException if the socket cannot be bound
     */
    InetSocketAddress bind(FrameServerListener listener);

    /**
     * Stop listening and release the listening socket and its threads.
     *
     * <p>Unblocks a pending accept. An accepted connection may lose its threads
     * here as well, so close it through {@link FrameConnection#close()} first.
     * Safe to call more than once, and before {@link #bind}.</p>
     */
    void close();
}
