package com.questrail.testhost.protocol.tcp.transport;

import java.net.InetSocketAddress;

/**
 * Connecting half of the framing primitive, used by the execution engine.
 */
public interface FrameConnector
{
    /**
     * Open a connection to {@code remote}, blocking until it is established.
     *
     * @return the connection, with reads still disabled
     * @throws FrameTransportException if the connection cannot be established
     */
    FrameConnection connect(InetSocketAddress remote);

    /**
     * Release the connector's threads. Safe to call more than once.
     */
    void close();
}
