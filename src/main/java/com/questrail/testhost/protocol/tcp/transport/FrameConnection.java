package com.questrail.testhost.protocol.tcp.transport;

import java.net.SocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * FrameConnection
 * -----------------------------------------------------------------------------
 * One established, framed TCP connection.
 *
 * <p>Inbound bytes are split on the end-of-message byte and delivered as whole
 * frames. Outbound, each {@link #send(byte[])} call carries one complete frame
 * (end-of-message byte included) and is written as a single unit: concurrent
 * senders never interleave their bytes.</p>
 */
public interface FrameConnection
{
    /**
     * Begin delivering inbound frames to {@code listener}.
     *
     * <p>Must be called at most once.</p>
     */
    void start(FrameConnectionListener listener);

    /**
     * Queue one complete frame for transmission. Safe to call from any thread.
     *
     * @return completes when the frame is written, or exceptionally if the write fails
     */
    CompletableFuture<Void> send(byte[] frame);

    /**
     * @return completes once every frame sent before this call has been written
     */
    CompletableFuture<Void> flush();

    /**
     * Close the connection. Frames not yet written may be lost; call
     * {@link #flush()} first when they matter. Safe to call more than once.
     */
    void close();

    SocketAddress remoteAddress();
}
