package com.questrail.testhost.protocol.tcp.transport;

/**
 * FrameConnectionListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link FrameConnection}.
 *
 * <p>Callbacks for one connection are delivered serially, on the connection's
 * inbound thread.</p>
 */
public interface FrameConnectionListener
{
    /**
     * Called for each complete inbound frame.
     *
     * @param frame frame bytes, with the end-of-message byte removed
     */
    void onFrame(byte[] frame);

    /**
     * Called when the inbound side fails (I/O error, oversized frame). The
     * connection is closed after this call. An orderly close by the peer is
     * not reported here.
     */
    void onAbnormalTermination(Throwable cause);
}
