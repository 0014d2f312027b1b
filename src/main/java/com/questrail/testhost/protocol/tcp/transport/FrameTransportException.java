package com.questrail.testhost.protocol.tcp.transport;

/**
 * Indicates that the framing primitive could not bind or connect.
 */
public final class FrameTransportException extends RuntimeException
{
    public FrameTransportException(String message) {
        super(message);
    }

    public FrameTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
