package com.questrail.testhost.protocol.tcp.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a change in the underlying TCP connection.
 *
 * @param address the local address for {@link Kind#LISTENING}, the remote address otherwise
 */
public record EngineTransportEvent(
    Instant timestamp,
    String engine,
    Kind kind,
    SocketAddress address
) {
    public enum Kind {
        LISTENING,
        ACCEPTED,
        CONNECTED,
        DISCONNECTING,
        DISCONNECTED
    }
}
