package com.questrail.testhost.protocol.tcp.engine;

import java.util.Optional;

/**
 * Handles one inbound command.
 */
@FunctionalInterface
public interface CommandHandler
{
    /**
     * @param payload bytes after the first separator; empty when the frame had no separator
     */
    void handle(Optional<byte[]> payload);
}
