package com.questrail.testhost.protocol.tcp.codec;

/**
 * Indicates that a JSON payload on the engine link could not be read or written.
 *
 * This typically reflects:
 * <ul>
 *   <li>Malformed JSON in an INFO or MSG payload</li>
 *   <li>A payload of the wrong shape (not an object, no {@code type})</li>
 *   <li>A value rejected by a validated setter during binding</li>
 * </ul>
 */
public final class EngineJsonException extends RuntimeException
{
    public EngineJsonException(String message) {
        super(message);
    }

    public EngineJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
