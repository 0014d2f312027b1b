package com.questrail.testhost.api;

/**
 * Receives application messages forwarded by the runner engine.
 *
 * <p>Invoked on the transport's inbound thread, possibly concurrently for
 * different frames. Implementations must be thread-safe and should not block.</p>
 */
@FunctionalInterface
public interface MessageDispatcher
{
    /** Operation id used for messages that do not belong to a single operation. */
    String BROADCAST_OPERATION_ID = "::BROADCAST::";

    /**
     * Handle one message.
     *
     * @param operationId the operation the message belongs to, or {@link #BROADCAST_OPERATION_ID}
     * @param message the decoded message
     * @return {@code true} to continue; {@code false} to ask the execution engine to cancel
     */
    boolean dispatch(String operationId, EngineMessage message);
}
