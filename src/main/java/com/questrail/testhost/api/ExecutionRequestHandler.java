package com.questrail.testhost.api;

import java.util.Optional;

/**
 * ExecutionRequestHandler
 * -----------------------------------------------------------------------------
 * Execution-engine side callback for the commands a runner issues.
 *
 * <p>Calls arrive on the transport's inbound thread. Long-running work (finding
 * or running tests) must be handed off; results are reported back through
 * {@code TcpExecutionEngine#sendMessage(String, EngineMessage)} using the same
 * operation id.</p>
 */
public interface ExecutionRequestHandler
{
    /** The runner asked for test discovery under {@code operationId}. */
    void onFind(String operationId);

    /** The runner asked for test execution under {@code operationId}. */
    void onRun(String operationId);

    /**
     * The runner asked to cancel. The id is absent when the runner cancels
     * because its dispatcher asked to stop, rather than naming an operation.
     */
    void onCancel(Optional<String> operationId);
}
