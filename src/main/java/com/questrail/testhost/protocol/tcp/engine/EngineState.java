package com.questrail.testhost.protocol.tcp.engine;

/**
 * Connection state of an engine, in order of expected progression.
 *
 * <pre>
 *   UNKNOWN → INITIALIZED → LISTENING → NEGOTIATING → CONNECTED → DISCONNECTING → DISCONNECTED
 * </pre>
 *
 * <p>The execution engine never listens and goes straight from
 * {@link #INITIALIZED} to {@link #NEGOTIATING}. Any state may jump forward to
 * {@link #DISCONNECTING}.</p>
 */
public enum EngineState
{
    UNKNOWN,
    INITIALIZED,
    LISTENING,
    NEGOTIATING,
    CONNECTED,
    DISCONNECTING,
    DISCONNECTED;

    /** States only move forward. */
    public boolean canAdvanceTo(EngineState next)
    {
        return next.ordinal() > ordinal();
    }

    public boolean isTornDown()
    {
        return this == DISCONNECTING || this == DISCONNECTED;
    }
}
