package com.questrail.testhost.protocol.tcp.engine;

/**
 * Thrown when an engine is disposed a second time.
 */
public final class EngineDisposedException extends IllegalStateException
{
    public EngineDisposedException(String engineDisplayName) {
        super(engineDisplayName + ": engine has already been disposed");
    }
}
