package com.questrail.testhost.protocol.tcp.engine;

import com.questrail.testhost.protocol.tcp.codec.EngineCommand;
import com.questrail.testhost.protocol.tcp.codec.EngineMessages;
import com.questrail.testhost.protocol.tcp.observability.EngineErrorEvent;
import com.questrail.testhost.protocol.tcp.observability.EngineObservabilitySink;
import com.questrail.testhost.protocol.tcp.observability.EngineProtocolEvent;
import com.questrail.testhost.protocol.tcp.observability.EngineStateTransitionEvent;
import com.questrail.testhost.protocol.tcp.observability.EngineTransportEvent;
import com.questrail.testhost.protocol.tcp.observability.NullObservabilitySink;

import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * TcpEngine
 * =============================================================================
 * Base class shared by both ends of the engine link: {@link TcpRunnerEngine}
 * and {@link TcpExecutionEngine}.
 *
 * <h2>What this class owns</h2>
 * <ul>
 *   <li>Engine identity (id and display name used in every event)</li>
 *   <li>The connection {@link EngineState} and the single lock guarding it</li>
 *   <li>The ordered command table and inbound {@link #dispatch(byte[])}</li>
 *   <li>The {@link DisposalTracker} and the teardown sequence</li>
 * </ul>
 *
 * <h2>State discipline</h2>
 * All writes to the state go through {@link #transitionState(EngineState)} while
 * holding {@link #stateLock()}. Reads through {@link #state()} are unlocked and
 * may be stale; a subclass that acts on the current state must re-check it
 * under the lock.
 *
 * <h2>Dispatch</h2>
 * Frames are split at the first separator into a command tag and an optional
 * payload. Bindings are scanned in registration order and the first exact tag
 * match wins. Handler failures and unknown tags are reported as error events;
 * neither ends the connection.
 */
public abstract class TcpEngine implements AutoCloseable
{
    private record CommandBinding(byte[] command, CommandHandler handler) {}

    private final List<CommandBinding> commandHandlers = new CopyOnWriteArrayList<>();
    private final Object stateLock = new Object();
    private final String engineId;
    private final String displayName;
    private final EngineObservabilitySink observabilitySink;
    private final DisposalTracker disposalTracker;

    private volatile EngineState state = EngineState.UNKNOWN;

    /**
     * @param engineId engine id, used in diagnostic output
     * @param observabilitySink receives state, protocol, transport and error events; may be null
     */
    protected TcpEngine(String engineId, EngineObservabilitySink observabilitySink)
    {
        if (engineId == null || engineId.isEmpty()) {
            throw new IllegalArgumentException("engineId must be a non-empty string");
        }
        this.engineId = engineId;
        this.displayName = getClass().getSimpleName() + "(" + engineId + ")";
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.disposalTracker = new DisposalTracker(
                failure -> reportError("Error during disposal", unwrap(failure)));
    }

    public final String engineId()
    {
        return engineId;
    }

    /** {@code SimpleClassName(engineId)}, the prefix of every diagnostic. */
    public final String displayName()
    {
        return displayName;
    }

    /**
     * Current state. Unlocked read: may lag a concurrent transition.
     */
    public final EngineState state()
    {
        return state;
    }

    /** The lock serializing state checks and transitions. */
    protected final Object stateLock()
    {
        return stateLock;
    }

    /** Cleanup actions released by {@link #dispose()}. */
    protected final DisposalTracker disposalTracker()
    {
        return disposalTracker;
    }

    // -------------------------------------------------------------------------
    // State machine
    // -------------------------------------------------------------------------

    /**
     * Move to {@code newState}, emitting a state transition event.
     *
     * @throws IllegalStateException if {@code newState} is not ahead of the current state
     */
    protected final void transitionState(EngineState newState)
    {
        Objects.requireNonNull(newState, "newState");

        synchronized (stateLock) {
            EngineState oldState = state;
            if (!oldState.canAdvanceTo(newState)) {
                throw new IllegalStateException(String.format(Locale.ROOT,
                        "%s: Illegal state transition from %s to %s", displayName, oldState, newState));
            }
            observabilitySink.onStateTransition(
                    new EngineStateTransitionEvent(Instant.now(), displayName, oldState, newState));
            state = newState;
        }
    }

    // -------------------------------------------------------------------------
    // Command table
    // -------------------------------------------------------------------------

    /**
     * Bind {@code handler} to the exact tag {@code command}.
     *
     * <p>Register everything before the connection starts delivering frames.
     * A duplicate tag is accepted but never reached: the first binding wins.</p>
     */
    protected final void registerHandler(byte[] command, CommandHandler handler)
    {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(handler, "handler");
        commandHandlers.add(new CommandBinding(command.clone(), handler));
    }

    protected final void registerHandler(EngineCommand command, CommandHandler handler)
    {
        Objects.requireNonNull(command, "command");
        registerHandler(command.bytes(), handler);
    }

    /**
     * Route one inbound frame (end-of-message byte already removed) to its handler.
     * Handler failures, {@link AssertionError} included, are reported; only a
     * {@link VirtualMachineError} propagates.
     */
    protected final void dispatch(byte[] request)
    {
        EngineMessages.Split split = EngineMessages.split(request);

        for (CommandBinding binding : commandHandlers) {
            if (Arrays.equals(split.head(), binding.command())) {
                try {
                    binding.handler().handle(split.rest());
                } catch (VirtualMachineError e) {
                    throw e;
                } catch (Throwable e) {
                    reportError(String.format(Locale.ROOT,
                            "Error during message processing '%s'", printable(request)), e);
                }
                return;
            }
        }

        reportError(String.format(Locale.ROOT, "Received unknown command '%s'", printable(request)), null);
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    /**
     * Tear down the engine: move to {@link EngineState#DISCONNECTING}, release
     * every registered cleanup action in reverse order, then move to
     * {@link EngineState#DISCONNECTED}.
     *
     * <p>Blocks until asynchronous cleanup (e.g. the final QUIT write) has
     * finished, so it must not be called from a transport event loop. Cleanup
     * failures are reported, never thrown.</p>
     *
     * @throws EngineDisposedException if the engine is already disposing or disposed
     */
    public final void dispose()
    {
        synchronized (stateLock) {
            if (state.isTornDown()) {
                throw new EngineDisposedException(displayName);
            }
            transitionState(EngineState.DISCONNECTING);
        }

        try {
            disposalTracker.dispose().join();
        } catch (CompletionException e) {
            reportError("Error during disposal", unwrap(e));
        }

        synchronized (stateLock) {
            transitionState(EngineState.DISCONNECTED);
        }
    }

    /** Same as {@link #dispose()}. */
    @Override
    public final void close()
    {
        dispose();
    }

    // -------------------------------------------------------------------------
    // Observability
    // -------------------------------------------------------------------------

    protected final void reportProtocolEvent(String format, Object... args)
    {
        observabilitySink.onProtocolEvent(
                new EngineProtocolEvent(Instant.now(), displayName, String.format(Locale.ROOT, format, args)));
    }

    protected final void reportTransportEvent(EngineTransportEvent.Kind kind, SocketAddress address)
    {
        observabilitySink.onTransportEvent(new EngineTransportEvent(Instant.now(), displayName, kind, address));
    }

    /**
     * @param cause may be null for pure protocol violations
     */
    protected final void reportError(String message, Throwable cause)
    {
        observabilitySink.onError(new EngineErrorEvent(Instant.now(), displayName, message, cause));
    }

    private static Throwable unwrap(Throwable failure)
    {
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }

    private static String printable(byte[] request)
    {
        return new String(request, StandardCharsets.UTF_8).replace((char) EngineMessages.SEPARATOR, ' ');
    }
}
