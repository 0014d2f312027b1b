package com.questrail.testhost.protocol.tcp.engine;

import com.questrail.testhost.api.EngineMessage;
import com.questrail.testhost.api.MessageDispatcher;
import com.questrail.testhost.protocol.tcp.codec.EngineCommand;
import com.questrail.testhost.protocol.tcp.codec.EngineJson;
import com.questrail.testhost.protocol.tcp.codec.EngineMessages;
import com.questrail.testhost.protocol.tcp.model.ExecutionEngineInfo;
import com.questrail.testhost.protocol.tcp.model.ProtocolVersion;
import com.questrail.testhost.protocol.tcp.model.RunnerEngineInfo;
import com.questrail.testhost.protocol.tcp.observability.EngineObservabilitySink;
import com.questrail.testhost.protocol.tcp.observability.EngineTransportEvent;
import com.questrail.testhost.protocol.tcp.transport.FrameConnection;
import com.questrail.testhost.protocol.tcp.transport.FrameConnectionListener;
import com.questrail.testhost.protocol.tcp.transport.FrameServer;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TcpRunnerEngine
 * =============================================================================
 * The runner side of the engine link. Opens a loopback port for the execution
 * engine to connect to, negotiates with it, forwards its MSG notifications to a
 * {@link MessageDispatcher} and sends it FIND / RUN / CANCEL / QUIT requests.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   INITIALIZED --start()--> LISTENING --accept--> NEGOTIATING --INFO--> CONNECTED
 *        any state --dispose()--> DISCONNECTING --cleanup--> DISCONNECTED
 * </pre>
 *
 * <p>On accept the runner immediately sends its own INFO; the execution engine
 * answers with its {@link ExecutionEngineInfo}, which completes the handshake.</p>
 *
 * <h2>Teardown order</h2>
 * Cleanup actions are registered as resources are acquired and released in
 * reverse:
 * <ol>
 *   <li>send QUIT unless {@link #sendQuit()} already did, and flush</li>
 *   <li>close the accepted connection</li>
 *   <li>close the listening socket (unblocks an accept that never happened)</li>
 * </ol>
 *
 * <h2>Cancellation</h2>
 * When the dispatcher returns {@code false}, a bare CANCEL frame is sent. A
 * single compare-and-set guards it, so exactly one CANCEL goes out per
 * connection no matter how many inbound messages race to request it.
 *
 * <h2>Sends without a connection</h2>
 * The send methods tolerate being called before an execution engine has
 * connected: they report an error event and return without writing.
 */
public class TcpRunnerEngine extends TcpEngine
{
    private final MessageDispatcher messageDispatcher;
    private final FrameServer frameServer;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicBoolean quitSent = new AtomicBoolean();

    private volatile FrameConnection connection;
    private volatile ExecutionEngineInfo executionEngineInfo;

    /**
     * @param engineId engine id (used for diagnostic messages)
     * @param messageDispatcher receives messages from the execution engine
     * @param frameServer listening transport; owned and closed by this engine
     * @param observabilitySink diagnostic sink; may be null
     */
    public TcpRunnerEngine(String engineId,
                           MessageDispatcher messageDispatcher,
                           FrameServer frameServer,
                           EngineObservabilitySink observabilitySink)
    {
        super(engineId, observabilitySink);
        this.messageDispatcher = Objects.requireNonNull(messageDispatcher, "messageDispatcher");
        this.frameServer = Objects.requireNonNull(frameServer, "frameServer");

        registerHandler(EngineCommand.INFO, this::onInfo);
        registerHandler(EngineCommand.MESSAGE, this::onMessage);

        transitionState(EngineState.INITIALIZED);
    }

    // -------------------------------------------------------------------------
    // Negotiated info
    // -------------------------------------------------------------------------

    /**
     * The execution engine's info, present once {@link EngineState#CONNECTED} is reached.
     * The returned instance is read-only.
     */
    public Optional<ExecutionEngineInfo> executionEngineInfo()
    {
        return Optional.ofNullable(executionEngineInfo);
    }

    /**
     * @throws IllegalStateException if called before {@link EngineState#CONNECTED}
     */
    public String testAssemblyUniqueId()
    {
        return requireNegotiated("testAssemblyUniqueId").getTestAssemblyUniqueID();
    }

    /**
     * @throws IllegalStateException if called before {@link EngineState#CONNECTED}
     */
    public String testFrameworkDisplayName()
    {
        return requireNegotiated("testFrameworkDisplayName").getTestFrameworkDisplayName();
    }

    private ExecutionEngineInfo requireNegotiated(String accessor)
    {
        ExecutionEngineInfo info = executionEngineInfo;
        if (info == null) {
            throw new IllegalStateException(String.format(Locale.ROOT,
                    "%s: Cannot call %s before it has reached the %s state (currently in state %s)",
                    displayName(), accessor, EngineState.CONNECTED, state()));
        }
        return info;
    }

    // -------------------------------------------------------------------------
    // Start / accept
    // -------------------------------------------------------------------------

    /**
     * Start listening. Stop by disposing the engine.
     *
     * @return the loopback TCP port the execution engine must connect to
     * @throws IllegalStateException if the engine is not in {@link EngineState#INITIALIZED}
     */
    public int start()
    {
        InetSocketAddress bound;

        synchronized (stateLock()) {
            if (state() != EngineState.INITIALIZED) {
                throw new IllegalStateException(String.format(Locale.ROOT,
                        "%s: Cannot call start in any state other than %s (currently in state %s)",
                        displayName(), EngineState.INITIALIZED, state()));
            }

            disposalTracker().addAction(() -> {
                try {
                    frameServer.close();
                } catch (RuntimeException e) {
                    reportError("Error during listen socket closure", e);
                }
            });

            bound = frameServer.bind(this::onAccepted);
            transitionState(EngineState.LISTENING);
        }

        reportTransportEvent(EngineTransportEvent.Kind.LISTENING, bound);
        return bound.getPort();
    }

    private void onAccepted(FrameConnection accepted)
    {
        SocketAddress remote = accepted.remoteAddress();

        synchronized (stateLock()) {
            if (state() != EngineState.LISTENING) {
                reportError(String.format(Locale.ROOT,
                        "Connection from %s accepted in state %s; closing it", remote, state()), null);
                accepted.close();
                return;
            }

            reportTransportEvent(EngineTransportEvent.Kind.ACCEPTED, remote);

            disposalTracker().addAction(() -> {
                reportTransportEvent(EngineTransportEvent.Kind.DISCONNECTING, remote);
                try {
                    accepted.close();
                } catch (RuntimeException e) {
                    reportError("Error during connection socket closure", e);
                }
                reportTransportEvent(EngineTransportEvent.Kind.DISCONNECTED, remote);
            });

            connection = accepted;

            disposalTracker().addAsyncAction(() -> {
                try {
                    sendQuit();
                } catch (RuntimeException e) {
                    reportError("Error sending QUIT message to execution engine", e);
                }
                return accepted.flush().exceptionally(failure -> {
                    reportError("Error flushing connection before close", failure);
                    return null;
                });
            });

            transitionState(EngineState.NEGOTIATING);
            accepted.start(new Listener());
        }

        // Start protocol negotiation
        send(accepted, EngineMessages.frame(EngineCommand.INFO, EngineJson.write(RunnerEngineInfo.current())), "INFO");
    }

    // -------------------------------------------------------------------------
    // Inbound commands
    // -------------------------------------------------------------------------

    private void onInfo(Optional<byte[]> data)
    {
        if (data.isEmpty()) {
            reportError("[ERR] INFO data is missing the JSON", null);
            return;
        }

        ExecutionEngineInfo info = EngineJson.read(data.get(), ExecutionEngineInfo.class);

        synchronized (stateLock()) {
            if (state() != EngineState.NEGOTIATING) {
                reportError(String.format(Locale.ROOT,
                        "[ERR] INFO message received outside of the %s state (current state is %s)",
                        EngineState.NEGOTIATING, state()), null);
                return;
            }

            info.freeze();
            executionEngineInfo = info;
            transitionState(EngineState.CONNECTED);
        }

        if (!ProtocolVersion.isSupported(info.getProtocolVersion())) {
            reportProtocolEvent("[WRN] Execution engine negotiated unrecognized protocol version '%s'",
                    info.getProtocolVersion());
        }
    }

    private void onMessage(Optional<byte[]> data)
    {
        if (data.isEmpty()) {
            reportError("[ERR] MSG data is missing the operation ID and JSON", null);
            return;
        }

        EngineMessages.Split split = EngineMessages.split(data.get());
        if (split.rest().isEmpty()) {
            reportError("[ERR] MSG data is missing the JSON", null);
            return;
        }

        EngineMessage message = EngineMessage.parse(split.rest().get());
        boolean keepGoing = messageDispatcher.dispatch(split.headAsString(), message);

        if (!keepGoing && cancelRequested.compareAndSet(false, true)) {
            FrameConnection c = connection;
            if (c != null) {
                send(c, EngineMessages.frame(EngineCommand.CANCEL), "CANCEL");
                reportProtocolEvent("[INF] Request sent: CANCEL (requested by message dispatcher)");
            }
        }
    }

    // -------------------------------------------------------------------------
    // Outbound requests
    // -------------------------------------------------------------------------

    /**
     * Sends FIND for {@code operationId}.
     *
     * @throws IllegalArgumentException if the id is empty or contains a reserved byte
     */
    public void sendFind(String operationId)
    {
        sendOperation(EngineCommand.FIND, "sendFind", operationId);
    }

    /**
     * Sends RUN for {@code operationId}.
     *
     * @throws IllegalArgumentException if the id is empty or contains a reserved byte
     */
    public void sendRun(String operationId)
    {
        sendOperation(EngineCommand.RUN, "sendRun", operationId);
    }

    /**
     * Sends CANCEL for {@code operationId}.
     *
     * @throws IllegalArgumentException if the id is empty or contains a reserved byte
     */
    public void sendCancel(String operationId)
    {
        sendOperation(EngineCommand.CANCEL, "sendCancel", operationId);
    }

    /**
     * Sends QUIT, at most once per connection. Later calls, and disposal, send nothing.
     */
    public void sendQuit()
    {
        FrameConnection c = connection;
        if (c == null) {
            reportError(String.format(Locale.ROOT,
                    "[ERR] sendQuit called when there is no connected execution engine"), null);
            return;
        }

        if (quitSent.getAndSet(true)) {
            return;
        }
        send(c, EngineMessages.frame(EngineCommand.QUIT), "QUIT");
        reportProtocolEvent("[INF] Request sent: QUIT");
    }

    private void sendOperation(EngineCommand command, String caller, String operationId)
    {
        EngineMessages.requireValidOperationId(operationId);

        FrameConnection c = connection;
        if (c == null) {
            reportError(String.format(Locale.ROOT,
                    "[ERR] %s called when there is no connected execution engine", caller), null);
            return;
        }

        send(c, EngineMessages.frame(command, operationId), command.tag());
        reportProtocolEvent("[INF] Request sent: %s %s", command.tag(), operationId);
    }

    private void send(FrameConnection c, byte[] frame, String description)
    {
        c.send(frame).whenComplete((ignored, failure) -> {
            if (failure != null) {
                reportError("Error sending " + description + " to execution engine", failure);
            }
        });
    }

    /**
     * Connection callbacks: frames go to {@link #dispatch(byte[])}; an abnormal
     * termination is broadcast to the dispatcher as an error message.
     */
    private final class Listener implements FrameConnectionListener
    {
        @Override
        public void onFrame(byte[] frame)
        {
            dispatch(frame);
        }

        @Override
        public void onAbnormalTermination(Throwable cause)
        {
            reportError("Connection to execution engine terminated abnormally", cause);
            try {
                messageDispatcher.dispatch(MessageDispatcher.BROADCAST_OPERATION_ID, EngineMessage.error(cause));
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                reportError("Error dispatching abnormal termination", e);
            }
        }
    }
}
