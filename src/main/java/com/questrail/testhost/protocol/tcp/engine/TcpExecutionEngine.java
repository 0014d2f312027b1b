package com.questrail.testhost.protocol.tcp.engine;

import com.questrail.testhost.api.EngineMessage;
import com.questrail.testhost.api.ExecutionRequestHandler;
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
import com.questrail.testhost.protocol.tcp.transport.FrameConnector;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * TcpExecutionEngine
 * =============================================================================
 * The execution side of the engine link. Connects to the port a
 * {@link TcpRunnerEngine} is listening on, answers the runner's INFO with its
 * own {@link ExecutionEngineInfo}, hands FIND / RUN / CANCEL requests to an
 * {@link ExecutionRequestHandler} and reports results back as MSG frames.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   INITIALIZED --start(port)--> NEGOTIATING --INFO--> CONNECTED
 *        any state --dispose()--> DISCONNECTING --cleanup--> DISCONNECTED
 * </pre>
 *
 * <p>A QUIT from the runner does not tear the engine down on its own; it
 * completes {@link #quitRequested()} and the owner decides when to dispose.</p>
 */
public class TcpExecutionEngine extends TcpEngine
{
    private final ExecutionEngineInfo ownInfo;
    private final byte[] ownInfoJson;
    private final ExecutionRequestHandler requestHandler;
    private final FrameConnector frameConnector;
    private final CompletableFuture<Void> quitRequested = new CompletableFuture<>();

    private volatile FrameConnection connection;
    private volatile RunnerEngineInfo runnerInfo;

    /**
     * @param engineId engine id (used for diagnostic messages)
     * @param ownInfo info sent to the runner; both required properties must be set. Frozen here.
     * @param requestHandler receives the runner's requests
     * @param frameConnector connecting transport; owned and closed by this engine
     * @param observabilitySink diagnostic sink; may be null
     * @throws com.questrail.testhost.protocol.tcp.model.UnsetPropertyException if {@code ownInfo} is incomplete
     */
    public TcpExecutionEngine(String engineId,
                              ExecutionEngineInfo ownInfo,
                              ExecutionRequestHandler requestHandler,
                              FrameConnector frameConnector,
                              EngineObservabilitySink observabilitySink)
    {
        super(engineId, observabilitySink);
        Objects.requireNonNull(ownInfo, "ownInfo");
        ownInfo.getTestAssemblyUniqueID();
        ownInfo.getTestFrameworkDisplayName();
        ownInfo.freeze();

        this.ownInfo = ownInfo;
        this.ownInfoJson = EngineJson.write(ownInfo);
        this.requestHandler = Objects.requireNonNull(requestHandler, "requestHandler");
        this.frameConnector = Objects.requireNonNull(frameConnector, "frameConnector");

        registerHandler(EngineCommand.INFO, this::onInfo);
        registerHandler(EngineCommand.FIND, this::onFind);
        registerHandler(EngineCommand.RUN, this::onRun);
        registerHandler(EngineCommand.CANCEL, this::onCancel);
        registerHandler(EngineCommand.QUIT, this::onQuit);

        transitionState(EngineState.INITIALIZED);
    }

    public ExecutionEngineInfo ownInfo()
    {
        return ownInfo;
    }

    /** The runner's info, present once {@link EngineState#CONNECTED} is reached. */
    public Optional<RunnerEngineInfo> runnerInfo()
    {
        return Optional.ofNullable(runnerInfo);
    }

    /** Completes when the runner sends QUIT. */
    public CompletableFuture<Void> quitRequested()
    {
        return quitRequested;
    }

    // -------------------------------------------------------------------------
    // Start
    // -------------------------------------------------------------------------

    /** Connect to a runner listening on the loopback interface. */
    public void start(int port)
    {
        start(new InetSocketAddress(InetAddress.getLoopbackAddress(), port));
    }

    /**
     * Connect to the runner at {@code runnerAddress} and wait for its INFO.
     *
     * @throws IllegalStateException if the engine is not in {@link EngineState#INITIALIZED}
     * @throws com.questrail.testhost.protocol.tcp.transport.FrameTransportException if the connection fails
     */
    public void start(InetSocketAddress runnerAddress)
    {
        Objects.requireNonNull(runnerAddress, "runnerAddress");

        synchronized (stateLock()) {
            if (state() != EngineState.INITIALIZED) {
                throw new IllegalStateException(String.format(Locale.ROOT,
                        "%s: Cannot call start in any state other than %s (currently in state %s)",
                        displayName(), EngineState.INITIALIZED, state()));
            }

            disposalTracker().addAction(() -> {
                try {
                    frameConnector.close();
                } catch (RuntimeException e) {
                    reportError("Error during connector shutdown", e);
                }
            });

            FrameConnection c = frameConnector.connect(runnerAddress);
            reportTransportEvent(EngineTransportEvent.Kind.CONNECTED, runnerAddress);

            disposalTracker().addAction(() -> {
                reportTransportEvent(EngineTransportEvent.Kind.DISCONNECTING, runnerAddress);
                try {
                    c.close();
                } catch (RuntimeException e) {
                    reportError("Error during connection socket closure", e);
                }
                reportTransportEvent(EngineTransportEvent.Kind.DISCONNECTED, runnerAddress);
            });

            connection = c;

            disposalTracker().addAsyncAction(() -> c.flush().exceptionally(failure -> {
                reportError("Error flushing connection before close", failure);
                return null;
            }));

            transitionState(EngineState.NEGOTIATING);
            c.start(new Listener());
        }
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

        RunnerEngineInfo info = EngineJson.read(data.get(), RunnerEngineInfo.class);

        synchronized (stateLock()) {
            if (state() != EngineState.NEGOTIATING) {
                reportError(String.format(Locale.ROOT,
                        "[ERR] INFO message received outside of the %s state (current state is %s)",
                        EngineState.NEGOTIATING, state()), null);
                return;
            }

            runnerInfo = info;
            send(connection, EngineMessages.frame(EngineCommand.INFO, ownInfoJson), "INFO");
            transitionState(EngineState.CONNECTED);
        }

        if (!ProtocolVersion.isSupported(info.protocolVersion())) {
            reportProtocolEvent("[WRN] Runner negotiated unrecognized protocol version '%s'", info.protocolVersion());
        }
    }

    private void onFind(Optional<byte[]> data)
    {
        requireOperationId(EngineCommand.FIND, data).ifPresent(requestHandler::onFind);
    }

    private void onRun(Optional<byte[]> data)
    {
        requireOperationId(EngineCommand.RUN, data).ifPresent(requestHandler::onRun);
    }

    private void onCancel(Optional<byte[]> data)
    {
        Optional<String> operationId = data
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .filter(id -> !id.isEmpty());
        requestHandler.onCancel(operationId);
    }

    private void onQuit(Optional<byte[]> data)
    {
        reportProtocolEvent("[INF] QUIT received from runner");
        quitRequested.complete(null);
    }

    private Optional<String> requireOperationId(EngineCommand command, Optional<byte[]> data)
    {
        if (data.isEmpty() || data.get().length == 0) {
            reportError(String.format(Locale.ROOT, "[ERR] %s data is missing the operation ID", command.tag()), null);
            return Optional.empty();
        }
        return Optional.of(new String(data.get(), StandardCharsets.UTF_8));
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Send {@code message} to the runner as part of {@code operationId}.
     *
     * @return completes when the frame is written; fails if there is no
     *         connection or the write fails
     * @throws IllegalArgumentException if the id is empty or contains a reserved byte
     */
    public CompletableFuture<Void> sendMessage(String operationId, EngineMessage message)
    {
        EngineMessages.requireValidOperationId(operationId);
        Objects.requireNonNull(message, "message");

        FrameConnection c = connection;
        if (c == null) {
            reportError("[ERR] sendMessage called when there is no connected runner", null);
            return CompletableFuture.failedFuture(new IllegalStateException(
                    displayName() + ": not connected to a runner"));
        }

        return send(c, EngineMessages.messageFrame(operationId, message.toJson()), "MSG");
    }

    private CompletableFuture<Void> send(FrameConnection c, byte[] frame, String description)
    {
        return c.send(frame).whenComplete((ignored, failure) -> {
            if (failure != null) {
                reportError("Error sending " + description + " to runner", failure);
            }
        });
    }

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
            reportError("Connection to runner terminated abnormally", cause);
        }
    }
}
