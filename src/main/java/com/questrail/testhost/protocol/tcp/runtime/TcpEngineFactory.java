package com.questrail.testhost.protocol.tcp.runtime;

import com.questrail.testhost.api.ExecutionRequestHandler;
import com.questrail.testhost.api.MessageDispatcher;
import com.questrail.testhost.protocol.tcp.config.EngineConfig;
import com.questrail.testhost.protocol.tcp.engine.TcpExecutionEngine;
import com.questrail.testhost.protocol.tcp.engine.TcpRunnerEngine;
import com.questrail.testhost.protocol.tcp.model.ExecutionEngineInfo;
import com.questrail.testhost.protocol.tcp.observability.EngineObservabilitySink;
import com.questrail.testhost.protocol.tcp.observability.Slf4jEngineObservabilitySink;
import com.questrail.testhost.protocol.tcp.transport.netty.NettyFrameConnector;
import com.questrail.testhost.protocol.tcp.transport.netty.NettyFrameServer;

import java.util.Objects;

/**
 * TcpEngineFactory
 * =============================================================================
 * Composition root for the engine link: wires the Netty transport and an
 * observability sink into either engine role.
 *
 * <p>The returned engine owns its transport. Call {@code start} to go live and
 * {@code dispose()} (or try-with-resources) to release every socket and thread.</p>
 */
public final class TcpEngineFactory {
    private TcpEngineFactory() {}

    /** Runner engine logging through SLF4J. */
    public static TcpRunnerEngine newRunnerEngine(EngineConfig config, MessageDispatcher dispatcher) {
        return newRunnerEngine(config, dispatcher, new Slf4jEngineObservabilitySink());
    }

    public static TcpRunnerEngine newRunnerEngine(EngineConfig config,
                                                  MessageDispatcher dispatcher,
                                                  EngineObservabilitySink observabilitySink) {
        Objects.requireNonNull(config, "config");
        NettyFrameServer server = new NettyFrameServer(config.bindAddress(), config.backlog(), config.maxFrameLength());
        return new TcpRunnerEngine(config.engineId(), dispatcher, server, observabilitySink);
    }

    /** Execution engine logging through SLF4J. */
    public static TcpExecutionEngine newExecutionEngine(EngineConfig config,
                                                        ExecutionEngineInfo info,
                                                        ExecutionRequestHandler handler) {
        return newExecutionEngine(config, info, handler, new Slf4jEngineObservabilitySink());
    }

    public static TcpExecutionEngine newExecutionEngine(EngineConfig config,
                                                        ExecutionEngineInfo info,
                                                        ExecutionRequestHandler handler,
                                                        EngineObservabilitySink observabilitySink) {
        Objects.requireNonNull(config, "config");
        NettyFrameConnector connector = new NettyFrameConnector(config.maxFrameLength());
        return new TcpExecutionEngine(config.engineId(), info, handler, connector, observabilitySink);
    }
}
