/**
 * Engine layer of the runner/execution-engine link.
 *
 * <p>{@link com.questrail.testhost.protocol.tcp.engine.TcpEngine} holds what both
 * roles share: the state machine, the command table and teardown.
 * {@link com.questrail.testhost.protocol.tcp.engine.TcpRunnerEngine} listens and
 * drives; {@link com.questrail.testhost.protocol.tcp.engine.TcpExecutionEngine}
 * connects and serves. Neither touches sockets directly; both talk to the
 * transport ports in {@code protocol.tcp.transport}.</p>
 */
package com.questrail.testhost.protocol.tcp.engine;
