/**
 * Engine Link Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty in production, fakes in
 * tests) and the engines in {@code protocol.tcp.engine}.
 *
 * <h2>Why these ports exist</h2>
 * Netty does the socket work (event loops, accept, delimiter framing) but its
 * types must not leak into the engines. Everything above this boundary sees only:
 * <ul>
 *   <li>Whole frames as {@code byte[]}</li>
 *   <li>Addresses as standard {@link java.net.SocketAddress}</li>
 *   <li>Write completion as {@link java.util.concurrent.CompletableFuture}</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O and end-of-message framing only</li>
 *   <li>Not interpret command tags or payloads</li>
 *   <li>Not retry binds, connects or writes</li>
 *   <li>Not deliver frames before {@link com.questrail.testhost.protocol.tcp.transport.FrameConnection#start} is called</li>
 * </ul>
 */
package com.questrail.testhost.protocol.tcp.transport;
