/**
 * Engine link codec
 * =============================================================================
 *
 * Byte-level layout of frames exchanged between the runner and the execution
 * engine, plus the JSON binding used for INFO and MSG payloads.
 *
 * <p>Nothing in this package performs I/O or holds connection state. Splitting
 * a socket stream into frames belongs to the transport port; interpreting
 * commands belongs to the engines.</p>
 */
package com.questrail.testhost.protocol.tcp.codec;
