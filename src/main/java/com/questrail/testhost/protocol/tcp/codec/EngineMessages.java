package com.questrail.testhost.protocol.tcp.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * EngineMessages
 * -----------------------------------------------------------------------------
 * Frame layout for the runner/execution-engine link.
 *
 * <pre>
 *   FRAME   := COMMAND (SEP PAYLOAD)? EOM
 *   SEP     := 0x1F
 *   EOM     := 0x00
 * </pre>
 *
 * <p>The end-of-message byte is consumed by the framing primitive: frames handed
 * to {@link #split(byte[])} never contain it. JSON payloads cannot contain either
 * reserved byte because JSON escapes all control characters.</p>
 */
public final class EngineMessages
{
    /** Separates the command tag from its payload, and fields inside a MSG payload. */
    public static final byte SEPARATOR = 0x1F;

    /** Terminates every frame on the wire. */
    public static final byte END_OF_MESSAGE = 0x00;

    private EngineMessages() {}

    /**
     * Result of splitting a frame (or payload) at its first separator.
     *
     * @param head bytes before the separator, or the whole input when there is none
     * @param rest bytes after the separator; empty when there was no separator
     */
    public record Split(byte[] head, Optional<byte[]> rest) {
        public Split {
            Objects.requireNonNull(head, "head");
            Objects.requireNonNull(rest, "rest");
        }

        public String headAsString()
        {
            return new String(head, StandardCharsets.UTF_8);
        }
    }

    /**
     * Split {@code data} at the first {@link #SEPARATOR}.
     *
     * <p>A separator in the last position yields an empty (but present) rest.</p>
     */
    public static Split split(byte[] data)
    {
        Objects.requireNonNull(data, "data");

        for (int i = 0; i < data.length; i++) {
            if (data[i] == SEPARATOR) {
                return new Split(
                        Arrays.copyOfRange(data, 0, i),
                        Optional.of(Arrays.copyOfRange(data, i + 1, data.length)));
            }
        }
        return new Split(data.clone(), Optional.empty());
    }

    /** {@code COMMAND EOM} */
    public static byte[] frame(EngineCommand command)
    {
        Objects.requireNonNull(command, "command");
        return assemble(command.bytes());
    }

    /** {@code COMMAND SEP payload EOM}, with the payload UTF-8 encoded. */
    public static byte[] frame(EngineCommand command, String payload)
    {
        Objects.requireNonNull(payload, "payload");
        return frame(command, payload.getBytes(StandardCharsets.UTF_8));
    }

    /** {@code COMMAND SEP payload EOM} */
    public static byte[] frame(EngineCommand command, byte[] payload)
    {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(payload, "payload");
        return assemble(command.bytes(), payload);
    }

    /** {@code MSG SEP operationId SEP json EOM} */
    public static byte[] messageFrame(String operationId, byte[] json)
    {
        requireValidOperationId(operationId);
        Objects.requireNonNull(json, "json");
        return assemble(EngineCommand.MESSAGE.bytes(), operationId.getBytes(StandardCharsets.UTF_8), json);
    }

    /**
     * Validates a caller-chosen operation identifier.
     *
     * @throws IllegalArgumentException if the id is empty or contains a reserved byte
     */
    public static String requireValidOperationId(String operationId)
    {
        Objects.requireNonNull(operationId, "operationId");
        if (operationId.isEmpty()) {
            throw new IllegalArgumentException("operationId must not be empty");
        }
        for (int i = 0; i < operationId.length(); i++) {
            char c = operationId.charAt(i);
            if (c == SEPARATOR || c == END_OF_MESSAGE) {
                throw new IllegalArgumentException(
                        "operationId must not contain reserved byte 0x" + Integer.toHexString(c) + ": " + operationId.replace(c, '?'));
            }
        }
        return operationId;
    }

    private static byte[] assemble(byte[] command, byte[]... fields)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream(64);
        out.writeBytes(command);
        for (byte[] field : fields) {
            out.write(SEPARATOR);
            out.writeBytes(field);
        }
        out.write(END_OF_MESSAGE);
        return out.toByteArray();
    }
}
