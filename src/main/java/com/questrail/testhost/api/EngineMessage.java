package com.questrail.testhost.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.testhost.protocol.tcp.codec.EngineJson;
import com.questrail.testhost.protocol.tcp.codec.EngineJsonException;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.Optional;

/**
 * EngineMessage
 * -----------------------------------------------------------------------------
 * An application-level notification carried inside a MSG frame.
 *
 * <p>The link treats the message as an opaque JSON object that carries a
 * textual {@code type} discriminator. Everything else in the object belongs to
 * the test framework and is passed through untouched.</p>
 *
 * <p>Instances are immutable; {@link #with(String, String)} returns a copy.</p>
 */
public final class EngineMessage
{
    public static final String TYPE_FIELD = "type";

    /** Type of the message synthesized from a transport failure. */
    public static final String ERROR_TYPE = "error";

    private final ObjectNode body;

    private EngineMessage(ObjectNode body) {
        this.body = body;
    }

    /** Creates a message with only a {@code type} field. */
    public static EngineMessage of(String type) {
        if (type == null || type.isEmpty()) {
            throw new IllegalArgumentException("type must be a non-empty string");
        }
        ObjectNode node = EngineJson.mapper().createObjectNode();
        node.put(TYPE_FIELD, type);
        return new EngineMessage(node);
    }

    /**
     * Parses the JSON remainder of a MSG frame.
     *
     * @throws EngineJsonException if the bytes are not a JSON object with a textual {@code type}
     */
    public static EngineMessage parse(byte[] json) {
        JsonNode node = EngineJson.readTree(json);
        if (node == null || !node.isObject()) {
            throw new EngineJsonException("Engine message must be a JSON object");
        }
        JsonNode type = node.get(TYPE_FIELD);
        if (type == null || !type.isTextual() || type.asText().isEmpty()) {
            throw new EngineJsonException("Engine message is missing a textual '" + TYPE_FIELD + "' field");
        }
        return new EngineMessage((ObjectNode) node);
    }

    /**
     * Converts a failure into an {@link #ERROR_TYPE} message so it can travel through
     * the same dispatcher as ordinary messages.
     */
    public static EngineMessage error(Throwable failure) {
        Objects.requireNonNull(failure, "failure");
        StringWriter trace = new StringWriter();
        failure.printStackTrace(new PrintWriter(trace));

        return of(ERROR_TYPE)
                .with("exceptionType", failure.getClass().getName())
                .with("message", Objects.toString(failure.getMessage(), ""))
                .with("stackTrace", trace.toString());
    }

    public String type() {
        return body.get(TYPE_FIELD).asText();
    }

    public boolean isError() {
        return ERROR_TYPE.equals(type());
    }

    /** Returns a copy of this message with {@code field} set to {@code value}. */
    public EngineMessage with(String field, String value) {
        Objects.requireNonNull(field, "field");
        if (TYPE_FIELD.equals(field)) {
            throw new IllegalArgumentException("type is fixed at construction");
        }
        ObjectNode copy = body.deepCopy();
        copy.put(field, value);
        return new EngineMessage(copy);
    }

    /** Textual value of {@code field}, if present and textual. */
    public Optional<String> text(String field) {
        JsonNode value = body.get(field);
        return value != null && value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
    }

    /** A copy of the full JSON body. */
    public ObjectNode body() {
        return body.deepCopy();
    }

    public byte[] toJson() {
        return EngineJson.write(body);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EngineMessage && body.equals(((EngineMessage) o).body);
    }

    @Override
    public int hashCode() {
        return body.hashCode();
    }

    @Override
    public String toString() {
        return "EngineMessage" + body;
    }
}
