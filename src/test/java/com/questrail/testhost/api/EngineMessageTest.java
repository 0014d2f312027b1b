package com.questrail.testhost.api;

import com.questrail.testhost.protocol.tcp.codec.EngineJsonException;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EngineMessageTest {

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void parseKeepsFrameworkFields() {
        EngineMessage message = EngineMessage.parse(utf8("{\"type\":\"test-passed\",\"testUniqueID\":\"t1\",\"time\":0.5}"));

        assertEquals("test-passed", message.type());
        assertEquals(Optional.of("t1"), message.text("testUniqueID"));
        assertEquals(0.5, message.body().get("time").asDouble());
        assertFalse(message.isError());
    }

    @Test
    void parseRejectsNonObjectsAndMissingType() {
        assertThrows(EngineJsonException.class, () -> EngineMessage.parse(utf8("[1,2]")));
        assertThrows(EngineJsonException.class, () -> EngineMessage.parse(utf8("{\"kind\":\"x\"}")));
        assertThrows(EngineJsonException.class, () -> EngineMessage.parse(utf8("{\"type\":5}")));
        assertThrows(EngineJsonException.class, () -> EngineMessage.parse(utf8("{\"type\":")));
    }

    @Test
    void withReturnsCopyAndLeavesSourceUntouched() {
        EngineMessage base = EngineMessage.of("x");
        EngineMessage extended = base.with("detail", "d");

        assertEquals(Optional.empty(), base.text("detail"));
        assertEquals(Optional.of("d"), extended.text("detail"));
        assertThrows(IllegalArgumentException.class, () -> base.with(EngineMessage.TYPE_FIELD, "y"));
    }

    @Test
    void bodyIsDefensiveCopy() {
        EngineMessage message = EngineMessage.of("x");
        message.body().put("type", "mutated");

        assertEquals("x", message.type());
    }

    @Test
    void errorMessageDescribesFailure() {
        EngineMessage error = EngineMessage.error(new IOException("connection reset"));

        assertTrue(error.isError());
        assertEquals(Optional.of(IOException.class.getName()), error.text("exceptionType"));
        assertEquals(Optional.of("connection reset"), error.text("message"));
        assertTrue(error.text("stackTrace").orElseThrow().contains("connection reset"));
    }

    @Test
    void errorWithoutMessageCarriesEmptyText() {
        EngineMessage error = EngineMessage.error(new IllegalStateException());

        assertEquals(Optional.of(""), error.text("message"));
    }

    @Test
    void toJsonParsesBackToEqualMessage() {
        EngineMessage message = EngineMessage.of("x").with("a", "b");

        assertEquals(message, EngineMessage.parse(message.toJson()));
    }

    @Test
    void emptyTypeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> EngineMessage.of(""));
    }
}
