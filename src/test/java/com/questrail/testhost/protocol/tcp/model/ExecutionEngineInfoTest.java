package com.questrail.testhost.protocol.tcp.model;

import com.questrail.testhost.protocol.tcp.codec.EngineJson;
import com.questrail.testhost.protocol.tcp.codec.EngineJsonException;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionEngineInfoTest {

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    // ---------------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------------

    @Test
    void protocolVersionDefaultsToFirstVersion() {
        assertEquals(ProtocolVersion.V1_0, new ExecutionEngineInfo().getProtocolVersion());
    }

    @Test
    void unsetRequiredPropertiesThrowOnRead() {
        ExecutionEngineInfo info = new ExecutionEngineInfo();

        UnsetPropertyException e = assertThrows(UnsetPropertyException.class, info::getTestAssemblyUniqueID);
        assertEquals("testAssemblyUniqueID", e.propertyName());
        assertEquals(ExecutionEngineInfo.class, e.declaringType());

        assertThrows(IllegalStateException.class, info::getTestFrameworkDisplayName);
    }

    @Test
    void settersRejectNullAndEmpty() {
        ExecutionEngineInfo info = new ExecutionEngineInfo();

        assertThrows(IllegalArgumentException.class, () -> info.setTestAssemblyUniqueID(null));
        assertThrows(IllegalArgumentException.class, () -> info.setTestAssemblyUniqueID(""));
        assertThrows(IllegalArgumentException.class, () -> info.setTestFrameworkDisplayName(""));
        assertThrows(IllegalArgumentException.class, () -> info.setProtocolVersion(null));
    }

    @Test
    void frozenInstanceRejectsSetters() {
        ExecutionEngineInfo info = new ExecutionEngineInfo("abc", "demo");
        info.freeze();

        assertThrows(IllegalStateException.class, () -> info.setTestAssemblyUniqueID("other"));
        assertEquals("abc", info.getTestAssemblyUniqueID());
    }

    // ---------------------------------------------------------------------
    // JSON
    // ---------------------------------------------------------------------

    @Test
    void jsonUsesWireFieldNames() {
        ExecutionEngineInfo info = new ExecutionEngineInfo("abc", "demo");

        String json = new String(EngineJson.write(info), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"protocolVersion\":\"1.0\""), json);
        assertTrue(json.contains("\"testAssemblyUniqueID\":\"abc\""), json);
        assertTrue(json.contains("\"testFrameworkDisplayName\":\"demo\""), json);
        assertEquals(info, EngineJson.read(utf8(json), ExecutionEngineInfo.class));
    }

    @Test
    void peerPayloadWithUnknownFieldsBinds() {
        ExecutionEngineInfo info = EngineJson.read(utf8(
                "{\"protocolVersion\":\"1.0\",\"testAssemblyUniqueID\":\"abc\","
                        + "\"testFrameworkDisplayName\":\"demo\",\"futureField\":[1,2]}"),
                ExecutionEngineInfo.class);

        assertEquals("abc", info.getTestAssemblyUniqueID());
        assertEquals("demo", info.getTestFrameworkDisplayName());
    }

    @Test
    void missingFieldsBindButThrowOnRead() {
        ExecutionEngineInfo info = EngineJson.read(utf8("{\"testAssemblyUniqueID\":\"abc\"}"), ExecutionEngineInfo.class);

        assertEquals(ProtocolVersion.V1_0, info.getProtocolVersion());
        assertThrows(UnsetPropertyException.class, info::getTestFrameworkDisplayName);
    }

    @Test
    void emptyFieldInPayloadFailsBinding() {
        assertThrows(EngineJsonException.class, () -> EngineJson.read(
                utf8("{\"testAssemblyUniqueID\":\"\",\"testFrameworkDisplayName\":\"demo\"}"),
                ExecutionEngineInfo.class));
    }

    @Test
    void incompleteInfoCannotBeSerialized() {
        assertThrows(EngineJsonException.class, () -> EngineJson.write(new ExecutionEngineInfo()));
    }

    @Test
    void runnerInfoRequiresVersion() {
        assertThrows(IllegalArgumentException.class, () -> new RunnerEngineInfo(""));
        assertTrue(ProtocolVersion.isSupported(RunnerEngineInfo.current().protocolVersion()));
        assertFalse(ProtocolVersion.isSupported("9.9"));
    }
}
