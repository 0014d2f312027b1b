package com.questrail.testhost.protocol.tcp.config;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void builderAppliesDefaults() {
        EngineConfig config = EngineConfig.builder().withEngineId("e1").build();

        assertEquals("e1", config.engineId());
        assertTrue(config.bindAddress().isLoopbackAddress());
        assertEquals(1, config.backlog());
        assertEquals(16 * 1024 * 1024, config.maxFrameLength());
    }

    @Test
    void overridesAreKept() throws Exception {
        EngineConfig config = EngineConfig.builder()
            .withEngineId("e1")
            .withBindAddress(InetAddress.getByName("127.0.0.2"))
            .withBacklog(4)
            .withMaxFrameLength(4096)
            .build();

        assertEquals("127.0.0.2", config.bindAddress().getHostAddress());
        assertEquals(4, config.backlog());
        assertEquals(4096, config.maxFrameLength());
    }

    @Test
    void nonLoopbackAddressIsRejected() throws Exception {
        InetAddress remote = InetAddress.getByAddress(new byte[] { 10, 1, 2, 3 });

        assertThrows(IllegalArgumentException.class,
            () -> EngineConfig.builder().withEngineId("e1").withBindAddress(remote).build());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().build());
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfig.builder().withEngineId("e1").withBacklog(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfig.builder().withEngineId("e1").withMaxFrameLength(0).build());
        assertThrows(NullPointerException.class,
            () -> EngineConfig.builder().withEngineId("e1").withBindAddress(null).build());
    }
}
