package com.questrail.testhost.protocol.tcp.codec;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class EngineMessagesTest
{
    private static byte[] ascii(String s)
    {
        return s.replace('|', (char) EngineMessages.SEPARATOR).getBytes(StandardCharsets.UTF_8);
    }

    // ---------------------------------------------------------------------
    // Frame construction
    // ---------------------------------------------------------------------

    @Test
    void bareCommandFrameIsTagFollowedByEndOfMessage()
    {
        assertArrayEquals(new byte[] { 'Q', 'U', 'I', 'T', 0x00 }, EngineMessages.frame(EngineCommand.QUIT));
        assertArrayEquals(new byte[] { 'C', 'A', 'N', 'C', 'E', 'L', 0x00 }, EngineMessages.frame(EngineCommand.CANCEL));
    }

    @Test
    void commandWithPayloadIsSeparatedBySeparatorByte()
    {
        byte[] frame = EngineMessages.frame(EngineCommand.FIND, "op-1");

        assertArrayEquals(new byte[] { 'F', 'I', 'N', 'D', 0x1F, 'o', 'p', '-', '1', 0x00 }, frame);
    }

    @Test
    void messageFrameCarriesOperationIdThenJson()
    {
        byte[] frame = EngineMessages.messageFrame("op-7", "{\"type\":\"x\"}".getBytes(StandardCharsets.UTF_8));

        byte[] expected = ascii("MSG|op-7|{\"type\":\"x\"}\0");
        assertArrayEquals(expected, frame);
    }

    @Test
    void messageTagIsMsgOnTheWire()
    {
        assertEquals("MSG", EngineCommand.MESSAGE.tag());
        assertArrayEquals(ascii("MSG"), EngineCommand.MESSAGE.bytes());
    }

    @Test
    void commandBytesAreDefensiveCopies()
    {
        byte[] bytes = EngineCommand.INFO.bytes();
        bytes[0] = 'X';

        assertEquals("INFO", new String(EngineCommand.INFO.bytes(), StandardCharsets.US_ASCII));
    }

    // ---------------------------------------------------------------------
    // Splitting
    // ---------------------------------------------------------------------

    @Test
    void splitWithoutSeparatorYieldsWholeInputAndNoRest()
    {
        EngineMessages.Split split = EngineMessages.split(ascii("QUIT"));

        assertEquals("QUIT", split.headAsString());
        assertTrue(split.rest().isEmpty());
    }

    @Test
    void splitHappensAtFirstSeparatorOnly()
    {
        EngineMessages.Split split = EngineMessages.split(ascii("MSG|op-7|{\"type\":\"x\"}"));

        assertEquals("MSG", split.headAsString());
        assertTrue(split.rest().isPresent());
        assertArrayEquals(ascii("op-7|{\"type\":\"x\"}"), split.rest().get());
    }

    @Test
    void trailingSeparatorYieldsEmptyButPresentRest()
    {
        EngineMessages.Split split = EngineMessages.split(ascii("CANCEL|"));

        assertEquals("CANCEL", split.headAsString());
        assertEquals(0, split.rest().orElseThrow().length);
    }

    @Test
    void emptyFrameSplitsIntoEmptyHead()
    {
        EngineMessages.Split split = EngineMessages.split(new byte[0]);

        assertEquals(0, split.head().length);
        assertTrue(split.rest().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Operation ids
    // ---------------------------------------------------------------------

    @Test
    void operationIdContainingSeparatorIsRejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> EngineMessages.requireValidOperationId("op\u001f1"));
    }

    @Test
    void operationIdContainingEndOfMessageIsRejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> EngineMessages.frame(EngineCommand.RUN, EngineMessages.requireValidOperationId("op\u00001")));
    }

    @Test
    void emptyOperationIdIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> EngineMessages.requireValidOperationId(""));
        assertThrows(IllegalArgumentException.class,
                () -> EngineMessages.messageFrame("", new byte[] { '{', '}' }));
    }

    @Test
    void ordinaryOperationIdIsReturnedUnchanged()
    {
        assertEquals("op-42", EngineMessages.requireValidOperationId("op-42"));
    }
}
