package com.questrail.testhost.protocol.tcp.codec;

import java.nio.charset.StandardCharsets;

/**
 * EngineCommand
 * -----------------------------------------------------------------------------
 * The command tags that lead every frame on the runner/execution-engine link.
 *
 * <p>The runner sends {@link #INFO}, {@link #FIND}, {@link #RUN}, {@link #CANCEL}
 * and {@link #QUIT}. The execution engine sends {@link #INFO} and {@link #MESSAGE}.</p>
 */
public enum EngineCommand
{
    INFO("INFO"),
    MESSAGE("MSG"),
    FIND("FIND"),
    RUN("RUN"),
    CANCEL("CANCEL"),
    QUIT("QUIT");

    private final String tag;
    private final byte[] bytes;

    EngineCommand(String tag)
    {
        this.tag = tag;
        this.bytes = tag.getBytes(StandardCharsets.US_ASCII);
    }

    /** ASCII form of the tag, as it appears on the wire. */
    public String tag()
    {
        return tag;
    }

    /** A copy of the tag bytes. */
    public byte[] bytes()
    {
        return bytes.clone();
    }
}
