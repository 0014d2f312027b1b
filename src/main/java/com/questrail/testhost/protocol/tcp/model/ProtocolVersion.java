package com.questrail.testhost.protocol.tcp.model;

import java.util.Set;

/**
 * Versions of the engine link protocol.
 */
public final class ProtocolVersion
{
    /** First supported protocol. */
    public static final String V1_0 = "1.0";

    /** Version advertised by engines built from this code. */
    public static final String CURRENT = V1_0;

    private static final Set<String> SUPPORTED = Set.of(V1_0);

    private ProtocolVersion() {}

    public static boolean isSupported(String version)
    {
        return version != null && SUPPORTED.contains(version);
    }
}
