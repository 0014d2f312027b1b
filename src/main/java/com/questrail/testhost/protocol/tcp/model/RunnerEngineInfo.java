package com.questrail.testhost.protocol.tcp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Identity of the runner, sent as the JSON payload of the runner's INFO frame
 * immediately after the connection is accepted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunnerEngineInfo(String protocolVersion) {
    public RunnerEngineInfo {
        if (protocolVersion == null || protocolVersion.isEmpty()) {
            throw new IllegalArgumentException("protocolVersion must be a non-empty string");
        }
    }

    public static RunnerEngineInfo current() {
        return new RunnerEngineInfo(ProtocolVersion.CURRENT);
    }
}
