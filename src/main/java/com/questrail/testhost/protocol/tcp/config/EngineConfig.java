package com.questrail.testhost.protocol.tcp.config;

import java.net.InetAddress;
import java.util.Objects;

/**
 * Configuration shared by both engine roles.
 *
 * @param engineId       id used in every diagnostic message
 * @param bindAddress    address the runner listens on and the execution engine
 *                       connects to; must be a loopback address
 * @param backlog        listen backlog for the runner's socket
 * @param maxFrameLength largest inbound frame accepted, end-of-message byte excluded
 */
public record EngineConfig(
    String engineId,
    InetAddress bindAddress,
    int backlog,
    int maxFrameLength
) {
    public static final int DEFAULT_BACKLOG = 1;
    public static final int DEFAULT_MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    public EngineConfig {
        if (engineId == null || engineId.isEmpty()) {
            throw new IllegalArgumentException("engineId must be a non-empty string");
        }
        Objects.requireNonNull(bindAddress, "bindAddress");
        if (!bindAddress.isLoopbackAddress()) {
            throw new IllegalArgumentException("bindAddress must be a loopback address: " + bindAddress.getHostAddress());
        }
        if (backlog < 1) {
            throw new IllegalArgumentException("backlog must be at least 1: " + backlog);
        }
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be positive: " + maxFrameLength);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String engineId;
        private InetAddress bindAddress = InetAddress.getLoopbackAddress();
        private int backlog = DEFAULT_BACKLOG;
        private int maxFrameLength = DEFAULT_MAX_FRAME_LENGTH;

        public Builder withEngineId(String engineId) {
            this.engineId = engineId;
            return this;
        }

        public Builder withBindAddress(InetAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withBacklog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        public Builder withMaxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(engineId, bindAddress, backlog, maxFrameLength);
        }
    }
}
