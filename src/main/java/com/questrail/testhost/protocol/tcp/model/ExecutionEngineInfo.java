package com.questrail.testhost.protocol.tcp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * ExecutionEngineInfo
 * -----------------------------------------------------------------------------
 * Identity of an execution engine, exchanged as the JSON payload of its INFO
 * frame during protocol negotiation.
 *
 * <pre>
 *   {"protocolVersion":"1.0","testAssemblyUniqueID":"...","testFrameworkDisplayName":"..."}
 * </pre>
 *
 * <h2>Validation</h2>
 * Every setter rejects {@code null} or empty strings immediately with
 * {@link IllegalArgumentException}. Reading a required property that was never
 * assigned throws {@link UnsetPropertyException}.
 *
 * <h2>Lifecycle</h2>
 * The runner binds a fresh instance from the peer's INFO payload and then calls
 * {@link #freeze()}; from that point every setter throws
 * {@link IllegalStateException}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ExecutionEngineInfo
{
    private String protocolVersion = ProtocolVersion.V1_0;
    private String testAssemblyUniqueID;
    private String testFrameworkDisplayName;
    private volatile boolean frozen;

    public ExecutionEngineInfo() {}

    public ExecutionEngineInfo(String testAssemblyUniqueID, String testFrameworkDisplayName) {
        setTestAssemblyUniqueID(testAssemblyUniqueID);
        setTestFrameworkDisplayName(testFrameworkDisplayName);
    }

    /** Version of the link protocol the execution engine supports. */
    @JsonProperty("protocolVersion")
    public String getProtocolVersion() {
        return protocolVersion;
    }

    @JsonProperty("protocolVersion")
    public void setProtocolVersion(String protocolVersion) {
        this.protocolVersion = requireNonEmpty(protocolVersion, "protocolVersion");
    }

    /** Unique ID of the test assembly hosted by the execution engine. */
    @JsonProperty("testAssemblyUniqueID")
    public String getTestAssemblyUniqueID() {
        if (testAssemblyUniqueID == null) {
            throw new UnsetPropertyException("testAssemblyUniqueID", ExecutionEngineInfo.class);
        }
        return testAssemblyUniqueID;
    }

    @JsonProperty("testAssemblyUniqueID")
    public void setTestAssemblyUniqueID(String testAssemblyUniqueID) {
        this.testAssemblyUniqueID = requireNonEmpty(testAssemblyUniqueID, "testAssemblyUniqueID");
    }

    /** Display name of the test framework running inside the execution engine. */
    @JsonProperty("testFrameworkDisplayName")
    public String getTestFrameworkDisplayName() {
        if (testFrameworkDisplayName == null) {
            throw new UnsetPropertyException("testFrameworkDisplayName", ExecutionEngineInfo.class);
        }
        return testFrameworkDisplayName;
    }

    @JsonProperty("testFrameworkDisplayName")
    public void setTestFrameworkDisplayName(String testFrameworkDisplayName) {
        this.testFrameworkDisplayName = requireNonEmpty(testFrameworkDisplayName, "testFrameworkDisplayName");
    }

    /**
     * Makes this instance read-only. Idempotent.
     */
    public void freeze() {
        frozen = true;
    }

    private String requireNonEmpty(String value, String name) {
        if (frozen) {
            throw new IllegalStateException("ExecutionEngineInfo is read-only after negotiation; cannot set " + name);
        }
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " must be a non-empty string");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExecutionEngineInfo)) {
            return false;
        }
        ExecutionEngineInfo other = (ExecutionEngineInfo) o;
        return protocolVersion.equals(other.protocolVersion)
                && Objects.equals(testAssemblyUniqueID, other.testAssemblyUniqueID)
                && Objects.equals(testFrameworkDisplayName, other.testFrameworkDisplayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(protocolVersion, testAssemblyUniqueID, testFrameworkDisplayName);
    }

    @Override
    public String toString() {
        return "ExecutionEngineInfo[protocolVersion=" + protocolVersion
                + ", testAssemblyUniqueID=" + testAssemblyUniqueID
                + ", testFrameworkDisplayName=" + testFrameworkDisplayName + "]";
    }
}
