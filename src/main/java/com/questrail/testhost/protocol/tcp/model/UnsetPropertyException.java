package com.questrail.testhost.protocol.tcp.model;

/**
 * Thrown when a required property is read before anything has assigned it.
 *
 * <p>This is a contract violation on the caller's side, not a recoverable
 * runtime condition.</p>
 */
public final class UnsetPropertyException extends IllegalStateException
{
    private final String propertyName;
    private final Class<?> declaringType;

    public UnsetPropertyException(String propertyName, Class<?> declaringType) {
        super("Attempted to get unset property '" + propertyName + "' on " + declaringType.getSimpleName());
        this.propertyName = propertyName;
        this.declaringType = declaringType;
    }

    public String propertyName() {
        return propertyName;
    }

    public Class<?> declaringType() {
        return declaringType;
    }
}
