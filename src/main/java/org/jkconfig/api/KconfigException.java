package org.jkconfig.api;

import java.util.Optional;

/**
 * Thrown when a configuration cannot be built or a configuration file cannot be read or written.
 * <p>
 * It is part of the public API and hides the internal exception types of the parser.
 */
public class KconfigException extends Exception {

    private final transient SourceInfo sourceInfo;

    /**
     * Constructs a new exception with the specified detail message.
     * @param message The detail message.
     */
    public KconfigException(String message) {
        super(message, null);
        this.sourceInfo = null;
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public KconfigException(String message, Throwable cause) {
        super(message, cause);
        this.sourceInfo = null;
    }

    /**
     * Constructs a new exception tagged with the location it was raised at.
     * @param message The detail message.
     * @param sourceInfo The location, or {@code null} if there is none.
     */
    public KconfigException(String message, SourceInfo sourceInfo) {
        this(message, sourceInfo, null);
    }

    /**
     * Constructs a new exception tagged with the location it was raised at.
     * @param message The detail message.
     * @param sourceInfo The location, or {@code null} if there is none.
     * @param cause The cause.
     */
    public KconfigException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(sourceInfo == null ? message : sourceInfo + ": " + message, cause);
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The location the error was raised at, if known.
     */
    public Optional<SourceInfo> getSourceInfo() {
        return Optional.ofNullable(sourceInfo);
    }
}
