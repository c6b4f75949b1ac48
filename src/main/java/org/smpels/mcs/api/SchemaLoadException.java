package org.smpels.mcs.api;

/**
 * Thrown when the MCS statement catalog cannot be read or parsed.
 * <p>
 * It is part of the public API and hides the underlying I/O and JSON exception types.
 */
public class SchemaLoadException extends Exception {

    /**
     * Constructs a new schema load exception with the specified detail message.
     * @param message The detail message.
     */
    public SchemaLoadException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new schema load exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
