package io.github.yok.schedlink.core;

/**
 * Signals that the destination schema could not be reset or rebuilt. The work done by the builder
 * has been rolled back to its savepoint when this is thrown.
 */
public class SchemaBuildException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception.
     *
     * @param message description
     * @param cause original failure
     */
    public SchemaBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
