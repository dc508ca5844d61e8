package io.github.yok.schedlink.core;

/**
 * Signals that a load run failed and its transaction was rolled back.
 *
 * <p>
 * The cause is the original failure (SQL error, schema reset failure, missing generated key...).
 * </p>
 */
public class LoadException extends Exception {

    private static final long serialVersionUID = 1L;

    // Zero-based index of the record being processed, -1 outside the record loop
    private final int recordIndex;

    /**
     * Creates an exception.
     *
     * @param message description
     * @param recordIndex zero-based index of the failing record, or {@code -1}
     * @param cause original failure
     */
    public LoadException(String message, int recordIndex, Throwable cause) {
        super(message, cause);
        this.recordIndex = recordIndex;
    }

    /**
     * Returns the zero-based index of the record that failed.
     *
     * @return record index, or {@code -1} when the failure happened outside the record loop
     */
    public int getRecordIndex() {
        return recordIndex;
    }
}
