package io.github.yok.schedlink.core;

import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of one extraction.
 *
 * <p>
 * {@link Status#EMPTY} and {@link Status#FAILED} both end the run without touching the
 * destination, but they are kept apart so the run log tells an empty source from a broken one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ExtractionResult {

    /**
     * Extraction status.
     */
    public enum Status {
        // At least one record was read
        SUCCESS,
        // The query ran and returned no rows
        EMPTY,
        // The source could not be reached or the query failed
        FAILED
    }

    private final Status status;
    private final List<FlatAppointmentRecord> records;
    private final Exception cause;

    /**
     * Creates a result for the records read; an empty list yields {@link Status#EMPTY}.
     *
     * @param records records in source order
     * @return result
     */
    public static ExtractionResult of(List<FlatAppointmentRecord> records) {
        if (records.isEmpty()) {
            return new ExtractionResult(Status.EMPTY, List.of(), null);
        }
        return new ExtractionResult(Status.SUCCESS, List.copyOf(records), null);
    }

    /**
     * Creates a failed result.
     *
     * @param cause extraction failure
     * @return result
     */
    public static ExtractionResult failed(Exception cause) {
        return new ExtractionResult(Status.FAILED, List.of(), cause);
    }

    /**
     * Returns whether there is something to load.
     *
     * @return {@code true} for {@link Status#SUCCESS}
     */
    public boolean hasRecords() {
        return status == Status.SUCCESS;
    }
}
