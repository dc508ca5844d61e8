package io.github.yok.schedlink.core;

/**
 * Reads the batch of appointment records to load.
 */
@FunctionalInterface
public interface AppointmentExtractor {

    /**
     * Reads all records in source order. Never throws; failures are reported through
     * {@link ExtractionResult#failed(Exception)}.
     *
     * @return tagged extraction outcome
     */
    ExtractionResult extract();
}
