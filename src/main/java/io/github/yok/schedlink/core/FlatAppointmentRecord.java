package io.github.yok.schedlink.core;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * One denormalized appointment row as read from the HIS.
 *
 * <p>
 * The source stores the services of an appointment in {@value #SERVICE_SLOTS} fixed columns (the
 * assigned service plus ten "performable" services). {@link #getServiceNames()} always has exactly
 * that many elements; absent slots are {@code null}. The cap mirrors the source schema and is not
 * derived from the data.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class FlatAppointmentRecord {

    /** Number of service columns on a source appointment row. */
    public static final int SERVICE_SLOTS = 11;

    // Appointment id in the HIS (only used in log messages)
    Long sourceId;

    String patientGivenName;
    String patientFamilyName;
    String patientDocument;

    LocalDate date;
    LocalTime time;
    Integer durationMinutes;
    Boolean overbooked;
    String status;

    LocalDateTime createdAt;
    String createdBy;

    List<String> serviceNames;

    /**
     * Returns the service name in the given slot.
     *
     * @param slot slot index, {@code 0} to {@code SERVICE_SLOTS - 1}
     * @return raw service name, or {@code null} when the slot is empty
     */
    public String getServiceName(int slot) {
        return serviceNames.get(slot);
    }

    /**
     * Lombok builder customization that pads or validates the service slots.
     */
    public static class FlatAppointmentRecordBuilder {

        /**
         * Sets the service slots. Shorter lists are padded with {@code null}.
         *
         * @param serviceNames service names in slot order
         * @return this builder
         * @throws IllegalArgumentException if more names than service slots are given
         */
        public FlatAppointmentRecordBuilder serviceNames(List<String> serviceNames) {
            List<String> slots = new ArrayList<>(SERVICE_SLOTS);
            if (serviceNames != null) {
                if (serviceNames.size() > SERVICE_SLOTS) {
                    throw new IllegalArgumentException("At most " + SERVICE_SLOTS
                            + " service slots are supported, got " + serviceNames.size());
                }
                slots.addAll(serviceNames);
            }
            while (slots.size() < SERVICE_SLOTS) {
                slots.add(null);
            }
            this.serviceNames = Collections.unmodifiableList(slots);
            return this;
        }

        /**
         * Builds the record, padding the service slots when none were set.
         *
         * @return record
         */
        public FlatAppointmentRecord build() {
            if (serviceNames == null) {
                serviceNames(null);
            }
            return new FlatAppointmentRecord(sourceId, patientGivenName, patientFamilyName,
                    patientDocument, date, time, durationMinutes, overbooked, status, createdAt,
                    createdBy, serviceNames);
        }
    }
}
