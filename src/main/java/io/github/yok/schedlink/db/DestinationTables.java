package io.github.yok.schedlink.db;

import java.util.List;
import lombok.Generated;

/**
 * Names and DDL of the destination analysis tables.
 *
 * <p>
 * Identity columns use {@code GENERATED BY DEFAULT AS IDENTITY} so the same statements run on
 * PostgreSQL and on H2 in PostgreSQL mode.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class DestinationTables {

    public static final String PATIENT = "patient";
    public static final String APPOINTMENT = "appointment";
    public static final String SERVICE = "service";
    public static final String APPOINTMENT_SERVICE = "appointment_service";

    /** Tables in creation order (parents first). */
    public static final List<String> CREATION_ORDER =
            List.of(PATIENT, APPOINTMENT, SERVICE, APPOINTMENT_SERVICE);

    /** Tables in drop order (children first). */
    public static final List<String> DROP_ORDER =
            List.of(APPOINTMENT_SERVICE, SERVICE, APPOINTMENT, PATIENT);

    /** Table and index DDL, executed in order. */
    public static final List<String> DDL = List.of(
            "CREATE TABLE patient ("
                    + "id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "given_name VARCHAR(255) NOT NULL, "
                    + "family_name VARCHAR(255) NOT NULL, "
                    + "identity_document VARCHAR(255) NOT NULL, "
                    + "inferred_sex VARCHAR(255))",
            "CREATE INDEX idx_patient_document ON patient (identity_document)",

            "CREATE TABLE appointment ("
                    + "id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "patient_id INTEGER NOT NULL, "
                    + "appointment_date DATE NOT NULL, "
                    + "appointment_time TIME(0) WITHOUT TIME ZONE NOT NULL, "
                    + "duration_minutes INTEGER NOT NULL, "
                    + "overbooked BOOLEAN NOT NULL, "
                    + "status VARCHAR(255) NOT NULL, "
                    + "created_at TIMESTAMP(0) WITHOUT TIME ZONE NOT NULL, "
                    + "created_by VARCHAR(255) NOT NULL, "
                    + "CONSTRAINT fk_appointment_patient FOREIGN KEY (patient_id) "
                    + "REFERENCES patient (id) ON DELETE RESTRICT)",
            "CREATE INDEX idx_appointment_patient ON appointment (patient_id)",
            "CREATE INDEX idx_appointment_date ON appointment (appointment_date)",
            "CREATE INDEX idx_appointment_status ON appointment (status)",

            "CREATE TABLE service ("
                    + "id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "name VARCHAR(255) NOT NULL UNIQUE)",

            "CREATE TABLE appointment_service ("
                    + "id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "appointment_id INTEGER NOT NULL, "
                    + "service_id INTEGER NOT NULL, "
                    + "CONSTRAINT fk_appsvc_appointment FOREIGN KEY (appointment_id) "
                    + "REFERENCES appointment (id) ON DELETE CASCADE, "
                    + "CONSTRAINT fk_appsvc_service FOREIGN KEY (service_id) "
                    + "REFERENCES service (id) ON DELETE RESTRICT)",
            "CREATE INDEX idx_appsvc_appointment ON appointment_service (appointment_id)",
            "CREATE INDEX idx_appsvc_service ON appointment_service (service_id)");

    @Generated
    private DestinationTables() {}
}
