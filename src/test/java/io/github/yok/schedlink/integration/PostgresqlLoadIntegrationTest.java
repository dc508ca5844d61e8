package io.github.yok.schedlink.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.schedlink.core.FlatAppointmentRecord;
import io.github.yok.schedlink.core.LoadException;
import io.github.yok.schedlink.core.LoadResult;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Integration tests for AppointmentLoader against a PostgreSQL container.
 *
 * <p>
 * Covers: schema reset (DROP SCHEMA) inside the load transaction, commit and full rollback.
 * </p>
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresqlLoadIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>("postgres:16-alpine").withDatabaseName("analytics")
                    .withUsername("test").withPassword("test");

    @BeforeEach
    void setup() {
        PostgresqlIntegrationSupport.prepareDatabase(postgres);
    }

    private static FlatAppointmentRecord record(long sourceId, String document, String status,
            String... services) {
        return FlatAppointmentRecord.builder().sourceId(sourceId).patientGivenName("María José")
                .patientFamilyName("Acosta").patientDocument(document)
                .date(LocalDate.of(2025, 4, 2)).time(LocalTime.of(10, 0)).durationMinutes(15)
                .overbooked(false).status(status).createdAt(LocalDateTime.of(2025, 3, 28, 7, 45))
                .createdBy("recep02").serviceNames(List.of(services)).build();
    }

    @Test
    void load_正常ケース_前回内容があるDBへロードする_スキーマが作り直されてコミットされること()
            throws Exception {
        LoadResult result = PostgresqlIntegrationSupport.newLoader(postgres)
                .load(List.of(record(1L, "4455667", "Asignado", "Consulta", "Laboratorio"),
                        record(2L, "4455667", "Atendido", "Consulta")));

        assertEquals(2, result.getAppointments());
        assertEquals(1, result.getPatientsCreated());
        assertEquals(2, result.getServicesCreated());
        assertEquals(3, result.getAppointmentServices());

        try (Connection conn = PostgresqlIntegrationSupport.openConnection(postgres);
                Statement st = conn.createStatement()) {
            assertFalse(PostgresqlIntegrationSupport.tableExists(conn, "legacy_report"));
            assertFalse(PostgresqlIntegrationSupport.tableExists(conn, "flyway_schema_history"));
            assertEquals(1, PostgresqlIntegrationSupport.count(conn, "patient"));
            assertEquals(2, PostgresqlIntegrationSupport.count(conn, "appointment"));
            assertEquals(3, PostgresqlIntegrationSupport.count(conn, "appointment_service"));

            try (ResultSet rs = st.executeQuery(
                    "SELECT given_name, family_name, inferred_sex FROM patient")) {
                assertTrue(rs.next());
                assertEquals("MARÍA JOSÉ", rs.getString("given_name"));
                assertEquals("ACOSTA", rs.getString("family_name"));
                assertEquals("FEMALE", rs.getString("inferred_sex"));
            }
        }
    }

    @Test
    void load_異常ケース_2件目で制約違反が発生する_スキーマ削除も含めてロールバックされること()
            throws Exception {
        List<FlatAppointmentRecord> batch = List.of(record(1L, "111", "Asignado", "Consulta"),
                record(2L, "222", null, "Laboratorio"));

        LoadException ex = assertThrows(LoadException.class,
                () -> PostgresqlIntegrationSupport.newLoader(postgres).load(batch));
        assertEquals(1, ex.getRecordIndex());

        try (Connection conn = PostgresqlIntegrationSupport.openConnection(postgres);
                Statement st = conn.createStatement()) {
            assertTrue(PostgresqlIntegrationSupport.tableExists(conn, "legacy_report"));
            assertTrue(PostgresqlIntegrationSupport.tableExists(conn, "flyway_schema_history"));
            assertFalse(PostgresqlIntegrationSupport.tableExists(conn, "appointment"));
            assertEquals(1, PostgresqlIntegrationSupport.count(conn, "legacy_report"));

            try (ResultSet rs = st.executeQuery("SELECT given_name FROM patient")) {
                assertTrue(rs.next());
                assertEquals("LEGACY", rs.getString(1));
                assertFalse(rs.next());
            }
        }
    }
}
