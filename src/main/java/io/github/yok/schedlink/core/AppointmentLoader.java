package io.github.yok.schedlink.core;

import io.github.yok.schedlink.config.ConnectionConfig;
import io.github.yok.schedlink.config.EtlConfig;
import io.github.yok.schedlink.db.DestinationTables;
import io.github.yok.schedlink.infer.SexInferrer;
import io.github.yok.schedlink.util.JdbcConnections;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Loads one extracted batch into the destination as a single all-or-nothing transaction.
 *
 * <p>
 * <strong>Flow:</strong>
 * </p>
 * <ol>
 * <li>Open the destination connection with auto-commit disabled.</li>
 * <li>Rebuild the destination tables through {@link SchemaBuilder} in the same transaction.</li>
 * <li>For each record in source order: resolve the patient, insert the appointment, then for slot
 * 0 to 10 resolve each non-blank service and insert one {@code appointment_service} row.</li>
 * <li>Commit and return a {@link LoadResult}.</li>
 * </ol>
 *
 * <p>
 * Any failure rolls back the whole transaction, including the schema rebuild where the destination
 * has transactional DDL, and is rethrown as {@link LoadException} with the original cause. An empty
 * batch does nothing: no connection, no reset.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class AppointmentLoader {

    static final String INSERT_APPOINTMENT = "INSERT INTO appointment (patient_id, "
            + "appointment_date, appointment_time, duration_minutes, overbooked, status, "
            + "created_at, created_by) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    static final String INSERT_APPOINTMENT_SERVICE =
            "INSERT INTO appointment_service (appointment_id, service_id) VALUES (?, ?)";

    private final ConnectionConfig connectionConfig;
    private final EtlConfig etlConfig;
    private final SchemaBuilder schemaBuilder;
    private final SexInferrer sexInferrer;
    private final ConnectionProvider connectionProvider;

    /**
     * Creates a loader that opens connections through {@link JdbcConnections}.
     *
     * @param connectionConfig connection settings (destination is used)
     * @param etlConfig ETL settings
     * @param schemaBuilder destination schema builder
     * @param sexInferrer first-name sex inference
     */
    public AppointmentLoader(ConnectionConfig connectionConfig, EtlConfig etlConfig,
            SchemaBuilder schemaBuilder, SexInferrer sexInferrer) {
        this(connectionConfig, etlConfig, schemaBuilder, sexInferrer, JdbcConnections::open);
    }

    /**
     * Creates a loader with a custom connection provider.
     *
     * @param connectionConfig connection settings (destination is used)
     * @param etlConfig ETL settings
     * @param schemaBuilder destination schema builder
     * @param sexInferrer first-name sex inference
     * @param connectionProvider opens the destination connection
     */
    AppointmentLoader(ConnectionConfig connectionConfig, EtlConfig etlConfig,
            SchemaBuilder schemaBuilder, SexInferrer sexInferrer,
            ConnectionProvider connectionProvider) {
        this.connectionConfig = connectionConfig;
        this.etlConfig = etlConfig;
        this.schemaBuilder = schemaBuilder;
        this.sexInferrer = sexInferrer;
        this.connectionProvider = connectionProvider;
    }

    /**
     * Rebuilds the destination and loads the batch.
     *
     * @param batch records in source order
     * @return summary of the committed load; {@link LoadResult#empty()} for an empty batch
     * @throws LoadException if anything fails; nothing from this run is committed
     */
    public LoadResult load(List<FlatAppointmentRecord> batch) throws LoadException {
        if (batch == null || batch.isEmpty()) {
            log.info("Nothing to load → destination left untouched");
            return LoadResult.empty();
        }

        ConnectionConfig.Entry entry = connectionConfig.requireDestination();
        String dbId = entry.getId();
        int total = batch.size();
        log.info("=== AppointmentLoader started (records={}, destination={}) ===", total, dbId);

        Connection jdbc = openTransaction(entry);
        try {
            return loadInTransaction(jdbc, dbId, batch);
        } finally {
            close(jdbc, dbId);
        }
    }

    /**
     * Opens the destination connection with auto-commit disabled.
     *
     * @throws LoadException if the connection cannot be opened or configured
     */
    private Connection openTransaction(ConnectionConfig.Entry entry) throws LoadException {
        String dbId = entry.getId();
        Connection jdbc;
        try {
            jdbc = connectionProvider.open(entry);
        } catch (SQLException e) {
            throw new LoadException("Destination connection failed (DB=" + dbId + "): "
                    + e.getMessage(), -1, e);
        }
        try {
            jdbc.setAutoCommit(false);
        } catch (SQLException e) {
            close(jdbc, dbId);
            throw new LoadException("Could not start a transaction (DB=" + dbId + "): "
                    + e.getMessage(), -1, e);
        }
        log.info("[{}] Transaction started", dbId);
        return jdbc;
    }

    private LoadResult loadInTransaction(Connection jdbc, String dbId,
            List<FlatAppointmentRecord> batch) throws LoadException {
        int total = batch.size();
        int index = -1;
        try {
            schemaBuilder.recreate(jdbc);

            EntityResolver resolver = new EntityResolver(jdbc, sexInferrer);
            int links = 0;
            for (index = 0; index < total; index++) {
                links += loadRecord(jdbc, resolver, batch.get(index));
                logProgress(dbId, index + 1, total);
            }
            index = -1;

            LoadResult result = new LoadResult(total, resolver.getPatientsCreated(),
                    resolver.getServicesCreated(), links, countRows(jdbc));

            jdbc.commit();
            log.info("[{}] Transaction committed (appointments={})", dbId, total);
            log.info("=== AppointmentLoader finished ===");
            logSummary(dbId, result);
            return result;
        } catch (Exception e) {
            rollback(jdbc, dbId);
            String where = index >= 0
                    ? " at record " + (index + 1) + "/" + total + " (source id="
                            + batch.get(index).getSourceId() + ")"
                    : "";
            log.error("[{}] Load failed{}: {}", dbId, where, e.getMessage());
            throw new LoadException("Load failed" + where + ": " + e.getMessage(), index, e);
        }
    }

    /**
     * Loads one record: patient, appointment, then the service links in slot order.
     *
     * @return number of {@code appointment_service} rows inserted
     */
    private int loadRecord(Connection jdbc, EntityResolver resolver, FlatAppointmentRecord record)
            throws SQLException {
        long patientId = resolver.resolveSubject(record.getPatientDocument(),
                record.getPatientGivenName(), record.getPatientFamilyName());

        long appointmentId = insertAppointment(jdbc, patientId, record);

        int links = 0;
        try (PreparedStatement ps = jdbc.prepareStatement(INSERT_APPOINTMENT_SERVICE)) {
            for (int slot = 0; slot < FlatAppointmentRecord.SERVICE_SLOTS; slot++) {
                String raw = record.getServiceName(slot);
                if (StringUtils.isBlank(raw)) {
                    continue;
                }
                long serviceId = resolver.resolveService(raw.trim());
                ps.setLong(1, appointmentId);
                ps.setLong(2, serviceId);
                ps.executeUpdate();
                links++;
            }
        }
        return links;
    }

    private long insertAppointment(Connection jdbc, long patientId, FlatAppointmentRecord record)
            throws SQLException {
        try (PreparedStatement ps =
                jdbc.prepareStatement(INSERT_APPOINTMENT, new String[] {"id"})) {
            ps.setLong(1, patientId);
            bind(ps, 2, record.getDate(), Types.DATE);
            bind(ps, 3, record.getTime(), Types.TIME);
            bind(ps, 4, record.getDurationMinutes(), Types.INTEGER);
            bind(ps, 5, record.getOverbooked(), Types.BOOLEAN);
            bind(ps, 6, record.getStatus(), Types.VARCHAR);
            bind(ps, 7, record.getCreatedAt(), Types.TIMESTAMP);
            bind(ps, 8, record.getCreatedBy(), Types.VARCHAR);
            ps.executeUpdate();
            return GeneratedKeys.single(ps, DestinationTables.APPOINTMENT);
        }
    }

    private static void bind(PreparedStatement ps, int index, Object value, int sqlType)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, sqlType);
        } else {
            ps.setObject(index, value);
        }
    }

    private void rollback(Connection jdbc, String dbId) {
        try {
            jdbc.rollback();
            log.warn("[{}] Transaction rolled back due to error.", dbId);
        } catch (SQLException rollbackEx) {
            log.warn("[{}] Rollback failed: {}", dbId, rollbackEx.getMessage(), rollbackEx);
        }
    }

    private void close(Connection jdbc, String dbId) {
        try {
            jdbc.close();
        } catch (SQLException closeEx) {
            log.warn("[{}] Failed to close connection: {}", dbId, closeEx.getMessage(), closeEx);
        }
    }

    private void logProgress(String dbId, int done, int total) {
        int interval = etlConfig.getProgressInterval();
        if (interval > 0 && (done % interval == 0 || done == total)) {
            log.info("[{}] Progress: {}/{} records", dbId, done, total);
        }
    }

    private Map<String, Integer> countRows(Connection jdbc) throws SQLException {
        Map<String, Integer> counts = new LinkedHashMap<>();
        try (Statement st = jdbc.createStatement()) {
            for (String table : DestinationTables.CREATION_ORDER) {
                try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
                    counts.put(table, rs.next() ? rs.getInt(1) : 0);
                }
            }
        }
        return counts;
    }

    private void logSummary(String dbId, LoadResult result) {
        log.info("===== Summary =====");
        result.getTableRowCounts().forEach((table, count) -> log
                .info("[{}] Table[{}] rows={}", dbId, String.format("%-20s", table), count));
        log.info("[{}] appointments={}, patients={}, services={}, appointment_services={}", dbId,
                result.getAppointments(), result.getPatientsCreated(),
                result.getServicesCreated(), result.getAppointmentServices());
        log.info("===================");
    }
}
