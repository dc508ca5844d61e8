package io.github.yok.schedlink.core;

import io.github.yok.schedlink.config.ConnectionConfig;
import io.github.yok.schedlink.config.EtlConfig;
import io.github.yok.schedlink.util.JdbcConnections;
import io.github.yok.schedlink.util.MaskingLogUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;

/**
 * Reads appointment records from the HIS SQL Server database.
 *
 * <p>
 * The query text is loaded from the classpath resource named by
 * {@link EtlConfig#getExtractQueryLocation()}. Columns are read by alias:
 * </p>
 * <ul>
 * <li>{@code appointment_id}</li>
 * <li>{@code patient_given_name}, {@code patient_family_name}, {@code patient_document}</li>
 * <li>{@code appointment_date}, {@code appointment_time}, {@code appointment_duration},
 * {@code overbooked}, {@code appointment_status}</li>
 * <li>{@code created_at}, {@code created_by_login}</li>
 * <li>{@code service0} to {@code service10}</li>
 * </ul>
 *
 * <p>
 * The whole result set is read into memory. Any failure (driver, connection, query, mapping) is
 * returned as {@link ExtractionResult.Status#FAILED}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SqlServerAppointmentExtractor implements AppointmentExtractor {

    private final ConnectionConfig connectionConfig;
    private final EtlConfig etlConfig;
    private final ConnectionProvider connectionProvider;

    /**
     * Creates an extractor that opens connections through {@link JdbcConnections}.
     *
     * @param connectionConfig connection settings (source is used)
     * @param etlConfig ETL settings
     */
    public SqlServerAppointmentExtractor(ConnectionConfig connectionConfig, EtlConfig etlConfig) {
        this(connectionConfig, etlConfig, JdbcConnections::open);
    }

    /**
     * Creates an extractor with a custom connection provider.
     *
     * @param connectionConfig connection settings (source is used)
     * @param etlConfig ETL settings
     * @param connectionProvider opens the source connection
     */
    SqlServerAppointmentExtractor(ConnectionConfig connectionConfig, EtlConfig etlConfig,
            ConnectionProvider connectionProvider) {
        this.connectionConfig = connectionConfig;
        this.etlConfig = etlConfig;
        this.connectionProvider = connectionProvider;
    }

    @Override
    public ExtractionResult extract() {
        try {
            ConnectionConfig.Entry entry = connectionConfig.requireSource();
            String sql = loadQuery(etlConfig.getExtractQueryLocation());
            log.info("[{}] Extracting appointments ({})", entry.getId(),
                    MaskingLogUtil.maskConnection(entry));

            List<FlatAppointmentRecord> records = new ArrayList<>();
            try (Connection conn = connectionProvider.open(entry);
                    Statement st = conn.createStatement();
                    ResultSet rs = st.executeQuery(sql)) {
                while (rs.next()) {
                    records.add(map(rs));
                }
            }
            log.info("[{}] Extracted {} record(s)", entry.getId(), records.size());
            return ExtractionResult.of(records);
        } catch (Exception e) {
            log.warn("Extraction failed: {}", e.getMessage(), e);
            return ExtractionResult.failed(e);
        }
    }

    /**
     * Reads the query text from the classpath.
     *
     * @param location classpath resource name
     * @return query text
     * @throws IOException if the resource is missing or unreadable
     */
    String loadQuery(String location) throws IOException {
        return IOUtils.resourceToString(location, StandardCharsets.UTF_8,
                SqlServerAppointmentExtractor.class.getClassLoader());
    }

    /**
     * Maps the current row of the result set.
     *
     * @param rs result set positioned on a row
     * @return record
     * @throws SQLException if a column is missing or has an incompatible type
     */
    FlatAppointmentRecord map(ResultSet rs) throws SQLException {
        List<String> services = new ArrayList<>(FlatAppointmentRecord.SERVICE_SLOTS);
        for (int slot = 0; slot < FlatAppointmentRecord.SERVICE_SLOTS; slot++) {
            services.add(rs.getString("service" + slot));
        }

        long sourceId = rs.getLong("appointment_id");
        Long sourceIdOrNull = rs.wasNull() ? null : sourceId;
        int duration = rs.getInt("appointment_duration");
        Integer durationOrNull = rs.wasNull() ? null : duration;
        boolean overbooked = rs.getBoolean("overbooked");
        Boolean overbookedOrNull = rs.wasNull() ? null : overbooked;

        Date date = rs.getDate("appointment_date");
        Time time = rs.getTime("appointment_time");
        Timestamp createdAt = rs.getTimestamp("created_at");

        return FlatAppointmentRecord.builder()
                .sourceId(sourceIdOrNull)
                .patientGivenName(rs.getString("patient_given_name"))
                .patientFamilyName(rs.getString("patient_family_name"))
                .patientDocument(rs.getString("patient_document"))
                .date(date == null ? null : date.toLocalDate())
                .time(time == null ? null : time.toLocalTime())
                .durationMinutes(durationOrNull)
                .overbooked(overbookedOrNull)
                .status(rs.getString("appointment_status"))
                .createdAt(createdAt == null ? null : createdAt.toLocalDateTime())
                .createdBy(rs.getString("created_by_login"))
                .serviceNames(services)
                .build();
    }
}
