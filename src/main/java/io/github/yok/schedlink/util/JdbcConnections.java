package io.github.yok.schedlink.util;

import io.github.yok.schedlink.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Opens JDBC connections from {@link ConnectionConfig.Entry} settings.
 *
 * <p>
 * When a driver class name is configured it is loaded explicitly; otherwise JDBC 4 auto-loading
 * is relied upon.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class JdbcConnections {

    @Generated
    private JdbcConnections() {}

    /**
     * Opens a connection for the given entry.
     *
     * @param entry connection settings
     * @return open JDBC connection; the caller closes it
     * @throws SQLException if the driver class is missing or the connection cannot be opened
     */
    public static Connection open(ConnectionConfig.Entry entry) throws SQLException {
        loadDriverIfConfigured(entry.getDriverClass());
        log.debug("[{}] Opening connection: {}", entry.getId(),
                MaskingLogUtil.maskConnection(entry));
        return DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
    }

    /**
     * Loads the JDBC driver class only when the class name is configured.
     *
     * @param driverClass fully qualified JDBC driver class name, or {@code null}/blank
     * @throws SQLException when the specified class cannot be found
     */
    static void loadDriverIfConfigured(String driverClass) throws SQLException {
        if (StringUtils.isBlank(driverClass)) {
            return;
        }
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            throw new SQLException("JDBC driver class not found: " + driverClass, e);
        }
    }
}
