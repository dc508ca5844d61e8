package io.github.yok.schedlink.core;

import io.github.yok.schedlink.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens a JDBC connection for a configured entry. Replaceable in tests.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Opens a connection.
     *
     * @param entry connection settings
     * @return open connection; the caller closes it
     * @throws SQLException if the connection cannot be opened
     */
    Connection open(ConnectionConfig.Entry entry) throws SQLException;
}
