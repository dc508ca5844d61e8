package io.github.yok.schedlink.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Wipes the destination before the tables are recreated.
 *
 * <p>
 * Implementations run on the caller's connection and never commit or roll back themselves.
 * </p>
 */
public interface SchemaResetHandler {

    /**
     * Irrecoverably removes prior destination content (subject to the caller's transaction).
     *
     * @param connection destination connection with auto-commit disabled
     * @throws SQLException if a statement fails
     */
    void reset(Connection connection) throws SQLException;
}
