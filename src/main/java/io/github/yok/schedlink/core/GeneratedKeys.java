package io.github.yok.schedlink.core;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import lombok.Generated;

/**
 * Reads the generated {@code id} of a single-row insert.
 */
final class GeneratedKeys {

    @Generated
    private GeneratedKeys() {}

    /**
     * Returns the generated key of the row just inserted by {@code ps}.
     *
     * @param ps executed insert statement prepared with generated-key retrieval
     * @param table table name (for the error message)
     * @return generated id
     * @throws SQLException if the keys cannot be read
     * @throws IllegalStateException if the driver returned no key
     */
    static long single(PreparedStatement ps, String table) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (keys == null || !keys.next()) {
                throw new IllegalStateException("No generated id returned for insert into " + table);
            }
            long id = keys.getLong(1);
            if (keys.wasNull()) {
                throw new IllegalStateException("Generated id is NULL for insert into " + table);
            }
            return id;
        }
    }
}
