package io.github.yok.schedlink.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.extern.slf4j.Slf4j;

/**
 * Drops the destination tables, children first. Leaves anything else in the schema untouched, so
 * it works for accounts that do not own the schema.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DropTablesResetHandler implements SchemaResetHandler {

    @Override
    public void reset(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String table : DestinationTables.DROP_ORDER) {
                st.execute("DROP TABLE IF EXISTS " + table + " CASCADE");
                log.debug("Dropped table {}", table);
            }
        }
    }
}
