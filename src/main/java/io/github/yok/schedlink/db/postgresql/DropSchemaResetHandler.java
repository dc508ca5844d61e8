package io.github.yok.schedlink.db.postgresql;

import io.github.yok.schedlink.db.SchemaResetHandler;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Drops and recreates the PostgreSQL {@code public} schema.
 *
 * <p>
 * Everything in the schema goes, not only the tables created by this tool. PostgreSQL DDL is
 * transactional, so a rollback of the caller's transaction restores the schema.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class DropSchemaResetHandler implements SchemaResetHandler {

    static final String SCHEMA = "public";

    @Override
    public void reset(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("DROP SCHEMA IF EXISTS " + SCHEMA + " CASCADE");
            st.execute("CREATE SCHEMA " + SCHEMA);
            st.execute("GRANT ALL ON SCHEMA " + SCHEMA + " TO PUBLIC");
        }
    }
}
