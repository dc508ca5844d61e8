package io.github.yok.schedlink.core;

import io.github.yok.schedlink.db.DestinationTables;
import io.github.yok.schedlink.db.SchemaResetHandler;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import lombok.extern.slf4j.Slf4j;

/**
 * (Re)creates the destination analysis tables.
 *
 * <p>
 * Runs inside the caller's transaction. The builder marks a savepoint, wipes the destination with
 * the configured {@link SchemaResetHandler}, then creates the tables and indexes from
 * {@link DestinationTables#DDL}. On failure it rolls back to its savepoint and throws
 * {@link SchemaBuildException}; committing or rolling back the enclosing transaction is left to the
 * caller.
 * </p>
 *
 * <p>
 * <strong>Warning:</strong> depending on the reset handler, this deletes everything in the
 * destination schema.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaBuilder {

    private final SchemaResetHandler resetHandler;

    /**
     * Constructs a SchemaBuilder.
     *
     * @param resetHandler strategy used to wipe the destination
     */
    public SchemaBuilder(SchemaResetHandler resetHandler) {
        this.resetHandler = resetHandler;
    }

    /**
     * Wipes and rebuilds the destination tables.
     *
     * @param connection destination connection with auto-commit disabled
     * @throws SchemaBuildException if any statement fails; the builder's own work is rolled back
     */
    public void recreate(Connection connection) throws SchemaBuildException {
        Savepoint savepoint;
        try {
            savepoint = connection.setSavepoint("schema_rebuild");
        } catch (SQLException e) {
            throw new SchemaBuildException("Failed to open savepoint for schema rebuild", e);
        }

        try {
            resetHandler.reset(connection);
            log.info("Destination reset done ({})", resetHandler.getClass().getSimpleName());

            try (Statement st = connection.createStatement()) {
                for (String ddl : DestinationTables.DDL) {
                    st.execute(ddl);
                }
            }
            log.info("Destination tables created: {}", DestinationTables.CREATION_ORDER);

            connection.releaseSavepoint(savepoint);
        } catch (SQLException e) {
            try {
                connection.rollback(savepoint);
                log.warn("Schema rebuild rolled back to savepoint.");
            } catch (SQLException rollbackEx) {
                log.warn("Rollback to savepoint failed: {}", rollbackEx.getMessage(), rollbackEx);
                e.addSuppressed(rollbackEx);
            }
            throw new SchemaBuildException("Failed to rebuild destination schema", e);
        }
    }
}
