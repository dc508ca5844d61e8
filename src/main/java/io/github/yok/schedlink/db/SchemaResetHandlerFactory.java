package io.github.yok.schedlink.db;

import io.github.yok.schedlink.config.EtlConfig;
import io.github.yok.schedlink.config.SchemaResetMode;
import io.github.yok.schedlink.db.postgresql.DropSchemaResetHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link SchemaResetHandler} according to
 * {@link EtlConfig#getResetMode()}.
 *
 * <ul>
 * <li>{@code SCHEMA}: {@link DropSchemaResetHandler}</li>
 * <li>{@code TABLES}: {@link DropTablesResetHandler}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaResetHandlerFactory {

    private final EtlConfig etlConfig;

    /**
     * Creates the handler for the configured reset mode.
     *
     * @return handler
     * @throws IllegalArgumentException if the mode is not set
     */
    public SchemaResetHandler create() {
        SchemaResetMode mode = etlConfig.getResetMode();
        if (mode == null) {
            String msg = "etl.reset-mode is not configured";
            log.error(msg);
            throw new IllegalArgumentException(msg);
        }
        switch (mode) {
            case SCHEMA:
                return new DropSchemaResetHandler();
            case TABLES:
                return new DropTablesResetHandler();
            default:
                String msg = "Unsupported reset mode: " + mode;
                log.error(msg);
                throw new IllegalArgumentException(msg);
        }
    }
}
