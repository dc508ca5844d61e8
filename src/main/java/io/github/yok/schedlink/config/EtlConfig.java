package io.github.yok.schedlink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code etl} section in {@code application.yml}. Centralizes
 * the behavior of the extractor, the schema builder and the loader.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "etl")
@Data
public class EtlConfig {

    /**
     * When {@code true}, the operator is prompted before the destination is wiped. The
     * {@code --yes} option skips the prompt for one run.
     */
    private boolean confirmBeforeLoad = true;

    /**
     * How the destination is wiped before the load.
     */
    private SchemaResetMode resetMode = SchemaResetMode.SCHEMA;

    /**
     * Classpath location of the SQL query run against the source.
     */
    private String extractQueryLocation = "sql/extract-appointments.sql";

    /**
     * Classpath location of the first-name dictionary used for sex inference.
     */
    private String nameDictionaryLocation = "names/first-names.csv";

    /**
     * ISO country code that scopes the first-name dictionary.
     */
    private String nameInferenceCountry = "PY";

    /**
     * Number of records between two progress log lines. Zero or less disables progress logging.
     */
    private int progressInterval = 500;
}
