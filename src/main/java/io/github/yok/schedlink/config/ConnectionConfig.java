package io.github.yok.schedlink.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code connections} section of {@code application.yml}.
 *
 * <pre>
 * connections:
 *   source:
 *     id: his
 *     url: jdbc:sqlserver://localhost:1433;databaseName=HIS;encrypt=true;trustServerCertificate=true
 *     user: etl_reader
 *     password: secret
 *     driver-class: com.microsoft.sqlserver.jdbc.SQLServerDriver
 *   destination:
 *     id: analytics
 *     url: jdbc:postgresql://localhost:5432/analytics
 *     user: etl_writer
 *     password: secret
 *     driver-class: org.postgresql.Driver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "connections")
@Data
public class ConnectionConfig {

    // HIS database the appointments are read from
    private Entry source;

    // Analysis database the normalized tables are written to
    private Entry destination;

    /**
     * Returns the source connection entry.
     *
     * @return source entry
     * @throws IllegalStateException if {@code connections.source.url} is not configured
     */
    public Entry requireSource() {
        return require(source, "source");
    }

    /**
     * Returns the destination connection entry.
     *
     * @return destination entry
     * @throws IllegalStateException if {@code connections.destination.url} is not configured
     */
    public Entry requireDestination() {
        return require(destination, "destination");
    }

    private static Entry require(Entry entry, String role) {
        if (entry == null || StringUtils.isBlank(entry.getUrl())) {
            throw new IllegalStateException("connections." + role
                    + ".url is not configured. Please set it in application.yml.");
        }
        return entry;
    }

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID used as log prefix (e.g., "his", "analytics")
        private String id;
        // JDBC connection URL
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name; blank means JDBC 4 auto-loading
        private String driverClass;
    }
}
