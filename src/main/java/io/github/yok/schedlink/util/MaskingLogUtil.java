package io.github.yok.schedlink.util;

import io.github.yok.schedlink.config.ConnectionConfig;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Utility for masking credentials before connection information is logged.
 *
 * <p>
 * Masks user names, embedded credentials in authority-style JDBC URLs, and {@code password}
 * properties in semicolon/ampersand separated URLs (SQL Server, PostgreSQL).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    private static final Pattern JDBC_AUTH_PATTERN =
            Pattern.compile("(jdbc:[^:]+://[^:/?#]+:)([^@/]+)(@.*)", Pattern.CASE_INSENSITIVE);

    private static final Pattern PASSWORD_PROPERTY_PATTERN =
            Pattern.compile("(?i)(password=)([^;&]+)");

    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a sensitive text.
     *
     * @param value raw text
     * @return {@code ***}, or the input itself when it is {@code null} or empty
     */
    public static String maskText(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return "***";
    }

    /**
     * Masks password-like fragments in a JDBC URL.
     *
     * @param url JDBC URL
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskJdbcUrl(String url) {
        if (url == null) {
            return null;
        }
        String masked = url;
        Matcher authMatcher = JDBC_AUTH_PATTERN.matcher(masked);
        if (authMatcher.find()) {
            masked = authMatcher.replaceFirst("$1***$3");
        }
        return PASSWORD_PROPERTY_PATTERN.matcher(masked).replaceAll("$1***");
    }

    /**
     * Formats a connection entry for logging with masked sensitive values.
     *
     * @param entry connection entry
     * @return formatted log string
     */
    public static String maskConnection(ConnectionConfig.Entry entry) {
        if (entry == null) {
            return "<null>";
        }
        return "id=" + entry.getId() + ", url=" + maskJdbcUrl(entry.getUrl()) + ", user="
                + maskText(entry.getUser());
    }
}
