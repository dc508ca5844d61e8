package io.github.yok.schedlink.util;

import java.util.Locale;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Normalizes person names before they are stored: trims, collapses internal whitespace runs to
 * one space and converts to upper case. Applying it twice gives the same result as applying it
 * once.
 *
 * @author Yasuharu.Okawauchi
 */
public final class NameNormalizer {

    @Generated
    private NameNormalizer() {}

    /**
     * Normalizes a name.
     *
     * @param raw raw name as read from the source
     * @return normalized name, or {@code null} when {@code raw} is {@code null}
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        return StringUtils.normalizeSpace(raw).toUpperCase(Locale.ROOT);
    }

    /**
     * Returns the first space-delimited token of an already normalized name.
     *
     * @param normalized normalized name
     * @return first token, or an empty string when the name is {@code null} or empty
     */
    public static String firstToken(String normalized) {
        if (StringUtils.isEmpty(normalized)) {
            return "";
        }
        return StringUtils.substringBefore(normalized, " ");
    }
}
