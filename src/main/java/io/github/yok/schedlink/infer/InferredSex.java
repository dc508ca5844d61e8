package io.github.yok.schedlink.infer;

import java.util.Locale;
import java.util.Optional;

/**
 * Sex inferred from a first name.
 */
public enum InferredSex {
    MALE,
    FEMALE,
    MOSTLY_MALE,
    MOSTLY_FEMALE,
    UNISEX;

    /**
     * Parses a dictionary code. Accepts the enum name or the short codes {@code M}, {@code F},
     * {@code ?M}, {@code ?F} and {@code ?}.
     *
     * @param code dictionary code
     * @return parsed value, or empty when the code is not recognized
     */
    public static Optional<InferredSex> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "M":
            case "MALE":
                return Optional.of(MALE);
            case "F":
            case "FEMALE":
                return Optional.of(FEMALE);
            case "?M":
            case "MOSTLY_MALE":
                return Optional.of(MOSTLY_MALE);
            case "?F":
            case "MOSTLY_FEMALE":
                return Optional.of(MOSTLY_FEMALE);
            case "?":
            case "UNISEX":
                return Optional.of(UNISEX);
            default:
                return Optional.empty();
        }
    }
}
