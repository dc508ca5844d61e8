package io.github.yok.schedlink.infer;

import java.util.Optional;

/**
 * Infers a person's sex from a first name.
 *
 * <p>
 * Implementations return {@link Optional#empty()} when the name is unknown and must not let internal
 * errors escape. Callers still guard against {@link RuntimeException}.
 * </p>
 */
@FunctionalInterface
public interface SexInferrer {

    /**
     * Infers the sex for the given first name.
     *
     * @param firstName single first-name token, typically upper case
     * @return inferred value, or empty when it cannot be determined
     */
    Optional<InferredSex> infer(String firstName);
}
