package org.templatize.engine;

import java.util.Optional;

/**
 * Static type information for host nodes.
 *
 * @param <N> the host's expression node type
 * @param <T> the host's type representation
 */
public interface TypeOracle<N, T> {

    /**
     * The statically inferred result type of {@code node}, or empty when it cannot be resolved.
     */
    Optional<T> resultType(N node);

    boolean isStringType(T type);

    default boolean hasStringType(N node) {
        return resultType(node).map(this::isStringType).orElse(false);
    }
}
