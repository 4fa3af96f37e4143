package sh.nebula.registry.client;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides when a local answer is final and what "nothing" looks like for an operation.
 *
 * @param empty              value returned when no backend answers
 * @param isEmpty            recognises an empty answer
 * @param fallThroughOnEmpty whether an empty local answer still consults the remote registry
 */
public record FallbackPolicy<T>(T empty, Predicate<T> isEmpty, boolean fallThroughOnEmpty) {

    public FallbackPolicy {
        Objects.requireNonNull(isEmpty, "isEmpty");
    }

    /**
     * A reachable local store is the source of truth, even when it returns nothing.
     */
    public static <T> FallbackPolicy<T> localAuthoritative(T empty) {
        return new FallbackPolicy<>(empty, value -> Objects.equals(value, empty), false);
    }

    /**
     * An empty local answer is treated like a miss and the remote registry is asked.
     */
    public static <T> FallbackPolicy<T> fallThroughWhenEmpty(T empty) {
        return fallThroughWhenEmpty(empty, value -> Objects.equals(value, empty));
    }

    public static <T> FallbackPolicy<T> fallThroughWhenEmpty(T empty, Predicate<T> isEmpty) {
        return new FallbackPolicy<>(empty, isEmpty, true);
    }

    boolean isEmptyValue(T value) {
        return value == null || isEmpty.test(value);
    }

    boolean acceptsLocal(T value) {
        return value != null && !(fallThroughOnEmpty && isEmpty.test(value));
    }
}
