package io.kvcache.instrument;

/**
 * A single-argument operation that can be wrapped with call tracking.
 *
 * @param <T> the argument type
 * @param <R> the result type
 */
@FunctionalInterface
public interface Operation<T, R> {

    R apply(T argument);
}
