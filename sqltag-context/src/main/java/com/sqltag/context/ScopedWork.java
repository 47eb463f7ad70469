package com.sqltag.context;

/**
 * Body of a scoped context update that produces a result.
 *
 * @param <T> result type
 * @param <E> checked exception the body may throw
 */
@FunctionalInterface
public interface ScopedWork<T, E extends Exception> {

    T run() throws E;
}
