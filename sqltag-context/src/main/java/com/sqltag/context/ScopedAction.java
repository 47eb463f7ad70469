package com.sqltag.context;

/**
 * Body of a scoped context update without a result.
 *
 * @param <E> checked exception the body may throw
 */
@FunctionalInterface
public interface ScopedAction<E extends Exception> {

    void run() throws E;
}
