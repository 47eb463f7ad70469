package com.sqltag.context;

import java.util.Map;

/**
 * Read-only view of a {@link QueryTagContext}. Handed to context-aware tag handlers so they can
 * read values without being able to mutate the context (and thereby the cached comment).
 */
public interface ReadableContext {

    /**
     * Returns the value bound to the key, or null if the key is absent or explicitly bound to null.
     * Use {@link #contains(String)} to tell the two apart.
     */
    Object get(String key);

    /** True if the key is bound, even to null. */
    boolean contains(String key);

    /** Unmodifiable snapshot of all bindings, in insertion order. */
    Map<String, Object> asMap();

    /**
     * Typed lookup.
     *
     * @return the value if bound and an instance of {@code type}; otherwise null
     */
    default <T> T get(String key, Class<T> type) {
        Object v = get(key);
        return (v != null && type.isInstance(v)) ? type.cast(v) : null;
    }
}
