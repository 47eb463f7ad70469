package com.sqltag.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable key/value context of one logical execution unit (a request, a job, a thread).
 * Producers such as request middleware or job runners bind values ({@code controller},
 * {@code action}, {@code job}, ...); tag handlers read them when the query comment is rendered.
 * <p>
 * The context also owns the unit's cached comment. Every mutation through this class invalidates it.
 * <p>
 * Not thread-safe: an instance belongs to a single execution unit. Use
 * {@link QueryTagContextHolder} for a thread-confined ambient instance, or pass an instance
 * explicitly through the call chain.
 */
public final class QueryTagContext implements ReadableContext {

    private static final Logger log = LoggerFactory.getLogger(QueryTagContext.class);

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Deque<ContextScope> openScopes = new ArrayDeque<>();
    private CachedComment cachedComment;

    @Override
    public Object get(String key) {
        return values.get(key);
    }

    @Override
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    @Override
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Binds a single key. Null values are stored as explicit nulls (the tag is still omitted). */
    public void setContext(String key, Object value) {
        setContext(Collections.singletonMap(key, value));
    }

    /**
     * Merges the updates into this context and invalidates the cached comment.
     *
     * @param updates key to value; values may be null, keys must be non-blank
     */
    public void setContext(Map<String, ?> updates) {
        values.putAll(checkedCopy(updates));
        invalidateCachedComment();
    }

    /**
     * Applies the updates for the duration of {@code body} and returns its result. On every exit
     * path, including an exception thrown by the body, the updated keys go back to their previous
     * binding (absent keys are removed again) and the cached comment is invalidated.
     *
     * @throws E whatever the body throws, unchanged
     */
    public <T, E extends Exception> T setContext(Map<String, ?> updates, ScopedWork<T, E> body) throws E {
        Objects.requireNonNull(body, "body");
        try (ContextScope ignored = openScope(updates)) {
            return body.run();
        }
    }

    /** Same as {@link #setContext(Map, ScopedWork)} for a body without a result. */
    public <E extends Exception> void runWithContext(Map<String, ?> updates, ScopedAction<E> body) throws E {
        Objects.requireNonNull(body, "body");
        try (ContextScope ignored = openScope(updates)) {
            body.run();
        }
    }

    /**
     * Applies the updates and returns a scope that restores the previous bindings of the updated
     * keys when closed. Scopes unwind last-in first-out: closing a scope first closes every scope
     * opened after it that is still open.
     */
    public ContextScope openScope(Map<String, ?> updates) {
        Map<String, Object> copy = checkedCopy(updates);
        Map<String, ContextScope.PreviousBinding> previous = new LinkedHashMap<>();
        for (String key : copy.keySet()) {
            previous.put(key, values.containsKey(key)
                    ? ContextScope.PreviousBinding.of(values.get(key))
                    : ContextScope.PreviousBinding.ABSENT);
        }
        values.putAll(copy);
        invalidateCachedComment();
        log.trace("Opened context scope for keys {}", copy.keySet());
        ContextScope scope = new ContextScope(this, previous);
        openScopes.push(scope);
        return scope;
    }

    /** Removes every binding and invalidates the cached comment. */
    public void clear() {
        values.clear();
        invalidateCachedComment();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Cached comment of this unit, or null if nothing is cached. */
    public CachedComment getCachedComment() {
        return cachedComment;
    }

    public void setCachedComment(CachedComment cachedComment) {
        this.cachedComment = cachedComment;
    }

    public void invalidateCachedComment() {
        cachedComment = null;
    }

    void closeScope(ContextScope scope) {
        if (!openScopes.contains(scope)) {
            return;
        }
        ContextScope top;
        do {
            top = openScopes.pop();
            if (top != scope) {
                log.debug("Context scope for keys {} closed by an enclosing scope", top.getKeys());
            }
            top.markClosed();
            restore(top.previous());
        } while (top != scope);
    }

    private void restore(Map<String, ContextScope.PreviousBinding> previous) {
        for (Map.Entry<String, ContextScope.PreviousBinding> e : previous.entrySet()) {
            if (e.getValue().present()) {
                values.put(e.getKey(), e.getValue().value());
            } else {
                values.remove(e.getKey());
            }
        }
        invalidateCachedComment();
        log.trace("Restored context keys {}", previous.keySet());
    }

    private static Map<String, Object> checkedCopy(Map<String, ?> updates) {
        Objects.requireNonNull(updates, "updates");
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : updates.entrySet()) {
            String key = e.getKey();
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Context key must be non-blank: " + key);
            }
            copy.put(key, e.getValue());
        }
        return copy;
    }

    @Override
    public String toString() {
        return "QueryTagContext" + values;
    }
}
