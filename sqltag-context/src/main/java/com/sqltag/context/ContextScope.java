package com.sqltag.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Scoped update of a {@link QueryTagContext}, opened by {@link QueryTagContext#openScope(Map)}.
 * Holds the previous binding of exactly the keys that were updated; {@link #close()} puts them back
 * (removing keys that were absent) and invalidates the cached comment. Use with try-with-resources.
 * <p>
 * Scopes of one context unwind as a stack, so nested scopes over the same key go back to the value
 * of the enclosing scope. Closing an enclosing scope first also closes the scopes opened inside it,
 * innermost first. Closing more than once is a no-op.
 */
public final class ContextScope implements AutoCloseable {

    private final QueryTagContext context;
    private final Map<String, PreviousBinding> previous;
    private boolean closed;

    ContextScope(QueryTagContext context, Map<String, PreviousBinding> previous) {
        this.context = context;
        this.previous = Collections.unmodifiableMap(new LinkedHashMap<>(previous));
    }

    /** Keys this scope will restore on close. */
    public Set<String> getKeys() {
        return previous.keySet();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        context.closeScope(this);
    }

    Map<String, PreviousBinding> previous() {
        return previous;
    }

    void markClosed() {
        closed = true;
    }

    /** Binding of a key before the scope was opened: absent, or present with a (possibly null) value. */
    record PreviousBinding(boolean present, Object value) {

        static final PreviousBinding ABSENT = new PreviousBinding(false, null);

        static PreviousBinding of(Object value) {
            return new PreviousBinding(true, value);
        }
    }
}
