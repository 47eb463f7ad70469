package com.sqltag.context;

/**
 * Thread-local holder for the current execution unit's {@link QueryTagContext}. The context is
 * created on first access; the owner of the unit (end of request, end of job) calls
 * {@link #clear()}. Nothing is cleared implicitly.
 */
public final class QueryTagContextHolder {

    private static final ThreadLocal<QueryTagContext> CONTEXT = new ThreadLocal<>();

    private QueryTagContextHolder() {
    }

    /** Context of the current thread, created lazily. */
    public static QueryTagContext current() {
        QueryTagContext ctx = CONTEXT.get();
        if (ctx == null) {
            ctx = new QueryTagContext();
            CONTEXT.set(ctx);
        }
        return ctx;
    }

    /** True if the current thread has a context attached. */
    public static boolean isAttached() {
        return CONTEXT.get() != null;
    }

    /** Empties the current thread's context (invalidating its cached comment) and detaches it. */
    public static void clear() {
        QueryTagContext ctx = CONTEXT.get();
        if (ctx != null) {
            ctx.clear();
        }
        CONTEXT.remove();
    }
}
