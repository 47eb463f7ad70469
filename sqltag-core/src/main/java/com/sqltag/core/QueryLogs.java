package com.sqltag.core;

import com.sqltag.config.QueryTagsConfig;
import com.sqltag.config.TagHandler;
import com.sqltag.context.ContextScope;
import com.sqltag.context.QueryTagContext;
import com.sqltag.context.QueryTagContextHolder;
import com.sqltag.context.ScopedAction;
import com.sqltag.context.ScopedWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Process-wide query log tags. Holds the configuration (read without locking, replaced atomically)
 * and works on the current thread's context from {@link QueryTagContextHolder}.
 * <p>
 * Producers bind values:
 * <pre>{@code
 * QueryLogs.getInstance().runWithContext(Map.of("controller", "posts", "action", "index"), () -> handle(request));
 * }</pre>
 * and the query path annotates:
 * <pre>{@code
 * String sql = QueryLogs.getInstance().annotate("SELECT * FROM posts");
 * }</pre>
 * The owner of the execution unit calls {@link #clearContext()} when the unit ends.
 */
public final class QueryLogs implements SqlAnnotator {

    private static final Logger log = LoggerFactory.getLogger(QueryLogs.class);
    private static final QueryLogs INSTANCE = new QueryLogs();

    private final AtomicReference<QueryTagsConfig> config = new AtomicReference<>(QueryTagsConfig.defaults());
    private final QueryAnnotator annotator = new QueryAnnotator(config::get);

    public static QueryLogs getInstance() {
        return INSTANCE;
    }

    private QueryLogs() {
    }

    public QueryTagsConfig getConfig() {
        return config.get();
    }

    /** Replaces the configuration. Cached comments rendered for the previous one are not reused. */
    public void configure(QueryTagsConfig newConfig) {
        Objects.requireNonNull(newConfig, "config");
        config.set(newConfig);
        log.info("Query log tags configured: {}", newConfig);
    }

    /**
     * Atomically derives a new configuration from the current one, e.g.
     * {@code update(c -> c.toBuilder().cacheTags(true).build())}.
     */
    public QueryTagsConfig update(UnaryOperator<QueryTagsConfig> change) {
        Objects.requireNonNull(change, "change");
        QueryTagsConfig updated = config.updateAndGet(current ->
                Objects.requireNonNull(change.apply(current), "updated config"));
        log.info("Query log tags updated: {}", updated);
        return updated;
    }

    /** Adds or replaces a default handler for bare-key tags. */
    public void registerTagging(String key, TagHandler handler) {
        update(c -> c.toBuilder().tagging(key, handler).build());
    }

    @Override
    public String annotate(String sql) {
        return annotator.annotate(sql, QueryTagContextHolder.current());
    }

    /** The current thread's comment, or empty if no tag has a value. */
    public Optional<String> comment() {
        return annotator.comment(QueryTagContextHolder.current());
    }

    /** The current thread's context. */
    public QueryTagContext context() {
        return QueryTagContextHolder.current();
    }

    public void setContext(Map<String, ?> updates) {
        QueryTagContextHolder.current().setContext(updates);
    }

    public <T, E extends Exception> T setContext(Map<String, ?> updates, ScopedWork<T, E> body) throws E {
        return QueryTagContextHolder.current().setContext(updates, body);
    }

    public <E extends Exception> void runWithContext(Map<String, ?> updates, ScopedAction<E> body) throws E {
        QueryTagContextHolder.current().runWithContext(updates, body);
    }

    public ContextScope openScope(Map<String, ?> updates) {
        return QueryTagContextHolder.current().openScope(updates);
    }

    /** Empties and detaches the current thread's context. */
    public void clearContext() {
        QueryTagContextHolder.clear();
    }

    /** Restores default configuration and clears the current thread's context (mainly for tests). */
    public void reset() {
        config.set(QueryTagsConfig.defaults());
        QueryTagContextHolder.clear();
    }
}
