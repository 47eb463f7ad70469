package com.sqltag.core;

import com.sqltag.config.QueryTagsConfig;
import com.sqltag.context.CachedComment;
import com.sqltag.context.QueryTagContext;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Attaches the query log comment to SQL for an explicitly passed {@link QueryTagContext}.
 * <p>
 * The configuration is read from the supplier once per call. With {@link QueryTagsConfig#isCacheTags()}
 * the comment is stored in the context and reused until the context is mutated or a different
 * configuration instance is supplied.
 */
public final class QueryAnnotator {

    private final Supplier<QueryTagsConfig> configSource;

    /** Annotator with a fixed configuration. */
    public QueryAnnotator(QueryTagsConfig config) {
        Objects.requireNonNull(config, "config");
        this.configSource = () -> config;
    }

    /** Annotator reading the configuration from the supplier on every call (e.g. an atomic reference). */
    public QueryAnnotator(Supplier<QueryTagsConfig> configSource) {
        this.configSource = Objects.requireNonNull(configSource, "configSource");
    }

    /**
     * Returns {@code "<comment> <sql>"} when prepending, else {@code "<sql> <comment>"}, trimmed.
     * Without a comment the trimmed SQL is returned.
     */
    public String annotate(String sql, QueryTagContext context) {
        Objects.requireNonNull(sql, "sql");
        QueryTagsConfig config = currentConfig();
        Optional<String> comment = comment(config, context);
        if (comment.isEmpty()) {
            return sql.strip();
        }
        String annotated = config.isPrependComment()
                ? comment.get() + " " + sql
                : sql + " " + comment.get();
        return annotated.strip();
    }

    /** The comment for the context, from cache when enabled. */
    public Optional<String> comment(QueryTagContext context) {
        return comment(currentConfig(), context);
    }

    /** An annotator bound to one context, for callers that hand it to the query path. */
    public SqlAnnotator bind(QueryTagContext context) {
        Objects.requireNonNull(context, "context");
        return sql -> annotate(sql, context);
    }

    private Optional<String> comment(QueryTagsConfig config, QueryTagContext context) {
        Objects.requireNonNull(context, "context");
        if (!config.isCacheTags()) {
            return TagRenderer.render(config, context);
        }
        CachedComment cached = context.getCachedComment();
        if (cached != null && cached.isFor(config)) {
            return cached.getComment();
        }
        Optional<String> rendered = TagRenderer.render(config, context);
        context.setCachedComment(CachedComment.of(config, rendered.orElse(null)));
        return rendered;
    }

    private QueryTagsConfig currentConfig() {
        return Objects.requireNonNull(configSource.get(), "configuration");
    }
}
