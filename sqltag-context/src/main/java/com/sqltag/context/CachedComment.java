package com.sqltag.context;

import java.util.Objects;
import java.util.Optional;

/**
 * Rendered comment stored in a {@link QueryTagContext}. Remembers the configuration it was rendered
 * for (by identity) so a configuration swap is treated as a cache miss.
 */
public final class CachedComment {

    private final Object renderedFor;
    private final String comment;

    private CachedComment(Object renderedFor, String comment) {
        this.renderedFor = Objects.requireNonNull(renderedFor, "renderedFor");
        this.comment = comment;
    }

    /**
     * @param renderedFor configuration instance the comment was rendered with
     * @param comment     wrapped comment, or null when no tag produced a value
     */
    public static CachedComment of(Object renderedFor, String comment) {
        return new CachedComment(renderedFor, comment);
    }

    /** True if this entry was rendered for exactly this configuration instance. */
    public boolean isFor(Object configuration) {
        return renderedFor == configuration;
    }

    /** The cached comment; empty when rendering produced no tags. */
    public Optional<String> getComment() {
        return Optional.ofNullable(comment);
    }
}
