package com.sqltag.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Query log tag configuration: ordered tag list, tagging registry and rendering flags.
 * Immutable; build a new instance (see {@link #toBuilder()}) to change it.
 * <p>
 * Environment: SQLTAG_TAGS (comma-separated keys, default {@code application}),
 * SQLTAG_PREPEND_COMMENT (default false), SQLTAG_CACHE_TAGS (default false),
 * SQLTAG_APPLICATION (default {@value #DEFAULT_APPLICATION_NAME}).
 */
public final class QueryTagsConfig {

    private static final String ENV_TAGS = "SQLTAG_TAGS";
    private static final String ENV_PREPEND_COMMENT = "SQLTAG_PREPEND_COMMENT";
    private static final String ENV_CACHE_TAGS = "SQLTAG_CACHE_TAGS";
    private static final String ENV_APPLICATION = "SQLTAG_APPLICATION";

    public static final String DEFAULT_APPLICATION_NAME = "sqltag";
    private static final List<TagSpec> DEFAULT_TAGS = List.of(TagSpec.key(QueryTagKeys.APPLICATION));

    private final List<TagSpec> tags;
    private final TaggingRegistry taggings;
    private final boolean prependComment;
    private final boolean cacheTags;

    private QueryTagsConfig(Builder b) {
        this.tags = Collections.unmodifiableList(new ArrayList<>(b.tags));
        this.taggings = b.taggings;
        this.prependComment = b.prependComment;
        this.cacheTags = b.cacheTags;
    }

    /** Configuration with defaults: tags {@code [application]}, append, no caching. */
    public static QueryTagsConfig defaults() {
        return builder().build();
    }

    /** Ordered tag list; output order follows it. */
    public List<TagSpec> getTags() {
        return tags;
    }

    /** Default handlers for bare keys. */
    public TaggingRegistry getTaggings() {
        return taggings;
    }

    /** True to put the comment before the query, false (default) to append it. */
    public boolean isPrependComment() {
        return prependComment;
    }

    /** True to render the comment once per context and reuse it until the context changes. Default false. */
    public boolean isCacheTags() {
        return cacheTags;
    }

    public static QueryTagsConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static QueryTagsConfig fromEnvironment(Map<String, String> env) {
        Builder b = builder()
                .applicationName(getEnv(env, ENV_APPLICATION, DEFAULT_APPLICATION_NAME))
                .prependComment(parseBoolean(env.get(ENV_PREPEND_COMMENT), false))
                .cacheTags(parseBoolean(env.get(ENV_CACHE_TAGS), false));
        List<String> keys = parseCommaSeparated(env.get(ENV_TAGS));
        if (!keys.isEmpty()) {
            b.tags(keys.stream().map(TagSpec::key).collect(Collectors.toList()));
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.tags = new ArrayList<>(tags);
        b.taggings = taggings;
        b.prependComment = prependComment;
        b.cacheTags = cacheTags;
        return b;
    }

    static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "QueryTagsConfig{tags=" + tags + ", taggings=" + taggings
                + ", prependComment=" + prependComment + ", cacheTags=" + cacheTags + "}";
    }

    /**
     * Builder. Starts from {@link DefaultTaggings#registry(String)} with
     * {@value #DEFAULT_APPLICATION_NAME} as application name.
     */
    public static final class Builder {
        private List<TagSpec> tags = new ArrayList<>(DEFAULT_TAGS);
        private TaggingRegistry taggings = DefaultTaggings.registry(DEFAULT_APPLICATION_NAME);
        private boolean prependComment;
        private boolean cacheTags;

        public Builder tags(List<TagSpec> tags) {
            Objects.requireNonNull(tags, "tags");
            for (TagSpec spec : tags) {
                if (spec == null) {
                    throw new InvalidTagConfigurationException("Tag list must not contain null entries");
                }
            }
            this.tags = new ArrayList<>(tags);
            return this;
        }

        /** Replaces the tag list with bare keys. */
        public Builder tags(String... keys) {
            List<TagSpec> specs = new ArrayList<>(keys.length);
            for (String key : keys) {
                specs.add(TagSpec.key(key));
            }
            this.tags = specs;
            return this;
        }

        /** Appends one entry to the tag list. */
        public Builder tag(TagSpec spec) {
            if (spec == null) {
                throw new InvalidTagConfigurationException("Tag spec must not be null");
            }
            this.tags.add(spec);
            return this;
        }

        /** Replaces the tagging registry, including the default {@code application} and {@code pid} handlers. */
        public Builder taggings(TaggingRegistry taggings) {
            this.taggings = taggings != null ? taggings : TaggingRegistry.EMPTY;
            return this;
        }

        /** Adds or replaces one default handler. */
        public Builder tagging(String key, TagHandler handler) {
            this.taggings = taggings.with(key, handler);
            return this;
        }

        /** Sets the static value of the {@code application} tag. */
        public Builder applicationName(String applicationName) {
            return tagging(QueryTagKeys.APPLICATION, TagHandler.value(applicationName));
        }

        public Builder prependComment(boolean prependComment) {
            this.prependComment = prependComment;
            return this;
        }

        public Builder cacheTags(boolean cacheTags) {
            this.cacheTags = cacheTags;
            return this;
        }

        public QueryTagsConfig build() {
            return new QueryTagsConfig(this);
        }
    }
}
