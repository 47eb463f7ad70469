package com.sqltag.core;

import com.sqltag.config.QueryTagsConfig;
import com.sqltag.config.TagHandler;
import com.sqltag.config.TagSpec;
import com.sqltag.context.ReadableContext;

import java.util.Objects;
import java.util.Optional;

/**
 * Renders the configured tags into {@code /*k1:v1,k2:v2*&#47;}.
 * <p>
 * For each tag, in list order (groups flattened in their own order): the explicit handler wins,
 * then the registry's handler for the key, else the value is read from the context by key.
 * Null values drop the tag. Handler exceptions propagate.
 */
public final class TagRenderer {

    private static final String COMMENT_START = "/*";
    private static final String COMMENT_END = "*/";

    private TagRenderer() {
    }

    /**
     * @return the wrapped, escaped comment, or empty when no tag has a value
     */
    public static Optional<String> render(QueryTagsConfig config, ReadableContext context) {
        String content = SqlCommentEscaper.escape(tagContent(config, context));
        if (content.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(COMMENT_START + content + COMMENT_END);
    }

    /** Unescaped {@code k1:v1,k2:v2} content; empty when no tag has a value. */
    public static String tagContent(QueryTagsConfig config, ReadableContext context) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(context, "context");
        StringBuilder sb = new StringBuilder();
        for (TagSpec spec : config.getTags()) {
            for (TagSpec.Entry entry : spec.getEntries()) {
                Object value = resolve(entry, config, context);
                if (value == null) {
                    continue;
                }
                if (sb.length() > 0) {
                    sb.append(',');
                }
                sb.append(entry.key()).append(':').append(value);
            }
        }
        return sb.toString();
    }

    private static Object resolve(TagSpec.Entry entry, QueryTagsConfig config, ReadableContext context) {
        TagHandler handler = entry.handler() != null ? entry.handler() : config.getTaggings().get(entry.key());
        if (handler == null) {
            return context.get(entry.key());
        }
        return handler.resolve(context);
    }
}
