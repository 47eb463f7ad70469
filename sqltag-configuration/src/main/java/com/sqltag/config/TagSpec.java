package com.sqltag.config;

import com.sqltag.context.ReadableContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One entry of the ordered tag list: either a bare key (value comes from the tagging registry or the
 * context) or a group of key to handler pairs rendered in insertion order.
 */
public final class TagSpec {

    private final List<Entry> entries;
    private final boolean group;

    private TagSpec(List<Entry> entries, boolean group) {
        this.entries = Collections.unmodifiableList(entries);
        this.group = group;
    }

    /** Bare key: resolved through the tagging registry, else read from the context. */
    public static TagSpec key(String key) {
        return new TagSpec(List.of(new Entry(checkKey(key), null)), false);
    }

    /** Single key with an explicit handler. */
    public static TagSpec of(String key, TagHandler handler) {
        return group().tag(key, handler).build();
    }

    /** Group of explicit handlers, in the map's iteration order. */
    public static TagSpec group(Map<String, TagHandler> handlers) {
        if (handlers == null) {
            throw new InvalidTagConfigurationException("Tag group must not be null");
        }
        GroupBuilder b = group();
        handlers.forEach(b::tag);
        return b.build();
    }

    public static GroupBuilder group() {
        return new GroupBuilder();
    }

    /** Key/handler pairs of this entry; handler is null for a bare key. */
    public List<Entry> getEntries() {
        return entries;
    }

    public boolean isGroup() {
        return group;
    }

    static String checkKey(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidTagConfigurationException("Tag key must be non-blank: " + key);
        }
        return key.trim();
    }

    @Override
    public String toString() {
        return group ? "TagSpec" + entries : "TagSpec[" + entries.get(0).key() + "]";
    }

    /**
     * A flattened tag: key plus optional explicit handler.
     *
     * @param key     tag key as rendered
     * @param handler explicit handler, or null when the registry or the context decides
     */
    public record Entry(String key, TagHandler handler) {
    }

    public static final class GroupBuilder {
        private final Map<String, TagHandler> handlers = new LinkedHashMap<>();

        public GroupBuilder tag(String key, TagHandler handler) {
            String k = checkKey(key);
            if (handler == null) {
                throw new InvalidTagConfigurationException("Handler for tag '" + k + "' must not be null");
            }
            handlers.put(k, handler);
            return this;
        }

        public GroupBuilder value(String key, Object value) {
            return tag(key, TagHandler.value(value));
        }

        public GroupBuilder producer(String key, Supplier<?> producer) {
            return tag(key, TagHandler.producer(producer));
        }

        public GroupBuilder fromContext(String key, Function<? super ReadableContext, ?> contextProducer) {
            return tag(key, TagHandler.fromContext(contextProducer));
        }

        public TagSpec build() {
            if (handlers.isEmpty()) {
                throw new InvalidTagConfigurationException("Tag group must contain at least one tag");
            }
            List<Entry> entries = new ArrayList<>(handlers.size());
            handlers.forEach((k, h) -> entries.add(new Entry(k, h)));
            return new TagSpec(entries, true);
        }
    }
}
