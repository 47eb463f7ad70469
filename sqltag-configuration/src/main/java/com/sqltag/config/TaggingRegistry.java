package com.sqltag.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default handlers by tag key, consulted for tags that carry no explicit handler.
 * Immutable: changes produce a new registry, which is then swapped in with a new configuration.
 */
public final class TaggingRegistry {

    public static final TaggingRegistry EMPTY = new TaggingRegistry(Map.of());

    private final Map<String, TagHandler> handlers;

    private TaggingRegistry(Map<String, TagHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    /**
     * Returns the handler for the key, or null if none is registered.
     */
    public TagHandler get(String key) {
        return key != null ? handlers.get(key) : null;
    }

    public boolean contains(String key) {
        return key != null && handlers.containsKey(key);
    }

    public Map<String, TagHandler> getAll() {
        return handlers;
    }

    /** Returns a registry with the handler added or replaced. */
    public TaggingRegistry with(String key, TagHandler handler) {
        return toBuilder().register(key, handler).build();
    }

    /** Returns a registry without the key. */
    public TaggingRegistry without(String key) {
        Builder b = toBuilder();
        b.handlers.remove(key);
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.handlers.putAll(handlers);
        return b;
    }

    @Override
    public String toString() {
        return "TaggingRegistry" + handlers.keySet();
    }

    public static final class Builder {
        private final Map<String, TagHandler> handlers = new LinkedHashMap<>();

        public Builder register(String key, TagHandler handler) {
            String k = TagSpec.checkKey(key);
            if (handler == null) {
                throw new InvalidTagConfigurationException("Handler for tagging '" + k + "' must not be null");
            }
            handlers.put(k, handler);
            return this;
        }

        public TaggingRegistry build() {
            return handlers.isEmpty() ? EMPTY : new TaggingRegistry(handlers);
        }
    }
}
