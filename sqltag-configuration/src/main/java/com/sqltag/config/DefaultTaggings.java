package com.sqltag.config;

/**
 * Built-in taggings: {@code application} (static application name) and {@code pid} (current
 * process id). {@code controller}, {@code action} and {@code job} need no registration: bare keys
 * are read from the context.
 */
public final class DefaultTaggings {

    private DefaultTaggings() {
    }

    public static TaggingRegistry registry(String applicationName) {
        return TaggingRegistry.builder()
                .register(QueryTagKeys.APPLICATION, TagHandler.value(applicationName))
                .register(QueryTagKeys.PID, TagHandler.producer(() -> ProcessHandle.current().pid()))
                .build();
    }
}
