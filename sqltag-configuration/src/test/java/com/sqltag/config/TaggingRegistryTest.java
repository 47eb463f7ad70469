package com.sqltag.config;

import com.sqltag.context.QueryTagContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaggingRegistryTest {

    @Test
    void with_returnsNewRegistryAndLeavesOriginalUntouched() {
        TaggingRegistry base = TaggingRegistry.builder()
                .register("region", TagHandler.value("eu"))
                .build();

        TaggingRegistry extended = base.with("zone", TagHandler.value("b"));

        assertFalse(base.contains("zone"));
        assertTrue(extended.contains("zone"));
        assertTrue(extended.contains("region"));
    }

    @Test
    void without_removesKey() {
        TaggingRegistry registry = DefaultTaggings.registry("app").without(QueryTagKeys.PID);

        assertFalse(registry.contains(QueryTagKeys.PID));
        assertTrue(registry.contains(QueryTagKeys.APPLICATION));
    }

    @Test
    void emptyBuilderYieldsSharedEmptyRegistry() {
        assertSame(TaggingRegistry.EMPTY, TaggingRegistry.builder().build());
        assertNull(TaggingRegistry.EMPTY.get("anything"));
        assertNull(TaggingRegistry.EMPTY.get(null));
    }

    @Test
    void getAll_isUnmodifiable() {
        TaggingRegistry registry = DefaultTaggings.registry("app");

        assertThrows(UnsupportedOperationException.class,
                () -> registry.getAll().put("x", TagHandler.value("y")));
    }

    @Test
    void defaultTaggings_resolveApplicationAndPid() {
        TaggingRegistry registry = DefaultTaggings.registry("myapp");
        QueryTagContext ctx = new QueryTagContext();

        assertEquals("myapp", registry.get(QueryTagKeys.APPLICATION).resolve(ctx));
        assertEquals(ProcessHandle.current().pid(), registry.get(QueryTagKeys.PID).resolve(ctx));
    }

    @Test
    void register_rejectsNullHandler() {
        assertThrows(InvalidTagConfigurationException.class,
                () -> TaggingRegistry.builder().register("x", null));
    }
}
