package com.sqltag.config;

import com.sqltag.context.QueryTagContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryTagsConfigTest {

    @Test
    void defaults_tagApplicationAndAppendWithoutCache() {
        QueryTagsConfig config = QueryTagsConfig.defaults();

        assertEquals(List.of("application"), keys(config));
        assertFalse(config.isPrependComment());
        assertFalse(config.isCacheTags());
        assertEquals(QueryTagsConfig.DEFAULT_APPLICATION_NAME,
                config.getTaggings().get(QueryTagKeys.APPLICATION).resolve(new QueryTagContext()));
    }

    @Test
    void fromEnvironment_readsTagsAndFlags() {
        QueryTagsConfig config = QueryTagsConfig.fromEnvironment(Map.of(
                "SQLTAG_TAGS", "application, controller,,action ",
                "SQLTAG_PREPEND_COMMENT", "true",
                "SQLTAG_CACHE_TAGS", "1",
                "SQLTAG_APPLICATION", "billing"));

        assertEquals(List.of("application", "controller", "action"), keys(config));
        assertTrue(config.isPrependComment());
        assertTrue(config.isCacheTags());
        assertEquals("billing", config.getTaggings().get(QueryTagKeys.APPLICATION).resolve(new QueryTagContext()));
    }

    @Test
    void fromEnvironment_fallsBackToDefaults() {
        QueryTagsConfig config = QueryTagsConfig.fromEnvironment(Map.of("SQLTAG_PREPEND_COMMENT", "yes"));

        assertEquals(List.of("application"), keys(config));
        assertFalse(config.isPrependComment());
    }

    @Test
    void toBuilder_copiesEverything() {
        QueryTagsConfig original = QueryTagsConfig.builder()
                .tags("application", "job")
                .applicationName("worker")
                .cacheTags(true)
                .build();

        QueryTagsConfig copy = original.toBuilder().prependComment(true).build();

        assertEquals(keys(original), keys(copy));
        assertTrue(copy.isCacheTags());
        assertTrue(copy.isPrependComment());
        assertFalse(original.isPrependComment());
    }

    @Test
    void tagList_isImmutable() {
        List<TagSpec> tags = new ArrayList<>(List.of(TagSpec.key("job")));
        QueryTagsConfig config = QueryTagsConfig.builder().tags(tags).build();
        tags.add(TagSpec.key("controller"));

        assertEquals(List.of("job"), keys(config));
        assertThrows(UnsupportedOperationException.class, () -> config.getTags().add(TagSpec.key("x")));
    }

    @Test
    void tagList_rejectsNullEntries() {
        List<TagSpec> tags = new ArrayList<>();
        tags.add(null);

        assertThrows(InvalidTagConfigurationException.class, () -> QueryTagsConfig.builder().tags(tags));
    }

    private static List<String> keys(QueryTagsConfig config) {
        return config.getTags().stream()
                .flatMap(s -> s.getEntries().stream())
                .map(TagSpec.Entry::key)
                .collect(Collectors.toList());
    }
}
