package com.sqltag.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link QueryTagsConfig} from JSON. Every field is optional:
 * <pre>{@code
 * {
 *   "application": "billing",
 *   "prependComment": false,
 *   "cacheTags": true,
 *   "tags": ["application", "controller", "action", {"region": "eu-west-1", "shard": 3}],
 *   "taggings": {"deployment": "blue"}
 * }
 * }</pre>
 * String entries of {@code tags} are bare keys; object entries are groups of static values.
 * {@code taggings} adds static default handlers. Dynamic handlers are added in code
 * ({@link QueryTagsConfig#toBuilder()}).
 */
public final class QueryTagsConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(QueryTagsConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private QueryTagsConfigLoader() {
    }

    /**
     * Parses the configuration document.
     *
     * @throws UncheckedIOException              on malformed JSON
     * @throws InvalidTagConfigurationException on a structurally invalid tag list
     */
    public static QueryTagsConfig fromJson(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return fromTree(root);
    }

    public static QueryTagsConfig fromFile(Path path) {
        try {
            String json = Files.readString(path);
            log.info("Loading query tag configuration from {}", path);
            return fromJson(json);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Loads a classpath resource, or returns {@link QueryTagsConfig#defaults()} when it does not exist.
     */
    public static QueryTagsConfig fromClasspath(String resource) {
        try (InputStream in = QueryTagsConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("Query tag configuration resource {} not found; using defaults", resource);
                return QueryTagsConfig.defaults();
            }
            log.info("Loading query tag configuration from classpath {}", resource);
            return fromTree(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static QueryTagsConfig fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw invalid("Query tag configuration must be a JSON object");
        }
        QueryTagsConfig.Builder b = QueryTagsConfig.builder();
        JsonNode application = root.get("application");
        if (application != null && !application.isNull()) {
            b.applicationName(application.asText());
        }
        b.prependComment(root.path("prependComment").asBoolean(false));
        b.cacheTags(root.path("cacheTags").asBoolean(false));

        JsonNode taggings = root.get("taggings");
        if (taggings != null && !taggings.isNull()) {
            if (!taggings.isObject()) {
                throw invalid("'taggings' must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> it = taggings.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                b.tagging(e.getKey(), TagHandler.value(scalar(e.getKey(), e.getValue())));
            }
        }

        JsonNode tags = root.get("tags");
        if (tags != null && !tags.isNull()) {
            if (!tags.isArray()) {
                throw invalid("'tags' must be an array");
            }
            List<TagSpec> specs = new ArrayList<>();
            for (JsonNode entry : tags) {
                specs.add(toTagSpec(entry));
            }
            b.tags(specs);
        }
        QueryTagsConfig config = b.build();
        log.debug("Parsed query tag configuration {}", config);
        return config;
    }

    private static TagSpec toTagSpec(JsonNode entry) {
        if (entry.isTextual()) {
            return TagSpec.key(entry.asText());
        }
        if (entry.isObject()) {
            TagSpec.GroupBuilder group = TagSpec.group();
            Iterator<Map.Entry<String, JsonNode>> it = entry.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                group.value(e.getKey(), scalar(e.getKey(), e.getValue()));
            }
            return group.build();
        }
        throw invalid("Tag entry must be a string or an object: " + entry);
    }

    private static Object scalar(String key, JsonNode node) {
        if (node.isTextual()) return node.asText();
        if (node.isIntegralNumber()) return node.longValue();
        if (node.isNumber()) return node.decimalValue();
        if (node.isBoolean()) return node.booleanValue();
        throw invalid("Value of tag '" + key + "' must be a string, number or boolean: " + node);
    }

    private static InvalidTagConfigurationException invalid(String message) {
        log.warn("Rejecting query tag configuration: {}", message);
        return new InvalidTagConfigurationException(message);
    }
}
