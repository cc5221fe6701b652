package de.mirkosertic.mcp.vaultsearch.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.vaultsearch.index.SecretRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flattens a secret payload into the names of all keys it contains.
 * <p>
 * Nested maps and list elements are unfolded recursively. String values that look like
 * an embedded JSON or YAML document are parsed and their keys are collected as well;
 * values that fail to parse simply contribute nothing. Recursion stops silently at
 * {@code maxDepth}. Secret values themselves never leave this class.
 * <p>
 * Thread-safe: the extractor keeps no per-call state.
 */
public class KeyExtractor {

    private static final Logger logger = LoggerFactory.getLogger(KeyExtractor.class);

    public static final int DEFAULT_MAX_DEPTH = 10;

    private final ObjectMapper objectMapper;
    private final int maxDepth;

    public KeyExtractor() {
        this(DEFAULT_MAX_DEPTH);
    }

    public KeyExtractor(final int maxDepth) {
        this.objectMapper = new ObjectMapper();
        this.maxDepth = maxDepth;
    }

    /**
     * Builds the index record for one secret.
     */
    public SecretRecord extract(final String secretPath, final SecretValue.MapValue data) {
        final List<String> keys = extractKeys(data);
        return new SecretRecord(keys, buildSearchString(secretPath, keys));
    }

    /**
     * Returns every key name reachable from the top-level fields, top-level keys included.
     * Duplicates are kept.
     */
    public List<String> extractKeys(final SecretValue.MapValue data) {
        final List<String> keys = new ArrayList<>(data.entries().size());
        for (final Map.Entry<String, SecretValue> entry : data.entries().entrySet()) {
            keys.add(entry.getKey());
            collectNestedKeys(entry.getValue(), keys, 0);
        }
        return keys;
    }

    private void collectNestedKeys(final SecretValue value, final List<String> keys, final int depth) {
        if (depth >= maxDepth) {
            return;
        }
        if (value instanceof SecretValue.Text text) {
            final String content = text.value();
            if (looksLikeJson(content)) {
                collectKeysFromJson(content, keys, depth + 1);
            } else if (looksLikeYaml(content)) {
                collectKeysFromYaml(content, keys, depth + 1);
            }
        } else if (value instanceof SecretValue.MapValue map) {
            collectKeysFromMap(map, keys, depth + 1);
        } else if (value instanceof SecretValue.ListValue list) {
            for (final SecretValue element : list.elements()) {
                collectNestedKeys(element, keys, depth + 1);
            }
        }
        // Numbers, booleans and nulls carry no keys
    }

    private void collectKeysFromMap(final SecretValue.MapValue map, final List<String> keys, final int depth) {
        for (final Map.Entry<String, SecretValue> entry : map.entries().entrySet()) {
            keys.add(entry.getKey());
            collectNestedKeys(entry.getValue(), keys, depth);
        }
    }

    private void collectKeysFromJson(final String content, final List<String> keys, final int depth) {
        logger.debug("Detected potential JSON in value, attempting to parse");
        final JsonNode parsed;
        try {
            parsed = objectMapper.readTree(content);
        } catch (final JsonProcessingException e) {
            logger.debug("Failed to parse JSON in value, skipping nested key extraction: {}", e.getOriginalMessage());
            return;
        }
        collectKeysFromDocument(SecretValues.fromJson(parsed), keys, depth);
    }

    private void collectKeysFromYaml(final String content, final List<String> keys, final int depth) {
        logger.debug("Detected potential YAML in value, attempting to parse");
        final Object parsed;
        try {
            // Yaml instances are not thread-safe
            parsed = new Yaml(new SafeConstructor(new LoaderOptions())).load(content);
        } catch (final YAMLException e) {
            logger.debug("Failed to parse YAML in value, skipping nested key extraction: {}", e.getMessage());
            return;
        }
        collectKeysFromDocument(SecretValues.fromObject(parsed), keys, depth);
    }

    /**
     * An embedded document contributes keys only when it is a map or a list of maps.
     */
    private void collectKeysFromDocument(final SecretValue document, final List<String> keys, final int depth) {
        if (document instanceof SecretValue.MapValue map) {
            collectKeysFromMap(map, keys, depth);
        } else if (document instanceof SecretValue.ListValue list) {
            for (final SecretValue element : list.elements()) {
                if (element instanceof SecretValue.MapValue map) {
                    collectKeysFromMap(map, keys, depth);
                }
            }
        }
    }

    static boolean looksLikeJson(final String value) {
        final String trimmed = value.strip();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }

    static boolean looksLikeYaml(final String value) {
        return value.contains(":") && value.contains("\n");
    }

    /**
     * Lowercase path followed by every lowercase key, separated by single spaces.
     */
    public static String buildSearchString(final String secretPath, final List<String> keys) {
        final StringBuilder builder = new StringBuilder(secretPath.length() + keys.size() * 12);
        builder.append(secretPath.toLowerCase(Locale.ROOT));
        for (final String key : keys) {
            builder.append(' ').append(key.toLowerCase(Locale.ROOT));
        }
        return builder.toString();
    }
}
