package de.mirkosertic.mcp.vaultsearch.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts parser output (Jackson trees and SnakeYAML object graphs) into {@link SecretValue}s.
 */
public final class SecretValues {

    private SecretValues() {
    }

    public static SecretValue fromJson(final @Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return SecretValue.Null.INSTANCE;
        }
        if (node.isObject()) {
            final Map<String, SecretValue> entries = new LinkedHashMap<>();
            for (final Map.Entry<String, JsonNode> field : node.properties()) {
                entries.put(field.getKey(), fromJson(field.getValue()));
            }
            return new SecretValue.MapValue(entries);
        }
        if (node.isArray()) {
            final List<SecretValue> elements = new ArrayList<>(node.size());
            for (final JsonNode element : node) {
                elements.add(fromJson(element));
            }
            return new SecretValue.ListValue(elements);
        }
        if (node.isBoolean()) {
            return new SecretValue.Bool(node.booleanValue());
        }
        if (node.isNumber()) {
            return new SecretValue.Numeric(node.numberValue());
        }
        return new SecretValue.Text(node.asText());
    }

    /**
     * Converts a plain Java object graph as produced by SnakeYAML. Map keys that are
     * not strings (YAML allows integer or boolean keys) are converted with {@link String#valueOf(Object)}.
     */
    public static SecretValue fromObject(final @Nullable Object value) {
        if (value == null) {
            return SecretValue.Null.INSTANCE;
        }
        if (value instanceof Map<?, ?> map) {
            final Map<String, SecretValue> entries = new LinkedHashMap<>();
            for (final Map.Entry<?, ?> entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), fromObject(entry.getValue()));
            }
            return new SecretValue.MapValue(entries);
        }
        if (value instanceof List<?> list) {
            final List<SecretValue> elements = new ArrayList<>(list.size());
            for (final Object element : list) {
                elements.add(fromObject(element));
            }
            return new SecretValue.ListValue(elements);
        }
        if (value instanceof Boolean bool) {
            return new SecretValue.Bool(bool);
        }
        if (value instanceof java.lang.Number number) {
            return new SecretValue.Numeric(number);
        }
        return new SecretValue.Text(value.toString());
    }
}
