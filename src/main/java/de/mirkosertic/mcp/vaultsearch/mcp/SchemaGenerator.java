package de.mirkosertic.mcp.vaultsearch.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives MCP tool input schemas from request records.
 * <p>
 * Every component becomes a property; components not annotated with {@link Nullable} are required.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            properties.put(component.getName(), propertySchema(component));
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * Schema for tools without arguments.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    // @Nullable is a type-use annotation, so it sits on the component's type
    private static boolean isNullable(final RecordComponent component) {
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class)
                || component.isAnnotationPresent(Nullable.class);
    }

    private static Map<String, Object> propertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }

        final Type type = component.getGenericType();
        if (type instanceof Class<?> clazz) {
            addTypeSchema(schema, clazz);
        } else if (type instanceof ParameterizedType paramType
                && paramType.getRawType() instanceof Class<?> rawClass
                && List.class.isAssignableFrom(rawClass)) {
            schema.put("type", "array");
            final Map<String, Object> items = new LinkedHashMap<>();
            final Type[] typeArgs = paramType.getActualTypeArguments();
            if (typeArgs.length > 0 && typeArgs[0] instanceof Class<?> itemClass) {
                addTypeSchema(items, itemClass);
            } else {
                items.put("type", "string");
            }
            schema.put("items", items);
        } else {
            schema.put("type", "string");
        }
        return schema;
    }

    private static void addTypeSchema(final Map<String, Object> schema, final Class<?> clazz) {
        if (clazz == Boolean.class || clazz == boolean.class) {
            schema.put("type", "boolean");
        } else if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            schema.put("type", "integer");
        } else if (clazz.isEnum()) {
            // Enum arguments are passed in lower case
            schema.put("type", "string");
            final List<String> values = new ArrayList<>();
            for (final Object constant : clazz.getEnumConstants()) {
                values.add(((Enum<?>) constant).name().toLowerCase(Locale.ROOT));
            }
            schema.put("enum", values);
        } else {
            schema.put("type", "string");
        }
    }
}
