package de.mirkosertic.mcp.ruleengine.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives tool input schemas from request records. Components annotated with {@link Nullable}
 * are optional, all others required; {@link ToolParam} supplies descriptions and numeric bounds.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> requestClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();
        for (final RecordComponent component : requestClass.getRecordComponents()) {
            final Map<String, Object> property = typeSchema(component.getGenericType());
            final ToolParam param = component.getAnnotation(ToolParam.class);
            if (param != null) {
                property.put("description", param.value());
                if (!Double.isNaN(param.minimum())) {
                    property.put("minimum", bound(param.minimum()));
                }
                if (!Double.isNaN(param.maximum())) {
                    property.put("maximum", bound(param.maximum()));
                }
            }
            properties.put(component.getName(), property);
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }
        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    // whole numbers are written as integers, e.g. "maximum": 50
    private static Number bound(final double value) {
        if (value == Math.rint(value)) {
            return (long) value;
        }
        return value;
    }

    // JSpecify's @Nullable is a type-use annotation, so it sits on the annotated type
    private static boolean isNullable(final RecordComponent component) {
        return component.isAnnotationPresent(Nullable.class)
                || component.getAnnotatedType().isAnnotationPresent(Nullable.class);
    }

    static Map<String, Object> typeSchema(final Type type) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> raw) {
            if (Collection.class.isAssignableFrom(raw)) {
                schema.put("type", "array");
                schema.put("items", typeSchema(parameterized.getActualTypeArguments()[0]));
            } else {
                schema.put("type", "object");
                schema.put("additionalProperties", true);
            }
            return schema;
        }
        if (!(type instanceof Class<?> clazz)) {
            schema.put("type", "string");
            return schema;
        }
        if (clazz == String.class) {
            schema.put("type", "string");
        } else if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            schema.put("type", "integer");
        } else if (clazz == Double.class || clazz == double.class || clazz == Float.class || clazz == float.class) {
            schema.put("type", "number");
        } else if (clazz == Boolean.class || clazz == boolean.class) {
            schema.put("type", "boolean");
        } else if (clazz.isEnum()) {
            schema.put("type", "string");
            final List<String> values = new ArrayList<>();
            for (final Object constant : clazz.getEnumConstants()) {
                values.add(((Enum<?>) constant).name());
            }
            schema.put("enum", values);
        } else {
            schema.put("type", "object");
        }
        return schema;
    }
}
