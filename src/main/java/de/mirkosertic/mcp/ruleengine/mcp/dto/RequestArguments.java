package de.mirkosertic.mcp.ruleengine.mcp.dto;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed access to raw tool arguments. Numbers and booleans may arrive as JSON strings.
 */
final class RequestArguments {

    private RequestArguments() {
    }

    static @Nullable String string(final Map<String, Object> args, final String name) {
        final Object value = args.get(name);
        return value == null ? null : value.toString();
    }

    static @Nullable Double number(final Map<String, Object> args, final String name) {
        final Object value = args.get(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException("'" + name + "' is not a number: " + text, e);
            }
        }
        return null;
    }

    static @Nullable Integer integer(final Map<String, Object> args, final String name) {
        final Double value = number(args, name);
        return value == null ? null : value.intValue();
    }

    static @Nullable Boolean bool(final Map<String, Object> args, final String name) {
        final Object value = args.get(name);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text && !text.isBlank()) {
            return Boolean.parseBoolean(text.trim());
        }
        return null;
    }

    static @Nullable List<String> strings(final Map<String, Object> args, final String name) {
        final Object value = args.get(name);
        if (value instanceof List<?> list) {
            final List<String> result = new ArrayList<>(list.size());
            for (final Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        if (value instanceof String text && !text.isBlank()) {
            return List.of(text.split("\\s*,\\s*"));
        }
        return null;
    }
}
