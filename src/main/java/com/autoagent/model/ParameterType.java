package com.autoagent.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The closed set of parameter kinds an {@link Operation} may declare.
 * <p>
 * Each kind owns the conversion from a raw invocation value (typically a string typed at the
 * shell or a value read from JSON) to the Java type the operation handler receives:
 * <ul>
 *   <li>{@link #STRING} to {@link String}</li>
 *   <li>{@link #INTEGER} to {@link Long}</li>
 *   <li>{@link #FLOAT} to {@link Double}</li>
 *   <li>{@link #BOOLEAN} to {@link Boolean}</li>
 *   <li>{@link #STRING_LIST} to an unmodifiable {@code List<String>}</li>
 *   <li>{@link #MAP} to an unmodifiable {@code Map<String, Object>}</li>
 * </ul>
 */
public enum ParameterType {

    STRING("string") {
        @Override
        public Object coerce(Object raw) {
            if (raw instanceof CharSequence || raw instanceof Number || raw instanceof Boolean || raw instanceof Character) {
                return raw.toString();
            }
            throw mismatch(raw);
        }
    },

    INTEGER("integer") {
        @Override
        public Object coerce(Object raw) {
            if (raw instanceof Long value) {
                return value;
            }
            if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
                return ((Number) raw).longValue();
            }
            try {
                if (raw instanceof Number number) {
                    return new BigDecimal(number.toString()).longValueExact();
                }
                if (raw instanceof CharSequence text) {
                    return Long.parseLong(text.toString().trim());
                }
            } catch (NumberFormatException | ArithmeticException e) {
                throw mismatch(raw);
            }
            throw mismatch(raw);
        }
    },

    FLOAT("float") {
        @Override
        public Object coerce(Object raw) {
            if (raw instanceof Number number) {
                return number.doubleValue();
            }
            if (raw instanceof CharSequence text) {
                try {
                    double value = Double.parseDouble(text.toString().trim());
                    if (!Double.isNaN(value) && !Double.isInfinite(value)) {
                        return value;
                    }
                } catch (NumberFormatException e) {
                    throw mismatch(raw);
                }
            }
            throw mismatch(raw);
        }
    },

    BOOLEAN("boolean") {
        @Override
        public Object coerce(Object raw) {
            if (raw instanceof Boolean value) {
                return value;
            }
            if (raw instanceof CharSequence text) {
                switch (text.toString().trim().toLowerCase(Locale.ROOT)) {
                    case "true", "yes", "y", "1":
                        return Boolean.TRUE;
                    case "false", "no", "n", "0":
                        return Boolean.FALSE;
                    default:
                        throw mismatch(raw);
                }
            }
            throw mismatch(raw);
        }
    },

    STRING_LIST("list of strings") {
        @Override
        public Object coerce(Object raw) {
            if (raw instanceof CharSequence text) {
                // Comma-separated input, as typed at the shell.
                if (text.toString().isBlank()) {
                    return List.of();
                }
                return Arrays.stream(text.toString().split(","))
                        .map(String::trim)
                        .toList();
            }
            if (raw instanceof Collection<?> items) {
                List<String> values = new ArrayList<>(items.size());
                for (Object item : items) {
                    if (item == null) {
                        throw mismatch(raw);
                    }
                    values.add((String) STRING.coerce(item));
                }
                return List.copyOf(values);
            }
            throw mismatch(raw);
        }
    },

    MAP("map") {
        @Override
        public Object coerce(Object raw) {
            if (raw instanceof Map<?, ?> map) {
                Map<String, Object> copy = new LinkedHashMap<>();
                map.forEach((key, value) -> copy.put(String.valueOf(key), value));
                return Collections.unmodifiableMap(copy);
            }
            if (raw instanceof CharSequence text) {
                try {
                    Map<String, Object> parsed = JSON.readValue(text.toString(), new TypeReference<LinkedHashMap<String, Object>>() {});
                    if (parsed == null) {
                        throw mismatch(raw);
                    }
                    return Collections.unmodifiableMap(parsed);
                } catch (JsonProcessingException e) {
                    throw mismatch(raw);
                }
            }
            throw mismatch(raw);
        }
    };

    private static final ObjectMapper JSON = new ObjectMapper();

    private final String displayName;

    ParameterType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Converts a raw invocation value to this kind's Java representation.
     *
     * @param raw The value as supplied by the caller, never {@code null}.
     * @return The converted value.
     * @throws IllegalArgumentException if the value cannot be represented as this kind.
     */
    public abstract Object coerce(Object raw);

    /**
     * @return the name used in validation messages, e.g. {@code "integer"}.
     */
    public String getDisplayName() {
        return displayName;
    }

    IllegalArgumentException mismatch(Object raw) {
        String kind = raw == null ? "null" : raw.getClass().getSimpleName();
        return new IllegalArgumentException("Cannot convert " + kind + " value to " + displayName);
    }
}
