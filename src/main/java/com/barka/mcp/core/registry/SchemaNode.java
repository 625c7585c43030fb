package com.barka.mcp.core.registry;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Structural description of a tool argument. Object nodes are open: properties that are not
 * declared are accepted and left for the semantic layer to ignore.
 * <p>
 * Nodes are immutable; the {@code with*} methods return copies.
 */
public final class SchemaNode {

    public enum Type {
        STRING("string"),
        NUMBER("number"),
        INTEGER("integer"),
        BOOLEAN("boolean"),
        ARRAY("array"),
        OBJECT("object");

        private final String jsonType;

        Type(String jsonType) {
            this.jsonType = jsonType;
        }

        public String jsonType() {
            return jsonType;
        }
    }

    private static final Pattern OBJECT_ID = Pattern.compile("^[0-9a-fA-F]{24}$");

    private final Type type;
    private final String description;
    private final List<String> enumValues;
    private final Number minimum;
    private final Number maximum;
    private final Pattern pattern;
    private final boolean dateTime;
    private final boolean optional;
    private final SchemaNode items;
    private final Map<String, SchemaNode> properties;

    private SchemaNode(Type type, String description, List<String> enumValues, Number minimum, Number maximum,
                       Pattern pattern, boolean dateTime, boolean optional, SchemaNode items,
                       Map<String, SchemaNode> properties) {
        this.type = type;
        this.description = description;
        this.enumValues = enumValues;
        this.minimum = minimum;
        this.maximum = maximum;
        this.pattern = pattern;
        this.dateTime = dateTime;
        this.optional = optional;
        this.items = items;
        this.properties = properties;
    }

    private static SchemaNode of(Type type, String description) {
        return new SchemaNode(type, description, List.of(), null, null, null, false, true, null, Map.of());
    }

    public static SchemaNode string(String description) {
        return of(Type.STRING, description);
    }

    /** A 24 hex character store identifier. */
    public static SchemaNode id(String description) {
        return string(description).withPattern(OBJECT_ID);
    }

    public static SchemaNode dateTime(String description) {
        return new SchemaNode(Type.STRING, description, List.of(), null, null, null, true, true, null, Map.of());
    }

    public static SchemaNode enumOf(String description, String... values) {
        return new SchemaNode(Type.STRING, description, List.of(values), null, null, null, false, true, null, Map.of());
    }

    public static SchemaNode number(String description) {
        return of(Type.NUMBER, description);
    }

    public static SchemaNode integer(String description) {
        return of(Type.INTEGER, description);
    }

    public static SchemaNode bool(String description) {
        return of(Type.BOOLEAN, description);
    }

    public static SchemaNode arrayOf(SchemaNode items, String description) {
        return new SchemaNode(Type.ARRAY, description, List.of(), null, null, null, false, true, items, Map.of());
    }

    public static SchemaNode object(String description) {
        return of(Type.OBJECT, description);
    }

    public static SchemaNode object(String description, Map<String, SchemaNode> properties) {
        return new SchemaNode(Type.OBJECT, description, List.of(), null, null, null, false, true, null,
                Collections.unmodifiableMap(new LinkedHashMap<>(properties)));
    }

    public SchemaNode withRange(Number min, Number max) {
        return new SchemaNode(type, description, enumValues, min, max, pattern, dateTime, optional, items, properties);
    }

    public SchemaNode withMinimum(Number min) {
        return withRange(min, maximum);
    }

    public SchemaNode required() {
        return new SchemaNode(type, description, enumValues, minimum, maximum, pattern, dateTime, false, items, properties);
    }

    private SchemaNode withPattern(Pattern p) {
        return new SchemaNode(type, description, enumValues, minimum, maximum, p, dateTime, optional, items, properties);
    }

    public Type type() {
        return type;
    }

    public String description() {
        return description;
    }

    public List<String> enumValues() {
        return enumValues;
    }

    public boolean isOptional() {
        return optional;
    }

    public Map<String, SchemaNode> properties() {
        return properties;
    }

    public SchemaNode items() {
        return items;
    }

    /**
     * Checks {@code value} against this node and appends a {@code "path: reason"} entry for every
     * violation. Null values are treated as absent.
     */
    public void validate(String path, Object value, List<String> violations) {
        if (value == null) {
            return;
        }
        switch (type) {
            case STRING -> validateString(path, value, violations);
            case NUMBER, INTEGER -> validateNumber(path, value, violations);
            case BOOLEAN -> {
                if (!(value instanceof Boolean)) {
                    violations.add(mismatch(path, value));
                }
            }
            case ARRAY -> validateArray(path, value, violations);
            case OBJECT -> validateObject(path, value, violations);
        }
    }

    /** Validates a whole argument map, reporting unset required properties as well. */
    public List<String> validateArguments(Map<String, Object> arguments) {
        List<String> violations = new ArrayList<>();
        validateObject("", arguments, violations);
        return violations;
    }

    private void validateString(String path, Object value, List<String> violations) {
        if (!(value instanceof String s)) {
            violations.add(mismatch(path, value));
            return;
        }
        if (!enumValues.isEmpty() && !enumValues.contains(s)) {
            violations.add(path + ": must be one of " + String.join(", ", enumValues));
        }
        if (pattern != null && !pattern.matcher(s).matches()) {
            violations.add(path + ": invalid identifier format");
        }
        if (dateTime && !isDateTime(s)) {
            violations.add(path + ": must be an ISO-8601 date-time");
        }
    }

    private void validateNumber(String path, Object value, List<String> violations) {
        if (!(value instanceof Number n)) {
            violations.add(mismatch(path, value));
            return;
        }
        if (type == Type.INTEGER && !isIntegral(n)) {
            violations.add(path + ": expected integer");
            return;
        }
        double d = n.doubleValue();
        if (minimum != null && d < minimum.doubleValue()) {
            violations.add(path + ": must be >= " + minimum);
        }
        if (maximum != null && d > maximum.doubleValue()) {
            violations.add(path + ": must be <= " + maximum);
        }
    }

    private void validateArray(String path, Object value, List<String> violations) {
        if (!(value instanceof List<?> list)) {
            violations.add(mismatch(path, value));
            return;
        }
        if (items == null) {
            return;
        }
        for (int i = 0; i < list.size(); i++) {
            Object element = list.get(i);
            if (element == null) {
                violations.add(path + "[" + i + "]: must not be null");
            } else {
                items.validate(path + "[" + i + "]", element, violations);
            }
        }
    }

    private void validateObject(String path, Object value, List<String> violations) {
        if (!(value instanceof Map<?, ?> map)) {
            violations.add(mismatch(path, value));
            return;
        }
        for (Map.Entry<String, SchemaNode> e : properties.entrySet()) {
            String childPath = path.isEmpty() ? e.getKey() : path + "." + e.getKey();
            Object child = map.get(e.getKey());
            if (child == null) {
                if (!e.getValue().isOptional()) {
                    violations.add(childPath + ": is required");
                }
                continue;
            }
            e.getValue().validate(childPath, child, violations);
        }
    }

    private String mismatch(String path, Object value) {
        return path + ": expected " + type.jsonType() + " but got " + jsonTypeOf(value);
    }

    /**
     * Renders this node as a JSON Schema fragment, in a stable property order.
     */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type.jsonType());
        if (description != null) {
            m.put("description", description);
        }
        if (!enumValues.isEmpty()) {
            m.put("enum", enumValues);
        }
        if (pattern != null) {
            m.put("pattern", pattern.pattern());
        }
        if (dateTime) {
            m.put("format", "date-time");
        }
        if (minimum != null) {
            m.put("minimum", minimum);
        }
        if (maximum != null) {
            m.put("maximum", maximum);
        }
        if (items != null) {
            m.put("items", items.toJsonSchema());
        }
        if (type == Type.OBJECT && !properties.isEmpty()) {
            Map<String, Object> props = new LinkedHashMap<>();
            List<String> required = new ArrayList<>();
            for (Map.Entry<String, SchemaNode> e : properties.entrySet()) {
                props.put(e.getKey(), e.getValue().toJsonSchema());
                if (!e.getValue().isOptional()) {
                    required.add(e.getKey());
                }
            }
            m.put("properties", props);
            if (!required.isEmpty()) {
                m.put("required", required);
            }
            m.put("additionalProperties", true);
        }
        return m;
    }

    static String jsonTypeOf(Object value) {
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Number) return "number";
        if (value instanceof List<?>) return "array";
        if (value instanceof Map<?, ?>) return "object";
        return value.getClass().getSimpleName();
    }

    private static boolean isIntegral(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof BigInteger) {
            return true;
        }
        if (n instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().scale() <= 0;
        }
        double d = n.doubleValue();
        return !Double.isInfinite(d) && d == Math.rint(d);
    }

    private static boolean isDateTime(String s) {
        try {
            OffsetDateTime.parse(s);
            return true;
        } catch (DateTimeParseException e) {
            try {
                LocalDate.parse(s);
                return true;
            } catch (DateTimeParseException ignored) {
                return false;
            }
        }
    }
}
