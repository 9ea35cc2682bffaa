package com.modelchain.deployer.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Shape of one named field in a {@link Contract}.
 *
 * @param type         value type accepted by the field
 * @param required     true if every instance must carry a non-null value
 * @param defaultValue value used when an optional field is absent (may be null)
 * @param constraints  validation rules, e.g. {@code gt -> 5.0}. Opaque to this
 *                     package; carried through extension and JSON rendering as-is.
 * @param metadata     free-form annotations such as a human-readable description
 */
public record FieldDescriptor(
        FieldType           type,
        boolean             required,
        Object              defaultValue,
        Map<String, Object> constraints,
        Map<String, Object> metadata) {

    public FieldDescriptor {
        Objects.requireNonNull(type, "type");
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("A required field cannot declare a default value");
        }
        if (defaultValue != null && !type.accepts(defaultValue)) {
            throw new IllegalArgumentException(
                    "Default value " + defaultValue + " is not a valid " + type);
        }
        constraints = constraints == null ? Map.of() : unmodifiableCopy(constraints);
        metadata    = metadata    == null ? Map.of() : unmodifiableCopy(metadata);
    }

    public static FieldDescriptor required(FieldType type) {
        return new FieldDescriptor(type, true, null, Map.of(), Map.of());
    }

    /** Optional field whose absent value is null. */
    public static FieldDescriptor optional(FieldType type) {
        return new FieldDescriptor(type, false, null, Map.of(), Map.of());
    }

    public static FieldDescriptor optional(FieldType type, Object defaultValue) {
        return new FieldDescriptor(type, false, defaultValue, Map.of(), Map.of());
    }

    public FieldDescriptor withConstraint(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(constraints);
        copy.put(name, value);
        return new FieldDescriptor(type, required, defaultValue, copy, metadata);
    }

    public FieldDescriptor withMetadata(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(name, value);
        return new FieldDescriptor(type, required, defaultValue, constraints, copy);
    }

    /** Convenience for {@code withMetadata("description", text)}. */
    public FieldDescriptor describedAs(String text) {
        return withMetadata("description", text);
    }

    // Map.copyOf() would lose insertion order, which shows up in rendered schemas.
    private static Map<String, Object> unmodifiableCopy(Map<String, Object> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
