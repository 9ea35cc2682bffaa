package com.modelchain.deployer.schema;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Value type of a contract field.
 *
 * Each constant knows its JSON Schema type name (used by {@link ContractJson})
 * and which Java values conform to it (used by {@link Contract#instantiate}).
 */
public enum FieldType {
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object"),
    ANY(null);

    private final String jsonType;

    FieldType(String jsonType) {
        this.jsonType = jsonType;
    }

    /** JSON Schema "type" keyword, or null for {@link #ANY}. */
    public String jsonType() { return jsonType; }

    /** True if {@code value} is an acceptable non-null value for this type. */
    public boolean accepts(Object value) {
        return switch (this) {
            case STRING  -> value instanceof String || value instanceof Enum<?>;
            case INTEGER -> value instanceof Integer || value instanceof Long
                         || value instanceof Short   || value instanceof Byte
                         || value instanceof BigInteger;
            case NUMBER  -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case ARRAY   -> value instanceof List<?> || (value != null && value.getClass().isArray());
            case OBJECT  -> value instanceof Map<?, ?>;
            case ANY     -> true;
        };
    }
}
