package com.modelchain.deployer.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Schema describing the shape of a model's input or output.
 *
 * A contract is a name plus an ordered mapping of field name to
 * {@link FieldDescriptor}. Instances are immutable: {@link #extend} and
 * friends always return a new contract and never touch this one.
 *
 * <p>Equality is structural over the field mapping (including order);
 * the name is a label and does not take part.
 */
public final class Contract {

    private final String                       name;
    private final Map<String, FieldDescriptor> fields;

    private Contract(String name, Map<String, FieldDescriptor> fields) {
        this.name   = Objects.requireNonNull(name, "name");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() { return name; }

    /** Ordered, unmodifiable view of all fields. */
    public Map<String, FieldDescriptor> fields() { return fields; }

    public Set<String> fieldNames() { return fields.keySet(); }

    public boolean hasField(String fieldName) { return fields.containsKey(fieldName); }

    public FieldDescriptor field(String fieldName) {
        FieldDescriptor descriptor = fields.get(fieldName);
        if (descriptor == null) {
            throw new IllegalArgumentException(
                    "Contract '" + name + "' has no field '" + fieldName + "'");
        }
        return descriptor;
    }

    // ------------------------------------------------------------------
    // Derivation
    // ------------------------------------------------------------------

    /**
     * Derive a contract holding every field of this one plus {@code additions}.
     *
     * On a name collision the addition wins and keeps the inherited field's
     * position; new fields are appended in the order given. The result keeps
     * this contract's name.
     */
    public Contract extend(Map<String, FieldDescriptor> additions) {
        return extend(additions, name);
    }

    /** As {@link #extend(Map)}, publishing the result under {@code newName}. */
    public Contract extend(Map<String, FieldDescriptor> additions, String newName) {
        Map<String, FieldDescriptor> merged = new LinkedHashMap<>(fields);
        additions.forEach((fieldName, descriptor) -> merged.put(fieldName,
                Objects.requireNonNull(descriptor, "descriptor for field '" + fieldName + "'")));
        return new Contract(newName, merged);
    }

    /**
     * As {@link #extend(Map)}, but refuses to replace an inherited field.
     *
     * @throws SchemaConflictException if any addition names an existing field
     */
    public Contract extendStrict(Map<String, FieldDescriptor> additions) {
        for (String fieldName : additions.keySet()) {
            if (fields.containsKey(fieldName)) {
                throw new SchemaConflictException(name, fieldName);
            }
        }
        return extend(additions, name);
    }

    /** Same fields under a different name. */
    public Contract renamed(String newName) {
        return new Contract(newName, fields);
    }

    // ------------------------------------------------------------------
    // Instantiation
    // ------------------------------------------------------------------

    /**
     * Build an instance of this contract from raw values.
     *
     * Absent optional fields take their default; values for undeclared
     * fields are dropped.
     *
     * @throws ContractViolationException if a required field is missing or
     *         a value does not conform to its field type
     */
    public Payload instantiate(Map<String, ?> values) {
        Map<String, Object> accepted = new LinkedHashMap<>();
        for (Map.Entry<String, FieldDescriptor> entry : fields.entrySet()) {
            String          fieldName  = entry.getKey();
            FieldDescriptor descriptor = entry.getValue();
            Object          value      = values.get(fieldName);

            if (value == null) {
                if (descriptor.required()) {
                    throw new ContractViolationException(name, fieldName, "required field is missing");
                }
                accepted.put(fieldName, descriptor.defaultValue());
                continue;
            }
            if (!descriptor.type().accepts(value)) {
                throw new ContractViolationException(name, fieldName,
                        "expected " + descriptor.type() + " but got " + value.getClass().getSimpleName());
            }
            accepted.put(fieldName, value instanceof Enum<?> e ? e.toString() : value);
        }
        return new Payload(this, accepted);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Contract other)) return false;
        // LinkedHashMap.equals ignores order, so compare key order explicitly.
        return fields.equals(other.fields)
                && fields.keySet().stream().toList().equals(other.fields.keySet().stream().toList());
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Contract[" + name + " " + fields.keySet() + "]";
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {

        private final String                       name;
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder field(String fieldName, FieldDescriptor descriptor) {
            if (fields.putIfAbsent(fieldName, Objects.requireNonNull(descriptor)) != null) {
                throw new SchemaConflictException(name, fieldName);
            }
            return this;
        }

        public Builder required(String fieldName, FieldType type) {
            return field(fieldName, FieldDescriptor.required(type));
        }

        public Builder optional(String fieldName, FieldType type, Object defaultValue) {
            return field(fieldName, FieldDescriptor.optional(type, defaultValue));
        }

        public Contract build() {
            return new Contract(name, fields);
        }
    }
}
