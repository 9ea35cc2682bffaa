package com.modelchain.deployer.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One instance of a {@link Contract}: the body of a prediction request or
 * response. Created through {@link Contract#instantiate} (or {@link #of},
 * which instantiates an ad-hoc contract), so every payload satisfies the
 * contract it carries.
 */
public final class Payload {

    static final String UNTYPED_CONTRACT = "Untyped";

    private final Contract            contract;
    private final Map<String, Object> values;

    Payload(Contract contract, Map<String, Object> values) {
        this.contract = contract;
        this.values   = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Payload for a caller with no contract at hand: every key becomes an
     * optional field of type ANY, in iteration order.
     */
    public static Payload of(Map<String, ?> values) {
        Contract.Builder untyped = Contract.builder(UNTYPED_CONTRACT);
        for (String fieldName : values.keySet()) {
            untyped.field(fieldName, FieldDescriptor.optional(FieldType.ANY));
        }
        return untyped.build().instantiate(values);
    }

    public Contract contract() { return contract; }

    /** Field values in contract order; absent optional fields map to their default. */
    public Map<String, Object> values() { return values; }

    /** True if the contract declares the field and its value is non-null. */
    public boolean has(String fieldName) {
        return values.get(fieldName) != null;
    }

    public Object get(String fieldName) {
        if (!contract.hasField(fieldName)) {
            throw new IllegalArgumentException(
                    "Contract '" + contract.name() + "' has no field '" + fieldName + "'");
        }
        return values.get(fieldName);
    }

    public <T> T get(String fieldName, Class<T> type) {
        Object value = get(fieldName);
        if (value != null && !type.isInstance(value)) {
            throw new ContractViolationException(contract.name(), fieldName,
                    "value is " + value.getClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    /** Numeric field as a double, whichever Number subtype it was parsed into. */
    public double getDouble(String fieldName) {
        return get(fieldName, Number.class).doubleValue();
    }

    public long getLong(String fieldName) {
        return get(fieldName, Number.class).longValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Payload other)) return false;
        return contract.equals(other.contract) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contract, values);
    }

    @Override
    public String toString() {
        return contract.name() + values;
    }
}
