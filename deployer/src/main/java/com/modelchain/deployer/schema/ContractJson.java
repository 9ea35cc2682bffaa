package com.modelchain.deployer.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON view of contracts and payloads, for whatever transport hosts a model.
 *
 * {@link #toJsonSchema} describes request/response bodies; {@link #readPayload}
 * and {@link #writePayload} move payloads on and off the wire. Constraints and
 * metadata are copied into the schema verbatim, so a constraint named
 * {@code minimum} renders as the JSON Schema keyword of the same name.
 */
@Component
public class ContractJson {

    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {};

    private final ObjectMapper json;

    public ContractJson(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    /**
     * Render a contract as a JSON Schema object:
     * <pre>
     *   { "title": name, "type": "object",
     *     "properties": { field: { "type", "default", ...constraints, ...metadata } },
     *     "required": [ ... ] }
     * </pre>
     */
    public ObjectNode toJsonSchema(Contract contract) {
        ObjectNode schema = json.createObjectNode();
        schema.put("title", contract.name());
        schema.put("type", "object");

        ObjectNode properties = schema.putObject("properties");
        ArrayNode  required   = json.createArrayNode();

        contract.fields().forEach((fieldName, descriptor) -> {
            ObjectNode property = properties.putObject(fieldName);
            if (descriptor.type().jsonType() != null) {
                property.put("type", descriptor.type().jsonType());
            }
            if (descriptor.defaultValue() != null) {
                property.set("default", json.valueToTree(descriptor.defaultValue()));
            }
            descriptor.constraints().forEach((k, v) -> property.set(k, json.valueToTree(v)));
            descriptor.metadata().forEach((k, v) -> property.set(k, json.valueToTree(v)));
            if (descriptor.required()) {
                required.add(fieldName);
            }
        });

        if (!required.isEmpty()) {
            schema.set("required", required);
        }
        return schema;
    }

    /**
     * Parse a JSON object body and instantiate it against {@code contract}.
     *
     * @throws ContractViolationException if the body is not a JSON object or
     *         does not satisfy the contract
     */
    public Payload readPayload(Contract contract, String body) {
        Map<String, Object> values;
        try {
            values = json.readValue(body, BODY_TYPE);
        } catch (JsonProcessingException e) {
            throw new ContractViolationException(
                    "Body is not a JSON object for contract '" + contract.name() + "'", e);
        }
        if (values == null) {
            throw new ContractViolationException(
                    "Body is not a JSON object for contract '" + contract.name() + "'", null);
        }
        return contract.instantiate(values);
    }

    /** Serialize payload values as a JSON object, in contract field order. */
    public String writePayload(Payload payload) {
        try {
            return json.writeValueAsString(payload.values());
        } catch (JsonProcessingException e) {
            throw new ContractViolationException(
                    "Failed to serialize payload of contract '" + payload.contract().name() + "'", e);
        }
    }
}
