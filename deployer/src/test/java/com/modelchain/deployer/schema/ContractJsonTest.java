package com.modelchain.deployer.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContractJsonTest {

    private final ContractJson contractJson = new ContractJson(new ObjectMapper());

    private final Contract contract = Contract.builder("ModelInput")
            .field("petal_length", FieldDescriptor.required(FieldType.NUMBER)
                    .withConstraint("exclusiveMinimum", 1.0)
                    .describedAs("Petal length in cm"))
            .optional("prediction_id", FieldType.STRING, null)
            .optional("verbose", FieldType.BOOLEAN, false)
            .build();

    @Test
    void toJsonSchema_rendersTypesConstraintsAndRequired() {
        JsonNode schema = contractJson.toJsonSchema(contract);

        assertThat(schema.get("title").asText()).isEqualTo("ModelInput");
        assertThat(schema.get("type").asText()).isEqualTo("object");

        JsonNode petal = schema.get("properties").get("petal_length");
        assertThat(petal.get("type").asText()).isEqualTo("number");
        assertThat(petal.get("exclusiveMinimum").asDouble()).isEqualTo(1.0);
        assertThat(petal.get("description").asText()).isEqualTo("Petal length in cm");

        assertThat(schema.get("properties").get("verbose").get("default").asBoolean()).isFalse();
        assertThat(schema.get("properties").get("prediction_id").has("default")).isFalse();

        assertThat(schema.get("required").size()).isEqualTo(1);
        assertThat(schema.get("required").get(0).asText()).isEqualTo("petal_length");
    }

    @Test
    void toJsonSchema_keepsFieldOrder() {
        JsonNode properties = contractJson.toJsonSchema(contract).get("properties");

        assertThat(properties.fieldNames()).toIterable()
                .containsExactly("petal_length", "prediction_id", "verbose");
    }

    @Test
    void readPayload_validBody_instantiatesContract() {
        Payload payload = contractJson.readPayload(contract, """
                {"petal_length": 1.4, "prediction_id": "abc"}
                """);

        assertThat(payload.getDouble("petal_length")).isEqualTo(1.4);
        assertThat(payload.get("prediction_id")).isEqualTo("abc");
        assertThat(payload.get("verbose")).isEqualTo(false);
    }

    @Test
    void readPayload_malformedJson_throwsContractViolation() {
        assertThatThrownBy(() -> contractJson.readPayload(contract, "{not json"))
                .isInstanceOf(ContractViolationException.class)
                .hasMessageContaining("ModelInput");
    }

    @Test
    void readPayload_missingRequiredField_throwsContractViolation() {
        assertThatThrownBy(() -> contractJson.readPayload(contract, "{\"verbose\": true}"))
                .isInstanceOf(ContractViolationException.class)
                .hasMessageContaining("petal_length");
    }

    @Test
    void writePayload_writesValuesInContractOrder() {
        Payload payload = contract.instantiate(Map.of("petal_length", 2.5, "prediction_id", "p-1"));

        assertThat(contractJson.writePayload(payload))
                .isEqualTo("{\"petal_length\":2.5,\"prediction_id\":\"p-1\",\"verbose\":false}");
    }
}
