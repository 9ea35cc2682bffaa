package com.modelchain.deployer.decorator.impl;

import com.modelchain.deployer.decorator.DecoratorException;
import com.modelchain.deployer.decorator.MLModelDecorator;
import com.modelchain.deployer.model.MLModel;
import com.modelchain.deployer.schema.Contract;
import com.modelchain.deployer.schema.FieldDescriptor;
import com.modelchain.deployer.schema.FieldType;
import com.modelchain.deployer.schema.Payload;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Gives every prediction a unique identifier.
 *
 * The input contract gains an optional string field (default
 * {@code prediction_id}, configurable with {@code field}); the output
 * contract gains the same field as required. A caller-supplied identifier is
 * echoed back verbatim, otherwise a random UUID is generated, so feeding a
 * returned identifier back in never produces a new one.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code field} — name of the identifier field (default "prediction_id")</li>
 * </ul>
 */
public class PredictionIdDecorator extends MLModelDecorator {

    public static final String DEFAULT_FIELD = "prediction_id";

    private final String field;

    public PredictionIdDecorator(MLModel model) {
        this(model, Map.of());
    }

    public PredictionIdDecorator(MLModel model, Map<String, ?> configuration) {
        super(model, configuration);
        this.field = configValue("field", DEFAULT_FIELD);
        if (field.isBlank()) {
            throw DecoratorException.badSetting(PredictionIdDecorator.class, "field", field,
                    "identifier field name must not be blank");
        }
    }

    /** Name of the identifier field this decorator adds. */
    public String field() { return field; }

    @Override
    public String description() {
        return model().description()
                + " This model also has an optional input called '" + field + "' that accepts"
                + " a UUID string to uniquely identify the prediction returned. If the prediction"
                + " id is not provided, a UUID is generated and returned in a field called '"
                + field + "' in the model output.";
    }

    @Override
    public Contract inputContract() {
        return model().inputContract().extend(Map.of(field,
                FieldDescriptor.optional(FieldType.STRING)
                        .describedAs("Identifier to attach to this prediction")));
    }

    @Override
    public Contract outputContract() {
        return model().outputContract().extend(Map.of(field,
                FieldDescriptor.required(FieldType.STRING)
                        .describedAs("Identifier of this prediction")));
    }

    @Override
    public Payload predict(Payload input) {
        Object supplied = input.values().get(field);

        // A failing model propagates before any identifier is drawn.
        Payload prediction = model().predict(input);

        String predictionId = supplied != null ? supplied.toString() : UUID.randomUUID().toString();
        Map<String, Object> values = new LinkedHashMap<>(prediction.values());
        values.put(field, predictionId);
        return outputContract().instantiate(values);
    }
}
