package com.modelchain.deployer.models;

import com.modelchain.deployer.model.MLModel;
import com.modelchain.deployer.schema.Contract;
import com.modelchain.deployer.schema.FieldDescriptor;
import com.modelchain.deployer.schema.FieldType;
import com.modelchain.deployer.schema.Payload;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Example base model: predicts an iris species from four flower measurements
 * using the textbook two-split decision tree on petal size.
 */
@Component
public class IrisModel implements MLModel {

    public enum Species {
        IRIS_SETOSA("Iris setosa"),
        IRIS_VERSICOLOR("Iris versicolor"),
        IRIS_VIRGINICA("Iris virginica");

        private final String label;

        Species(String label) { this.label = label; }

        @Override
        public String toString() { return label; }
    }

    private static final Contract INPUT = Contract.builder("ModelInput")
            .field("sepal_length", measurement(5.0, 8.0))
            .field("sepal_width",  measurement(2.0, 6.0))
            .field("petal_length", measurement(1.0, 6.8))
            .field("petal_width",  measurement(0.0, 3.0))
            .build();

    private static final Contract OUTPUT = Contract.builder("ModelOutput")
            .field("species", FieldDescriptor.required(FieldType.STRING)
                    .withConstraint("enum", List.of(
                            Species.IRIS_SETOSA.toString(),
                            Species.IRIS_VERSICOLOR.toString(),
                            Species.IRIS_VIRGINICA.toString())))
            .build();

    @Override public String   displayName()    { return "Iris Model"; }
    @Override public String   qualifiedName()  { return "iris_model"; }
    @Override public String   version()        { return "1.0.0"; }
    @Override public Contract inputContract()  { return INPUT; }
    @Override public Contract outputContract() { return OUTPUT; }

    @Override
    public String description() {
        return "A model to predict the species of a flower based on its measurements.";
    }

    @Override
    public Payload predict(Payload input) {
        double petalLength = input.getDouble("petal_length");
        double petalWidth  = input.getDouble("petal_width");

        Species species;
        if (petalLength < 2.45) {
            species = Species.IRIS_SETOSA;
        } else if (petalWidth < 1.75) {
            species = Species.IRIS_VERSICOLOR;
        } else {
            species = Species.IRIS_VIRGINICA;
        }
        return OUTPUT.instantiate(Map.of("species", species));
    }

    // Bounds are exclusive, as JSON Schema's exclusiveMinimum/exclusiveMaximum.
    private static FieldDescriptor measurement(double above, double below) {
        return FieldDescriptor.required(FieldType.NUMBER)
                .withConstraint("exclusiveMinimum", above)
                .withConstraint("exclusiveMaximum", below);
    }
}
