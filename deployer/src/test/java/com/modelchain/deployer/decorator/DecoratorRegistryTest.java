package com.modelchain.deployer.decorator;

import com.modelchain.deployer.decorator.impl.LoggingDecoratorFactory;
import com.modelchain.deployer.decorator.impl.MetricsDecoratorFactory;
import com.modelchain.deployer.decorator.impl.PredictionIdDecorator;
import com.modelchain.deployer.decorator.impl.PredictionIdDecoratorFactory;
import com.modelchain.deployer.model.DoublingModel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for DecoratorRegistry.
 * No Spring context — all wiring is done manually.
 */
class DecoratorRegistryTest {

    DecoratorRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DecoratorRegistry(List.of(
                new PredictionIdDecoratorFactory(),
                new LoggingDecoratorFactory(),
                new MetricsDecoratorFactory(new SimpleMeterRegistry())));
    }

    @Test
    void registry_registersAllFactories() {
        assertThat(registry.names()).containsExactly("logging", "metrics", "prediction_id");
        assertThat(registry.contains("prediction_id")).isTrue();
    }

    @Test
    void get_knownName_returnsWorkingFactory() {
        MLModelDecorator decorator = registry.get("prediction_id")
                .create(new DoublingModel(), Map.of("field", "trace_id"));

        assertThat(decorator).isInstanceOf(PredictionIdDecorator.class);
        assertThat(decorator.outputContract().hasField("trace_id")).isTrue();
    }

    @Test
    void get_unknownName_throwsNotFoundException() {
        assertThatThrownBy(() -> registry.get("com.example.EvilDecorator"))
                .isInstanceOf(DecoratorNotFoundException.class)
                .hasMessageContaining("com.example.EvilDecorator");
    }

    @Test
    void get_nullName_throwsNotFoundException() {
        assertThatThrownBy(() -> registry.get(null))
                .isInstanceOf(DecoratorNotFoundException.class);
    }

    @Test
    void duplicateNames_areRejected() {
        assertThatThrownBy(() -> new DecoratorRegistry(List.of(
                new LoggingDecoratorFactory(), new LoggingDecoratorFactory())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("logging");
    }
}
