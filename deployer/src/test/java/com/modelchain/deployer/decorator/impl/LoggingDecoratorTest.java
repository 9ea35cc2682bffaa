package com.modelchain.deployer.decorator.impl;

import com.modelchain.deployer.decorator.DecoratorException;
import com.modelchain.deployer.model.DoublingModel;
import com.modelchain.deployer.schema.Payload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(OutputCaptureExtension.class)
class LoggingDecoratorTest {

    private final DoublingModel base = new DoublingModel();

    @Test
    void predict_returnsWrappedResultUnchanged() {
        LoggingDecorator decorator = new LoggingDecorator(base, Map.of("log-payloads", "true"));

        Payload input = DoublingModel.input(6);

        assertThat(decorator.predict(input)).isEqualTo(base.predict(input));
        assertThat(decorator.outputContract()).isSameAs(base.outputContract());
        assertThat(decorator.description()).isEqualTo(base.description());
    }

    @Test
    void predict_logsBeforeAndAfterWithoutPayloadsByDefault(CapturedOutput output) {
        new LoggingDecorator(base, Map.of()).predict(DoublingModel.input(7));

        assertThat(output).contains("Executing before prediction of 'doubling_model'");
        assertThat(output).contains("Executing after prediction of 'doubling_model'");
        assertThat(output).doesNotContain("{a=7}").doesNotContain("{b=14}");
    }

    @Test
    void predict_logsPayloadValuesWhenEnabled(CapturedOutput output) {
        new LoggingDecorator(base, Map.of("log-payloads", "true")).predict(DoublingModel.input(8));

        assertThat(output).contains("Executing before prediction of 'doubling_model': {a=8}");
        assertThat(output).contains("Executing after prediction of 'doubling_model': {b=16}");
    }

    @Test
    void level_acceptsDebugAndTraceCaseInsensitively() {
        assertThat(new LoggingDecorator(base, Map.of("level", "debug")).predict(DoublingModel.input(1))
                .get("b")).isEqualTo(2L);
        assertThat(new LoggingDecorator(base, Map.of("level", "TRACE")).predict(DoublingModel.input(2))
                .get("b")).isEqualTo(4L);
    }

    @Test
    void level_unsupportedValue_isConstructionFailure() {
        assertThatThrownBy(() -> new LoggingDecorator(base, Map.of("level", "ERROR")))
                .isInstanceOf(DecoratorException.class)
                .hasMessageStartingWith("[CONSTRUCTION_FAILURE] LoggingDecorator setting 'level' = 'ERROR'")
                .extracting("kind").isEqualTo(DecoratorException.Kind.CONSTRUCTION_FAILURE);
        assertThatThrownBy(() -> new LoggingDecorator(base, Map.of("level", "LOUD")))
                .isInstanceOf(DecoratorException.class)
                .hasMessageContaining("LOUD");
    }

    @Test
    void predict_failureIsLoggedAndRethrownUnchanged(CapturedOutput output) {
        IllegalStateException failure = new IllegalStateException("boom");
        DoublingModel failing = new DoublingModel() {
            @Override public String  qualifiedName()        { return "failing_model"; }
            @Override public Payload predict(Payload input) { throw failure; }
        };

        LoggingDecorator decorator = new LoggingDecorator(failing, Map.of());

        assertThatThrownBy(() -> decorator.predict(DoublingModel.input(1))).isSameAs(failure);
        assertThat(output).contains("WARN").contains("Prediction of 'failing_model' failed: boom");
        assertThat(output).contains("Executing before prediction of 'failing_model'")
                .doesNotContain("Executing after prediction of 'failing_model'");
    }
}
