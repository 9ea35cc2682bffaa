package com.modelchain.deployer.decorator.impl;

import com.modelchain.deployer.decorator.MLModelDecorator;
import com.modelchain.deployer.model.MLModel;
import com.modelchain.deployer.schema.Payload;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Map;

/**
 * Times and counts every prediction:
 * <pre>
 *   modelchain.model.predictions{model, status="success|error"}
 *   modelchain.model.duration{model}
 * </pre>
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code name} — value of the {@code model} tag (default: the wrapped
 *       model's qualified name, read when the decorator is built)</li>
 * </ul>
 */
public class MetricsDecorator extends MLModelDecorator {

    static final String CALLS_METRIC    = "modelchain.model.predictions";
    static final String DURATION_METRIC = "modelchain.model.duration";

    private final MeterRegistry meterRegistry;
    private final String        modelTag;

    public MetricsDecorator(MLModel model, Map<String, ?> configuration, MeterRegistry meterRegistry) {
        super(model, configuration);
        this.meterRegistry = meterRegistry;
        this.modelTag      = configValue("name", model.qualifiedName());
    }

    @Override
    public Payload predict(Payload input) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return model().predict(input);
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer(DURATION_METRIC, "model", modelTag));
            meterRegistry.counter(CALLS_METRIC, "model", modelTag, "status", status).increment();
        }
    }
}
