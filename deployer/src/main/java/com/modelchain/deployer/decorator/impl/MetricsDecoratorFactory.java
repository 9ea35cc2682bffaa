package com.modelchain.deployer.decorator.impl;

import com.modelchain.deployer.decorator.DecoratorFactory;
import com.modelchain.deployer.decorator.MLModelDecorator;
import com.modelchain.deployer.model.MLModel;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class MetricsDecoratorFactory implements DecoratorFactory {

    private final MeterRegistry meterRegistry;

    public MetricsDecoratorFactory(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String name() { return "metrics"; }

    @Override
    public MLModelDecorator create(MLModel model, Map<String, Object> configuration) {
        return new MetricsDecorator(model, configuration, meterRegistry);
    }
}
