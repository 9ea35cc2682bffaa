package com.modelchain.deployer.decorator.impl;

import com.modelchain.deployer.decorator.DecoratorFactory;
import com.modelchain.deployer.decorator.MLModelDecorator;
import com.modelchain.deployer.model.MLModel;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class LoggingDecoratorFactory implements DecoratorFactory {

    @Override
    public String name() { return "logging"; }

    @Override
    public MLModelDecorator create(MLModel model, Map<String, Object> configuration) {
        return new LoggingDecorator(model, configuration);
    }
}
