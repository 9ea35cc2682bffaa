package com.modelchain.deployer.decorator;

import com.modelchain.deployer.model.MLModel;

import java.util.Map;

/**
 * Publishes one decorator type under a stable name that deployment
 * configuration can refer to.
 *
 * Factories are Spring {@code @Component}s collected by
 * {@link DecoratorRegistry}; only names registered this way can appear in a
 * chain, so configuration never selects arbitrary classes.
 */
public interface DecoratorFactory {

    /** Reference name used in configuration, e.g. "prediction_id". */
    String name();

    /**
     * Wrap {@code model} in a new, fully bound decorator.
     *
     * @param configuration the decorator's entry from the chain declaration,
     *                      passed through verbatim (never null)
     * @throws DecoratorException if the model or configuration is unusable
     */
    MLModelDecorator create(MLModel model, Map<String, Object> configuration);
}
