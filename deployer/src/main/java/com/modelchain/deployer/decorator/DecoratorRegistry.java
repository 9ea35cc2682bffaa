package com.modelchain.deployer.decorator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process decorator registry.
 *
 * All {@link DecoratorFactory} beans declared as Spring {@code @Component}s
 * are collected at startup via constructor injection. The map is fixed after
 * construction: configuration can only pick among these names, it cannot
 * load code.
 */
@Component
public class DecoratorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DecoratorRegistry.class);

    private final Map<String, DecoratorFactory> factories;

    /**
     * Spring collects every {@code DecoratorFactory} bean and passes the list here.
     * Adding a new decorator only requires declaring its factory as {@code @Component}.
     */
    public DecoratorRegistry(List<DecoratorFactory> allFactories) {
        Map<String, DecoratorFactory> byName = new HashMap<>();
        for (DecoratorFactory factory : allFactories) {
            DecoratorFactory previous = byName.putIfAbsent(factory.name(), factory);
            if (previous != null) {
                throw new IllegalStateException("Decorator name '" + factory.name()
                        + "' is registered twice: " + previous.getClass().getName()
                        + " and " + factory.getClass().getName());
            }
            log.info("Registered decorator '{}' ({})", factory.name(), factory.getClass().getSimpleName());
        }
        this.factories = Collections.unmodifiableMap(byName);
    }

    public DecoratorFactory get(String name) {
        DecoratorFactory factory = name == null ? null : factories.get(name);
        if (factory == null) {
            throw new DecoratorNotFoundException(name);
        }
        return factory;
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    /** Returns all registered decorator names (sorted). */
    public List<String> names() {
        return factories.keySet().stream().sorted().toList();
    }
}
