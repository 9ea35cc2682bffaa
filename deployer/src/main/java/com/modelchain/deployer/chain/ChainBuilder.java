package com.modelchain.deployer.chain;

import com.modelchain.deployer.decorator.DecoratorException;
import com.modelchain.deployer.decorator.DecoratorFactory;
import com.modelchain.deployer.decorator.DecoratorRegistry;
import com.modelchain.deployer.decorator.MLModelDecorator;
import com.modelchain.deployer.model.MLModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Nests decorators around a base model.
 *
 * Specs are applied in order, so the last one listed ends up outermost and
 * sees client calls first: [A, B, C] builds C(B(A(base))).
 *
 * <p>Holds no state besides the registry; every call builds a fresh,
 * independent chain.
 */
@Component
public class ChainBuilder {

    private static final Logger log = LoggerFactory.getLogger(ChainBuilder.class);

    private final DecoratorRegistry registry;

    public ChainBuilder(DecoratorRegistry registry) {
        this.registry = registry;
    }

    /**
     * Build the chain and return its outermost layer ({@code base} itself if
     * {@code specs} is empty).
     *
     * @throws com.modelchain.deployer.decorator.DecoratorNotFoundException
     *         if a spec names an unregistered decorator
     * @throws DecoratorException CONSTRUCTION_FAILURE if a factory rejects its
     *         input or returns something other than a decorator of the current chain
     */
    public MLModel build(MLModel base, List<DecoratorSpec> specs) {
        Objects.requireNonNull(base, "base");

        // Resolve everything up front so an unknown name fails before any construction.
        List<DecoratorFactory> factories = specs.stream()
                .map(spec -> registry.get(spec.reference()))
                .toList();

        MLModel current = base;
        for (int i = 0; i < specs.size(); i++) {
            DecoratorSpec    spec    = specs.get(i);
            DecoratorFactory factory = factories.get(i);

            MLModelDecorator decorator;
            try {
                decorator = factory.create(current, spec.configuration());
            } catch (RuntimeException e) {
                throw new DecoratorException(DecoratorException.Kind.CONSTRUCTION_FAILURE,
                        "Decorator '" + spec.reference() + "' (layer " + (i + 1) + ") around '"
                        + base.qualifiedName() + "' failed: " + e.getMessage(), e);
            }
            if (decorator == null || !decorator.isBound() || decorator.unwrap() != current) {
                throw new DecoratorException(DecoratorException.Kind.CONSTRUCTION_FAILURE,
                        "Decorator '" + spec.reference() + "' did not wrap the chain it was given");
            }

            log.debug("Wrapped '{}' with '{}' (layer {})", base.qualifiedName(), spec.reference(), i + 1);
            current = decorator;
        }
        return current;
    }
}
