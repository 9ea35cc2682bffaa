package com.modelchain.deployer.chain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One layer of a chain declaration.
 *
 * @param reference     registered decorator name (see
 *                      {@link com.modelchain.deployer.decorator.DecoratorRegistry})
 * @param configuration handed to the decorator's factory verbatim; empty if omitted
 */
public record DecoratorSpec(String reference, Map<String, Object> configuration) {

    public DecoratorSpec {
        Objects.requireNonNull(reference, "reference");
        configuration = configuration == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
    }

    public static DecoratorSpec of(String reference) {
        return new DecoratorSpec(reference, Map.of());
    }
}
