package com.modelchain.deployer.model;

import com.modelchain.deployer.schema.Contract;
import com.modelchain.deployer.schema.Payload;

/**
 * Everything a prediction-serving component exposes to its host.
 *
 * Base models implement this directly and are declared as Spring
 * {@code @Component}s so that {@link ModelCatalog} can find them. Decorators
 * implement it too (see
 * {@link com.modelchain.deployer.decorator.MLModelDecorator}), which is what
 * lets a built chain stand in for the model it wraps.
 *
 * <p>Implementations must be safe for concurrent {@link #predict} calls.
 */
public interface MLModel {

    /** Human-readable name, e.g. "Iris Model". */
    String displayName();

    /** Stable machine name used for lookup and configuration, e.g. "iris_model". */
    String qualifiedName();

    String description();

    String version();

    /** Contract every {@link #predict} input satisfies. */
    Contract inputContract();

    /** Contract every {@link #predict} result satisfies. */
    Contract outputContract();

    /**
     * Run one prediction.
     *
     * @param input instance of {@link #inputContract()}; it may carry extra
     *              fields added by outer decorators, which models ignore
     * @return instance of {@link #outputContract()}
     */
    Payload predict(Payload input);
}
