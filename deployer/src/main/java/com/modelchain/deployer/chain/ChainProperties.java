package com.modelchain.deployer.chain;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Chain declarations, bound from {@code modelchain.deployments}:
 * <pre>
 * modelchain:
 *   deployments:
 *     - model: iris_model
 *       decorators:
 *         - reference: logging
 *           configuration:
 *             level: DEBUG
 *         - reference: prediction_id
 * </pre>
 */
@ConfigurationProperties("modelchain")
public record ChainProperties(List<Deployment> deployments) {

    public ChainProperties {
        deployments = deployments == null ? List.of() : List.copyOf(deployments);
    }

    /**
     * @param model      qualified name of a base model in the catalog
     * @param decorators applied in order; the last entry is outermost
     */
    public record Deployment(String model, List<DecoratorSpec> decorators) {

        public Deployment {
            decorators = decorators == null ? List.of() : List.copyOf(decorators);
        }
    }
}
