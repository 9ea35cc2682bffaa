package com.modelchain.deployer.chain;

import com.modelchain.deployer.decorator.MLModelDecorator;
import com.modelchain.deployer.model.MLModel;
import com.modelchain.deployer.model.ModelCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assembles every deployment during context startup.
 *
 * Each catalog model is deployed exactly once: wrapped in its declared chain
 * if {@code modelchain.deployments} names it, as-is otherwise. Any failure
 * (unknown model, unknown decorator, rejected construction) propagates out
 * of the bean method and stops the application before it serves anything.
 */
@Configuration
@EnableConfigurationProperties(ChainProperties.class)
public class ModelChainConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ModelChainConfiguration.class);

    @Bean
    public DeployedModels deployedModels(ModelCatalog catalog,
                                         ChainBuilder chainBuilder,
                                         ChainProperties properties) {
        Map<String, List<DecoratorSpec>> chains = new LinkedHashMap<>();
        for (ChainProperties.Deployment deployment : properties.deployments()) {
            catalog.get(deployment.model());   // fail fast on unknown names
            if (chains.putIfAbsent(deployment.model(), deployment.decorators()) != null) {
                throw new IllegalStateException(
                        "Model '" + deployment.model() + "' is deployed more than once");
            }
        }

        Map<String, MLModel> deployed = new LinkedHashMap<>();
        for (MLModel base : catalog.all()) {
            List<DecoratorSpec> specs = chains.getOrDefault(base.qualifiedName(), List.of());
            MLModel outermost = chainBuilder.build(base, specs);
            deployed.put(base.qualifiedName(), outermost);

            log.info("Deployed model '{}' v{}: {}", base.qualifiedName(), outermost.version(),
                    describeLineage(outermost));
        }
        return new DeployedModels(deployed);
    }

    /** e.g. "IrisModel <- LoggingDecorator <- PredictionIdDecorator" */
    static String describeLineage(MLModel outermost) {
        return MLModelDecorator.lineage(outermost).stream()
                .map(m -> m.getClass().getSimpleName())
                .collect(Collectors.joining(" <- "));
    }
}
