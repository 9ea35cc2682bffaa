package com.modelchain.deployer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process catalog of base models.
 *
 * All {@link MLModel} beans declared as Spring {@code @Component}s are
 * collected at startup via constructor injection. Adding a model to the
 * service only requires declaring it as {@code @Component}; whether it is
 * decorated is decided by configuration (see
 * {@link com.modelchain.deployer.chain.ChainProperties}).
 */
@Component
public class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    private final Map<String, MLModel> models;

    public ModelCatalog(List<MLModel> allModels) {
        Map<String, MLModel> byName = new LinkedHashMap<>();
        for (MLModel model : allModels) {
            MLModel previous = byName.putIfAbsent(model.qualifiedName(), model);
            if (previous != null) {
                throw new IllegalStateException("Two models share the qualified name '"
                        + model.qualifiedName() + "': " + previous.getClass().getName()
                        + " and " + model.getClass().getName());
            }
            log.info("Registered model '{}' v{} ({})",
                    model.qualifiedName(), model.version(), model.displayName());
        }
        this.models = Collections.unmodifiableMap(byName);
    }

    public MLModel get(String qualifiedName) {
        MLModel model = models.get(qualifiedName);
        if (model == null) {
            throw new ModelNotFoundException(qualifiedName);
        }
        return model;
    }

    /** Returns all registered qualified names (sorted). */
    public List<String> modelNames() {
        return models.keySet().stream().sorted().toList();
    }

    /** Models in registration order. */
    public List<MLModel> all() {
        return List.copyOf(models.values());
    }
}
