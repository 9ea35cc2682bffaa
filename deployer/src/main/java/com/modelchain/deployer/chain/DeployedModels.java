package com.modelchain.deployer.chain;

import com.modelchain.deployer.model.MLModel;
import com.modelchain.deployer.model.ModelNotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The models this service serves, each one the outermost layer of its chain,
 * keyed by the base model's qualified name.
 *
 * Built once at startup by {@link ModelChainConfiguration} and read-only
 * afterwards; rewrapping means restarting with a new configuration.
 */
public final class DeployedModels {

    private final Map<String, MLModel> models;

    DeployedModels(Map<String, MLModel> models) {
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
    }

    public MLModel get(String qualifiedName) {
        MLModel model = models.get(qualifiedName);
        if (model == null) {
            throw new ModelNotFoundException(qualifiedName);
        }
        return model;
    }

    /** Returns all deployed names (sorted). */
    public List<String> names() {
        return models.keySet().stream().sorted().toList();
    }

    public Map<String, MLModel> all() {
        return models;
    }
}
