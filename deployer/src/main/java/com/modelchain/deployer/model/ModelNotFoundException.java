package com.modelchain.deployer.model;

public class ModelNotFoundException extends RuntimeException {
    public ModelNotFoundException(String qualifiedName) {
        super("No model registered with qualified name: '" + qualifiedName + "'");
    }
}
