package com.modelchain.deployer.decorator;

public class DecoratorNotFoundException extends RuntimeException {
    public DecoratorNotFoundException(String name) {
        super("No decorator registered with name: '" + name + "'");
    }
}
