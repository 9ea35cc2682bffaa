package com.modelchain.deployer.decorator;

/**
 * A model chain that cannot be assembled or served as wired.
 *
 * The kind says which link of the chain is at fault; the message always
 * starts with it in brackets so it survives being wrapped by the context
 * that aborted startup.
 */
public class DecoratorException extends RuntimeException {

    public enum Kind {
        /** The component handed to a decorator is missing, is the decorator itself, or has an incomplete surface. */
        INVALID_WRAPPED_COMPONENT,
        /** A decorator created without a model was asked to forward before {@code bind}. */
        UNBOUND_DECORATOR,
        /** A decorator rejected its settings, was bound twice, or its factory did not wrap the chain. */
        CONSTRUCTION_FAILURE
    }

    private final Kind kind;

    public DecoratorException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public DecoratorException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    /** A configuration entry that the decorator cannot work with. */
    public static DecoratorException badSetting(Class<? extends MLModelDecorator> decorator,
                                                String key, Object value, String problem) {
        return new DecoratorException(Kind.CONSTRUCTION_FAILURE,
                decorator.getSimpleName() + " setting '" + key + "' = '" + value + "': " + problem);
    }

    public Kind getKind() { return kind; }
}
