package com.modelchain.deployer.decorator;

import com.modelchain.deployer.model.MLModel;
import com.modelchain.deployer.schema.Contract;
import com.modelchain.deployer.schema.Payload;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * An {@link MLModel} that wraps exactly one other model.
 *
 * Every member of the surface forwards to the wrapped model, read at call
 * time, so overrides made by decorators further in remain visible outward.
 * Subclasses override only what they change; to extend rather than replace a
 * value they call the wrapped model again through {@link #model()}.
 *
 * <p>Construction is normally eager ({@link #MLModelDecorator(MLModel, Map)}).
 * The configuration-only constructor leaves the decorator unbound until
 * {@link #bind} is called once; any surface call before that fails with
 * {@link DecoratorException.Kind#UNBOUND_DECORATOR}.
 *
 * <p>The configuration map belongs to the decorator and is not forwarded.
 */
public class MLModelDecorator implements MLModel {

    private final Map<String, Object> configuration;

    // Written once by bind(); volatile so the two-phase path publishes safely.
    private volatile MLModel model;

    public MLModelDecorator(MLModel model) {
        this(model, Map.of());
    }

    public MLModelDecorator(MLModel model, Map<String, ?> configuration) {
        this(configuration);
        if (model == null) {
            throw new DecoratorException(DecoratorException.Kind.INVALID_WRAPPED_COMPONENT,
                    getClass().getSimpleName() + " was given no model to wrap");
        }
        bind(model);
    }

    /** Two-phase construction: call {@link #bind} before use. */
    public MLModelDecorator(Map<String, ?> configuration) {
        this.configuration = configuration == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
    }

    // ------------------------------------------------------------------
    // Binding
    // ------------------------------------------------------------------

    /**
     * Attach the wrapped model. Allowed once.
     *
     * @throws DecoratorException INVALID_WRAPPED_COMPONENT if {@code candidate}
     *         is null, already contains this decorator, or returns null for any
     *         surface property; CONSTRUCTION_FAILURE if already bound
     */
    public final synchronized void bind(MLModel candidate) {
        if (model != null) {
            throw new DecoratorException(DecoratorException.Kind.CONSTRUCTION_FAILURE,
                    getClass().getSimpleName() + " is already bound to '"
                    + model.qualifiedName() + "'");
        }
        validate(candidate);
        model = candidate;
    }

    public final boolean isBound() {
        return model != null;
    }

    private void validate(MLModel candidate) {
        if (candidate == null) {
            throw invalid("no model to wrap", null);
        }
        // Cycle check first: probing a cyclic chain would otherwise recurse.
        MLModel current = candidate;
        while (current != null) {
            if (current == this) {
                throw invalid("wrapping would make the chain contain itself", null);
            }
            current = current instanceof MLModelDecorator d ? d.model : null;
        }

        requireMember(candidate, "displayName",    MLModel::displayName);
        requireMember(candidate, "qualifiedName",  MLModel::qualifiedName);
        requireMember(candidate, "description",    MLModel::description);
        requireMember(candidate, "version",        MLModel::version);
        requireMember(candidate, "inputContract",  MLModel::inputContract);
        requireMember(candidate, "outputContract", MLModel::outputContract);
    }

    private void requireMember(MLModel candidate, String member, Function<MLModel, Object> read) {
        Object value;
        try {
            value = read.apply(candidate);
        } catch (RuntimeException e) {
            throw invalid(candidate.getClass().getName() + "." + member + "() failed", e);
        }
        if (value == null) {
            throw invalid(candidate.getClass().getName() + "." + member + "() returned null", null);
        }
    }

    private DecoratorException invalid(String problem, Throwable cause) {
        return new DecoratorException(DecoratorException.Kind.INVALID_WRAPPED_COMPONENT,
                "Cannot wrap with " + getClass().getSimpleName() + ": " + problem, cause);
    }

    // ------------------------------------------------------------------
    // Access for subclasses
    // ------------------------------------------------------------------

    /** The wrapped model. */
    protected final MLModel model() {
        MLModel bound = model;
        if (bound == null) {
            throw new DecoratorException(DecoratorException.Kind.UNBOUND_DECORATOR,
                    getClass().getSimpleName() + " was used before bind()");
        }
        return bound;
    }

    /** The directly wrapped model, which may itself be a decorator. */
    public MLModel unwrap() {
        return model();
    }

    public Map<String, Object> configuration() {
        return configuration;
    }

    /** String form of a configuration entry, or {@code defaultValue} if absent. */
    protected String configValue(String key, String defaultValue) {
        Object value = configuration.get(key);
        return value == null ? defaultValue : value.toString();
    }

    /** Accepts both Boolean values and the strings "true"/"false". */
    protected boolean configFlag(String key, boolean defaultValue) {
        Object value = configuration.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.toString().trim());
    }

    // ------------------------------------------------------------------
    // Forwarded surface
    // ------------------------------------------------------------------

    @Override public String   displayName()    { return model().displayName(); }
    @Override public String   qualifiedName()  { return model().qualifiedName(); }
    @Override public String   description()    { return model().description(); }
    @Override public String   version()        { return model().version(); }
    @Override public Contract inputContract()  { return model().inputContract(); }
    @Override public Contract outputContract() { return model().outputContract(); }

    @Override
    public Payload predict(Payload input) {
        return model().predict(input);
    }

    @Override
    public String toString() {
        MLModel bound = model;
        return getClass().getSimpleName() + "(" + (bound == null ? "unbound" : bound) + ")";
    }

    // ------------------------------------------------------------------
    // Chain inspection
    // ------------------------------------------------------------------

    /**
     * The full chain ending at {@code outermost}, base model first.
     *
     * For C wrapping B wrapping base model A, returns [A, B, C]. An unbound
     * decorator ends the walk.
     */
    public static List<MLModel> lineage(MLModel outermost) {
        List<MLModel> chain = new ArrayList<>();
        MLModel current = outermost;
        while (current != null) {
            chain.add(current);
            current = current instanceof MLModelDecorator d ? d.model : null;
        }
        Collections.reverse(chain);
        return chain;
    }
}
