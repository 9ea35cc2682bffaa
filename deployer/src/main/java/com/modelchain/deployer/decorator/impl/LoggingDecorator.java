package com.modelchain.deployer.decorator.impl;

import com.modelchain.deployer.decorator.DecoratorException;
import com.modelchain.deployer.decorator.MLModelDecorator;
import com.modelchain.deployer.model.MLModel;
import com.modelchain.deployer.schema.Payload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Locale;
import java.util.Map;

/**
 * Logs around every prediction; the contracts and identity pass through untouched.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code level} — INFO (default), DEBUG or TRACE</li>
 *   <li>{@code log-payloads} — include input and output values (default false)</li>
 * </ul>
 */
public class LoggingDecorator extends MLModelDecorator {

    private static final Logger log = LoggerFactory.getLogger(LoggingDecorator.class);

    private final Level   level;
    private final boolean logPayloads;

    public LoggingDecorator(MLModel model, Map<String, ?> configuration) {
        super(model, configuration);
        this.level       = parseLevel(configValue("level", "INFO"));
        this.logPayloads = configFlag("log-payloads", false);
    }

    @Override
    public Payload predict(Payload input) {
        String modelName = qualifiedName();
        if (logPayloads) {
            log.atLevel(level).log("Executing before prediction of '{}': {}", modelName, input.values());
        } else {
            log.atLevel(level).log("Executing before prediction of '{}'", modelName);
        }

        Payload prediction;
        try {
            prediction = model().predict(input);
        } catch (RuntimeException e) {
            log.warn("Prediction of '{}' failed: {}", modelName, e.getMessage());
            throw e;
        }

        if (logPayloads) {
            log.atLevel(level).log("Executing after prediction of '{}': {}", modelName, prediction.values());
        } else {
            log.atLevel(level).log("Executing after prediction of '{}'", modelName);
        }
        return prediction;
    }

    private static Level parseLevel(String value) {
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "INFO"  -> Level.INFO;
            case "DEBUG" -> Level.DEBUG;
            case "TRACE" -> Level.TRACE;
            default -> throw DecoratorException.badSetting(LoggingDecorator.class, "level", value,
                    "unsupported logging level for predictions (INFO, DEBUG or TRACE)");
        };
    }
}
