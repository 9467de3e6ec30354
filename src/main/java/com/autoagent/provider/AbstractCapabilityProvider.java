package com.autoagent.provider;

import com.autoagent.dispatch.ParameterValidator;
import com.autoagent.exception.AgentRuntimeException;
import com.autoagent.exception.ConfigurationException;
import com.autoagent.exception.ProviderException;
import com.autoagent.exception.UnknownOperationException;
import com.autoagent.model.Operation;
import com.autoagent.model.OperationParameter;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for capability providers.
 * <p>
 * Holds the operation table and implements the shared parts of the contract: two-phase
 * initialization, operation registration checks, parameter validation before every call, and
 * conversion of arbitrary downstream failures into {@link ProviderException}.
 */
@Slf4j
public abstract class AbstractCapabilityProvider implements CapabilityProvider {

    private final String name;
    protected final ProviderContext context;
    private final Map<String, Operation> operations = new LinkedHashMap<>();
    private Map<String, Object> config = Map.of();
    private boolean initialized;

    protected AbstractCapabilityProvider(String name, ProviderContext context) {
        this.name = name;
        this.context = context;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public final void initialize(Map<String, Object> raw) {
        if (initialized) {
            throw new IllegalStateException("Provider '" + name + "' is already initialized");
        }
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(validateConfig(raw == null ? Map.of() : raw)));
        applyConfig(config);
        registerActions();
        initialized = true;
        log.debug("Initialized provider '{}' with operations {}", name, operations.keySet());
    }

    /**
     * Takes over a configuration accepted by {@link #validateConfig}. Does nothing by default.
     */
    protected void applyConfig(Map<String, Object> config) {
    }

    /**
     * Populates the operation table through {@link #register(Operation)}.
     */
    protected abstract void registerActions();

    /**
     * Adds an operation to this provider.
     *
     * @throws ConfigurationException if the name is taken, or a parameter is duplicated or untyped.
     */
    protected void register(Operation operation) {
        if (operations.containsKey(operation.name())) {
            throw new ConfigurationException("Provider '" + name + "' declares operation '" + operation.name() + "' twice");
        }
        Set<String> seen = new HashSet<>();
        for (OperationParameter parameter : operation.parameters()) {
            if (parameter.type() == null) {
                throw new ConfigurationException("Parameter '" + parameter.name() + "' of '" + operation.name() + "' has no supported type");
            }
            if (!seen.add(parameter.name())) {
                throw new ConfigurationException("Parameter '" + parameter.name() + "' of '" + operation.name() + "' is declared twice");
            }
        }
        operations.put(operation.name(), operation);
    }

    @Override
    public Map<String, Operation> getOperations() {
        return Collections.unmodifiableMap(operations);
    }

    @Override
    public Map<String, Object> getConfig() {
        return config;
    }

    @Override
    public Object performAction(String actionName, Map<String, Object> params) {
        Operation operation = operations.get(actionName);
        if (operation == null) {
            throw new UnknownOperationException("Unknown action '" + actionName + "' for connection '" + name + "'");
        }
        Map<String, Object> coerced = ParameterValidator.validate(operation, params == null ? Map.of() : params);
        try {
            return operation.handler().handle(coerced);
        } catch (AgentRuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(name + " " + actionName + " was interrupted", e);
        } catch (Exception e) {
            throw new ProviderException(name + " " + actionName + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Fails with one message naming every required field absent from the block.
     */
    protected static void requireFields(String provider, Map<String, Object> raw, List<String> fields) {
        List<String> missing = fields.stream()
                .filter(field -> raw.get(field) == null || (raw.get(field) instanceof String s && s.isBlank()))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required configuration fields for " + provider + ": " + String.join(", ", missing));
        }
    }

    protected static String requireString(Map<String, Object> raw, String field) {
        if (!(raw.get(field) instanceof String value)) {
            throw new ConfigurationException(field + " must be a string");
        }
        return value;
    }

    protected static String stringOrDefault(Map<String, Object> raw, String field, String fallback) {
        Object value = raw.get(field);
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof String text)) {
            throw new ConfigurationException(field + " must be a string");
        }
        return text;
    }

    protected static int requirePositiveInt(Map<String, Object> raw, String field) {
        if (!(raw.get(field) instanceof Integer value) || value <= 0) {
            throw new ConfigurationException(field + " must be a positive integer");
        }
        return value;
    }

    protected static int optionalPositiveInt(Map<String, Object> raw, String field, int fallback) {
        return raw.get(field) == null ? fallback : requirePositiveInt(raw, field);
    }

    /**
     * Reads a credential saved by {@code configure()}, falling back to an environment variable.
     */
    protected String credentialOrEnv(String key, String envVariable) {
        String stored = context.credentialStore().getCredential(name, key);
        if (stored != null && !stored.isBlank()) {
            return stored;
        }
        return context.environment() == null ? null : context.environment().getProperty(envVariable);
    }
}
