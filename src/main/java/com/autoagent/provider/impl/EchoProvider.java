package com.autoagent.provider.impl;

import com.autoagent.model.Operation;
import com.autoagent.model.OperationParameter;
import com.autoagent.model.ParameterType;
import com.autoagent.provider.AbstractCapabilityProvider;
import com.autoagent.provider.ProviderContext;
import java.util.Map;

/**
 * A provider with no external dependency: {@code say} returns its input.
 * <p>
 * Always configured. Useful to check an agent's wiring from the shell before any real
 * credentials are set up.
 */
public class EchoProvider extends AbstractCapabilityProvider {

    public static final String NAME = "echo";

    public EchoProvider(String name, ProviderContext context) {
        super(name, context);
    }

    @Override
    public boolean isLlmProvider() {
        return false;
    }

    @Override
    public Map<String, Object> validateConfig(Map<String, Object> raw) {
        return raw;
    }

    @Override
    protected void registerActions() {
        register(Operation.of("say", "Return the given text unchanged",
                params -> params.get("text"),
                OperationParameter.required("text", ParameterType.STRING, "The text to echo back")));
    }

    @Override
    public boolean configure() {
        return true;
    }

    @Override
    public boolean isConfigured(boolean verbose) {
        return true;
    }
}
