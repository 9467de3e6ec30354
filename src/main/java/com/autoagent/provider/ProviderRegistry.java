package com.autoagent.provider;

import com.autoagent.dispatch.ActionDispatcher;
import com.autoagent.dispatch.ActionResult;
import com.autoagent.dispatch.ErrorKind;
import com.autoagent.exception.ProviderNotFoundException;
import com.autoagent.model.Operation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the capability providers of one agent by name and is the single entry point through
 * which the rest of the runtime invokes them.
 * <p>
 * Registration never fails the caller: a provider whose name is unknown or whose configuration
 * is rejected is logged and left out, and the agent runs in degraded mode without it.
 * Dispatch never throws either; every outcome is an {@link ActionResult}.
 */
@Slf4j
public class ProviderRegistry {

    private final ProviderCatalog catalog;
    private final ProviderContext context;
    private final ActionDispatcher dispatcher;
    private final Map<String, CapabilityProvider> providers = new LinkedHashMap<>();

    public ProviderRegistry(ProviderCatalog catalog, ProviderContext context, ActionDispatcher dispatcher) {
        this.catalog = catalog;
        this.context = context;
        this.dispatcher = dispatcher;
    }

    /**
     * Registers every named configuration block, in order.
     */
    public void registerAll(List<Map<String, Object>> configBlocks) {
        for (Map<String, Object> block : configBlocks) {
            Object name = block.get("name");
            if (!(name instanceof String providerName)) {
                log.error("Skipping a connection config block without a 'name': {}", block.keySet());
                continue;
            }
            register(providerName, block);
        }
    }

    /**
     * Instantiates and initializes the provider bound to {@code name}.
     *
     * @param name   The provider name, e.g. {@code "openai"}.
     * @param config The provider's configuration block.
     */
    public void register(String name, Map<String, Object> config) {
        Optional<ProviderFactory> factory = catalog.find(name);
        if (factory.isEmpty()) {
            log.error("Failed to initialize connection {}: no provider is registered under that name", name);
            return;
        }
        try {
            CapabilityProvider provider = factory.get().create(name, context);
            provider.initialize(config);
            providers.put(name, provider);
            log.debug("Registered connection {}", name);
        } catch (Exception e) {
            log.error("Failed to initialize connection {}: {}", name, e.getMessage());
        }
    }

    /**
     * Adds an already initialized provider.
     */
    public void register(CapabilityProvider provider) {
        providers.put(provider.getName(), provider);
    }

    /**
     * @throws ProviderNotFoundException if no provider has that name.
     */
    public CapabilityProvider get(String name) {
        CapabilityProvider provider = providers.get(name);
        if (provider == null) {
            throw new ProviderNotFoundException("Unknown connection '" + name + "'. Try 'list-connections' to see all supported connections.");
        }
        return provider;
    }

    public Optional<CapabilityProvider> find(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public List<String> names() {
        return List.copyOf(providers.keySet());
    }

    /**
     * @return names of providers that are both configured and able to generate text, in
     *         registration order.
     */
    public List<String> listLlmProviders() {
        List<String> names = new ArrayList<>();
        for (CapabilityProvider provider : providers.values()) {
            if (provider.isLlmProvider() && provider.isConfigured()) {
                names.add(provider.getName());
            }
        }
        return names;
    }

    /**
     * @return each provider's configured flag, in registration order.
     */
    public Map<String, Boolean> connectionStatuses() {
        Map<String, Boolean> statuses = new LinkedHashMap<>();
        providers.forEach((name, provider) -> statuses.put(name, provider.isConfigured()));
        return Collections.unmodifiableMap(statuses);
    }

    /**
     * @throws ProviderNotFoundException if no provider has that name.
     */
    public List<Operation> describeActions(String name) {
        return List.copyOf(get(name).getOperations().values());
    }

    /**
     * Runs a provider's {@code configure()} routine.
     *
     * @return {@code false} if the provider is unknown, configuration failed, or it threw.
     */
    public boolean configure(String name) {
        CapabilityProvider provider = providers.get(name);
        if (provider == null) {
            log.error("Unknown connection '{}'. Try 'list-connections' to see all supported connections.", name);
            return false;
        }
        try {
            boolean success = provider.configure();
            if (success) {
                log.info("Successfully configured connection: {}", name);
            } else {
                log.error("Error configuring connection: {}", name);
            }
            return success;
        } catch (Exception e) {
            log.error("An error occurred while configuring {}: {}", name, e.getMessage());
            return false;
        }
    }

    /**
     * Invokes an operation with positional parameters, mapped onto the operation's declared
     * parameters in order.
     *
     * @param providerName  The provider to call.
     * @param operationName The operation to run.
     * @param positional    Parameter values in declaration order.
     * @return The value, or a failure of kind {@code NOT_FOUND}, {@code NOT_CONFIGURED},
     *         {@code UNKNOWN_OPERATION}, {@code INVALID_PARAMETERS} or {@code PROVIDER_ERROR}.
     */
    public ActionResult dispatch(String providerName, String operationName, List<?> positional) {
        ActionResult unavailable = checkAvailable(providerName, operationName);
        if (unavailable != null) {
            return unavailable;
        }
        CapabilityProvider provider = providers.get(providerName);
        Operation operation = provider.getOperations().get(operationName);
        Map<String, Object> named = ActionDispatcher.bindPositional(operation, positional);
        return report(providerName, operationName, dispatcher.invoke(provider, operationName, named));
    }

    /**
     * Invokes an operation with parameters looked up by name.
     */
    public ActionResult dispatchNamed(String providerName, String operationName, Map<String, Object> params) {
        ActionResult unavailable = checkAvailable(providerName, operationName);
        if (unavailable != null) {
            return unavailable;
        }
        return report(providerName, operationName, dispatcher.invoke(providers.get(providerName), operationName, params));
    }

    /**
     * @return a failure if the provider is missing, unconfigured or lacks the operation;
     *         {@code null} if the call can proceed.
     */
    private ActionResult checkAvailable(String providerName, String operationName) {
        CapabilityProvider provider = providers.get(providerName);
        if (provider == null) {
            return report(providerName, operationName,
                    ActionResult.failure(ErrorKind.NOT_FOUND, "Unknown connection '" + providerName + "'"));
        }
        if (!provider.isConfigured()) {
            return report(providerName, operationName,
                    ActionResult.failure(ErrorKind.NOT_CONFIGURED, "Connection '" + providerName + "' is not configured"));
        }
        if (provider.findOperation(operationName).isEmpty()) {
            return report(providerName, operationName, ActionResult.failure(ErrorKind.UNKNOWN_OPERATION,
                    "Unknown action '" + operationName + "' for connection '" + providerName + "'"));
        }
        return null;
    }

    private ActionResult report(String providerName, String operationName, ActionResult result) {
        if (!result.isSuccess()) {
            log.error("Action {} on {} failed ({}): {}", operationName, providerName, result.getKind(), result.getDetail());
        }
        return result;
    }
}
