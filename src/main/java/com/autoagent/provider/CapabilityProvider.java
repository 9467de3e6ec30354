package com.autoagent.provider;

import com.autoagent.exception.ConfigurationException;
import com.autoagent.exception.InvalidParametersException;
import com.autoagent.exception.ProviderException;
import com.autoagent.exception.UnknownOperationException;
import com.autoagent.model.Operation;
import java.util.Map;
import java.util.Optional;

/**
 * An adapter exposing a fixed set of named operations over one external capability
 * (an LLM API, a chat room, a wallet, ...).
 * <p>
 * A provider owns its configuration and credential lifecycle. It is created once per agent,
 * initialized from the agent's configuration block, and then owned by the {@link ProviderRegistry}.
 */
public interface CapabilityProvider {

    /**
     * @return the unique provider name, matching the {@code name} of its configuration block.
     */
    String getName();

    /**
     * @return {@code true} if this provider can generate text and may serve as the agent's LLM.
     */
    boolean isLlmProvider();

    /**
     * Checks required fields and types of a raw configuration block. Performs no I/O.
     *
     * @param raw The configuration block as read from the agent file.
     * @return The validated configuration.
     * @throws ConfigurationException if a field is missing or has the wrong type.
     */
    Map<String, Object> validateConfig(Map<String, Object> raw);

    /**
     * Validates the configuration and registers the provider's operations. Called exactly once,
     * by the registry, right after construction.
     *
     * @throws ConfigurationException if the configuration or an operation declaration is invalid.
     */
    void initialize(Map<String, Object> raw);

    /**
     * Acquires and persists credentials, interactively or from the environment. Re-running it
     * must leave stored credentials intact unless the user chooses to replace them.
     *
     * @return {@code true} if the provider is configured afterwards.
     */
    boolean configure();

    /**
     * Checks whether the provider is usable. Must not throw.
     *
     * @param verbose Log the reason when the provider is not usable.
     */
    boolean isConfigured(boolean verbose);

    default boolean isConfigured() {
        return isConfigured(false);
    }

    /**
     * @return the registered operations keyed by name, in registration order.
     */
    Map<String, Operation> getOperations();

    default Optional<Operation> findOperation(String name) {
        return Optional.ofNullable(getOperations().get(name));
    }

    /**
     * Executes one operation.
     *
     * @param name   The operation name.
     * @param params Parameters keyed by name.
     * @return The operation's result, may be {@code null}.
     * @throws UnknownOperationException  if no operation has that name.
     * @throws InvalidParametersException if the parameters fail validation.
     * @throws ProviderException          if the downstream call fails.
     */
    Object performAction(String name, Map<String, Object> params);

    /**
     * @return the validated configuration block.
     */
    Map<String, Object> getConfig();
}
