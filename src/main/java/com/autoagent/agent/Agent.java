package com.autoagent.agent;

import com.autoagent.agent.action.AgentAction;
import com.autoagent.agent.action.AgentActionRegistry;
import com.autoagent.exception.NotConfiguredException;
import com.autoagent.model.AgentDefinition;
import com.autoagent.model.TaskDefinition;
import com.autoagent.provider.CapabilityProvider;
import com.autoagent.provider.ProviderRegistry;
import com.autoagent.provider.SubscriptionProvider;
import com.autoagent.scheduler.TaskScheduler;
import java.time.Clock;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;

/**
 * A loaded agent: its persona, its providers, its tasks and its working memory.
 * <p>
 * Provider calls made through the agent never throw for dispatch failures; they are logged and
 * come back as an empty {@link Optional}. Not safe for concurrent use while a loop is running.
 */
@Slf4j
public class Agent {

    private final AgentDefinition definition;
    private final ProviderRegistry registry;
    private final TaskScheduler scheduler;
    private final AgentActionRegistry actions;
    private final AgentState state = new AgentState();
    private final SubscriptionListener listener;
    private final Clock clock;
    private final Random random;

    private String modelProvider;
    private String systemPrompt;

    public Agent(AgentDefinition definition, ProviderRegistry registry, TaskScheduler scheduler,
                 AgentActionRegistry actions, Clock clock, Random random) {
        this.definition = definition;
        this.registry = registry;
        this.scheduler = scheduler;
        this.actions = actions;
        this.clock = clock;
        this.random = random;
        this.listener = new SubscriptionListener(state.inbox());
    }

    public String getName() {
        return definition.getName();
    }

    public AgentDefinition getDefinition() {
        return definition;
    }

    public ProviderRegistry getRegistry() {
        return registry;
    }

    public TaskScheduler getScheduler() {
        return scheduler;
    }

    public AgentState getState() {
        return state;
    }

    public Clock getClock() {
        return clock;
    }

    public Random getRandom() {
        return random;
    }

    /**
     * Selects the first configured LLM provider, in configuration order.
     *
     * @throws NotConfiguredException if no LLM provider is configured.
     */
    public void setupLlmProvider() {
        List<String> llmProviders = registry.listLlmProviders();
        if (llmProviders.isEmpty()) {
            throw new NotConfiguredException("No configured LLM provider found");
        }
        modelProvider = llmProviders.get(0);
        log.info("Using {} as the LLM provider", modelProvider);
    }

    public Optional<String> getModelProvider() {
        return Optional.ofNullable(modelProvider);
    }

    /**
     * Builds the persona prompt from the bio, traits and examples. Computed once.
     */
    public String getSystemPrompt() {
        if (systemPrompt == null) {
            List<String> parts = new ArrayList<>(definition.getBio());
            if (!definition.getTraits().isEmpty()) {
                parts.add("\nYour key traits are:");
                definition.getTraits().forEach(trait -> parts.add("- " + trait));
            }
            if (!definition.getExamples().isEmpty()) {
                parts.add("\nHere are some examples of your style (Please avoid repeating any of these):");
                definition.getExamples().forEach(example -> parts.add("- " + example));
            }
            systemPrompt = String.join("\n", parts);
        }
        return systemPrompt;
    }

    public Optional<String> promptLlm(String prompt) {
        return promptLlm(prompt, getSystemPrompt());
    }

    /**
     * Generates text with the agent's LLM provider, selecting one first if needed.
     *
     * @throws NotConfiguredException if no LLM provider is configured.
     */
    public Optional<String> promptLlm(String prompt, String customSystemPrompt) {
        if (modelProvider == null) {
            setupLlmProvider();
        }
        return performAction(modelProvider, "generate-text", List.of(prompt, customSystemPrompt))
                .map(String::valueOf);
    }

    /**
     * Invokes a provider operation with positional parameters.
     *
     * @return the value, or empty if the call failed or returned nothing.
     */
    public Optional<Object> performAction(String provider, String operation, List<?> params) {
        return registry.dispatch(provider, operation, params).toOptional();
    }

    public Optional<Object> performNamedAction(String provider, String operation, Map<String, Object> params) {
        return registry.dispatchNamed(provider, operation, params).toOptional();
    }

    /**
     * Runs the agent action bound to a task name.
     *
     * @return the action's result, {@code false} if no action has that name.
     */
    public boolean runAction(String name) {
        Optional<AgentAction> action = actions.find(name);
        if (action.isEmpty()) {
            log.error("Action {} not found", name);
            return false;
        }
        return action.get().execute(this);
    }

    public TaskDefinition selectTask() {
        return scheduler.select(LocalTime.now(clock).getHour(), definition.isUseTimeBasedWeights());
    }

    /**
     * Starts a background subscription on a provider, once per provider.
     *
     * @return {@code true} if the subscription is running afterwards.
     */
    public boolean subscribe(String providerName, String filter) {
        if (listener.isListening(providerName)) {
            return true;
        }
        Optional<CapabilityProvider> provider = registry.find(providerName);
        if (provider.isEmpty() || !(provider.get() instanceof SubscriptionProvider subscriptions)) {
            log.warn("Connection {} cannot deliver subscriptions", providerName);
            return false;
        }
        return listener.start(providerName, subscriptions.openSubscription(filter));
    }

    public void shutdown() {
        listener.stop();
    }
}
