package com.autoagent.agent;

import com.autoagent.agent.action.AgentActionRegistry;
import com.autoagent.dispatch.ActionDispatcher;
import com.autoagent.exception.ConfigurationException;
import com.autoagent.model.AgentDefinition;
import com.autoagent.model.TaskDefinition;
import com.autoagent.provider.ProviderCatalog;
import com.autoagent.provider.ProviderContext;
import com.autoagent.provider.ProviderRegistry;
import com.autoagent.scheduler.TaskScheduler;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Assembles a runnable {@link Agent}, and its {@link AgentLoop}, from a definition.
 */
@Component
@Slf4j
public class AgentFactory {

    private final ProviderCatalog catalog;
    private final ProviderContext context;
    private final AgentActionRegistry actions;
    private final Clock clock;
    private final Random random;
    private final Sleeper sleeper;

    @Value("${agent.loop.failure-backoff-seconds:60}")
    private long failureBackoffSeconds;

    @Value("${agent.loop.countdown-seconds:5}")
    private int countdownSeconds;

    public AgentFactory(ProviderCatalog catalog, ProviderContext context, AgentActionRegistry actions,
                        Clock clock, Random random, Sleeper sleeper) {
        this.catalog = catalog;
        this.context = context;
        this.actions = actions;
        this.clock = clock;
        this.random = random;
        this.sleeper = sleeper;
    }

    /**
     * Registers the agent's providers and builds its scheduler.
     * <p>
     * Providers that fail to initialize are left out and logged; the agent still loads.
     *
     * @throws ConfigurationException if a task names no known action, or the task weights are invalid.
     */
    public Agent create(AgentDefinition definition) {
        List<String> unknown = definition.getTasks().stream()
                .map(TaskDefinition::name)
                .filter(name -> !actions.contains(name))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Unknown task action(s): " + String.join(", ", unknown)
                    + ". Known actions: " + String.join(", ", actions.names()));
        }
        TaskScheduler scheduler = new TaskScheduler(definition.getTasks(), definition.getEffectiveTimeWeightRules(), random);
        ProviderRegistry registry = new ProviderRegistry(catalog, context, new ActionDispatcher());
        registry.registerAll(definition.getConfig());
        log.info("Agent {} ready with connections {}", definition.getName(), registry.names());
        return new Agent(definition, registry, scheduler, actions, clock, random);
    }

    public AgentLoop createLoop(Agent agent) {
        return new AgentLoop(agent, InputSource.defaults(), sleeper, Duration.ofSeconds(failureBackoffSeconds), countdownSeconds);
    }
}
