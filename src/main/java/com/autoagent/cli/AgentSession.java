package com.autoagent.cli;

import com.autoagent.agent.Agent;
import com.autoagent.agent.AgentFactory;
import com.autoagent.exception.NotConfiguredException;
import com.autoagent.model.AgentDefinition;
import com.autoagent.service.api.AgentDefinitionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Holds the agent the shell is currently working with.
 */
@Component
@Slf4j
public class AgentSession {

    private final AgentDefinitionService definitions;
    private final AgentFactory factory;
    private Agent agent;

    public AgentSession(AgentDefinitionService definitions, AgentFactory factory) {
        this.definitions = definitions;
        this.factory = factory;
    }

    /**
     * Loads an agent, replacing the current one.
     *
     * @throws com.autoagent.exception.ConfigurationException if the definition is invalid.
     */
    public synchronized Agent load(String name) {
        AgentDefinition definition = definitions.load(name);
        Agent loaded = factory.create(definition);
        if (agent != null) {
            agent.shutdown();
        }
        agent = loaded;
        log.info("Successfully loaded agent: {}", name);
        return loaded;
    }

    /**
     * @throws NotConfiguredException if no agent is loaded.
     */
    public synchronized Agent current() {
        if (agent == null) {
            throw new NotConfiguredException("No agent is currently loaded. Use 'load-agent' to load an agent.");
        }
        return agent;
    }

    public synchronized boolean isLoaded() {
        return agent != null;
    }
}
