package com.autoagent.service.api;

import com.autoagent.exception.ConfigurationException;
import com.autoagent.model.AgentDefinition;
import java.util.List;
import java.util.Optional;

/**
 * Reads agent definitions from the agents directory and tracks which one is loaded at startup.
 */
public interface AgentDefinitionService {

    /**
     * @return the names of all agent files, without the {@code .json} extension, sorted.
     */
    List<String> listAgents();

    /**
     * Reads and validates one agent definition.
     *
     * @param name The agent name, i.e. the file name without extension.
     * @return The parsed definition.
     * @throws ConfigurationException if the file is missing, unreadable, or lacks a required field.
     */
    AgentDefinition load(String name);

    /**
     * @return the agent named by {@code default_agent} in {@code general.json}, if any.
     */
    Optional<String> getDefaultAgent();

    /**
     * Records the agent to load at startup.
     *
     * @throws ConfigurationException if no agent has that name or the setting cannot be saved.
     */
    void setDefaultAgent(String name);
}
