package com.autoagent.service.impl;

import com.autoagent.exception.ConfigurationException;
import com.autoagent.model.AgentDefinition;
import com.autoagent.model.TaskDefinition;
import com.autoagent.service.api.AgentDefinitionService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Reads agents from {@code <agents-dir>/<name>.json}.
 * <p>
 * {@code general.json} in the same directory is not an agent: it holds shared settings, currently
 * only {@code default_agent}.
 */
@Service
@Slf4j
public class FileAgentDefinitionService implements AgentDefinitionService {

    static final String GENERAL_FILE = "general.json";
    static final String DEFAULT_AGENT = "default_agent";

    private final File agentsDirectory;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FileAgentDefinitionService(@Value("${agent.agents-dir}") String agentsDirectory) {
        this.agentsDirectory = new File(agentsDirectory);
    }

    @Override
    public List<String> listAgents() {
        File[] files = agentsDirectory.listFiles((dir, name) -> name.endsWith(".json") && !GENERAL_FILE.equals(name));
        if (files == null) {
            log.warn("Agents directory {} not found", agentsDirectory.getAbsolutePath());
            return List.of();
        }
        return Arrays.stream(files)
                .map(file -> file.getName().substring(0, file.getName().length() - ".json".length()))
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public AgentDefinition load(String name) {
        File file = new File(agentsDirectory, name + ".json");
        if (!file.isFile()) {
            throw new ConfigurationException("Agent file not found: " + file.getPath());
        }
        try {
            JsonNode tree = objectMapper.readTree(file);
            List<String> missing = AgentDefinition.REQUIRED_FIELDS.stream()
                    .filter(field -> !tree.has(field))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                throw new ConfigurationException("Missing required fields: " + String.join(", ", missing));
            }
            AgentDefinition definition = objectMapper.treeToValue(tree, AgentDefinition.class);
            validate(definition);
            log.info("Loaded agent {} from {}", definition.getName(), file.getPath());
            return definition;
        } catch (IOException e) {
            throw new ConfigurationException("Could not read agent file " + file.getPath() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> getDefaultAgent() {
        File file = new File(agentsDirectory, GENERAL_FILE);
        if (!file.isFile()) {
            return Optional.empty();
        }
        try {
            JsonNode value = objectMapper.readTree(file).get(DEFAULT_AGENT);
            return value == null || !value.isTextual() || value.asText().isBlank() ? Optional.empty() : Optional.of(value.asText());
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file.getPath(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void setDefaultAgent(String name) {
        if (!listAgents().contains(name)) {
            throw new ConfigurationException("Agent " + name + " not found in " + agentsDirectory.getPath());
        }
        File file = new File(agentsDirectory, GENERAL_FILE);
        try {
            ObjectNode general = file.isFile() && objectMapper.readTree(file) instanceof ObjectNode existing
                    ? existing
                    : objectMapper.createObjectNode();
            general.put(DEFAULT_AGENT, name);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, general);
            log.info("Default agent set to {}", name);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to save " + file.getPath(), e);
        }
    }

    private void validate(AgentDefinition definition) {
        if (definition.getLoopDelay() < 0) {
            throw new ConfigurationException("loop_delay must not be negative");
        }
        for (TaskDefinition task : definition.getTasks()) {
            if (task.name() == null || task.name().isBlank()) {
                throw new ConfigurationException("Every task needs a name");
            }
        }
    }
}
