package com.autoagent.config;

import com.autoagent.cli.AgentSession;
import com.autoagent.exception.AgentRuntimeException;
import com.autoagent.service.api.AgentDefinitionService;
import java.util.Optional;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Loads the default agent named in {@code general.json} when the shell starts.
 */
@Component
@Profile("!test")
public class DefaultAgentRunner implements CommandLineRunner {

    private final AgentDefinitionService definitions;
    private final AgentSession session;

    public DefaultAgentRunner(AgentDefinitionService definitions, AgentSession session) {
        this.definitions = definitions;
        this.session = session;
    }

    @Override
    public void run(String... args) {
        System.out.println("\n--- Starting Auto Agent ---");
        Optional<String> defaultAgent = definitions.getDefaultAgent();
        if (defaultAgent.isEmpty()) {
            System.out.println("No default agent set. Use 'list-agents' and 'load-agent' to pick one.");
            return;
        }
        try {
            session.load(defaultAgent.get());
            System.out.println("Loaded default agent '" + defaultAgent.get() + "'. Type 'help' to see the available commands.\n");
        } catch (AgentRuntimeException e) {
            System.err.println("Could not load default agent '" + defaultAgent.get() + "': " + e.getMessage());
        }
    }
}
