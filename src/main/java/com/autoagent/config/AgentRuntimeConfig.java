package com.autoagent.config;

import com.autoagent.agent.Sleeper;
import com.autoagent.agent.action.AgentActionRegistry;
import com.autoagent.provider.ProviderContext;
import com.autoagent.provider.UserPrompt;
import com.autoagent.service.api.CredentialStore;
import java.time.Clock;
import java.util.Random;
import org.jline.reader.LineReader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the collaborators shared by every agent the shell loads.
 */
@Configuration
public class AgentRuntimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Random random() {
        return new Random();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public AgentActionRegistry agentActionRegistry() {
        return AgentActionRegistry.withBundledActions();
    }

    /**
     * Prompts through the shell's line reader, resolved on first use because the reader only
     * exists once the terminal is up.
     */
    @Bean
    public UserPrompt userPrompt(@Lazy LineReader lineReader) {
        return lineReader::readLine;
    }

    @Bean
    public ProviderContext providerContext(CredentialStore credentialStore, WebClient webClient,
                                           UserPrompt userPrompt, Environment environment) {
        return new ProviderContext(credentialStore, webClient, userPrompt, environment);
    }
}
