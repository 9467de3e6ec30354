package com.autoagent.provider;

import com.autoagent.service.api.CredentialStore;
import org.springframework.core.env.Environment;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Shared collaborators handed to every provider at construction.
 *
 * @param credentialStore Durable, encrypted storage for API keys and tokens.
 * @param webClient       The shared HTTP client, with retry on 429 and 503 already applied.
 * @param userPrompt      Used by {@code configure()} to ask the operator for credentials.
 * @param environment     Source of environment variables such as {@code OPENAI_API_KEY}.
 */
public record ProviderContext(CredentialStore credentialStore,
                              WebClient webClient,
                              UserPrompt userPrompt,
                              Environment environment) {
}
