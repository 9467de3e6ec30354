package com.autoagent.provider.impl;

import com.autoagent.dto.llm.ChatCompletionRequest;
import com.autoagent.dto.llm.ChatCompletionResponse;
import com.autoagent.dto.llm.ChatMessage;
import com.autoagent.dto.llm.ModelListResponse;
import com.autoagent.exception.NotConfiguredException;
import com.autoagent.exception.ProviderException;
import com.autoagent.model.Operation;
import com.autoagent.model.OperationParameter;
import com.autoagent.model.ParameterType;
import com.autoagent.provider.AbstractCapabilityProvider;
import com.autoagent.provider.ProviderContext;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * An LLM provider speaking the OpenAI chat-completions protocol.
 * <p>
 * One implementation serves every service described by an {@link LlmProfile}. The API key is
 * read from the credential store, then from the profile's environment variable. Profiles without
 * a key variable (a local Ollama server) are considered configured when the server answers.
 * <p>
 * Configuration block fields:
 * <ul>
 *   <li>{@code model} (required): default model for {@code generate-text}.</li>
 *   <li>{@code base_url} (optional): overrides the profile's endpoint.</li>
 *   <li>{@code timeout_seconds} (optional): per-request timeout, 60 by default.</li>
 * </ul>
 */
@Slf4j
public class OpenAiCompatibleProvider extends AbstractCapabilityProvider {

    static final String API_KEY = "api_key";
    private static final int DEFAULT_TIMEOUT_SECONDS = 60;
    static final Duration SERVER_CHECK_TTL = Duration.ofSeconds(30);

    private final LlmProfile profile;
    private String baseUrl;
    private Duration timeout;
    private volatile Instant serverReachableUntil = Instant.MIN;

    public OpenAiCompatibleProvider(String name, ProviderContext context, LlmProfile profile) {
        super(name, context);
        this.profile = profile;
    }

    @Override
    public boolean isLlmProvider() {
        return true;
    }

    @Override
    public Map<String, Object> validateConfig(Map<String, Object> raw) {
        requireFields(getName(), raw, List.of("model"));
        requireString(raw, "model");
        String url = stringOrDefault(raw, "base_url", profile.getDefaultBaseUrl());
        Map<String, Object> validated = new LinkedHashMap<>(raw);
        validated.put("base_url", url.endsWith("/") ? url.substring(0, url.length() - 1) : url);
        validated.put("timeout_seconds", optionalPositiveInt(raw, "timeout_seconds", DEFAULT_TIMEOUT_SECONDS));
        return validated;
    }

    @Override
    protected void applyConfig(Map<String, Object> config) {
        this.baseUrl = (String) config.get("base_url");
        this.timeout = Duration.ofSeconds((Integer) config.get("timeout_seconds"));
    }

    @Override
    protected void registerActions() {
        register(Operation.of("generate-text", "Generate text using " + profile.getDisplayName() + " models",
                params -> generateText((String) params.get("prompt"), (String) params.get("system_prompt"), (String) params.get("model")),
                OperationParameter.required("prompt", ParameterType.STRING, "The input prompt for text generation"),
                OperationParameter.required("system_prompt", ParameterType.STRING, "System prompt to guide the model"),
                OperationParameter.optional("model", ParameterType.STRING, "Model to use for generation")));
        register(Operation.of("check-model", "Check if a specific model is available",
                params -> checkModel((String) params.get("model")),
                OperationParameter.required("model", ParameterType.STRING, "Model name to check availability")));
        register(Operation.of("list-models", "List all available " + profile.getDisplayName() + " models",
                params -> listModels(apiKey())));
    }

    /**
     * Asks for an API key, checks it against the {@code /models} endpoint and stores it.
     * <p>
     * When the provider is already configured the operator is asked first; answering anything
     * but {@code y} keeps the current key and reports success.
     */
    @Override
    public boolean configure() {
        log.info("Setting up {} API", profile.getDisplayName());
        if (isConfigured()) {
            log.info("{} API is already configured.", profile.getDisplayName());
            if (!context.userPrompt().confirm("Do you want to reconfigure?")) {
                return true;
            }
        }
        if (!profile.requiresApiKey()) {
            if (!context.userPrompt().confirm("Is your " + profile.getDisplayName() + " server running at " + baseUrl + "?")) {
                return false;
            }
            return isConfigured(true);
        }

        log.info("To get your {} API key, go to {}", profile.getDisplayName(), profile.getKeysPage());
        String key = context.userPrompt().ask("Enter your " + profile.getDisplayName() + " API key: ");
        if (key == null || key.isBlank()) {
            log.error("No API key entered, {} was not configured", profile.getDisplayName());
            return false;
        }
        try {
            listModels(key.trim());
            context.credentialStore().saveCredential(getName(), API_KEY, key.trim());
            log.info("{} API configuration successfully saved", profile.getDisplayName());
            return true;
        } catch (Exception e) {
            log.error("Configuration failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isConfigured(boolean verbose) {
        try {
            if (profile.requiresApiKey()) {
                String key = apiKey();
                if (key == null || key.isBlank()) {
                    if (verbose) {
                        log.info("{} API key not found. Run 'configure-connection {}' or set {}", profile.getDisplayName(), getName(), profile.getApiKeyVariable());
                    }
                    return false;
                }
                return true;
            }
            if (!verbose && Instant.now().isBefore(serverReachableUntil)) {
                return true;
            }
            listModels(null);
            serverReachableUntil = Instant.now().plus(SERVER_CHECK_TTL);
            return true;
        } catch (Exception e) {
            serverReachableUntil = Instant.MIN;
            if (verbose) {
                log.debug("Configuration check for {} failed: {}", getName(), e.getMessage());
            }
            return false;
        }
    }

    String generateText(String prompt, String systemPrompt, String model) {
        String selectedModel = model == null || model.isBlank() ? (String) getConfig().get("model") : model;
        ChatCompletionRequest request = new ChatCompletionRequest(selectedModel, List.of(
                new ChatMessage("system", systemPrompt),
                new ChatMessage("user", prompt)));

        log.debug("Sending chat completion request to {} with model {}", getName(), selectedModel);
        String key = requireKey();
        try {
            ChatCompletionResponse response = context.webClient().post()
                    .uri(baseUrl + "/chat/completions")
                    .headers(headers -> authorize(headers, key))
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(ChatCompletionResponse.class)
                    .block(timeout);

            if (response == null || response.getChoices() == null || response.getChoices().isEmpty()
                    || response.getChoices().get(0).getMessage() == null) {
                throw new ProviderException("Received an empty or invalid response from " + profile.getDisplayName());
            }
            return response.getChoices().get(0).getMessage().getContent();
        } catch (WebClientResponseException e) {
            throw new ProviderException("Text generation failed: " + e.getStatusCode() + " " + e.getResponseBodyAsString(), e);
        }
    }

    boolean checkModel(String model) {
        return listModels(requireKey()).contains(model);
    }

    List<String> listModels(String key) {
        try {
            ModelListResponse response = context.webClient().get()
                    .uri(baseUrl + "/models")
                    .headers(headers -> authorize(headers, key))
                    .retrieve()
                    .bodyToMono(ModelListResponse.class)
                    .block(timeout);
            if (response == null || response.getData() == null) {
                return List.of();
            }
            List<String> ids = response.getData().stream().map(ModelListResponse.Model::getId).toList();
            log.debug("Available {} models: {}", profile.getDisplayName(), ids);
            return ids;
        } catch (WebClientResponseException e) {
            throw new ProviderException("Listing models failed: " + e.getStatusCode(), e);
        }
    }

    private String apiKey() {
        return profile.requiresApiKey() ? credentialOrEnv(API_KEY, profile.getApiKeyVariable()) : null;
    }

    private String requireKey() {
        String key = apiKey();
        if (profile.requiresApiKey() && (key == null || key.isBlank())) {
            throw new NotConfiguredException(profile.getDisplayName() + " API key not found");
        }
        return key;
    }

    private static void authorize(HttpHeaders headers, String key) {
        if (key != null) {
            headers.setBearerAuth(key);
        }
    }
}
