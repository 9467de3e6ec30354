package com.autoagent.provider.impl;

/**
 * Connection defaults of the OpenAI-compatible chat-completion services the agent can use.
 */
public enum LlmProfile {

    OPENAI("openai", "OpenAI", "https://api.openai.com/v1", "OPENAI_API_KEY", "https://platform.openai.com/api-keys"),
    GROQ("groq", "Groq", "https://api.groq.com/openai/v1", "GROQ_API_KEY", "https://console.groq.com/keys"),
    XAI("xai", "xAI", "https://api.x.ai/v1", "XAI_API_KEY", "https://console.x.ai"),
    TOGETHER("together", "Together AI", "https://api.together.xyz/v1", "TOGETHER_API_KEY", "https://api.together.xyz/settings/api-keys"),
    // Local server, no key.
    OLLAMA("ollama", "Ollama", "http://localhost:11434/v1", null, null);

    private final String providerName;
    private final String displayName;
    private final String defaultBaseUrl;
    private final String apiKeyVariable;
    private final String keysPage;

    LlmProfile(String providerName, String displayName, String defaultBaseUrl, String apiKeyVariable, String keysPage) {
        this.providerName = providerName;
        this.displayName = displayName;
        this.defaultBaseUrl = defaultBaseUrl;
        this.apiKeyVariable = apiKeyVariable;
        this.keysPage = keysPage;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String getApiKeyVariable() {
        return apiKeyVariable;
    }

    public String getKeysPage() {
        return keysPage;
    }

    public boolean requiresApiKey() {
        return apiKeyVariable != null;
    }
}
