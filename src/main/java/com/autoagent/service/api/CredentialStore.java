package com.autoagent.service.api;

/**
 * Durable storage for provider credentials (API keys, tokens).
 * <p>
 * Callers treat the storage as opaque: they only save and read values by provider name and key.
 */
public interface CredentialStore {

    /**
     * Saves or replaces one credential.
     *
     * @param provider The provider the credential belongs to, e.g. {@code "openai"}.
     * @param key      The credential's key, e.g. {@code "api_key"}.
     * @param value    The plain-text credential.
     */
    void saveCredential(String provider, String key, String value);

    /**
     * Retrieves one credential.
     *
     * @return The plain-text credential, or {@code null} if none is stored or it cannot be read.
     */
    String getCredential(String provider, String key);

    /**
     * Deletes every credential stored for a provider.
     */
    void removeCredentials(String provider);
}
