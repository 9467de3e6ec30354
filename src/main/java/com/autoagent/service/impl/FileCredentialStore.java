package com.autoagent.service.impl;

import com.autoagent.exception.ConfigurationException;
import com.autoagent.service.api.CredentialStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * A {@link CredentialStore} persisting credentials to a JSON file under the agent home directory.
 * <p>
 * Values are encrypted with the Jasypt {@link StringEncryptor} before they are kept in memory or
 * written to disk; only {@link #getCredential} ever sees the plain text. A file that cannot be
 * parsed is moved aside with a {@code .corrupted.<timestamp>} suffix and the store starts empty.
 */
@Service
@Slf4j
public class FileCredentialStore implements CredentialStore {

    private final File credentialsFile;
    private final StringEncryptor encryptor;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private Map<String, Map<String, String>> credentials = new ConcurrentHashMap<>();

    public FileCredentialStore(StringEncryptor encryptor,
                               @Value("${agent.credentials-file:${agent.home}/credentials.json}") String credentialsPath) {
        this.encryptor = encryptor;
        this.credentialsFile = new File(credentialsPath);
    }

    @PostConstruct
    public void init() {
        load();
    }

    @Override
    public void saveCredential(String provider, String key, String value) {
        log.info("Encrypting and saving credential '{}' for provider '{}'", key, provider);
        credentials.computeIfAbsent(provider, p -> new ConcurrentHashMap<>()).put(key, encryptor.encrypt(value));
        save();
    }

    /**
     * {@inheritDoc}
     * <p>
     * Decrypts on the fly. A value that no longer decrypts, usually because the encryptor password
     * changed, is logged and reported as absent.
     */
    @Override
    public String getCredential(String provider, String key) {
        Map<String, String> providerCredentials = credentials.get(provider);
        if (providerCredentials == null || providerCredentials.get(key) == null) {
            return null;
        }
        try {
            return encryptor.decrypt(providerCredentials.get(key));
        } catch (Exception e) {
            log.error("Could not decrypt credential '{}' for provider '{}'. The secret key may have changed.", key, provider);
            return null;
        }
    }

    @Override
    public void removeCredentials(String provider) {
        if (credentials.remove(provider) != null) {
            save();
        }
    }

    private synchronized void save() {
        try {
            File parentDir = credentialsFile.getAbsoluteFile().getParentFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories at: " + parentDir.getAbsolutePath());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(credentialsFile, credentials);
        } catch (IOException e) {
            log.error("Failed to save credentials to {}", credentialsFile, e);
            throw new ConfigurationException("Failed to save credentials", e);
        }
    }

    synchronized void load() {
        if (!credentialsFile.exists() || credentialsFile.length() == 0) {
            log.info("No credentials file found at {}, starting with no stored credentials.", credentialsFile);
            return;
        }
        try {
            Map<String, Map<String, String>> loaded =
                    objectMapper.readValue(credentialsFile, new TypeReference<Map<String, Map<String, String>>>() {});
            Map<String, Map<String, String>> fresh = new ConcurrentHashMap<>();
            loaded.forEach((provider, values) -> fresh.put(provider, new ConcurrentHashMap<>(values)));
            this.credentials = fresh;
            log.info("Loaded credentials for {} provider(s) from {}", fresh.size(), credentialsFile);
        } catch (Exception e) {
            log.warn("Could not parse credentials file at {}. It will be backed up and ignored. Error: {}", credentialsFile, e.getMessage());
            backupCorruptedFile();
            this.credentials = new ConcurrentHashMap<>();
        }
    }

    private void backupCorruptedFile() {
        File backupFile = new File(credentialsFile.getPath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(credentialsFile.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted credentials file to {}", backupFile.getAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to back up corrupted credentials file {}", credentialsFile.getAbsolutePath(), e);
        }
    }
}
