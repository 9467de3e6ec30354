package com.autoagent.provider;

import com.autoagent.provider.impl.EchoProvider;
import com.autoagent.provider.impl.EchochambersProvider;
import com.autoagent.provider.impl.LlmProfile;
import com.autoagent.provider.impl.OpenAiCompatibleProvider;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Binds configuration block names to provider factories.
 * <p>
 * The bundled providers are bound at construction; {@link #bind} adds more.
 */
@Component
public class ProviderCatalog {

    private final Map<String, ProviderFactory> factories = new LinkedHashMap<>();

    public ProviderCatalog() {
        bind(EchoProvider.NAME, EchoProvider::new);
        for (LlmProfile profile : LlmProfile.values()) {
            bind(profile.getProviderName(), (name, context) -> new OpenAiCompatibleProvider(name, context, profile));
        }
        bind(EchochambersProvider.NAME, EchochambersProvider::new);
    }

    public void bind(String name, ProviderFactory factory) {
        factories.put(name, factory);
    }

    public Optional<ProviderFactory> find(String name) {
        return Optional.ofNullable(factories.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }
}
