package com.autoagent.provider;

/**
 * Creates an uninitialized provider instance for a configuration block.
 */
@FunctionalInterface
public interface ProviderFactory {

    CapabilityProvider create(String name, ProviderContext context);
}
