package com.autoagent.exception;

import com.autoagent.dispatch.ErrorKind;

/**
 * Signals missing or invalid settings or credentials, either for a provider or for an agent definition.
 * Never fatal to the process: the affected provider is left out or reported as unconfigured.
 */
public class ConfigurationException extends AgentRuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONFIGURATION;
    }
}
