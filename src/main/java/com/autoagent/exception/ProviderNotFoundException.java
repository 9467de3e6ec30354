package com.autoagent.exception;

import com.autoagent.dispatch.ErrorKind;

/**
 * Raised when no provider is registered under the requested name.
 */
public class ProviderNotFoundException extends AgentRuntimeException {

    public ProviderNotFoundException(String message) {
        super(message);
    }

    public ProviderNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
