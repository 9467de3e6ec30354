package com.autoagent.exception;

import com.autoagent.dispatch.ErrorKind;

/**
 * Wraps a failure of the third-party service behind a provider.
 */
public class ProviderException extends AgentRuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PROVIDER_ERROR;
    }
}
