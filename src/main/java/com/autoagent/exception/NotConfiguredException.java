package com.autoagent.exception;

import com.autoagent.dispatch.ErrorKind;

/**
 * Raised when a provider is known but its credentials or endpoint are not usable.
 */
public class NotConfiguredException extends AgentRuntimeException {

    public NotConfiguredException(String message) {
        super(message);
    }

    public NotConfiguredException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_CONFIGURED;
    }
}
