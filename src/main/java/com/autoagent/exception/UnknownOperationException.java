package com.autoagent.exception;

import com.autoagent.dispatch.ErrorKind;

/**
 * Raised when a provider is asked to perform an operation it does not expose.
 */
public class UnknownOperationException extends AgentRuntimeException {

    public UnknownOperationException(String message) {
        super(message);
    }

    public UnknownOperationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UNKNOWN_OPERATION;
    }
}
