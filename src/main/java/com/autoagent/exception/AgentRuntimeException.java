package com.autoagent.exception;

import com.autoagent.dispatch.ErrorKind;

/**
 * Base runtime exception for errors raised inside the agent runtime.
 * <p>
 * Each subclass is bound to one {@link ErrorKind}, which is what the provider registry reports
 * to its callers once the exception has been caught at the dispatch boundary.
 */
public abstract class AgentRuntimeException extends RuntimeException {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message The detail message.
     */
    protected AgentRuntimeException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The underlying cause, may be {@code null}.
     */
    protected AgentRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the error kind reported for this exception at the registry boundary.
     */
    public abstract ErrorKind getKind();
}
