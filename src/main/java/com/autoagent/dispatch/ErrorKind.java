package com.autoagent.dispatch;

/**
 * Classifies why an action invocation did not produce a value.
 * <p>
 * Every failure that crosses the registry boundary is reported with exactly one of these kinds,
 * so callers can decide between reconfiguring, correcting their input, or simply retrying later.
 */
public enum ErrorKind {

    /**
     * Missing or invalid credentials or settings. Recoverable by reconfiguration.
     */
    CONFIGURATION,

    /**
     * No provider with the requested name is registered.
     */
    NOT_FOUND,

    /**
     * The provider exists but is not currently usable.
     */
    NOT_CONFIGURED,

    /**
     * The provider does not expose an operation with the requested name.
     */
    UNKNOWN_OPERATION,

    /**
     * One or more parameters were missing or could not be coerced to their declared type.
     */
    INVALID_PARAMETERS,

    /**
     * The downstream service failed while executing the operation.
     */
    PROVIDER_ERROR
}
