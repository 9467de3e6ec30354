package com.autoagent.model;

/**
 * Declares one parameter of an {@link Operation}.
 * <p>
 * The same declaration drives the {@code list-actions} documentation and the runtime
 * validation and coercion of invocation values.
 *
 * @param name        Parameter name, unique within its operation.
 * @param required    Whether an invocation without this parameter must be rejected.
 * @param type        The kind the raw value is coerced to before the handler runs.
 * @param description Human-readable description.
 */
public record OperationParameter(String name, boolean required, ParameterType type, String description) {

    public static OperationParameter required(String name, ParameterType type, String description) {
        return new OperationParameter(name, true, type, description);
    }

    public static OperationParameter optional(String name, ParameterType type, String description) {
        return new OperationParameter(name, false, type, description);
    }
}
