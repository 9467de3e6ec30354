package com.autoagent.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, parameter-typed function exposed by a capability provider.
 * <p>
 * Operations are immutable once their provider has been initialized. The parameter list is
 * ordered: positional invocations are mapped onto it front to back.
 *
 * @param name        Operation name, unique within its provider (e.g. {@code "generate-text"}).
 * @param description Human-readable description.
 * @param parameters  Declared parameters, in positional order.
 * @param handler     The function executed once the parameters are valid.
 */
public record Operation(String name, String description, List<OperationParameter> parameters, OperationHandler handler) {

    public Operation {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static Operation of(String name, String description, OperationHandler handler, OperationParameter... parameters) {
        return new Operation(name, description, List.of(parameters), handler);
    }
}
