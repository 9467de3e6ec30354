package com.autoagent.dispatch;

import com.autoagent.exception.InvalidParametersException;
import com.autoagent.model.Operation;
import com.autoagent.model.OperationParameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates and coerces invocation parameters against an {@link Operation}'s declarations.
 * <p>
 * All violations are collected before failing. Coerced values are written into a new map, so
 * the caller's map is never modified and nothing from a failed validation reaches the handler.
 */
public final class ParameterValidator {

    private ParameterValidator() {
    }

    /**
     * @param operation The operation being invoked.
     * @param params    Raw parameters keyed by name.
     * @return A new map holding the coerced values of the declared parameters that were supplied.
     * @throws InvalidParametersException listing every missing or unconvertible parameter.
     */
    public static Map<String, Object> validate(Operation operation, Map<String, Object> params) {
        List<String> errors = new ArrayList<>();
        Map<String, Object> coerced = new LinkedHashMap<>();

        for (OperationParameter parameter : operation.parameters()) {
            Object raw = params.get(parameter.name());
            if (raw == null) {
                if (parameter.required()) {
                    errors.add("Missing required parameter: " + parameter.name());
                }
                continue;
            }
            try {
                coerced.put(parameter.name(), parameter.type().coerce(raw));
            } catch (IllegalArgumentException | ClassCastException e) {
                errors.add("Invalid type for " + parameter.name() + ". Expected " + parameter.type().getDisplayName());
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidParametersException(errors);
        }
        return coerced;
    }
}
