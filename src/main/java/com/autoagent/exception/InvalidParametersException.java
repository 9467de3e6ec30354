package com.autoagent.exception;

import com.autoagent.dispatch.ErrorKind;
import java.util.List;

/**
 * Raised when an invocation fails parameter validation.
 * <p>
 * Carries every violation found in a single pass, so the caller can correct the whole
 * invocation at once instead of discovering problems one by one.
 */
public class InvalidParametersException extends AgentRuntimeException {

    private final List<String> violations;

    /**
     * @param violations Human-readable violation messages, in parameter declaration order.
     */
    public InvalidParametersException(List<String> violations) {
        super("Invalid parameters: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INVALID_PARAMETERS;
    }
}
