package com.autoagent.dispatch;

import com.autoagent.exception.AgentRuntimeException;
import com.autoagent.exception.InvalidParametersException;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of dispatching one action: either a value or a typed failure.
 * <p>
 * This is what the provider registry returns instead of throwing, so call sites can branch
 * on {@link #getKind()} without catching exceptions. Failures produced from an
 * {@link InvalidParametersException} keep the full list of violations.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ActionResult {

    private final boolean success;
    private final Object value;
    private final ErrorKind kind;
    private final String detail;
    private final List<String> violations;

    public static ActionResult ok(Object value) {
        return new ActionResult(true, value, null, null, List.of());
    }

    public static ActionResult failure(ErrorKind kind, String detail) {
        return new ActionResult(false, null, kind, detail, List.of());
    }

    public static ActionResult failure(ErrorKind kind, String detail, List<String> violations) {
        return new ActionResult(false, null, kind, detail, List.copyOf(violations));
    }

    /**
     * Converts a runtime exception raised below the dispatch boundary into a failure result.
     */
    public static ActionResult from(AgentRuntimeException e) {
        if (e instanceof InvalidParametersException invalid) {
            return failure(invalid.getKind(), invalid.getMessage(), invalid.getViolations());
        }
        return failure(e.getKind(), e.getMessage());
    }

    /**
     * @return the value when successful and non-null, otherwise empty.
     */
    public Optional<Object> toOptional() {
        return success ? Optional.ofNullable(value) : Optional.empty();
    }

    @Override
    public String toString() {
        return success ? "Ok(" + value + ")" : "Err(" + kind + ", " + detail + ")";
    }
}
