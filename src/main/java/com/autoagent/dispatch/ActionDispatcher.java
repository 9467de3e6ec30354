package com.autoagent.dispatch;

import com.autoagent.exception.AgentRuntimeException;
import com.autoagent.model.Operation;
import com.autoagent.model.OperationParameter;
import com.autoagent.provider.CapabilityProvider;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates, coerces and routes one invocation to a provider operation, and normalizes whatever
 * happens into an {@link ActionResult}.
 * <p>
 * The dispatcher never throws for failures of the invocation itself. Typed runtime exceptions
 * become failures of their own kind; anything else raised by a provider is reported as
 * {@link ErrorKind#PROVIDER_ERROR}.
 */
@Slf4j
public class ActionDispatcher {

    /**
     * Maps positional values onto an operation's parameters in declaration order.
     * <p>
     * Values beyond the declared parameter count are dropped; parameters with no value left are
     * omitted. Callers are expected to supply values in declared order, required ones first.
     *
     * @param operation  The target operation.
     * @param positional The values, front to back.
     * @return Named parameters, in declaration order.
     */
    public static Map<String, Object> bindPositional(Operation operation, List<?> positional) {
        Map<String, Object> named = new LinkedHashMap<>();
        List<OperationParameter> parameters = operation.parameters();
        int count = Math.min(parameters.size(), positional == null ? 0 : positional.size());
        for (int i = 0; i < count; i++) {
            named.put(parameters.get(i).name(), positional.get(i));
        }
        if (positional != null && positional.size() > parameters.size()) {
            log.debug("Dropping {} extra positional value(s) for '{}'", positional.size() - parameters.size(), operation.name());
        }
        return named;
    }

    /**
     * Invokes an operation with named parameters.
     *
     * @param provider      A configured provider.
     * @param operationName The operation to run.
     * @param params        Raw parameters keyed by name. Not modified.
     * @return The operation's value, or the typed failure.
     */
    public ActionResult invoke(CapabilityProvider provider, String operationName, Map<String, Object> params) {
        Optional<Operation> operation = provider.findOperation(operationName);
        if (operation.isEmpty()) {
            return ActionResult.failure(ErrorKind.UNKNOWN_OPERATION,
                    "Unknown action '" + operationName + "' for connection '" + provider.getName() + "'");
        }
        try {
            Map<String, Object> coerced = ParameterValidator.validate(operation.get(), params == null ? Map.of() : params);
            return ActionResult.ok(provider.performAction(operationName, coerced));
        } catch (AgentRuntimeException e) {
            return ActionResult.from(e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {} {}", provider.getName(), operationName, e);
            return ActionResult.failure(ErrorKind.PROVIDER_ERROR,
                    provider.getName() + " " + operationName + " failed: " + e.getMessage());
        }
    }
}
