package com.autoagent.model;

import java.util.Map;

/**
 * The function bound to an {@link Operation} when its provider registers it.
 * <p>
 * Handlers receive parameters that have already been validated and coerced, keyed by
 * parameter name. Optional parameters that were not supplied are absent from the map.
 */
@FunctionalInterface
public interface OperationHandler {

    Object handle(Map<String, Object> params) throws Exception;
}
