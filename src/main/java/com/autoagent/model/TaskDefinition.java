package com.autoagent.model;

/**
 * A weighted unit of schedulable behaviour, as declared in an agent definition.
 *
 * @param name   Name of the agent action this task runs.
 * @param weight Relative selection weight, never negative.
 */
public record TaskDefinition(String name, double weight) {
}
