package com.autoagent.agent.action;

import com.autoagent.agent.Agent;

/**
 * A unit of agent behaviour that a task can name.
 */
@FunctionalInterface
public interface AgentAction {

    /**
     * Runs the action once.
     *
     * @return {@code true} if the action did something, which makes the loop wait the regular
     *         delay; {@code false} makes it back off.
     */
    boolean execute(Agent agent);
}
