package com.autoagent.agent;

import com.autoagent.model.TaskDefinition;
import java.util.List;

/**
 * An agent state entry refilled from a provider operation whenever it is missing or empty.
 *
 * @param stateKey    The state entry to fill.
 * @param taskKeyword The source is only read if some task name contains this keyword.
 * @param provider    Provider to call.
 * @param operation   Operation to call, without parameters.
 */
public record InputSource(String stateKey, String taskKeyword, String provider, String operation) {

    public static final InputSource ROOM_INFO = new InputSource(AgentState.ROOM_INFO, "echochambers", "echochambers", "get-room-info");

    public static List<InputSource> defaults() {
        return List.of(ROOM_INFO);
    }

    public boolean isNeededBy(List<TaskDefinition> tasks) {
        return tasks.stream().anyMatch(task -> task.name().contains(taskKeyword));
    }
}
