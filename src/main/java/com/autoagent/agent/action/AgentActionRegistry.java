package com.autoagent.agent.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps task names to the actions they run.
 */
public class AgentActionRegistry {

    private final Map<String, AgentAction> actions = new LinkedHashMap<>();

    /**
     * @return a registry holding {@code post-echochambers}, {@code reply-echochambers} and
     *         {@code process-mentions}.
     */
    public static AgentActionRegistry withBundledActions() {
        AgentActionRegistry registry = new AgentActionRegistry();
        registry.register(PostEchochambersAction.NAME, new PostEchochambersAction());
        registry.register(ReplyEchochambersAction.NAME, new ReplyEchochambersAction());
        registry.register(ProcessMentionsAction.NAME, new ProcessMentionsAction());
        return registry;
    }

    public AgentActionRegistry register(String name, AgentAction action) {
        actions.put(name, action);
        return this;
    }

    public Optional<AgentAction> find(String name) {
        return Optional.ofNullable(actions.get(name));
    }

    public boolean contains(String name) {
        return actions.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(actions.keySet());
    }
}
