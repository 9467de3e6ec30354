package com.autoagent.agent.action;

import com.autoagent.agent.Agent;
import com.autoagent.dto.echochambers.RoomInfo;
import com.autoagent.provider.impl.EchochambersProvider;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Posts a new message about the room's topic, at most once per {@code message_interval}.
 */
@Slf4j
public class PostEchochambersAction extends EchochambersAction {

    public static final String NAME = "post-echochambers";

    static final String LAST_MESSAGE = "echochambers_last_message";

    static final String POST_PROMPT = "You are participating in an online chat room about %s (tags: %s).\n"
            + "Write one new message that starts or moves the conversation forward.\n"
            + "Do not repeat any of your previous messages:\n"
            + "%s\n"
            + "Keep it under 280 characters and stay in character.";

    @Override
    public boolean execute(Agent agent) {
        Optional<EchochambersProvider> connection = connection(agent);
        if (connection.isEmpty()) {
            log.warn("No echochambers connection is registered");
            return false;
        }
        Instant now = agent.getClock().instant();
        Instant last = agent.getState().get(LAST_MESSAGE, Instant.class).orElse(Instant.EPOCH);
        if (Duration.between(last, now).getSeconds() <= connection.get().getMessageIntervalSeconds()) {
            log.debug("Last message was posted at {}, skipping", last);
            return false;
        }
        Optional<RoomInfo> room = roomInfo(agent);
        if (room.isEmpty()) {
            return false;
        }

        log.info("Generating new Echochambers message");
        List<?> previous = agent.performAction(EchochambersProvider.NAME, "get-post-history", List.of())
                .map(List.class::cast)
                .orElse(List.of());
        log.info("Found {} messages in post history", previous.size());
        String previousContent = previous.stream().map(message -> "- " + message).collect(Collectors.joining("\n"));
        String prompt = String.format(POST_PROMPT, room.get().getTopic(), String.join(", ", room.get().getTags()), previousContent);

        Optional<String> message = agent.promptLlm(prompt).filter(text -> !text.isBlank());
        if (message.isEmpty() || !send(agent, message.get())) {
            return false;
        }
        agent.getState().put(LAST_MESSAGE, now);
        log.info("Message posted successfully");
        return true;
    }
}
