package com.autoagent.agent.action;

import com.autoagent.agent.Agent;
import com.autoagent.agent.AgentState;
import com.autoagent.dto.echochambers.RoomInfo;
import com.autoagent.provider.impl.EchochambersProvider;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared plumbing of the actions that talk in an Echochambers room.
 */
@Slf4j
abstract class EchochambersAction implements AgentAction {

    static final String REPLIED_MESSAGES = "echochambers_replied_messages";
    static final double REFER_USERNAME_PROBABILITY = 0.7;

    static final String REPLY_PROMPT = "You are engaging in an online chat room about %s (tags: %s).\n"
            + "Reply to this message from @%s:\n"
            + "\"%s\"\n"
            + "%s. Keep the reply under 280 characters and stay in character.";

    Optional<EchochambersProvider> connection(Agent agent) {
        return agent.getRegistry().find(EchochambersProvider.NAME)
                .filter(EchochambersProvider.class::isInstance)
                .map(EchochambersProvider.class::cast);
    }

    Optional<RoomInfo> roomInfo(Agent agent) {
        Optional<RoomInfo> room = agent.getState().get(AgentState.ROOM_INFO, RoomInfo.class);
        if (room.isEmpty()) {
            log.warn("Room info has not been loaded yet");
        }
        return room;
    }

    Set<String> repliedMessages(Agent agent) {
        return agent.getState().idSet(REPLIED_MESSAGES);
    }

    boolean send(Agent agent, String content) {
        log.info("Posting message: '{}'", abbreviate(content));
        return agent.performAction(EchochambersProvider.NAME, "send-message", List.of(content)).isPresent();
    }

    /**
     * Generates and posts a reply, mentioning the author most of the time.
     *
     * @return {@code true} if the reply was posted.
     */
    boolean reply(Agent agent, RoomInfo room, String author, String content) {
        log.info("Generating reply to @{}: {}", author, abbreviate(content));
        String addressing = agent.getRandom().nextDouble() < REFER_USERNAME_PROBABILITY
                ? "Refer to the sender by their @" + author
                : "Respond without directly referring to the sender";
        String prompt = String.format(REPLY_PROMPT, room.getTopic(), String.join(", ", room.getTags()), author, content, addressing);
        Optional<String> reply = agent.promptLlm(prompt).filter(text -> !text.isBlank());
        return reply.isPresent() && send(agent, reply.get());
    }

    static String abbreviate(String text) {
        return text.length() <= 69 ? text : text.substring(0, 69) + "...";
    }
}
