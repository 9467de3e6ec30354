package com.autoagent.agent.action;

import com.autoagent.agent.Agent;
import com.autoagent.dto.echochambers.RoomInfo;
import com.autoagent.dto.echochambers.RoomMessage;
import com.autoagent.provider.impl.EchochambersProvider;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Replies to the first message in the room history that comes from someone else and has not
 * been answered yet.
 */
@Slf4j
public class ReplyEchochambersAction extends EchochambersAction {

    public static final String NAME = "reply-echochambers";

    @Override
    public boolean execute(Agent agent) {
        Optional<EchochambersProvider> connection = connection(agent);
        Optional<RoomInfo> room = roomInfo(agent);
        if (connection.isEmpty() || room.isEmpty()) {
            return false;
        }
        log.info("Checking for messages to reply to");
        List<?> history = agent.performAction(EchochambersProvider.NAME, "get-room-history", List.of())
                .map(List.class::cast)
                .orElse(List.of());
        if (history.isEmpty()) {
            log.info("No messages in history");
            return false;
        }

        Set<String> replied = repliedMessages(agent);
        String self = connection.get().getSenderUsername();
        for (Object item : history) {
            RoomMessage message = (RoomMessage) item;
            String author = message.getSender() == null ? null : message.getSender().getUsername();
            if (message.getId() == null || author == null || message.getContent() == null || message.getContent().isEmpty()) {
                log.warn("Skipping message with missing fields: {}", message);
                continue;
            }
            if (self.equals(author) || replied.contains(message.getId())) {
                log.debug("Skipping message {} from {} (own message or already replied)", message.getId(), author);
                continue;
            }
            if (reply(agent, room.get(), author, message.getContent())) {
                replied.add(message.getId());
                log.info("Reply posted successfully");
                return true;
            }
            return false;
        }
        return false;
    }
}
