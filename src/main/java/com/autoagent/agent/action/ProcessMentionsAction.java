package com.autoagent.agent.action;

import com.autoagent.agent.Agent;
import com.autoagent.agent.InboundRecord;
import com.autoagent.dto.echochambers.RoomInfo;
import com.autoagent.provider.impl.EchochambersProvider;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers mentions of the agent delivered by the background subscription.
 * <p>
 * The first run starts the subscription; every run answers at most one pending mention.
 */
@Slf4j
public class ProcessMentionsAction extends EchochambersAction {

    public static final String NAME = "process-mentions";

    @Override
    public boolean execute(Agent agent) {
        Optional<EchochambersProvider> connection = connection(agent);
        if (connection.isEmpty()) {
            log.warn("No echochambers connection is registered");
            return false;
        }
        agent.subscribe(EchochambersProvider.NAME, "@" + connection.get().getSenderUsername());
        Optional<RoomInfo> room = roomInfo(agent);
        if (room.isEmpty()) {
            return false;
        }

        Set<String> replied = repliedMessages(agent);
        Optional<InboundRecord> mention = agent.getState().pollMention();
        while (mention.isPresent() && replied.contains(mention.get().id())) {
            mention = agent.getState().pollMention();
        }
        if (mention.isEmpty()) {
            log.info("No pending mentions");
            return false;
        }
        InboundRecord record = mention.get();
        log.info("Received a mention from @{}", record.author());
        if (reply(agent, room.get(), record.author(), record.content())) {
            replied.add(record.id());
            return true;
        }
        return false;
    }
}
