package com.autoagent.dto.echochambers;

/**
 * Body of {@code POST /api/rooms/{room}/message}.
 *
 * @param content The message text.
 * @param sender  The agent's username and the model it reports.
 */
public record PostMessageRequest(String content, RoomMessage.Sender sender) {
}
