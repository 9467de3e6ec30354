package com.autoagent.agent;

import java.time.Instant;

/**
 * A normalized event received by a background subscription, such as a mention of the agent.
 *
 * @param source     Name of the provider the record came from.
 * @param id         Identifier of the underlying message, unique within its source.
 * @param author     Who wrote it.
 * @param content    The message text.
 * @param receivedAt When the listener picked it up.
 */
public record InboundRecord(String source, String id, String author, String content, Instant receivedAt) {
}
