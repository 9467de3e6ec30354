package com.autoagent.agent;

import java.util.function.Consumer;

/**
 * A long-lived stream of inbound records.
 * <p>
 * {@link #stream(Consumer)} blocks, handing every record to the sink, until the stream ends or
 * the calling thread is interrupted.
 */
@FunctionalInterface
public interface SubscriptionSource {

    void stream(Consumer<InboundRecord> sink) throws Exception;
}
