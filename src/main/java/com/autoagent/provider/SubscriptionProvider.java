package com.autoagent.provider;

import com.autoagent.agent.SubscriptionSource;

/**
 * Implemented by providers that can push events to the agent, such as mentions in a chat room.
 */
public interface SubscriptionProvider {

    /**
     * @param filter Only records whose text contains this string are delivered, e.g. {@code "@agent"}.
     * @return A source to be run by a background listener.
     */
    SubscriptionSource openSubscription(String filter);
}
