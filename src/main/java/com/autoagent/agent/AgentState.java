package com.autoagent.agent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * The agent's working memory for the lifetime of the process.
 * <p>
 * Values are read and written on the loop thread only. Background listeners never touch them:
 * they offer records to the {@link #inbox()}, which the loop moves into the state with
 * {@link #drainInbox()} at the start of every iteration.
 */
public class AgentState {

    public static final String ROOM_INFO = "room_info";

    static final int INBOX_CAPACITY = 1000;

    private final Map<String, Object> values = new HashMap<>();
    private final BlockingQueue<InboundRecord> inbox = new LinkedBlockingQueue<>(INBOX_CAPACITY);
    private final Deque<InboundRecord> pendingMentions = new ArrayDeque<>();
    private final Map<String, Set<String>> idSets = new HashMap<>();

    public Object get(String key) {
        return values.get(key);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public void put(String key, Object value) {
        values.put(key, value);
    }

    public void remove(String key) {
        values.remove(key);
    }

    /**
     * A named set of IDs the agent remembers, such as the messages it already replied to.
     * Created empty on first use.
     */
    public Set<String> idSet(String name) {
        return idSets.computeIfAbsent(name, k -> new HashSet<>());
    }

    /**
     * @return {@code true} if the key is absent, {@code null}, or holds an empty string, collection or map.
     */
    public boolean isEmpty(String key) {
        Object value = values.get(key);
        if (value == null) {
            return true;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return value instanceof CharSequence text && text.length() == 0;
    }

    /**
     * The hand-off point for background listeners. Safe to use from any thread.
     */
    public BlockingQueue<InboundRecord> inbox() {
        return inbox;
    }

    /**
     * Moves every record waiting in the inbox to the pending mentions, oldest first.
     *
     * @return the number of records moved.
     */
    public int drainInbox() {
        List<InboundRecord> drained = new ArrayList<>();
        inbox.drainTo(drained);
        if (!drained.isEmpty()) {
            pendingMentions.addAll(drained);
        }
        return drained.size();
    }

    /**
     * Takes the oldest pending mention.
     */
    public Optional<InboundRecord> pollMention() {
        return Optional.ofNullable(pendingMentions.pollFirst());
    }

    public int pendingMentionCount() {
        return pendingMentions.size();
    }
}
