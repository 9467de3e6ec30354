package com.autoagent.agent;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.assertThat;

class AgentStateTest {

    @Test
    void idSet_shouldBeCreatedOnceAndKeptPerName() {
        AgentState state = new AgentState();

        state.idSet("replied").add("m1");
        state.idSet("replied").add("m2");
        state.idSet("liked").add("m9");

        assertThat(state.idSet("replied")).containsExactlyInAnyOrder("m1", "m2");
        assertThat(state.idSet("liked")).containsExactly("m9");
        assertThat(state.idSet("unused")).isEmpty();
    }

    @Test
    void drainInbox_shouldQueueMentionsOldestFirst() {
        // --- Arrange ---
        AgentState state = new AgentState();
        state.inbox().offer(record("m1"));
        state.inbox().offer(record("m2"));

        // --- Act ---
        int moved = state.drainInbox();

        // --- Assert ---
        assertThat(moved).isEqualTo(2);
        assertThat(state.inbox()).isEmpty();
        assertThat(state.pendingMentionCount()).isEqualTo(2);
        assertThat(state.pollMention()).map(InboundRecord::id).contains("m1");
        assertThat(state.pollMention()).map(InboundRecord::id).contains("m2");
        assertThat(state.pollMention()).isEmpty();
    }

    private static InboundRecord record(String id) {
        return new InboundRecord("echochambers", id, "bob", "hi @bot", Instant.parse("2024-01-01T10:00:00Z"));
    }
}
