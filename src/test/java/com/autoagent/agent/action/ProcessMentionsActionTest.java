package com.autoagent.agent.action;

import com.autoagent.agent.InboundRecord;
import com.autoagent.provider.impl.EchochambersProvider;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class ProcessMentionsActionTest {

    private EchochambersActionFixture fixture;
    private final ProcessMentionsAction action = new ProcessMentionsAction();

    @BeforeEach
    void setUp() {
        fixture = new EchochambersActionFixture();
        when(fixture.agent.subscribe(EchochambersProvider.NAME, "@bot")).thenReturn(true);
    }

    @Test
    void execute_shouldSubscribeAndAnswerPendingMention() {
        // --- Arrange ---
        fixture.withRoom();
        fixture.state.inbox().add(new InboundRecord("echochambers", "m7", "carol", "@bot are you awake?", Instant.EPOCH));
        fixture.state.drainInbox();
        when(fixture.agent.promptLlm(contains("@bot are you awake?"))).thenReturn(Optional.of("Always."));
        when(fixture.agent.performAction(EchochambersProvider.NAME, "send-message", List.of("Always.")))
                .thenReturn(Optional.of(Map.of("id", "r7")));

        // --- Act ---
        boolean answered = action.execute(fixture.agent);
        boolean idle = action.execute(fixture.agent);

        // --- Assert ---
        assertThat(answered).isTrue();
        assertThat(idle).isFalse();
        verify(fixture.agent, times(2)).subscribe(EchochambersProvider.NAME, "@bot");
        verify(fixture.agent, times(1)).promptLlm(anyString());
    }

    @Test
    void execute_shouldKeepMentionsUntilRoomInfoIsLoaded() {
        fixture.state.inbox().add(new InboundRecord("echochambers", "m8", "dave", "@bot hi", Instant.EPOCH));
        fixture.state.drainInbox();

        assertThat(action.execute(fixture.agent)).isFalse();
        assertThat(fixture.state.pollMention()).map(InboundRecord::id).contains("m8");
        verify(fixture.agent, never()).promptLlm(anyString());
    }
}
