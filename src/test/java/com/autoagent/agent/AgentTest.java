package com.autoagent.agent;

import com.autoagent.agent.action.AgentActionRegistry;
import com.autoagent.dispatch.ActionDispatcher;
import com.autoagent.model.AgentDefinition;
import com.autoagent.model.Operation;
import com.autoagent.model.OperationParameter;
import com.autoagent.model.ParameterType;
import com.autoagent.model.TaskDefinition;
import com.autoagent.model.TimeWeightRule;
import com.autoagent.provider.ProviderCatalog;
import com.autoagent.provider.ProviderRegistry;
import com.autoagent.provider.StubProvider;
import com.autoagent.scheduler.TaskScheduler;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.assertThat;

class AgentTest {

    private final List<Map<String, Object>> llmCalls = new ArrayList<>();
    private ProviderRegistry registry;
    private AgentDefinition definition;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry(new ProviderCatalog(), null, new ActionDispatcher());
        definition = new AgentDefinition();
        definition.setName("scout");
        definition.setBio(List.of("You are Scout.", "You explore chat rooms."));
        definition.setTraits(List.of("Curious", "Brief"));
        definition.setExamples(List.of("What did I miss?"));
        definition.setTasks(List.of(new TaskDefinition("post-echochambers", 10), new TaskDefinition("reply-echochambers", 0)));
    }

    @Test
    void getSystemPrompt_shouldJoinBioTraitsAndExamples() {
        Agent agent = agent(12);

        assertThat(agent.getSystemPrompt()).isEqualTo("You are Scout.\n"
                + "You explore chat rooms.\n"
                + "\nYour key traits are:\n"
                + "- Curious\n"
                + "- Brief\n"
                + "\nHere are some examples of your style (Please avoid repeating any of these):\n"
                + "- What did I miss?");
    }

    @Test
    void promptLlm_shouldUseFirstConfiguredLlmWithPersona() {
        // --- Arrange ---
        StubProvider offline = StubProvider.initialized("offline-llm", true, generateText("unused"));
        offline.setConfigured(false);
        registry.register(StubProvider.initialized("echo", false));
        registry.register(offline);
        registry.register(StubProvider.initialized("online-llm", true, generateText("generated")));
        Agent agent = agent(12);

        // --- Act ---
        String text = agent.promptLlm("Say something").orElseThrow();

        // --- Assert ---
        assertThat(text).isEqualTo("generated");
        assertThat(agent.getModelProvider()).contains("online-llm");
        assertThat(llmCalls).hasSize(1);
        assertThat(llmCalls.get(0)).containsEntry("prompt", "Say something")
                .containsEntry("system_prompt", agent.getSystemPrompt());
    }

    @Test
    void performAction_shouldReturnEmptyOnFailure() {
        Agent agent = agent(12);

        assertThat(agent.performAction("ghost", "anything", List.of())).isEmpty();
        assertThat(agent.runAction("no-such-action")).isFalse();
    }

    @Test
    void selectTask_shouldReadHourFromClock() {
        definition.setUseTimeBasedWeights(true);
        definition.setTimeWeightRules(List.of(new TimeWeightRule("never-at-night", 0, 5, 0.0, List.of("post-echochambers"))));
        definition.setTasks(List.of(new TaskDefinition("post-echochambers", 10), new TaskDefinition("reply-echochambers", 1)));

        assertThat(agent(2).selectTask().name()).isEqualTo("reply-echochambers");
    }

    private Operation generateText(String result) {
        return Operation.of("generate-text", "Generate text", params -> {
            llmCalls.add(params);
            return result;
        }, OperationParameter.required("prompt", ParameterType.STRING, "Prompt"),
                OperationParameter.required("system_prompt", ParameterType.STRING, "System prompt"));
    }

    private Agent agent(int hour) {
        TaskScheduler scheduler = new TaskScheduler(definition.getTasks(), definition.getEffectiveTimeWeightRules(), new Random(5));
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z").plusSeconds(hour * 3600L), ZoneOffset.UTC);
        return new Agent(definition, registry, scheduler, new AgentActionRegistry(), clock, new Random(5));
    }
}
