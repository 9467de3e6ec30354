package com.autoagent.cli;

import com.autoagent.agent.Agent;
import com.autoagent.cli.ui.Spinner;
import com.autoagent.dispatch.ActionDispatcher;
import com.autoagent.dispatch.ActionResult;
import com.autoagent.dispatch.ErrorKind;
import com.autoagent.dto.response.CommandResponse;
import com.autoagent.exception.NotConfiguredException;
import com.autoagent.provider.InMemoryCredentialStore;
import com.autoagent.provider.ProviderCatalog;
import com.autoagent.provider.ProviderContext;
import com.autoagent.provider.ProviderRegistry;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConnectionCommandTest {

    @Mock
    private AgentSession session;

    @Mock
    private Spinner spinner;

    @Mock
    private Agent agent;

    @InjectMocks
    private ConnectionCommand connectionCommand;

    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        ProviderContext context = new ProviderContext(new InMemoryCredentialStore(), WebClient.create(), question -> "n", null);
        registry = new ProviderRegistry(new ProviderCatalog(), context, new ActionDispatcher());
        registry.register("echo", Map.of("name", "echo"));
    }

    @Test
    void connectionAction_shouldPrintEchoedText() {
        // --- Arrange ---
        givenLoadedAgent();
        when(spinner.spin(anyString(), any())).thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(1)).get());

        // --- Act ---
        String output = connectionCommand.connectionAction("echo", "say", new String[]{"hello"});

        // --- Assert ---
        assertThat(output).isEqualTo(CommandResponse.ok("Result: hello").toAnsiString());
        verify(spinner).spin(eq("echo say"), any());
    }

    @Test
    void connectionAction_shouldListMissingParameters() {
        givenLoadedAgent();
        when(spinner.spin(anyString(), any())).thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(1)).get());

        String output = connectionCommand.connectionAction("echo", "say", null);

        assertThat(output)
                .startsWith("\u001B[31m")
                .contains("INVALID_PARAMETERS")
                .contains("\n  - Missing required parameter: text");
    }

    @Test
    void connectionAction_shouldExplainWhenNoAgentIsLoaded() {
        when(session.current()).thenThrow(new NotConfiguredException("No agent is currently loaded. Use 'load-agent' to load an agent."));

        String output = connectionCommand.connectionAction("echo", "say", new String[]{"hello"});

        assertThat(output).isEqualTo(CommandResponse.error("No agent is currently loaded. Use 'load-agent' to load an agent.").toAnsiString());
        verifyNoInteractions(spinner);
    }

    @Test
    void listActions_shouldDescribeParameters() {
        givenLoadedAgent();

        String output = connectionCommand.listActions("echo");

        assertThat(output)
                .contains("say: Return the given text unchanged")
                .contains("- text (string, required): The text to echo back");
    }

    @Test
    void listActions_shouldReportUnknownConnection() {
        givenLoadedAgent();

        assertThat(connectionCommand.listActions("ghost")).contains("Unknown connection 'ghost'");
    }

    @Test
    void listConnections_shouldShowConfiguredFlag() {
        givenLoadedAgent();

        assertThat(connectionCommand.listConnections()).contains("echo (configured)");
    }

    @Test
    void render_shouldPrintStructuredValuesAsJson() {
        CommandResponse response = connectionCommand.render(ActionResult.ok(Map.of("topic", "agents")));

        assertThat(response.success()).isTrue();
        assertThat(response.message()).startsWith("Result:\n{").contains("\"topic\" : \"agents\"");
    }

    @Test
    void render_shouldPrintKindAndDetailOfFailures() {
        CommandResponse response = connectionCommand.render(ActionResult.failure(ErrorKind.NOT_FOUND, "Unknown connection 'ghost'"));

        assertThat(response.success()).isFalse();
        assertThat(response.message()).isEqualTo("NOT_FOUND: Unknown connection 'ghost'");
    }

    @Test
    void render_shouldPrintEmptyListsAsJson() {
        assertThat(connectionCommand.render(ActionResult.ok(List.of())).message()).isEqualTo("Result:\n[ ]");
    }

    private void givenLoadedAgent() {
        when(session.current()).thenReturn(agent);
        when(agent.getRegistry()).thenReturn(registry);
    }
}
