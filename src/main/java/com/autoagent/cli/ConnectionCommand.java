package com.autoagent.cli;

import com.autoagent.agent.Agent;
import com.autoagent.cli.ui.Spinner;
import com.autoagent.dispatch.ActionResult;
import com.autoagent.dto.response.CommandResponse;
import com.autoagent.exception.AgentRuntimeException;
import com.autoagent.model.Operation;
import com.autoagent.model.OperationParameter;
import com.autoagent.provider.ProviderRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands that inspect, configure and call the loaded agent's connections.
 */
@ShellComponent
public class ConnectionCommand {

    private final AgentSession session;
    private final Spinner spinner;
    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public ConnectionCommand(AgentSession session, Spinner spinner) {
        this.session = session;
        this.spinner = spinner;
    }

    @ShellMethod(key = "list-connections", value = "List the loaded agent's connections and whether they are configured.")
    public String listConnections() {
        try {
            Map<String, Boolean> statuses = session.current().getRegistry().connectionStatuses();
            if (statuses.isEmpty()) {
                return CommandResponse.error("The loaded agent has no connections.").toAnsiString();
            }
            StringBuilder out = new StringBuilder("Available connections:");
            statuses.forEach((name, configured) -> out.append("\n")
                    .append(new CommandResponse(configured, "  " + name + (configured ? " (configured)" : " (not configured)")).toAnsiString()));
            return out.toString();
        } catch (AgentRuntimeException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "list-actions", value = "List the actions of a connection with their parameters.")
    public String listActions(@ShellOption(value = {"--connection", "-c"}, help = "The connection name.") String connection) {
        try {
            List<Operation> operations = session.current().getRegistry().describeActions(connection);
            StringBuilder out = new StringBuilder("Actions of " + connection + ":");
            for (Operation operation : operations) {
                out.append("\n  ").append(operation.name()).append(": ").append(operation.description());
                for (OperationParameter parameter : operation.parameters()) {
                    out.append("\n    - ").append(parameter.name())
                            .append(" (").append(parameter.type().getDisplayName())
                            .append(parameter.required() ? ", required" : ", optional").append("): ")
                            .append(parameter.description());
                }
            }
            return out.toString();
        } catch (AgentRuntimeException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "configure-connection", value = "Set up the credentials of a connection.")
    public String configureConnection(@ShellOption(value = {"--connection", "-c"}, help = "The connection name.") String connection) {
        try {
            boolean configured = session.current().getRegistry().configure(connection);
            return configured
                    ? CommandResponse.ok("Successfully configured connection: " + connection).toAnsiString()
                    : CommandResponse.error("Error configuring connection: " + connection).toAnsiString();
        } catch (AgentRuntimeException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    /**
     * Calls one connection action with positional parameters, e.g.
     * {@code connection-action -c echo -a say -p hello}.
     */
    @ShellMethod(key = "connection-action", value = "Run a connection action with positional parameters.")
    public String connectionAction(
            @ShellOption(value = {"--connection", "-c"}, help = "The connection name.") String connection,
            @ShellOption(value = {"--action", "-a"}, help = "The action name.") String action,
            @ShellOption(value = {"--params", "-p"}, arity = Integer.MAX_VALUE, defaultValue = ShellOption.NULL,
                    help = "Parameter values in declaration order.") String[] params
    ) {
        try {
            Agent agent = session.current();
            List<String> positional = params == null ? List.of() : Arrays.asList(params);
            ProviderRegistry registry = agent.getRegistry();
            ActionResult result = spinner.spin(connection + " " + action, () -> registry.dispatch(connection, action, positional));
            return render(result).toAnsiString();
        } catch (AgentRuntimeException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    CommandResponse render(ActionResult result) {
        if (!result.isSuccess()) {
            StringBuilder message = new StringBuilder(result.getKind() + ": " + result.getDetail());
            result.getViolations().forEach(violation -> message.append("\n  - ").append(violation));
            return CommandResponse.error(message.toString());
        }
        Object value = result.getValue();
        if (value == null || value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return CommandResponse.ok("Result: " + value);
        }
        try {
            return CommandResponse.ok("Result:\n" + jsonMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            return CommandResponse.ok("Result: " + value);
        }
    }
}
