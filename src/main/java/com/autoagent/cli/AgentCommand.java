package com.autoagent.cli;

import com.autoagent.agent.Agent;
import com.autoagent.agent.AgentFactory;
import com.autoagent.agent.AgentLoop;
import com.autoagent.dto.response.CommandResponse;
import com.autoagent.exception.AgentRuntimeException;
import com.autoagent.service.api.AgentDefinitionService;
import java.util.List;
import java.util.Optional;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.springframework.context.annotation.Lazy;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands to pick an agent and run it.
 */
@ShellComponent
public class AgentCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";

    private final AgentDefinitionService definitions;
    private final AgentSession session;
    private final AgentFactory factory;
    private final Terminal terminal;
    private final LineReader lineReader;

    public AgentCommand(AgentDefinitionService definitions,
                        AgentSession session,
                        AgentFactory factory,
                        @Lazy Terminal terminal,
                        @Lazy LineReader lineReader) {
        this.definitions = definitions;
        this.session = session;
        this.factory = factory;
        this.terminal = terminal;
        this.lineReader = lineReader;
    }

    @ShellMethod(key = "list-agents", value = "List the agents found in the agents directory.")
    public String listAgents() {
        List<String> agents = definitions.listAgents();
        if (agents.isEmpty()) {
            return CommandResponse.error("No agents found. Create agent JSON files in the agents directory.").toAnsiString();
        }
        Optional<String> defaultAgent = definitions.getDefaultAgent();
        StringBuilder out = new StringBuilder("Available agents:");
        for (String agent : agents) {
            out.append("\n- ").append(agent);
            if (defaultAgent.filter(agent::equals).isPresent()) {
                out.append(" (default)");
            }
        }
        return out.toString();
    }

    @ShellMethod(key = "load-agent", value = "Load an agent from its definition file.")
    public String loadAgent(@ShellOption(value = {"--name", "-n"}, help = "The agent name, without .json.") String name) {
        try {
            Agent agent = session.load(name);
            return CommandResponse.ok("Successfully loaded agent: " + agent.getName()).toAnsiString();
        } catch (AgentRuntimeException e) {
            return CommandResponse.error("Error loading agent: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "set-default-agent", value = "Choose the agent loaded at startup.")
    public String setDefaultAgent(@ShellOption(value = {"--name", "-n"}, help = "The agent name, without .json.") String name) {
        try {
            definitions.setDefaultAgent(name);
            return CommandResponse.ok("Agent " + name + " is now set as default.").toAnsiString();
        } catch (AgentRuntimeException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "agent-action", value = "Run one of the agent's actions once, e.g. post-echochambers.")
    public String agentAction(@ShellOption(value = {"--action", "-a"}, help = "The action name.") String action) {
        try {
            boolean success = session.current().runAction(action);
            return success
                    ? CommandResponse.ok("Action " + action + " completed.").toAnsiString()
                    : CommandResponse.error("Action " + action + " did not complete. See the log for details.").toAnsiString();
        } catch (RuntimeException e) {
            return CommandResponse.error("Error running action: " + e.getMessage()).toAnsiString();
        }
    }

    /**
     * Runs the agent loop on the shell thread until Ctrl+C.
     */
    @ShellMethod(key = "agent-loop", value = "Start the agent's autonomous loop. Press Ctrl+C to stop.")
    public String agentLoop() {
        AgentLoop loop;
        try {
            loop = factory.createLoop(session.current());
        } catch (AgentRuntimeException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
        Terminal.SignalHandler previous = terminal.handle(Terminal.Signal.INT, signal -> loop.stop());
        try {
            loop.run();
            return CommandResponse.ok("Agent loop stopped by user.").toAnsiString();
        } catch (AgentRuntimeException e) {
            return CommandResponse.error("Error in agent loop: " + e.getMessage()).toAnsiString();
        } finally {
            terminal.handle(Terminal.Signal.INT, previous);
        }
    }

    /**
     * Talks to the agent's LLM with its persona until the user types {@code exit}.
     */
    @ShellMethod(key = "chat", value = "Start a chat session with the loaded agent.")
    public String chat() {
        try {
            Agent agent = session.current();
            if (agent.getModelProvider().isEmpty()) {
                agent.setupLlmProvider();
            }
            terminal.writer().println("Starting chat with " + agent.getName() + ". Type 'exit' to end the session.");
            while (true) {
                String input = lineReader.readLine(ANSI_CYAN + "You: " + ANSI_RESET).trim();
                if ("exit".equalsIgnoreCase(input)) {
                    return CommandResponse.ok("Chat session ended.").toAnsiString();
                }
                if (input.isEmpty()) {
                    continue;
                }
                String response = agent.promptLlm(input).orElse("(no response, see the log for details)");
                terminal.writer().println(ANSI_YELLOW + agent.getName() + ": " + ANSI_RESET + response);
                terminal.writer().flush();
            }
        } catch (UserInterruptException e) {
            return CommandResponse.ok("Chat session ended.").toAnsiString();
        } catch (AgentRuntimeException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }
}
