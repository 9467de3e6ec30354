package com.autoagent.agent;

import com.autoagent.model.TaskDefinition;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * The autonomous behaviour of an agent: replenish inputs, pick a task, run it, wait, repeat.
 * <p>
 * An iteration that fails for any reason is logged and followed by the failure backoff; the
 * loop itself only ends through {@link #stop()} or an interrupt of the loop thread.
 */
@Slf4j
public class AgentLoop {

    public enum Status { IDLE, RUNNING, STOPPED }

    private final Agent agent;
    private final List<InputSource> inputSources;
    private final Sleeper sleeper;
    private final Duration successDelay;
    private final Duration failureBackoff;
    private final int countdownSeconds;

    private volatile Status status = Status.IDLE;
    private volatile Thread loopThread;
    private long iterations;

    public AgentLoop(Agent agent, List<InputSource> inputSources, Sleeper sleeper,
                     Duration failureBackoff, int countdownSeconds) {
        this.agent = agent;
        this.inputSources = List.copyOf(inputSources);
        this.sleeper = sleeper;
        this.successDelay = Duration.ofSeconds(agent.getDefinition().getLoopDelay());
        this.failureBackoff = failureBackoff;
        this.countdownSeconds = countdownSeconds;
    }

    /**
     * Runs on the calling thread until stopped.
     *
     * @throws com.autoagent.exception.NotConfiguredException if the agent has no configured LLM provider.
     */
    public void run() {
        if (agent.getModelProvider().isEmpty()) {
            agent.setupLlmProvider();
        }
        loopThread = Thread.currentThread();
        status = Status.RUNNING;
        log.info("Starting agent loop for {}. Press Ctrl+C at any time to stop the loop.", agent.getName());
        try {
            countdown();
            while (status == Status.RUNNING && !Thread.currentThread().isInterrupted()) {
                boolean success = iterate();
                Duration pause = success ? successDelay : failureBackoff;
                log.info("Waiting {} seconds before next loop...", pause.toSeconds());
                sleeper.sleep(pause);
            }
        } catch (InterruptedException e) {
            if (status == Status.RUNNING) {
                Thread.currentThread().interrupt();
            }
        } finally {
            status = Status.STOPPED;
            loopThread = null;
            log.info("Agent loop stopped after {} iteration(s).", iterations);
        }
    }

    /**
     * Requests the loop to end. Interrupts a pause in progress when called from another thread.
     */
    public void stop() {
        status = Status.STOPPED;
        Thread thread = loopThread;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
        }
    }

    public Status getStatus() {
        return status;
    }

    public boolean isRunning() {
        return status == Status.RUNNING;
    }

    public long getIterations() {
        return iterations;
    }

    /**
     * @return whether the selected task reported success.
     */
    boolean iterate() {
        iterations++;
        try {
            int received = agent.getState().drainInbox();
            if (received > 0) {
                log.info("Received {} new record(s) from subscriptions", received);
            }
            replenishInputs();
            TaskDefinition task = agent.selectTask();
            log.info("Selected task {}", task.name());
            return agent.runAction(task.name());
        } catch (Exception e) {
            log.error("Error in agent loop iteration: {}", e.getMessage(), e);
            return false;
        }
    }

    private void replenishInputs() {
        AgentState state = agent.getState();
        List<TaskDefinition> tasks = agent.getScheduler().getTasks();
        for (InputSource source : inputSources) {
            if (state.isEmpty(source.stateKey()) && source.isNeededBy(tasks)) {
                log.info("Reading {} from {}", source.stateKey(), source.provider());
                agent.performNamedAction(source.provider(), source.operation(), Map.of())
                        .ifPresent(value -> state.put(source.stateKey(), value));
            }
        }
    }

    private void countdown() throws InterruptedException {
        if (countdownSeconds <= 0) {
            return;
        }
        log.info("Starting loop in {} seconds...", countdownSeconds);
        for (int i = countdownSeconds; i > 0 && status == Status.RUNNING; i--) {
            log.info("{}...", i);
            sleeper.sleep(Duration.ofSeconds(1));
        }
    }
}
