package com.autoagent.agent;

import java.time.Duration;

/**
 * Pauses the calling thread. Lets tests run the agent loop without real waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
