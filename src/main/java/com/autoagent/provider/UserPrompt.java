package com.autoagent.provider;

/**
 * Asks the operator a question during interactive configuration.
 */
@FunctionalInterface
public interface UserPrompt {

    String ask(String question);

    default boolean confirm(String question) {
        String answer = ask(question + " (y/n): ");
        return answer != null && "y".equalsIgnoreCase(answer.trim());
    }
}
