package com.autoagent.dto.response;

/**
 * The outcome of a shell command, printed green on success and red on failure.
 *
 * @param success Whether the command did what was asked.
 * @param message What to show the user.
 */
public record CommandResponse(boolean success, String message) {

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse error(String message) {
        return new CommandResponse(false, message);
    }

    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
