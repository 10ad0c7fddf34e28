package com.kgagent.dto.response;

/**
 * Outcome of a shell command: success flag plus a message for the terminal.
 */
public record CommandResponse(boolean success, String message) {

    /**
     * @return the message in green on success and red on failure.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
