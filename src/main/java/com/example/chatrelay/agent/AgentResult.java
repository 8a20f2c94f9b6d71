package com.example.chatrelay.agent;

/**
 * Outcome of one agent call: either a reply text or an error kind the caller recovers from.
 */
public class AgentResult {

    public enum ErrorKind {
        NOT_CONFIGURED,
        EMPTY_REPLY,
        UPSTREAM
    }

    private final String text;
    private final ErrorKind errorKind;
    private final String message;

    private AgentResult(String text, ErrorKind errorKind, String message) {
        this.text = text;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static AgentResult success(String text) {
        return new AgentResult(text, null, null);
    }

    public static AgentResult failure(ErrorKind kind, String message) {
        return new AgentResult(null, kind, message);
    }

    public boolean isSuccess() { return errorKind == null; }
    public String getText() { return text; }
    public ErrorKind getErrorKind() { return errorKind; }
    public String getMessage() { return message; }

    /**
     * Reply text on success, {@code fallback} otherwise.
     */
    public String textOr(String fallback) {
        return isSuccess() ? text : fallback;
    }
}
