package com.example.chatrelay.model;

public enum Sender {
    USER("user"),
    AGENT("agent");

    private final String value;

    Sender(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
