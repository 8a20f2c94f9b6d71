package com.example.chatrelay.controller;

public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
