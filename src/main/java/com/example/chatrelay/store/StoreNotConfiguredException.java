package com.example.chatrelay.store;

public class StoreNotConfiguredException extends RuntimeException {
    public StoreNotConfiguredException(String message) {
        super(message);
    }
}
