package com.example.chatrelay.kv;

import java.time.Duration;
import java.util.Optional;

public interface KvClient {
    Optional<String> get(String key);
    boolean setIfAbsent(String key, String value, Duration ttl);
}
