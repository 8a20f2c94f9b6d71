package com.example.chatrelay.controller;

import com.example.chatrelay.channel.TwilioClient;
import com.example.chatrelay.kv.KvClient;
import com.example.chatrelay.store.StoreClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final StoreClient storeClient;
    private final TwilioClient twilioClient;
    private final boolean dedupeEnabled;

    public HealthController(KvClient kvClient, StoreClient storeClient, TwilioClient twilioClient,
                            @Value("${chatrelay.webhook.dedupe.enabled:false}") boolean dedupeEnabled) {
        this.kvClient = kvClient;
        this.storeClient = storeClient;
        this.twilioClient = twilioClient;
        this.dedupeEnabled = dedupeEnabled;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "chat-relay");
        health.put("version", "0.1.0");
        health.put("twilio", twilioClient.isConfigured() ? "CONFIGURED" : "NOT_CONFIGURED");

        // Redis is only used for webhook dedupe
        if (dedupeEnabled) {
            try {
                kvClient.get("health-check");
                health.put("redis", "UP");
            } catch (Exception e) {
                health.put("redis", "DOWN");
                health.put("redisError", e.getMessage());
            }
        } else {
            health.put("redis", "DISABLED");
        }

        if (!storeClient.isConfigured()) {
            health.put("mongodb", "NOT_CONFIGURED");
        } else {
            try {
                storeClient.ping();
                health.put("mongodb", "UP");
            } catch (Exception e) {
                health.put("mongodb", "DOWN");
                health.put("mongodbError", e.getMessage());
            }
        }

        return ResponseEntity.ok(health);
    }

    @GetMapping(value = "/actuator/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
