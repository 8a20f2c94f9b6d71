package com.example.chatrelay.service;

import com.example.chatrelay.kv.KvClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Drops webhook redeliveries of a message the provider already sent us, keyed by its message
 * sid. Off by default. If the KV store cannot be reached the message is treated as new.
 */
@Service
public class InboundDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(InboundDeduplicator.class);

    static final String KEY_PREFIX = "webhook:seen:";

    private final KvClient kvClient;

    @Value("${chatrelay.webhook.dedupe.enabled:false}")
    private boolean enabled;

    @Value("${chatrelay.webhook.dedupe.ttl-seconds:86400}")
    private long ttlSeconds;

    public InboundDeduplicator(KvClient kvClient) {
        this.kvClient = kvClient;
    }

    public boolean isFirstDelivery(String messageSid, String userId) {
        if (!enabled || messageSid == null || messageSid.isBlank()) {
            return true;
        }
        try {
            boolean first = kvClient.setIfAbsent(KEY_PREFIX + messageSid, userId == null ? "" : userId,
                    Duration.ofSeconds(ttlSeconds));
            if (!first) {
                logger.info("Ignoring redelivered message {} from {}", messageSid, userId);
            }
            return first;
        } catch (Exception e) {
            logger.warn("Dedupe check failed for {}, processing anyway: {}", messageSid, e.getMessage());
            return true;
        }
    }
}
