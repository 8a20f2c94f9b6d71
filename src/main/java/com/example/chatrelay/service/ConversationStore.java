package com.example.chatrelay.service;

import com.example.chatrelay.model.ChatMessage;
import com.example.chatrelay.model.Sender;
import com.example.chatrelay.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Best-effort append of conversation turns. A failed or skipped write never reaches the caller,
 * so a store outage cannot keep a user from getting a reply.
 */
@Service
public class ConversationStore {

    private static final Logger logger = LoggerFactory.getLogger(ConversationStore.class);

    private final StoreClient storeClient;

    public ConversationStore(StoreClient storeClient) {
        this.storeClient = storeClient;
    }

    public void record(String userId, String text, Sender sender, Instant timestamp, String sessionId) {
        record(userId, text, sender, timestamp, null, null, sessionId);
    }

    public void record(String userId, String text, Sender sender, Instant timestamp,
                       String audioUrl, String mediaType, String sessionId) {
        ChatMessage message = ChatMessage.builder()
                .userId(userId)
                .message(text)
                .sender(sender.getValue())
                .timestamp(timestamp)
                .sessionId(sessionId != null ? sessionId : ChatMessage.defaultSessionId(userId))
                .audioUrl(isBlank(audioUrl) ? null : audioUrl)
                .mediaType(isBlank(mediaType) ? null : mediaType)
                .build();
        append(message);
    }

    public void append(ChatMessage message) {
        if (!storeClient.isConfigured()) {
            logger.debug("Store not configured, skipping {} message for {}", message.getSender(), message.getUserId());
            return;
        }
        try {
            storeClient.insert(message);
            logger.debug("Stored {} message for {} in session {}", message.getSender(), message.getUserId(), message.getSessionId());
        } catch (Exception e) {
            logger.warn("Skipping store insert for {} due to error: {}", message.getUserId(), e.getMessage(), e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
