package com.example.chatrelay.store;

import com.example.chatrelay.model.ChatMessage;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Optional;

public interface StoreClient {
    boolean isConfigured();
    void insert(ChatMessage message);
    List<ChatMessage> findByUser(String userId, Sort.Direction timestampOrder, int skip, int limit);
    long countByUser(String userId);
    List<String> distinctUserIds(int skip, int limit);
    void ping();

    default Optional<ChatMessage> latestByUser(String userId) {
        return findByUser(userId, Sort.Direction.DESC, 0, 1).stream().findFirst();
    }

    default Optional<ChatMessage> earliestByUser(String userId) {
        return findByUser(userId, Sort.Direction.ASC, 0, 1).stream().findFirst();
    }
}
