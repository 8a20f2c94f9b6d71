package com.example.chatrelay.agent;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.ai.chat.memory.ChatMemoryRepository;
import org.springframework.ai.chat.messages.Message;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Agent memory per session, bounded in the number of sessions kept and evicted after a
 * period without activity.
 */
@Component
public class CaffeineChatMemoryRepository implements ChatMemoryRepository {

    private final Cache<String, List<Message>> conversations;

    public CaffeineChatMemoryRepository(@Value("${chatrelay.agent.memory-max-sessions:10000}") long maxSessions,
                                        @Value("${chatrelay.agent.memory-idle-ttl-minutes:1440}") long idleTtlMinutes) {
        this.conversations = Caffeine.newBuilder()
                .maximumSize(maxSessions)
                .expireAfterAccess(Duration.ofMinutes(idleTtlMinutes))
                .build();
    }

    @Override
    public List<String> findConversationIds() {
        return new ArrayList<>(conversations.asMap().keySet());
    }

    @Override
    public List<Message> findByConversationId(String conversationId) {
        List<Message> messages = conversations.getIfPresent(conversationId);
        return messages == null ? List.of() : messages;
    }

    @Override
    public void saveAll(String conversationId, List<Message> messages) {
        conversations.put(conversationId, List.copyOf(messages));
    }

    @Override
    public void deleteByConversationId(String conversationId) {
        conversations.invalidate(conversationId);
    }

    long estimatedSize() {
        conversations.cleanUp();
        return conversations.estimatedSize();
    }
}
