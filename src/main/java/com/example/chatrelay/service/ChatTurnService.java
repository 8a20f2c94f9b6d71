package com.example.chatrelay.service;

import com.example.chatrelay.agent.AgentClient;
import com.example.chatrelay.agent.AgentRequest;
import com.example.chatrelay.agent.AgentResult;
import com.example.chatrelay.model.ChatMessage;
import com.example.chatrelay.model.Sender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * A synchronous chat turn outside the messaging channel: store the user message, ask the agent,
 * store its answer.
 */
@Service
public class ChatTurnService {

    private static final Logger logger = LoggerFactory.getLogger(ChatTurnService.class);

    private final ConversationStore conversationStore;
    private final AgentClient agentClient;
    private final Clock clock;

    public ChatTurnService(ConversationStore conversationStore, AgentClient agentClient, Clock clock) {
        this.conversationStore = conversationStore;
        this.agentClient = agentClient;
        this.clock = clock;
    }

    public TurnResult chat(String userId, String message) {
        Instant timestamp = clock.instant();
        String sessionId = ChatMessage.defaultSessionId(userId);

        conversationStore.record(userId, message, Sender.USER, timestamp, sessionId);

        AgentResult result = agentClient.invoke(AgentRequest.builder()
                .text(message)
                .userId(userId)
                .sessionId(sessionId)
                .build());
        if (!result.isSuccess()) {
            logger.warn("Agent failed for {} ({}): {}", userId, result.getErrorKind(), result.getMessage());
        }
        String reply = result.textOr(ReplyTemplates.CHAT_AGENT_FAILED);

        conversationStore.record(userId, reply, Sender.AGENT, clock.instant(), sessionId);
        return new TurnResult(userId, message, reply, timestamp);
    }

    public static class TurnResult {
        private final String userId;
        private final String message;
        private final String agentResponse;
        private final Instant timestamp;

        public TurnResult(String userId, String message, String agentResponse, Instant timestamp) {
            this.userId = userId;
            this.message = message;
            this.agentResponse = agentResponse;
            this.timestamp = timestamp;
        }

        public String getUserId() { return userId; }
        public String getMessage() { return message; }
        public String getAgentResponse() { return agentResponse; }
        public Instant getTimestamp() { return timestamp; }
    }
}
