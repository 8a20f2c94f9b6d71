package com.example.chatrelay.service;

import com.example.chatrelay.agent.AgentClient;
import com.example.chatrelay.agent.AgentResult;
import com.example.chatrelay.model.ChatMessage;
import com.example.chatrelay.model.Sender;
import com.example.chatrelay.store.InMemoryStoreClient;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ChatTurnServiceTest {

    private final Instant now = Instant.parse("2024-05-01T12:00:00Z");
    private final Clock clock = Clock.fixed(now, ZoneOffset.UTC);

    @Test
    void testChat_PersistsUserThenAgentTurn() {
        // Given
        ConversationStore conversationStore = mock(ConversationStore.class);
        AgentClient agentClient = mock(AgentClient.class);
        when(agentClient.invoke(any())).thenReturn(AgentResult.success("Bien sûr."));
        ChatTurnService service = new ChatTurnService(conversationStore, agentClient, clock);

        // When
        ChatTurnService.TurnResult result = service.chat("web-1", "Pouvez-vous m'aider ?");

        // Then
        assertEquals("web-1", result.getUserId());
        assertEquals("Pouvez-vous m'aider ?", result.getMessage());
        assertEquals("Bien sûr.", result.getAgentResponse());
        assertEquals(now, result.getTimestamp());
        verify(conversationStore).record("web-1", "Pouvez-vous m'aider ?", Sender.USER, now, "web-1_session");
        verify(conversationStore).record("web-1", "Bien sûr.", Sender.AGENT, now, "web-1_session");
    }

    @Test
    void testChat_AgentFailureReturnsApology() {
        // Given
        ConversationStore conversationStore = mock(ConversationStore.class);
        AgentClient agentClient = request -> AgentResult.failure(AgentResult.ErrorKind.NOT_CONFIGURED, "no model");
        ChatTurnService service = new ChatTurnService(conversationStore, agentClient, clock);

        // When
        ChatTurnService.TurnResult result = service.chat("web-1", "Salam");

        // Then
        assertEquals(ReplyTemplates.CHAT_AGENT_FAILED, result.getAgentResponse());
        verify(conversationStore).record("web-1", ReplyTemplates.CHAT_AGENT_FAILED, Sender.AGENT, now, "web-1_session");
    }

    @Test
    void testChat_ConcurrentUsersEachGetTheirOwnPair() throws Exception {
        // Given
        InMemoryStoreClient store = new InMemoryStoreClient();
        AgentClient echo = request -> AgentResult.success("echo: " + request.getText());
        ChatTurnService service = new ChatTurnService(new ConversationStore(store), echo, Clock.systemUTC());
        int users = 16;

        // When
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<ChatTurnService.TurnResult>> futures = new ArrayList<>();
            for (int i = 0; i < users; i++) {
                String userId = "user-" + i;
                String message = "msg-" + i;
                futures.add(pool.submit(() -> service.chat(userId, message)));
            }
            for (Future<ChatTurnService.TurnResult> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        // Then
        assertEquals(users * 2, store.all().size());
        for (int i = 0; i < users; i++) {
            String userId = "user-" + i;
            List<ChatMessage> own = store.all().stream()
                    .filter(m -> userId.equals(m.getUserId()))
                    .collect(Collectors.toList());
            assertEquals(2, own.size());
            assertTrue(own.stream().allMatch(m -> (userId + "_session").equals(m.getSessionId())));
            assertTrue(own.stream().anyMatch(m -> "user".equals(m.getSender()) && ("msg-" + userId.substring(5)).equals(m.getMessage())));
            assertTrue(own.stream().anyMatch(m -> "agent".equals(m.getSender()) && ("echo: msg-" + userId.substring(5)).equals(m.getMessage())));
        }
    }
}
