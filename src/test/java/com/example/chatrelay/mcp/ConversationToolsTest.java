package com.example.chatrelay.mcp;

import com.example.chatrelay.agent.AgentRequest;
import com.example.chatrelay.model.ChatMessage;
import com.example.chatrelay.model.UserSummary;
import com.example.chatrelay.service.HistoryAggregator;
import com.example.chatrelay.store.InMemoryStoreClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationToolsTest {

    private static final String CUSTOMER_A = "+212600000001";
    private static final String CUSTOMER_B = "+212600000002";

    @Mock
    private HistoryAggregator historyAggregator;

    private ConversationTools tools;

    @BeforeEach
    void setUp() {
        tools = new ConversationTools(historyAggregator);
    }

    private static ToolContext callerContext(String userId) {
        return new ToolContext(Map.of(AgentRequest.CALLER_ID, userId));
    }

    @Test
    void testConversationRecent_DefaultsAndCapsLimitForCaller() {
        // Given
        Instant ts = Instant.parse("2024-05-01T09:00:00Z");
        ChatMessage m = ChatMessage.builder().userId(CUSTOMER_A).sender("user").message("Salam").timestamp(ts).build();
        when(historyAggregator.getHistory(CUSTOMER_A, 10, 0)).thenReturn(List.of(m));
        when(historyAggregator.getHistory(CUSTOMER_A, ConversationTools.MAX_RECENT, 0)).thenReturn(List.of());

        // When
        List<Map<String, Object>> recent = tools.conversation_recent(null, callerContext(CUSTOMER_A));
        tools.conversation_recent(500, callerContext(CUSTOMER_A));

        // Then
        assertEquals(1, recent.size());
        assertEquals("user", recent.get(0).get("sender"));
        assertEquals("Salam", recent.get(0).get("message"));
        assertEquals("2024-05-01T09:00:00Z", recent.get(0).get("timestamp"));
        verify(historyAggregator).getHistory(CUSTOMER_A, ConversationTools.MAX_RECENT, 0);
    }

    @Test
    void testConversationRecent_WithoutCallerReadsNothing() {
        assertTrue(tools.conversation_recent(10, null).isEmpty());
        assertTrue(tools.conversation_recent(10, new ToolContext(Map.of("other", "x"))).isEmpty());

        verify(historyAggregator, never()).getHistory(anyString(), anyInt(), anyInt());
    }

    @Test
    void testConversationStats_ReportsCallerSummary() {
        // Given
        UserSummary summary = UserSummary.empty(CUSTOMER_A);
        summary.setTotalMessages(4);
        summary.setFirstActivity(Instant.parse("2024-05-01T09:00:00Z"));
        summary.setLastActivity(Instant.parse("2024-05-02T09:00:00Z"));
        when(historyAggregator.getUserSummary(CUSTOMER_A, 1)).thenReturn(summary);

        // When
        Map<String, Object> stats = tools.conversation_stats(callerContext(CUSTOMER_A));

        // Then
        assertEquals(4L, stats.get("totalMessages"));
        assertEquals("2024-05-01T09:00:00Z", stats.get("firstActivity"));
        assertEquals("2024-05-02T09:00:00Z", stats.get("lastActivity"));
    }

    @Test
    void testRegisteredTools_OnlyReturnTheCallersConversation() {
        // Given
        InMemoryStoreClient store = new InMemoryStoreClient();
        store.insert(ChatMessage.builder().userId(CUSTOMER_A).sender("user").message("Mon mot de passe est hunter2")
                .timestamp(Instant.parse("2024-05-01T09:00:00Z")).build());
        store.insert(ChatMessage.builder().userId(CUSTOMER_B).sender("user").message("Bonjour")
                .timestamp(Instant.parse("2024-05-01T09:05:00Z")).build());
        ToolCallback[] callbacks = MethodToolCallbackProvider.builder()
                .toolObjects(new ConversationTools(new HistoryAggregator(store)))
                .build()
                .getToolCallbacks();
        ToolCallback recent = Arrays.stream(callbacks)
                .filter(c -> "conversation_recent".equals(c.getToolDefinition().name()))
                .findFirst()
                .orElseThrow();

        // When
        String result = recent.call("{\"limit\":10}", callerContext(CUSTOMER_B));

        // Then
        assertFalse(recent.getToolDefinition().inputSchema().contains("userId"));
        assertTrue(result.contains("Bonjour"), result);
        assertFalse(result.contains("hunter2"), result);
    }
}
