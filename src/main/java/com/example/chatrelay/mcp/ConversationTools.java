package com.example.chatrelay.mcp;

import com.example.chatrelay.agent.AgentRequest;
import com.example.chatrelay.model.ChatMessage;
import com.example.chatrelay.model.UserSummary;
import com.example.chatrelay.service.HistoryAggregator;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * History lookups for the agent. Both tools only ever see the conversation of the user the
 * current turn belongs to; that user comes from the tool context, not from the model.
 */
@Service
public class ConversationTools {

    static final int MAX_RECENT = 20;

    private final HistoryAggregator historyAggregator;

    public ConversationTools(HistoryAggregator historyAggregator) {
        this.historyAggregator = historyAggregator;
    }

    @Tool(description = "Recent messages exchanged with the current user, oldest first")
    public List<Map<String,Object>> conversation_recent(@ToolParam(description = "Number of messages, 1 to 20", required = false) Integer limit,
                                                       ToolContext toolContext) {
        String userId = callerId(toolContext);
        if (userId == null) {
            return List.of();
        }
        int lim = (limit == null || limit <= 0) ? 10 : Math.min(limit, MAX_RECENT);
        return historyAggregator.getHistory(userId, lim, 0).stream()
                .map(ConversationTools::toToolView)
                .collect(Collectors.toList());
    }

    @Tool(description = "Message count and first/last activity timestamps for the current user")
    public Map<String,Object> conversation_stats(ToolContext toolContext) {
        String userId = callerId(toolContext);
        UserSummary summary = userId == null ? UserSummary.empty(null) : historyAggregator.getUserSummary(userId, 1);
        Map<String, Object> result = new HashMap<>();
        result.put("totalMessages", summary.getTotalMessages());
        result.put("firstActivity", summary.getFirstActivity() == null ? null : summary.getFirstActivity().toString());
        result.put("lastActivity", summary.getLastActivity() == null ? null : summary.getLastActivity().toString());
        return result;
    }

    static String callerId(ToolContext toolContext) {
        if (toolContext == null || toolContext.getContext() == null) {
            return null;
        }
        Object value = toolContext.getContext().get(AgentRequest.CALLER_ID);
        return value == null || value.toString().isBlank() ? null : value.toString();
    }

    private static Map<String,Object> toToolView(ChatMessage m) {
        Map<String, Object> view = new HashMap<>();
        view.put("sender", m.getSender());
        view.put("message", m.getMessage());
        view.put("timestamp", m.getTimestamp() == null ? null : m.getTimestamp().toString());
        return view;
    }
}
