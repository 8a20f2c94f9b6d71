package com.example.chatrelay.controller;

import com.example.chatrelay.model.ChatMessage;
import com.example.chatrelay.model.UserOverview;
import com.example.chatrelay.model.UserSummary;
import com.example.chatrelay.service.ChatTurnService;
import com.example.chatrelay.service.HistoryAggregator;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping(value = "/api/chat", produces = MediaType.APPLICATION_JSON_VALUE)
public class ChatApiController {

    static final String CHAT_FIELDS_REQUIRED = "user_id and message are required";
    static final String STORE_NOT_CONFIGURED = "Database not configured";

    private final HistoryAggregator historyAggregator;
    private final ChatTurnService chatTurnService;

    public ChatApiController(HistoryAggregator historyAggregator, ChatTurnService chatTurnService) {
        this.historyAggregator = historyAggregator;
        this.chatTurnService = chatTurnService;
    }

    @GetMapping("/history/{user_id}")
    public Map<String, Object> history(@PathVariable("user_id") String userId,
                                       @RequestParam(defaultValue = "50") int limit,
                                       @RequestParam(defaultValue = "0") int skip) {
        requireUserId(userId);
        requireRange("limit", limit, 1, 100);
        requireNonNegative("skip", skip);
        requireStore();

        List<ChatMessage> messages = historyAggregator.getHistory(userId, limit, skip);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", userId);
        body.put("messages", messages);
        body.put("total_messages", messages.size());
        body.put("limit", limit);
        body.put("skip", skip);
        return body;
    }

    @GetMapping("/users")
    public Map<String, Object> users(@RequestParam(defaultValue = "20") int limit,
                                     @RequestParam(defaultValue = "0") int skip,
                                     @RequestParam(name = "include_summary", defaultValue = "false") boolean includeSummary) {
        requireRange("limit", limit, 1, 100);
        requireNonNegative("skip", skip);
        requireStore();

        List<UserOverview> users = historyAggregator.listUsers(limit, skip, includeSummary);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("users", users);
        body.put("total_users", users.size());
        body.put("limit", limit);
        body.put("skip", skip);
        body.put("include_summary", includeSummary);
        return body;
    }

    @GetMapping("/users/{user_id}/summary")
    public UserSummary userSummary(@PathVariable("user_id") String userId,
                                   @RequestParam(defaultValue = "10") int limit) {
        requireUserId(userId);
        requireRange("limit", limit, 1, 50);
        requireStore();

        return historyAggregator.getUserSummary(userId, limit);
    }

    @PostMapping
    public Map<String, Object> chat(@RequestBody(required = false) Map<String, Object> request) {
        String userId = request == null ? null : asText(request.get("user_id"));
        String message = request == null ? null : asText(request.get("message"));
        if (userId == null || userId.isBlank() || message == null || message.isBlank()) {
            throw new ValidationException(CHAT_FIELDS_REQUIRED);
        }

        ChatTurnService.TurnResult turn = chatTurnService.chat(userId, message);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", turn.getUserId());
        body.put("message", turn.getMessage());
        body.put("agent_response", turn.getAgentResponse());
        body.put("timestamp", turn.getTimestamp());
        return body;
    }

    private void requireStore() {
        if (!historyAggregator.isStoreConfigured()) {
            throw new StoreUnavailableException(STORE_NOT_CONFIGURED);
        }
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("user_id is required");
        }
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new ValidationException(name + " must be between " + min + " and " + max);
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new ValidationException(name + " must be non-negative");
        }
    }

    private static String asText(Object value) {
        return value == null ? null : value.toString();
    }
}
