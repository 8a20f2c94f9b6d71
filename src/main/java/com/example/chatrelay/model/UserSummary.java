package com.example.chatrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.time.Instant;
import java.util.List;

/**
 * Read-time projection of a user's conversation. Not persisted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserSummary {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("total_messages")
    private long totalMessages;

    @JsonProperty("recent_messages")
    private List<ChatMessage> recentMessages;

    @JsonProperty("first_activity")
    private Instant firstActivity;

    @JsonProperty("last_activity")
    private Instant lastActivity;

    public static UserSummary empty(String userId) {
        return UserSummary.builder()
                .userId(userId)
                .totalMessages(0)
                .recentMessages(List.of())
                .build();
    }
}
