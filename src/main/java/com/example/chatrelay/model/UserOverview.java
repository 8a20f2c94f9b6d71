package com.example.chatrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserOverview {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("latest_message")
    private ChatMessage latestMessage;

    @JsonProperty("message_count")
    private long messageCount;

    @JsonProperty("last_activity")
    private Instant lastActivity;

    // only filled when the caller asks for summaries
    @JsonProperty("conversation_summary")
    private UserSummary conversationSummary;
}
