package com.example.chatrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * One persisted conversation turn half. Documents are inserted once and never updated.
 * The target collection is configured at runtime, see {@code chatrelay.store.collection}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessage {

    public static final String USER_ID = "user_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String AUDIO_PLACEHOLDER = "[Audio Message]";

    @Id
    @JsonProperty("_id")
    private String id;

    @Field(USER_ID)
    @JsonProperty(USER_ID)
    private String userId;

    private String message;

    // "user" or "agent", see Sender
    private String sender;

    @Field(TIMESTAMP)
    private Instant timestamp;

    @Field("session_id")
    @JsonProperty("session_id")
    private String sessionId;

    @Field("audio_url")
    @JsonProperty("audio_url")
    private String audioUrl;

    @Field("media_type")
    @JsonProperty("media_type")
    private String mediaType;

    public static String defaultSessionId(String userId) {
        return userId + "_session";
    }
}
