package com.example.chatrelay.agent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@AllArgsConstructor
@ToString(exclude = "audio")
public class AgentRequest {

    /**
     * Tool context key carrying the user the current turn belongs to. Tools read the caller
     * from here, never from model-supplied arguments.
     */
    public static final String CALLER_ID = "callerId";

    private final String text;
    private final byte[] audio;
    private final String audioContentType;
    private final String userId;
    private final String sessionId;

    public boolean hasAudio() {
        return audio != null && audio.length > 0;
    }
}
