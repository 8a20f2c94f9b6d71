package com.example.chatrelay.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;
import java.util.Map;

/**
 * A channel webhook call, reduced to the fields the relay reads. Parameter names follow the
 * provider's webhook format.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class InboundEvent {

    public enum Kind { TEXT, AUDIO, EMPTY }

    static final String CHANNEL_PREFIX = "whatsapp:";

    private final String from;
    private final String body;
    private final String mediaUrl;
    private final String mediaContentType;
    private final String messageSid;

    public static InboundEvent of(Map<String, ?> params) {
        return InboundEvent.builder()
                .from(str(params.get("From")))
                .body(str(params.get("Body")))
                .mediaUrl(str(params.get("MediaUrl0")))
                .mediaContentType(str(params.get("MediaContentType0")))
                .messageSid(str(params.get("MessageSid")))
                .build();
    }

    public Kind classify() {
        boolean hasMedia = mediaUrl != null && !mediaUrl.isBlank();
        if (hasMedia && mediaContentType != null && mediaContentType.toLowerCase(Locale.ROOT).startsWith("audio")) {
            return Kind.AUDIO;
        }
        if (body != null && !body.isEmpty()) {
            return Kind.TEXT;
        }
        return Kind.EMPTY;
    }

    /**
     * Sender id without the channel scheme, e.g. {@code whatsapp:+2126...} becomes {@code +2126...}.
     */
    public String userId() {
        if (from == null) {
            return "";
        }
        String id = from.trim();
        return id.startsWith(CHANNEL_PREFIX) ? id.substring(CHANNEL_PREFIX.length()) : id;
    }

    private static String str(Object value) {
        return value == null ? null : value.toString();
    }
}
