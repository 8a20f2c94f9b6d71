package com.example.chatrelay.channel;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.nio.charset.StandardCharsets;

/**
 * The HTTP answer to a channel webhook, together with the delivery tier that produced it.
 */
public class ReplyPayload {

    public enum DeliveryTier {
        PROVIDER_API,
        INLINE_MARKUP,
        PLAIN_TEXT,
        ACKNOWLEDGEMENT
    }

    private static final MediaType XML_UTF8 = new MediaType(MediaType.APPLICATION_XML, StandardCharsets.UTF_8);
    private static final MediaType TEXT_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final HttpStatus status;
    private final MediaType contentType;
    private final String body;
    private final DeliveryTier tier;

    private ReplyPayload(HttpStatus status, MediaType contentType, String body, DeliveryTier tier) {
        this.status = status;
        this.contentType = contentType;
        this.body = body;
        this.tier = tier;
    }

    public static ReplyPayload sentByProvider() {
        return new ReplyPayload(HttpStatus.NO_CONTENT, null, null, DeliveryTier.PROVIDER_API);
    }

    public static ReplyPayload markup(String xml) {
        return new ReplyPayload(HttpStatus.OK, XML_UTF8, xml, DeliveryTier.INLINE_MARKUP);
    }

    public static ReplyPayload plainText(String text) {
        return new ReplyPayload(HttpStatus.OK, TEXT_UTF8, text, DeliveryTier.PLAIN_TEXT);
    }

    public static ReplyPayload acknowledgement(String text) {
        return new ReplyPayload(HttpStatus.OK, TEXT_UTF8, text, DeliveryTier.ACKNOWLEDGEMENT);
    }

    public HttpStatus getStatus() { return status; }
    public MediaType getContentType() { return contentType; }
    public String getBody() { return body; }
    public DeliveryTier getTier() { return tier; }

    public ResponseEntity<String> toResponseEntity() {
        if (body == null) {
            return ResponseEntity.status(status).build();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(contentType);
        return new ResponseEntity<>(body, headers, status);
    }
}
