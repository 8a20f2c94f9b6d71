package com.example.chatrelay.controller;

import com.example.chatrelay.channel.ReplyDelivery;
import com.example.chatrelay.service.InboundEvent;
import com.example.chatrelay.service.ReplyTemplates;
import com.example.chatrelay.service.WebhookProcessor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Channel webhook. The provider posts form-encoded parameters; JSON bodies with the same
 * field names are accepted too. Every call is answered with a 2xx, whatever happens inside.
 */
@RestController
public class WebhookController {

    private static final Logger logger = LoggerFactory.getLogger(WebhookController.class);

    private final WebhookProcessor webhookProcessor;
    private final ReplyDelivery replyDelivery;
    private final ObjectMapper objectMapper;

    public WebhookController(WebhookProcessor webhookProcessor, ReplyDelivery replyDelivery, ObjectMapper objectMapper) {
        this.webhookProcessor = webhookProcessor;
        this.replyDelivery = replyDelivery;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/webhook", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<String> webhookForm(@RequestParam MultiValueMap<String, String> form) {
        return process(form.toSingleValueMap());
    }

    @PostMapping("/webhook")
    public ResponseEntity<String> webhookBody(@RequestBody(required = false) String body) {
        return process(parseJson(body));
    }

    private ResponseEntity<String> process(Map<String, ?> params) {
        try {
            return webhookProcessor.handle(InboundEvent.of(params)).toResponseEntity();
        } catch (Exception e) {
            logger.error("Unhandled webhook error", e);
            return replyDelivery.respondInline(ReplyTemplates.UNEXPECTED).toResponseEntity();
        }
    }

    private Map<String, Object> parseJson(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {});
            return parsed == null ? Map.of() : parsed;
        } catch (Exception e) {
            logger.warn("Failed to parse webhook body as JSON: {}", e.getMessage());
            return Map.of();
        }
    }
}
