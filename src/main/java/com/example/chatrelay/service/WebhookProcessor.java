package com.example.chatrelay.service;

import com.example.chatrelay.agent.AgentClient;
import com.example.chatrelay.agent.AgentRequest;
import com.example.chatrelay.agent.AgentResult;
import com.example.chatrelay.channel.ReplyDelivery;
import com.example.chatrelay.channel.ReplyPayload;
import com.example.chatrelay.media.MediaFetchResult;
import com.example.chatrelay.media.MediaFetcher;
import com.example.chatrelay.model.ChatMessage;
import com.example.chatrelay.model.Sender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Drives one inbound channel event through
 * {@code RECEIVED -> CLASSIFIED -> AGENT_INVOKED -> PERSISTED -> RESPONDED}.
 *
 * <p>{@link #handle(InboundEvent)} always returns a reply. Empty events are acknowledged without
 * any write; every other event persists the user's turn before anything else can fail.
 */
@Service
public class WebhookProcessor {

    private static final Logger logger = LoggerFactory.getLogger(WebhookProcessor.class);

    public enum State { RECEIVED, CLASSIFIED, AGENT_INVOKED, PERSISTED, RESPONDED }

    private final ConversationStore conversationStore;
    private final MediaFetcher mediaFetcher;
    private final AgentClient agentClient;
    private final ReplyDelivery replyDelivery;
    private final InboundDeduplicator deduplicator;
    private final Clock clock;

    public WebhookProcessor(ConversationStore conversationStore, MediaFetcher mediaFetcher, AgentClient agentClient,
                            ReplyDelivery replyDelivery, InboundDeduplicator deduplicator, Clock clock) {
        this.conversationStore = conversationStore;
        this.mediaFetcher = mediaFetcher;
        this.agentClient = agentClient;
        this.replyDelivery = replyDelivery;
        this.deduplicator = deduplicator;
        this.clock = clock;
    }

    public ReplyPayload handle(InboundEvent event) {
        Turn turn = new Turn(event.userId());
        try {
            InboundEvent.Kind kind = event.classify();
            if (turn.userId.isBlank()) {
                kind = InboundEvent.Kind.EMPTY;
            }
            turn.advance(State.CLASSIFIED, kind);

            if (kind == InboundEvent.Kind.EMPTY) {
                return turn.respond(ReplyPayload.acknowledgement(ReplyTemplates.MISSING_INPUT));
            }
            if (!deduplicator.isFirstDelivery(event.getMessageSid(), turn.userId)) {
                return turn.respond(ReplyPayload.acknowledgement(""));
            }
            return kind == InboundEvent.Kind.AUDIO ? handleAudio(turn, event) : handleText(turn, event);
        } catch (Exception e) {
            logger.error("Unhandled error while processing webhook from {}", turn.userId, e);
            return turn.respond(replyDelivery.respondInline(ReplyTemplates.UNEXPECTED));
        }
    }

    private ReplyPayload handleText(Turn turn, InboundEvent event) {
        String text = event.getBody();
        conversationStore.record(turn.userId, text, Sender.USER, clock.instant(), turn.sessionId);

        turn.advance(State.AGENT_INVOKED, null);
        AgentResult result = agentClient.invoke(AgentRequest.builder()
                .text(text)
                .userId(turn.userId)
                .sessionId(turn.sessionId)
                .build());
        return completeTurn(turn, result, ReplyTemplates.TEXT_AGENT_FAILED);
    }

    private ReplyPayload handleAudio(Turn turn, InboundEvent event) {
        String mediaUrl = event.getMediaUrl();
        String mediaType = event.getMediaContentType();

        MediaFetchResult media = mediaFetcher.fetch(mediaUrl, mediaType);
        conversationStore.record(turn.userId, ChatMessage.AUDIO_PLACEHOLDER, Sender.USER, clock.instant(),
                mediaUrl, mediaType, turn.sessionId);

        if (!media.isSuccess()) {
            logger.warn("Error downloading media for {} ({}): {}", turn.userId, media.getErrorKind(), media.getMessage());
            turn.advance(State.PERSISTED, null);
            return turn.respond(replyDelivery.respondInline(ReplyTemplates.MEDIA_FETCH_FAILED));
        }

        turn.advance(State.AGENT_INVOKED, null);
        AgentResult result = agentClient.invoke(AgentRequest.builder()
                .text(ReplyTemplates.AUDIO_INSTRUCTION)
                .audio(media.getContent())
                .audioContentType(mediaType)
                .userId(turn.userId)
                .sessionId(turn.sessionId)
                .build());
        return completeTurn(turn, result, ReplyTemplates.AUDIO_AGENT_FAILED);
    }

    private ReplyPayload completeTurn(Turn turn, AgentResult result, String apology) {
        if (!result.isSuccess()) {
            logger.warn("Agent failed for {} ({}): {}", turn.userId, result.getErrorKind(), result.getMessage());
        }
        String reply = result.textOr(apology);
        conversationStore.record(turn.userId, reply, Sender.AGENT, clock.instant(), turn.sessionId);
        turn.advance(State.PERSISTED, null);

        ReplyPayload payload = result.isSuccess()
                ? replyDelivery.deliver(turn.userId, reply)
                : replyDelivery.respondInline(reply);
        return turn.respond(payload);
    }

    private static class Turn {
        final String userId;
        final String sessionId;
        State state = State.RECEIVED;

        Turn(String userId) {
            this.userId = userId;
            this.sessionId = ChatMessage.defaultSessionId(userId);
        }

        void advance(State next, Object detail) {
            logger.debug("Webhook turn for {}: {} -> {}{}", userId, state, next, detail == null ? "" : " (" + detail + ")");
            state = next;
        }

        ReplyPayload respond(ReplyPayload payload) {
            advance(State.RESPONDED, payload.getTier());
            return payload;
        }
    }
}
