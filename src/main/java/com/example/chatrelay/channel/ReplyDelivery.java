package com.example.chatrelay.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns an agent reply into a webhook answer that is always valid:
 * <ol>
 *   <li>direct send through the provider API, answered with an empty 204;</li>
 *   <li>otherwise a TwiML reply in the response body;</li>
 *   <li>otherwise the bare text as {@code text/plain}.</li>
 * </ol>
 */
@Service
public class ReplyDelivery {

    private static final Logger logger = LoggerFactory.getLogger(ReplyDelivery.class);

    private final TwilioClient twilioClient;
    private final TwimlRenderer twimlRenderer;

    public ReplyDelivery(TwilioClient twilioClient, TwimlRenderer twimlRenderer) {
        this.twilioClient = twilioClient;
        this.twimlRenderer = twimlRenderer;
    }

    public ReplyPayload deliver(String userId, String message) {
        String formatted = format(message);
        if (twilioClient.isConfigured()) {
            try {
                twilioClient.sendWhatsApp(userId, formatted);
                return ReplyPayload.sentByProvider();
            } catch (Exception e) {
                logger.warn("Error sending message via Twilio, replying inline: {}", e.getMessage(), e);
            }
        }
        return inlineFormatted(formatted);
    }

    /**
     * Skips the provider API and answers in the webhook response itself.
     */
    public ReplyPayload respondInline(String message) {
        return inlineFormatted(format(message));
    }

    static String format(String message) {
        return message == null ? "" : message.replace("**", "*");
    }

    private ReplyPayload inlineFormatted(String formatted) {
        try {
            return ReplyPayload.markup(twimlRenderer.messagingResponse(formatted));
        } catch (Exception e) {
            logger.error("Failed to build TwiML, replying with plain text: {}", e.getMessage(), e);
            return ReplyPayload.plainText(formatted);
        }
    }
}
