package com.example.chatrelay.channel;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

/**
 * Outbound WhatsApp messages through the Twilio Messages REST API.
 */
@Service
public class TwilioClient {

    private static final Logger logger = LoggerFactory.getLogger(TwilioClient.class);

    static final String WHATSAPP_PREFIX = "whatsapp:";

    private final RestClient rest;
    private final String accountSid;
    private final String authToken;
    private final String phoneNumber;

    public TwilioClient(@Qualifier("twilioRestClient") RestClient rest,
                        @Value("${chatrelay.twilio.account-sid:}") String accountSid,
                        @Value("${chatrelay.twilio.auth-token:}") String authToken,
                        @Value("${chatrelay.twilio.phone-number:}") String phoneNumber) {
        this.rest = rest;
        this.accountSid = accountSid == null ? "" : accountSid.trim();
        this.authToken = authToken == null ? "" : authToken.trim();
        this.phoneNumber = phoneNumber == null ? "" : phoneNumber.trim();
    }

    public boolean isConfigured() {
        return !accountSid.isBlank() && !authToken.isBlank() && !phoneNumber.isBlank();
    }

    /**
     * Sends {@code body} to {@code userId} and returns the provider message sid.
     *
     * @throws ChannelDeliveryException when the client is not configured or the API call fails
     */
    public String sendWhatsApp(String userId, String body) {
        if (!isConfigured()) {
            throw new ChannelDeliveryException("Twilio credentials or sender number are not configured");
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("From", WHATSAPP_PREFIX + phoneNumber);
        form.add("To", WHATSAPP_PREFIX + userId);
        form.add("Body", body);

        try {
            JsonNode response = rest.post()
                    .uri("/2010-04-01/Accounts/{sid}/Messages.json", accountSid)
                    .headers(h -> h.setBasicAuth(accountSid, authToken))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
            String sid = response == null ? null : response.path("sid").asText(null);
            logger.info("Text message sent via Twilio: {}", sid);
            return sid;
        } catch (Exception e) {
            throw new ChannelDeliveryException("Twilio message send failed: " + e.getMessage(), e);
        }
    }
}
