package com.example.chatrelay.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import org.springframework.stereotype.Component;

/**
 * Renders a TwiML messaging response: {@code <Response><Message>text</Message></Response>}.
 */
@Component
public class TwimlRenderer {

    private final XmlMapper xmlMapper;

    public TwimlRenderer() {
        this.xmlMapper = XmlMapper.builder()
                .configure(ToXmlGenerator.Feature.WRITE_XML_DECLARATION, true)
                .build();
    }

    public String messagingResponse(String text) {
        try {
            return xmlMapper.writeValueAsString(new MessagingResponse(text));
        } catch (JsonProcessingException e) {
            throw new ChannelDeliveryException("Failed to build TwiML: " + e.getMessage(), e);
        }
    }

    @JacksonXmlRootElement(localName = "Response")
    static class MessagingResponse {

        @JacksonXmlProperty(localName = "Message")
        private final String message;

        MessagingResponse(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
