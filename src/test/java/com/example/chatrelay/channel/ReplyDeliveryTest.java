package com.example.chatrelay.channel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReplyDeliveryTest {

    @Mock
    private TwilioClient twilioClient;

    @Mock
    private TwimlRenderer twimlRenderer;

    private ReplyDelivery replyDelivery;

    @BeforeEach
    void setUp() {
        replyDelivery = new ReplyDelivery(twilioClient, twimlRenderer);
    }

    @Test
    void testDeliver_SendsThroughProviderWhenConfigured() {
        // Given
        when(twilioClient.isConfigured()).thenReturn(true);
        when(twilioClient.sendWhatsApp("+212600000001", "*Important* : oui")).thenReturn("SM1");

        // When
        ReplyPayload payload = replyDelivery.deliver("+212600000001", "**Important** : oui");

        // Then
        assertEquals(ReplyPayload.DeliveryTier.PROVIDER_API, payload.getTier());
        ResponseEntity<String> response = payload.toResponseEntity();
        assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
        assertNull(response.getBody());
        verifyNoInteractions(twimlRenderer);
    }

    @Test
    void testDeliver_FallsBackToMarkupWhenProviderFails() {
        // Given
        when(twilioClient.isConfigured()).thenReturn(true);
        when(twilioClient.sendWhatsApp(anyString(), anyString())).thenThrow(new ChannelDeliveryException("401"));
        when(twimlRenderer.messagingResponse("Bonjour")).thenReturn("<Response><Message>Bonjour</Message></Response>");

        // When
        ReplyPayload payload = replyDelivery.deliver("+212600000001", "Bonjour");

        // Then
        assertEquals(ReplyPayload.DeliveryTier.INLINE_MARKUP, payload.getTier());
        ResponseEntity<String> response = payload.toResponseEntity();
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(MediaType.APPLICATION_XML.isCompatibleWith(response.getHeaders().getContentType()));
        assertEquals("<Response><Message>Bonjour</Message></Response>", response.getBody());
    }

    @Test
    void testDeliver_SkipsProviderWhenNotConfigured() {
        // Given
        when(twilioClient.isConfigured()).thenReturn(false);
        when(twimlRenderer.messagingResponse("Bonjour")).thenReturn("<Response/>");

        // When
        ReplyPayload payload = replyDelivery.deliver("+212600000001", "Bonjour");

        // Then
        assertEquals(ReplyPayload.DeliveryTier.INLINE_MARKUP, payload.getTier());
        verify(twilioClient, never()).sendWhatsApp(anyString(), anyString());
    }

    @Test
    void testRespondInline_FallsBackToPlainTextWhenMarkupFails() {
        // Given
        when(twimlRenderer.messagingResponse("*Désolé*")).thenThrow(new ChannelDeliveryException("xml"));

        // When
        ReplyPayload payload = replyDelivery.respondInline("**Désolé**");

        // Then
        assertEquals(ReplyPayload.DeliveryTier.PLAIN_TEXT, payload.getTier());
        ResponseEntity<String> response = payload.toResponseEntity();
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(MediaType.TEXT_PLAIN.isCompatibleWith(response.getHeaders().getContentType()));
        assertEquals("UTF-8", response.getHeaders().getContentType().getCharset().name());
        assertEquals("*Désolé*", response.getBody());
        verifyNoInteractions(twilioClient);
    }

    @Test
    void testFormat_CollapsesDoubleAsterisks() {
        assertEquals("*a* et *b*", ReplyDelivery.format("**a** et **b**"));
        assertEquals("", ReplyDelivery.format(null));
    }
}
