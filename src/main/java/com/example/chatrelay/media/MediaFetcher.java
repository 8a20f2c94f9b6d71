package com.example.chatrelay.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.Set;

/**
 * Downloads media referenced by an inbound message. The underlying client does not follow
 * redirects; one redirect hop is followed here, without credentials.
 */
@Service
public class MediaFetcher {

    private static final Logger logger = LoggerFactory.getLogger(MediaFetcher.class);

    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);

    private final RestClient rest;
    private final String accountSid;
    private final String authToken;

    public MediaFetcher(@Qualifier("mediaRestClient") RestClient rest,
                        @Value("${chatrelay.twilio.account-sid:}") String accountSid,
                        @Value("${chatrelay.twilio.auth-token:}") String authToken) {
        this.rest = rest;
        this.accountSid = accountSid == null ? "" : accountSid.trim();
        this.authToken = authToken == null ? "" : authToken.trim();
    }

    public MediaFetchResult fetch(String mediaUrl, String declaredContentType) {
        if (mediaUrl == null || mediaUrl.isBlank()) {
            return MediaFetchResult.failure(MediaFetchResult.ErrorKind.INVALID_URL, "Media URL is missing");
        }
        URI uri;
        try {
            uri = URI.create(mediaUrl.trim());
        } catch (IllegalArgumentException e) {
            return MediaFetchResult.failure(MediaFetchResult.ErrorKind.INVALID_URL, "Malformed media URL: " + e.getMessage());
        }
        if (!uri.isAbsolute()) {
            return MediaFetchResult.failure(MediaFetchResult.ErrorKind.INVALID_URL, "Media URL is not absolute: " + mediaUrl);
        }

        try {
            Fetched response = get(uri, true);
            if (REDIRECT_STATUSES.contains(response.status.value()) && response.location != null) {
                URI target = uri.resolve(response.location);
                logger.debug("Media download redirected to {}", target.getHost());
                response = get(target, false);
            }
            if (!response.status.is2xxSuccessful()) {
                return MediaFetchResult.failure(MediaFetchResult.ErrorKind.HTTP_STATUS,
                        "Media download failed with status " + response.status.value());
            }
            String contentType = response.contentType != null ? response.contentType.toString() : declaredContentType;
            logger.debug("Downloaded {} bytes of {}", response.body.length, contentType);
            return MediaFetchResult.success(response.body, contentType);
        } catch (RestClientException | IllegalArgumentException e) {
            return MediaFetchResult.failure(MediaFetchResult.ErrorKind.IO, "Media download failed: " + e.getMessage());
        }
    }

    private Fetched get(URI uri, boolean withCredentials) {
        return rest.get()
                .uri(uri)
                .headers(h -> {
                    if (withCredentials && hasCredentials()) {
                        h.setBasicAuth(accountSid, authToken);
                    }
                })
                .exchange((request, response) -> new Fetched(
                        response.getStatusCode(),
                        response.getHeaders().getFirst("Location"),
                        response.getHeaders().getContentType(),
                        StreamUtils.copyToByteArray(response.getBody())));
    }

    private boolean hasCredentials() {
        return !accountSid.isBlank() && !authToken.isBlank();
    }

    private static class Fetched {
        final HttpStatusCode status;
        final String location;
        final MediaType contentType;
        final byte[] body;

        Fetched(HttpStatusCode status, String location, MediaType contentType, byte[] body) {
            this.status = status;
            this.location = location;
            this.contentType = contentType;
            this.body = body;
        }
    }
}
