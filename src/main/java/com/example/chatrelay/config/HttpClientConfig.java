package com.example.chatrelay.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient mediaRestClient(@Value("${chatrelay.media.connect-timeout-ms:10000}") long connectTimeoutMs) {
        return RestClient.builder()
                .requestFactory(new JdkClientHttpRequestFactory(noRedirectClient(connectTimeoutMs)))
                .build();
    }

    @Bean
    public RestClient twilioRestClient(@Value("${chatrelay.twilio.api-base-url:https://api.twilio.com}") String baseUrl,
                                       @Value("${chatrelay.twilio.connect-timeout-ms:10000}") long connectTimeoutMs) {
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(new JdkClientHttpRequestFactory(noRedirectClient(connectTimeoutMs)))
                .build();
    }

    private static HttpClient noRedirectClient(long connectTimeoutMs) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();
    }
}
