package com.what3words.geocoding.infrastructure.external;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the geocoding API.
 *
 * Every request carries the API key and a wrapper identification header.
 * Spring Boot auto-configures Jackson codecs on the injected builder.
 */
@Configuration
public class WebClientConfig {

    static final String API_KEY_HEADER = "X-Api-Key";
    static final String WRAPPER_HEADER = "X-W3W-Wrapper";

    @Bean
    public WebClient geocodingWebClient(
        WebClient.Builder webClientBuilder,
        @Value("${app.w3w.api-url}") String apiUrl,
        @Value("${app.w3w.api-key:}") String apiKey,
        @Value("${app.w3w.wrapper-version:0.1.0}") String wrapperVersion
    ) {
        return webClientBuilder
            .baseUrl(apiUrl)
            .defaultHeader(API_KEY_HEADER, apiKey)
            .defaultHeader(WRAPPER_HEADER, wrapperHeader(wrapperVersion))
            .build();
    }

    static String wrapperHeader(String version) {
        return "what3words-java/" + version + " (" + System.getProperty("os.name") + ")";
    }
}
