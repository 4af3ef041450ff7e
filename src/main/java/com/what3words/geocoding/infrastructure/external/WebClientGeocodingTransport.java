package com.what3words.geocoding.infrastructure.external;

import com.what3words.geocoding.application.port.out.GeocodingTransport;
import com.what3words.geocoding.application.port.out.TransportResponse;
import com.what3words.geocoding.domain.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Transport adapter issuing blocking GETs through {@link WebClient}.
 *
 * Non-2xx responses are handed back with their body so the application layer
 * can read the service error. No retries.
 */
@Component
public class WebClientGeocodingTransport implements GeocodingTransport {

    private static final Logger logger = LoggerFactory.getLogger(WebClientGeocodingTransport.class);

    private final WebClient webClient;
    private final int timeoutSeconds;

    public WebClientGeocodingTransport(
        WebClient geocodingWebClient,
        @Value("${app.w3w.timeout-seconds:30}") int timeoutSeconds
    ) {
        this.webClient = geocodingWebClient;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public TransportResponse get(String endpoint, Map<String, String> params) {
        // Values go in as template variables so they are fully encoded.
        Map<String, String> variables = new HashMap<>();
        try {
            TransportResponse response = webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(endpoint);
                    int index = 0;
                    for (Map.Entry<String, String> param : params.entrySet()) {
                        String variable = "p" + index++;
                        uriBuilder.queryParam(param.getKey(), "{" + variable + "}");
                        variables.put(variable, param.getValue());
                    }
                    return uriBuilder.build(variables);
                })
                .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(body -> new TransportResponse(clientResponse.statusCode().value(), body)))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .block();

            if (response == null) {
                throw new TransportException("No response from " + endpoint);
            }
            logger.debug("{} answered {}", endpoint, response.getStatus());
            return response;
        } catch (TransportException e) {
            throw e;
        } catch (WebClientException e) {
            logger.error("Failed to connect to geocoding API at {}", endpoint, e);
            throw new TransportException("Failed to connect to geocoding API", e);
        } catch (Exception e) {
            logger.error("Unexpected error calling geocoding API at {}", endpoint, e);
            throw new TransportException("Unexpected error calling geocoding API", e);
        }
    }
}
