package com.what3words.geocoding.infrastructure.external;

import com.what3words.geocoding.application.port.out.TransportResponse;
import com.what3words.geocoding.domain.exception.TransportException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientGeocodingTransportTest {

    private static final String API_URL = "https://api.what3words.com/v3";

    private final List<ClientRequest> requests = new ArrayList<>();

    private WebClientGeocodingTransport transport(ExchangeFunction exchange, int timeoutSeconds) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        WebClient webClient = new WebClientConfig().geocodingWebClient(
            WebClient.builder().exchangeFunction(recording), API_URL, "TEST_API_KEY", "0.1.0");
        return new WebClientGeocodingTransport(webClient, timeoutSeconds);
    }

    private static ExchangeFunction respondWith(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }

    @Test
    void testGet_Success_ReturnsStatusAndBody() {
        TransportResponse response = transport(respondWith(HttpStatus.OK, "{\"words\":\"filled.count.soap\"}"), 5)
            .get("/convert-to-coordinates", Map.of("words", "filled.count.soap"));

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.isSuccessful()).isTrue();
        assertThat(response.getBody()).isEqualTo("{\"words\":\"filled.count.soap\"}");
    }

    @Test
    void testGet_BuildsUrlUnderBasePathWithEncodedQuery() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("coordinates", "51.521251,-0.203586");
        params.put("language", "en");
        params.put("format", "json");

        transport(respondWith(HttpStatus.OK, "{}"), 5).get("/convert-to-3wa", params);

        assertThat(requests).hasSize(1);
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.url().getHost()).isEqualTo("api.what3words.com");
        assertThat(request.url().getPath()).isEqualTo("/v3/convert-to-3wa");
        assertThat(request.url().getRawQuery())
            .isEqualTo("coordinates=51.521251%2C-0.203586&language=en&format=json");
    }

    @Test
    void testGet_ReservedCharactersInValues_AreEncoded() {
        transport(respondWith(HttpStatus.OK, "{}"), 5)
            .get("/autosuggest", Map.of("input", "filled count&soap"));

        assertThat(requests.get(0).url().getRawQuery()).isEqualTo("input=filled%20count%26soap");
    }

    @Test
    void testGet_SendsApiKeyAndWrapperHeaders() {
        transport(respondWith(HttpStatus.OK, "{}"), 5).get("/available-languages", Map.of());

        HttpHeaders headers = requests.get(0).headers();
        assertThat(headers.getFirst(WebClientConfig.API_KEY_HEADER)).isEqualTo("TEST_API_KEY");
        assertThat(headers.getFirst(WebClientConfig.WRAPPER_HEADER))
            .isEqualTo(WebClientConfig.wrapperHeader("0.1.0"))
            .startsWith("what3words-java/0.1.0 (");
    }

    @Test
    void testGet_ErrorStatus_IsReturnedNotThrown() {
        String body = "{\"error\":{\"code\":\"BadWords\",\"message\":\"Invalid or non-existent 3 word address\"}}";

        TransportResponse response = transport(respondWith(HttpStatus.BAD_REQUEST, body), 5)
            .get("/convert-to-coordinates", Map.of("words", "filled.count"));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(response.isSuccessful()).isFalse();
        assertThat(response.getBody()).isEqualTo(body);
    }

    @Test
    void testGet_EmptyBody_ReturnsEmptyString() {
        ExchangeFunction noContent = request -> Mono.just(ClientResponse.create(HttpStatus.OK).build());

        TransportResponse response = transport(noContent, 5)
            .get("/autosuggest-selection", Map.of("raw-input", "i.h.r"));

        assertThat(response.getBody()).isEmpty();
    }

    @Test
    void testGet_ConnectionRefused_ThrowsTransportException() {
        ExchangeFunction refused = request -> Mono.error(new WebClientRequestException(
            new ConnectException("Connection refused"), request.method(), request.url(), request.headers()));

        assertThatThrownBy(() -> transport(refused, 5).get("/available-languages", Map.of()))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("Failed to connect")
            .satisfies(e -> assertThat(((TransportException) e).getStatus()).isEmpty());
    }

    @Test
    void testGet_NoAnswerWithinTimeout_ThrowsTransportException() {
        ExchangeFunction silent = request -> Mono.never();

        assertThatThrownBy(() -> transport(silent, 1).get("/available-languages", Map.of()))
            .isInstanceOf(TransportException.class);
    }
}
