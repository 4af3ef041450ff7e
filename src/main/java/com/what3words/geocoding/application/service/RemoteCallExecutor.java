package com.what3words.geocoding.application.service;

import com.what3words.geocoding.application.mapper.ResponseDecoder;
import com.what3words.geocoding.application.port.out.GeocodingTransport;
import com.what3words.geocoding.application.port.out.TransportResponse;
import com.what3words.geocoding.domain.exception.ApiErrorException;
import com.what3words.geocoding.domain.exception.TransportException;
import com.what3words.geocoding.domain.model.result.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Runs one call through the transport and turns non-2xx statuses into
 * exceptions. Successful bodies are returned raw for the caller to decode.
 */
@Component
public class RemoteCallExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RemoteCallExecutor.class);

    private final GeocodingTransport transport;
    private final ResponseDecoder responseDecoder;

    public RemoteCallExecutor(GeocodingTransport transport, ResponseDecoder responseDecoder) {
        this.transport = transport;
        this.responseDecoder = responseDecoder;
    }

    /**
     * @return the raw body of a 2xx response, possibly empty
     * @throws ApiErrorException if the service reported an error
     * @throws TransportException if the call failed or the error body is unreadable
     */
    public String call(String endpoint, Map<String, String> params) {
        logger.debug("Calling {} with {}", endpoint, params);
        TransportResponse response = transport.get(endpoint, params);
        if (response.isSuccessful()) {
            return response.getBody();
        }

        Optional<ApiError> error = responseDecoder.decodeError(response.getBody());
        if (error.isPresent()) {
            logger.info("{} returned {} {}", endpoint, response.getStatus(), error.get().getCode());
            throw new ApiErrorException(error.get(), response.getStatus());
        }
        logger.error("{} returned {} without a service error body", endpoint, response.getStatus());
        throw new TransportException(endpoint + " returned HTTP " + response.getStatus(), response.getStatus());
    }
}
