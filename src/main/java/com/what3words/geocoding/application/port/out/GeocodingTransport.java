package com.what3words.geocoding.application.port.out;

import java.util.Map;

/**
 * Output port for the HTTP round trip to the geocoding service.
 */
public interface GeocodingTransport {

  /**
   * Issue a GET against an endpoint of the configured host.
   *
   * @param endpoint path below the API base, e.g. {@code /convert-to-3wa}
   * @param params query parameters, sent in iteration order
   * @return status and raw body; non-2xx statuses are returned, not thrown
   * @throws com.what3words.geocoding.domain.exception.TransportException if no
   *         response was received
   */
  TransportResponse get(String endpoint, Map<String, String> params);
}
