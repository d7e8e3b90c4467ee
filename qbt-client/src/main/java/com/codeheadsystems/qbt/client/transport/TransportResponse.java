package com.codeheadsystems.qbt.client.transport;

import java.net.HttpCookie;
import java.util.List;
import java.util.Map;

/**
 * The parts of an HTTP response the engine needs.
 *
 * @param statusCode the status
 * @param headers    response headers
 * @param body       the body as text, never null
 * @param cookies    cookies parsed from {@code Set-Cookie}, only when capture was requested
 */
public record TransportResponse(int statusCode,
                                Map<String, List<String>> headers,
                                String body,
                                List<HttpCookie> cookies) {

  public TransportResponse {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    body = body == null ? "" : body;
    cookies = cookies == null ? List.of() : List.copyOf(cookies);
  }

  public static TransportResponse of(final int statusCode, final String body) {
    return new TransportResponse(statusCode, Map.of(), body, List.of());
  }

  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }
}
