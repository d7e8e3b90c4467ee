package com.codeheadsystems.qbt.client.transport;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One HTTP exchange as the engine sees it.
 *
 * @param method           {@code GET} or {@code POST}
 * @param path             path below the base URI, with any query string
 * @param body             request body, may be null
 * @param headers          extra request headers
 * @param sessionArtifacts session cookies to send, empty for unauthenticated requests
 * @param captureSession   whether {@code Set-Cookie} headers of the response are parsed
 * @param timeout          per-request timeout overriding the configured one, may be null
 */
public record TransportRequest(String method,
                               String path,
                               String body,
                               Map<String, String> headers,
                               Map<String, String> sessionArtifacts,
                               boolean captureSession,
                               Duration timeout) {

  public TransportRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    sessionArtifacts = sessionArtifacts == null ? Map.of() : Map.copyOf(sessionArtifacts);
  }

  public static TransportRequest get(final String path) {
    return new TransportRequest("GET", path, null, Map.of(), Map.of(), false, null);
  }

  /**
   * A GET with the form encoded as query string.
   *
   * @param path  the path
   * @param query the query parameters
   * @return the transport request
   */
  public static TransportRequest get(final String path, final FormBody query) {
    if (query.isEmpty()) {
      return get(path);
    }
    return get(path + "?" + query.encoded());
  }

  public static TransportRequest postForm(final String path, final FormBody form) {
    return new TransportRequest("POST", path, form.encoded(),
        Map.of("Content-Type", FormBody.CONTENT_TYPE), Map.of(), false, null);
  }

  public TransportRequest withSessionArtifacts(final Map<String, String> artifacts) {
    return new TransportRequest(method, path, body, headers, artifacts, captureSession, timeout);
  }

  public TransportRequest withCaptureSession(final boolean capture) {
    return new TransportRequest(method, path, body, headers, sessionArtifacts, capture, timeout);
  }

  public TransportRequest withTimeout(final Duration requestTimeout) {
    return new TransportRequest(method, path, body, headers, sessionArtifacts, captureSession, requestTimeout);
  }

  public TransportRequest withHeader(final String name, final String value) {
    Map<String, String> copy = new HashMap<>(headers);
    copy.put(name, value);
    return new TransportRequest(method, path, body, copy, sessionArtifacts, captureSession, timeout);
  }

  /**
   * Label used for logging and error messages.
   *
   * @return e.g. {@code GET /api/v2/app/version}
   */
  public String describe() {
    int q = path.indexOf('?');
    return method + " " + (q < 0 ? path : path.substring(0, q));
  }
}
