package com.codeheadsystems.qbt.client;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process stand-in for the torrent service's Web API: cookie sessions, the {@code Fails.}
 * login reply, 403 for requests without a live session, and scripted 503s.
 */
class FakeQbtServer implements AutoCloseable {

  static final String TORRENTS_JSON = "[{\"hash\":\"abc\",\"name\":\"debian.iso\",\"category\":\"linux\"}]";

  private final HttpServer server;
  private final String username;
  private final String password;
  private final Set<String> sessions = ConcurrentHashMap.newKeySet();
  private final AtomicInteger sessionCounter = new AtomicInteger();
  private final AtomicInteger failuresToServe = new AtomicInteger();

  final AtomicInteger logins = new AtomicInteger();
  final AtomicInteger logouts = new AtomicInteger();
  final AtomicInteger torrentRequests = new AtomicInteger();

  FakeQbtServer(final String username, final String password) throws IOException {
    this.username = username;
    this.password = password;
    this.server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/api/v2/app/version", this::version);
    server.createContext("/api/v2/auth/login", this::login);
    server.createContext("/api/v2/auth/logout", this::logout);
    server.createContext("/api/v2/torrents/info", this::torrents);
    server.start();
  }

  String baseUri() {
    return "http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort();
  }

  /**
   * Forgets every session, as the real service does when its session timeout passes.
   */
  void expireSessions() {
    sessions.clear();
  }

  void failNextTorrentRequests(final int count) {
    failuresToServe.set(count);
  }

  private void version(HttpExchange exchange) throws IOException {
    drain(exchange);
    if (hasSession(exchange)) {
      send(exchange, 200, "v4.6.0", null);
    } else {
      send(exchange, 403, "Forbidden", null);
    }
  }

  private void login(HttpExchange exchange) throws IOException {
    logins.incrementAndGet();
    Map<String, String> form = parseForm(drain(exchange));
    if (username.equals(form.get("username")) && password.equals(form.get("password"))) {
      String sid = "sid-" + sessionCounter.incrementAndGet();
      sessions.add(sid);
      send(exchange, 200, "Ok.", "SID=" + sid + "; HttpOnly; path=/");
    } else {
      send(exchange, 200, "Fails.", null);
    }
  }

  private void logout(HttpExchange exchange) throws IOException {
    drain(exchange);
    logouts.incrementAndGet();
    sessionId(exchange).ifPresent(sessions::remove);
    send(exchange, 200, "", null);
  }

  private void torrents(HttpExchange exchange) throws IOException {
    drain(exchange);
    torrentRequests.incrementAndGet();
    if (!hasSession(exchange)) {
      send(exchange, 403, "Forbidden", null);
    } else if (failuresToServe.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      send(exchange, 503, "Service Unavailable", null);
    } else {
      send(exchange, 200, TORRENTS_JSON, null);
    }
  }

  private boolean hasSession(HttpExchange exchange) {
    return sessionId(exchange).map(sessions::contains).orElse(false);
  }

  private static Optional<String> sessionId(HttpExchange exchange) {
    String cookie = exchange.getRequestHeaders().getFirst("Cookie");
    if (cookie == null) {
      return Optional.empty();
    }
    for (String pair : cookie.split(";")) {
      String trimmed = pair.trim();
      if (trimmed.startsWith("SID=")) {
        return Optional.of(trimmed.substring(4));
      }
    }
    return Optional.empty();
  }

  private static String drain(HttpExchange exchange) throws IOException {
    try (InputStream in = exchange.getRequestBody()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static Map<String, String> parseForm(String body) {
    Map<String, String> form = new HashMap<>();
    for (String pair : body.split("&")) {
      int eq = pair.indexOf('=');
      if (eq > 0) {
        form.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
            URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
      }
    }
    return form;
  }

  private static void send(HttpExchange exchange, int status, String body, String setCookie) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    if (setCookie != null) {
      exchange.getResponseHeaders().add("Set-Cookie", setCookie);
    }
    exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  @Override
  public void close() {
    server.stop(0);
  }
}
