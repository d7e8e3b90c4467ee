package com.codeheadsystems.qbt.client.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.qbt.client.QbtClient;
import java.net.URI;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.Test;

class QbtClientConfigTest {

  @Test
  void of_appliesDefaults() {
    QbtClientConfig config = QbtClientConfig.of("http://localhost:8080", "admin", "secret");

    assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.maxRetries()).isEqualTo(3);
    assertThat(config.retryBackoff()).isEqualTo(Duration.ofSeconds(1));
    assertThat(config.maxBackoff()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.backoffFactor()).isEqualTo(2.0);
    assertThat(config.retryableStatusCodes()).containsExactlyInAnyOrder(408, 429, 500, 502, 503, 504);
    assertThat(config.sessionExpiry()).isEqualTo(Duration.ofHours(24));
    assertThat(config.sweepInterval()).isEqualTo(Duration.ofMinutes(5));
    assertThat(config.debug()).isFalse();
  }

  @Test
  void toString_masksPassword() {
    QbtClientConfig config = QbtClientConfig.of("http://localhost:8080", "admin", "hunter2");

    assertThat(config.toString()).contains("admin").doesNotContain("hunter2");
  }

  @Test
  void resolve_handlesTrailingSlash() {
    QbtClientConfig config = QbtClientConfig.of("http://nas.local:8080/qbt/", "u", "p");

    assertThat(config.resolve("/api/v2/app/version"))
        .isEqualTo(URI.create("http://nas.local:8080/qbt/api/v2/app/version"));
  }

  @Test
  void withRetries_keepsOtherSettings() {
    QbtClientConfig config = QbtClientConfig.of("http://localhost:8080", "u", "p")
        .withDebug(true)
        .withRetries(5, Duration.ofMillis(10), Duration.ofMillis(100));

    assertThat(config.maxRetries()).isEqualTo(5);
    assertThat(config.retryBackoff()).isEqualTo(Duration.ofMillis(10));
    assertThat(config.maxBackoff()).isEqualTo(Duration.ofMillis(100));
    assertThat(config.debug()).isTrue();
    assertThat(RetryPolicy.fromConfig(config).totalAttempts()).isEqualTo(6);
  }

  @Test
  void jackson_bindsPartialDocument() throws Exception {
    String json = """
        {"baseUri": "https://torrents.example.com",
         "username": "admin",
         "password": "secret",
         "requestTimeout": "PT10S",
         "maxRetries": 2,
         "retryableStatusCodes": [503],
         "unknownSetting": true}
        """;

    QbtClientConfig config = QbtClient.objectMapper().readValue(json, QbtClientConfig.class);

    assertThat(config.baseUri()).isEqualTo(URI.create("https://torrents.example.com"));
    assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(config.maxRetries()).isEqualTo(2);
    assertThat(config.retryableStatusCodes()).isEqualTo(Set.of(503));
    assertThat(config.retryBackoff()).isEqualTo(QbtClientConfig.DEFAULT_RETRY_BACKOFF);
  }

  @Test
  void retryPolicy_isRetryableStatus() {
    RetryPolicy policy = RetryPolicy.fromConfig(QbtClientConfig.of("http://localhost", "u", "p"));

    assertThat(policy.isRetryableStatus(503)).isTrue();
    assertThat(policy.isRetryableStatus(404)).isFalse();
    assertThat(policy.isRetryableStatus(401)).isFalse();
  }
}
