package com.codeheadsystems.qbt.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.qbt.client.config.QbtClientConfig;
import com.codeheadsystems.qbt.client.exceptions.ErrorCode;
import com.codeheadsystems.qbt.client.exceptions.OperationFailedException;
import com.codeheadsystems.qbt.client.session.ConnectionStatus;
import com.codeheadsystems.qbt.client.session.SessionStatus;
import com.codeheadsystems.qbt.client.transport.TransportRequest;
import com.codeheadsystems.qbt.client.transport.TransportResponse;
import com.codeheadsystems.qbt.model.torrent.TorrentInfo;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * End-to-end tests over real HTTP against {@link FakeQbtServer}.
 */
class QbtClientTest {

  private static final String USER = "admin";
  private static final String PASSWORD = "adminadmin";

  private FakeQbtServer server;
  private QbtClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new FakeQbtServer(USER, PASSWORD);
    client = new QbtClient(config(server.baseUri(), PASSWORD));
  }

  @AfterEach
  void tearDown() {
    client.close();
    server.close();
  }

  private static QbtClientConfig config(String baseUri, String password) {
    return QbtClientConfig.of(baseUri, USER, password)
        .withRetries(2, Duration.ofMillis(10), Duration.ofSeconds(1))
        .withRequestTimeout(Duration.ofSeconds(5));
  }

  @Test
  void listTorrents_logsInOnDemand() {
    List<TorrentInfo> torrents = client.torrents().listTorrents(null);

    assertThat(torrents).extracting(TorrentInfo::name).containsExactly("debian.iso");
    assertThat(server.logins.get()).isEqualTo(1);
    assertThat(client.getStatus()).isEqualTo(SessionStatus.CONNECTED);
    assertThat(client.isSessionValid()).isTrue();
  }

  @Test
  void serverSideExpiry_isRecoveredTransparently() {
    client.torrents().listTorrents(null);
    server.expireSessions();

    List<TorrentInfo> torrents = client.torrents().listTorrents(null);

    assertThat(torrents).hasSize(1);
    assertThat(server.logins.get()).isEqualTo(2);
    assertThat(client.isAuthPermanentlyFailed()).isFalse();
  }

  @Test
  void transientFailures_succeedOnThirdCall() {
    client.torrents().listTorrents(null);
    server.failNextTorrentRequests(2);
    int before = server.torrentRequests.get();
    long start = System.nanoTime();

    TransportResponse response = client.execute("list", TransportRequest.get("/api/v2/torrents/info"));

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(server.torrentRequests.get() - before).isEqualTo(3);
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(30));
  }

  @Test
  void persistentFailure_exhaustsAfterThreeAttempts() {
    client.torrents().listTorrents(null);
    server.failNextTorrentRequests(100);

    assertThatThrownBy(() -> client.execute("list", TransportRequest.get("/api/v2/torrents/info")))
        .isInstanceOf(OperationFailedException.class)
        .hasMessageStartingWith("list failed after 3 attempts");
  }

  @Test
  void badPassword_latchesUntilReset() {
    client.update(config(server.baseUri(), "wrong"));

    assertThatThrownBy(() -> client.torrents().listTorrents(null))
        .isInstanceOfSatisfying(OperationFailedException.class, e -> assertThat(e.isPermanent()).isTrue());
    assertThat(client.isAuthPermanentlyFailed()).isTrue();
    ConnectionStatus status = client.getConnectionStatus();
    assertThat(status.status()).isEqualTo(SessionStatus.UNAUTHORIZED);
    assertThat(status.errorCode()).isEqualTo(ErrorCode.AUTH_FAILURE);
    assertThat(status.permanent()).isTrue();

    assertThatThrownBy(() -> client.torrents().listTorrents(null)).isInstanceOf(OperationFailedException.class);
    assertThat(server.logins.get()).isEqualTo(1);

    client.update(config(server.baseUri(), PASSWORD));
    client.resetAuthFailure();
    assertThat(client.getLastError()).isEmpty();
    assertThat(client.torrents().listTorrents(null)).hasSize(1);
  }

  @Test
  void unreachableServer_reportsConnectionRefused() throws Exception {
    int freePort;
    try (ServerSocket socket = new ServerSocket(0)) {
      freePort = socket.getLocalPort();
    }
    try (QbtClient offline = new QbtClient(config("http://127.0.0.1:" + freePort, PASSWORD))) {
      assertThatThrownBy(() -> offline.torrents().getAppVersion())
          .isInstanceOfSatisfying(OperationFailedException.class,
              e -> assertThat(e.code()).isEqualTo(ErrorCode.CONNECTION_REFUSED));
      assertThat(offline.getStatus()).isEqualTo(SessionStatus.UNREACHABLE);
      assertThat(offline.isAuthPermanentlyFailed()).isFalse();
    }
  }

  @Test
  void close_logsOutAndInvalidates() {
    client.torrents().listTorrents(null);

    client.close();

    assertThat(server.logouts.get()).isEqualTo(1);
    assertThat(client.getStatus()).isEqualTo(SessionStatus.UNAUTHORIZED);
  }

  @Test
  void invalidateSession_forcesNewLogin() {
    client.torrents().listTorrents(null);

    client.invalidateSession();
    client.torrents().listTorrents(null);

    assertThat(server.logins.get()).isEqualTo(2);
  }
}
