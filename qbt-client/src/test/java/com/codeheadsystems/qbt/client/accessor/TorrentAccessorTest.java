package com.codeheadsystems.qbt.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.qbt.client.QbtClient;
import com.codeheadsystems.qbt.client.classifier.ErrorClassifier;
import com.codeheadsystems.qbt.client.exceptions.ErrorCode;
import com.codeheadsystems.qbt.client.exceptions.QbtClientException;
import com.codeheadsystems.qbt.client.exceptions.TorrentAccessorException;
import com.codeheadsystems.qbt.client.retry.RetryExecutor;
import com.codeheadsystems.qbt.client.transport.CallContext;
import com.codeheadsystems.qbt.client.transport.TransportRequest;
import com.codeheadsystems.qbt.client.transport.TransportResponse;
import com.codeheadsystems.qbt.model.rss.RssFeed;
import com.codeheadsystems.qbt.model.torrent.AddTorrentRequest;
import com.codeheadsystems.qbt.model.torrent.Category;
import com.codeheadsystems.qbt.model.torrent.TorrentInfo;
import com.codeheadsystems.qbt.model.torrent.TorrentProperties;
import com.codeheadsystems.qbt.model.torrent.TorrentTracker;
import com.codeheadsystems.qbt.model.transfer.TransferInfo;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TorrentAccessorTest {

  @Mock private RetryExecutor retryExecutor;

  private final ObjectMapper objectMapper = QbtClient.objectMapper();
  private TorrentAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = new TorrentAccessor(retryExecutor, objectMapper, new ErrorClassifier());
  }

  private void respond(String label, int status, String body) {
    when(retryExecutor.execute(eq(label), any(), any())).thenReturn(TransportResponse.of(status, body));
  }

  private TransportRequest sent(String label) {
    ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
    verify(retryExecutor).execute(eq(label), any(), captor.capture());
    return captor.getValue();
  }

  private static String decoded(String body) {
    return URLDecoder.decode(body, StandardCharsets.UTF_8);
  }

  // ── Torrents ──────────────────────────────────────────────────────────────

  @Test
  void listTorrents_byCategory_decodesList() {
    respond("GET /api/v2/torrents/info", 200,
        "[{\"hash\":\"h1\",\"name\":\"one\",\"category\":\"linux\"},{\"hash\":\"h2\",\"name\":\"two\"}]");

    List<TorrentInfo> torrents = accessor.listTorrents("linux");

    assertThat(torrents).extracting(TorrentInfo::hash).containsExactly("h1", "h2");
    assertThat(sent("GET /api/v2/torrents/info").path()).isEqualTo("/api/v2/torrents/info?category=linux");
  }

  @Test
  void listTorrents_noCategory_omitsQuery() {
    respond("GET /api/v2/torrents/info", 200, "[]");

    assertThat(accessor.listTorrents(null)).isEmpty();
    assertThat(sent("GET /api/v2/torrents/info").path()).isEqualTo("/api/v2/torrents/info");
  }

  @Test
  void getTorrent_unknownHash_isEmpty() {
    respond("GET /api/v2/torrents/info", 200, "[]");

    Optional<TorrentInfo> torrent = accessor.getTorrent("nope");

    assertThat(torrent).isEmpty();
    assertThat(sent("GET /api/v2/torrents/info").path()).endsWith("?hashes=nope");
  }

  @Test
  void getTorrentProperties_decodes() {
    respond("GET /api/v2/torrents/properties", 200,
        "{\"save_path\":\"/downloads/\",\"piece_size\":4194304,\"share_ratio\":1.5,"
            + "\"completion_date\":1714557600,\"seeds_total\":42}");

    TorrentProperties properties = accessor.getTorrentProperties("abc");

    assertThat(properties.savePath()).isEqualTo("/downloads/");
    assertThat(properties.pieceSize()).isEqualTo(4194304L);
    assertThat(properties.shareRatio()).isEqualTo(1.5);
    assertThat(properties.seedsTotal()).isEqualTo(42);
    assertThat(properties.isComplete()).isTrue();
    assertThat(sent("GET /api/v2/torrents/properties").path()).endsWith("?hash=abc");
  }

  @Test
  void getTorrentProperties_unknownHash_carriesStatus() {
    respond("GET /api/v2/torrents/properties", 404, "Not Found");

    assertThatThrownBy(() -> accessor.getTorrentProperties("nope"))
        .isInstanceOfSatisfying(QbtClientException.class, e -> assertThat(e.statusCode()).isEqualTo(404));
  }

  @Test
  void getTorrentTrackers_decodesList() {
    respond("GET /api/v2/torrents/trackers", 200,
        "[{\"url\":\"** [DHT] **\",\"status\":2,\"tier\":-1},"
            + "{\"url\":\"udp://tracker.example:1337\",\"status\":4,\"tier\":0,\"msg\":\"timed out\"}]");

    List<TorrentTracker> trackers = accessor.getTorrentTrackers("abc");

    assertThat(trackers).hasSize(2);
    assertThat(trackers.get(0).isPseudoTracker()).isTrue();
    assertThat(trackers.get(0).isWorking()).isTrue();
    assertThat(trackers.get(1).isWorking()).isFalse();
    assertThat(trackers.get(1).msg()).isEqualTo("timed out");
    assertThat(sent("GET /api/v2/torrents/trackers").path()).endsWith("?hash=abc");
  }

  @Test
  void addTorrentLink_postsForm() {
    respond("POST /api/v2/torrents/add", 200, "Ok.");

    accessor.addTorrentLink(new AddTorrentRequest("magnet:?xt=urn:btih:abc", "/data", "linux", true, false));

    TransportRequest request = sent("POST /api/v2/torrents/add");
    assertThat(decoded(request.body()))
        .contains("urls=magnet:?xt=urn:btih:abc")
        .contains("savepath=/data")
        .contains("category=linux")
        .contains("paused=true")
        .contains("skip_checking=false");
  }

  @Test
  void addTorrentLink_refused_throws() {
    respond("POST /api/v2/torrents/add", 200, "Fails.");

    assertThatThrownBy(() -> accessor.addTorrentLink(AddTorrentRequest.ofMagnet("magnet:?xt=urn:btih:abc")))
        .isInstanceOf(TorrentAccessorException.class);
  }

  @Test
  void deleteTorrents_sendsHashesAndFlag() {
    respond("POST /api/v2/torrents/delete", 200, "");

    accessor.deleteTorrents("h1|h2", true);

    assertThat(decoded(sent("POST /api/v2/torrents/delete").body())).isEqualTo("hashes=h1|h2&deleteFiles=true");
  }

  @Test
  void addTags_joinsWithComma() {
    respond("POST /api/v2/torrents/addTags", 200, "");

    accessor.addTags("h1", List.of("iso", "linux"));

    assertThat(decoded(sent("POST /api/v2/torrents/addTags").body())).isEqualTo("hashes=h1&tags=iso,linux");
  }

  @Test
  void startTorrents_terminalErrorStatus_isClassified() {
    respond("POST /api/v2/torrents/start", 409, "conflict");

    assertThatThrownBy(() -> accessor.startTorrents("h1"))
        .isInstanceOfSatisfying(QbtClientException.class, e -> {
          assertThat(e.code()).isEqualTo(ErrorCode.UNKNOWN);
          assertThat(e.statusCode()).isEqualTo(409);
        });
  }

  // ── Categories and transfer ───────────────────────────────────────────────

  @Test
  void getCategories_decodesMap() {
    respond("GET /api/v2/torrents/categories", 200,
        "{\"linux\":{\"name\":\"linux\",\"savePath\":\"/data/linux\"}}");

    Map<String, Category> categories = accessor.getCategories();

    assertThat(categories).containsKey("linux");
    assertThat(categories.get("linux").savePath()).isEqualTo("/data/linux");
  }

  @Test
  void deleteCategory_usesRemoveCategories() {
    respond("POST /api/v2/torrents/removeCategories", 200, "");

    accessor.deleteCategory("linux");

    assertThat(decoded(sent("POST /api/v2/torrents/removeCategories").body())).isEqualTo("categories=linux");
  }

  @Test
  void getTransferInfo_decodes() {
    respond("GET /api/v2/transfer/info", 200,
        "{\"dl_info_speed\":1024,\"up_info_speed\":2048,\"dht_nodes\":300,\"connection_status\":\"connected\"}");

    TransferInfo info = accessor.getTransferInfo();

    assertThat(info.downloadSpeed()).isEqualTo(1024);
    assertThat(info.connectionStatus()).isEqualTo("connected");
  }

  @Test
  void getTransferInfo_malformedBody_throwsAccessorException() {
    respond("GET /api/v2/transfer/info", 200, "<html>");

    assertThatThrownBy(() -> accessor.getTransferInfo())
        .isInstanceOf(TorrentAccessorException.class)
        .hasMessageContaining("decode");
  }

  @Test
  void setDownloadLimit_postsLimit() {
    respond("POST /api/v2/transfer/setDownloadLimit", 200, "");

    accessor.setDownloadLimit(1_048_576L);

    assertThat(sent("POST /api/v2/transfer/setDownloadLimit").body()).isEqualTo("limit=1048576");
  }

  // ── Application and RSS ───────────────────────────────────────────────────

  @Test
  void getAppVersion_trimsBody() {
    respond("GET /api/v2/app/version", 200, "v4.6.2\n");

    assertThat(accessor.getAppVersion()).isEqualTo("v4.6.2");
  }

  @Test
  void setMaxActiveTorrentLimits_postsJsonPreferences() throws Exception {
    respond("POST /api/v2/app/setPreferences", 200, "");

    accessor.setMaxActiveTorrentLimits(3, 5, 8, 1);

    String body = decoded(sent("POST /api/v2/app/setPreferences").body());
    assertThat(body).startsWith("json=");
    Map<String, Object> json = objectMapper.readValue(body.substring("json=".length()), new TypeReference<>() {
    });
    assertThat(json).containsEntry("max_active_downloads", 3)
        .containsEntry("max_active_uploads", 5)
        .containsEntry("max_active_torrents", 8)
        .containsEntry("max_active_checking_torrents", 1);
  }

  @Test
  void getRssFeeds_withData() {
    respond("GET /api/v2/rss/items", 200, "{\"news\":{\"uid\":\"1\",\"url\":\"https://example.com/rss\",\"articles\":[]}}");

    Map<String, RssFeed> feeds = accessor.getRssFeeds(true);

    assertThat(feeds.get("news").url()).isEqualTo("https://example.com/rss");
    assertThat(sent("GET /api/v2/rss/items").path()).isEqualTo("/api/v2/rss/items?withData=true");
  }

  @Test
  void withContext_passesBoundContext() {
    CallContext context = CallContext.background();
    when(retryExecutor.execute(eq("POST /api/v2/rss/removeItem"), eq(context), any()))
        .thenReturn(TransportResponse.of(200, ""));

    accessor.withContext(context).removeRssFeed("news");

    verify(retryExecutor).execute(eq("POST /api/v2/rss/removeItem"), eq(context), any());
  }
}
