package com.codeheadsystems.qbt.client.accessor;

import com.codeheadsystems.qbt.client.classifier.ErrorClassifier;
import com.codeheadsystems.qbt.client.exceptions.QbtClientException;
import com.codeheadsystems.qbt.client.exceptions.TorrentAccessorException;
import com.codeheadsystems.qbt.client.retry.RetryExecutor;
import com.codeheadsystems.qbt.client.transport.CallContext;
import com.codeheadsystems.qbt.client.transport.FormBody;
import com.codeheadsystems.qbt.client.transport.TransportRequest;
import com.codeheadsystems.qbt.client.transport.TransportResponse;
import com.codeheadsystems.qbt.model.rss.RssFeed;
import com.codeheadsystems.qbt.model.torrent.AddTorrentRequest;
import com.codeheadsystems.qbt.model.torrent.Category;
import com.codeheadsystems.qbt.model.torrent.TorrentFile;
import com.codeheadsystems.qbt.model.torrent.TorrentInfo;
import com.codeheadsystems.qbt.model.torrent.TorrentProperties;
import com.codeheadsystems.qbt.model.torrent.TorrentTracker;
import com.codeheadsystems.qbt.model.transfer.TransferInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed calls against the torrent service's Web API v2.
 * <p>
 * Every method goes through {@link RetryExecutor#execute}, so it logs in on demand, retries
 * transient failures and re-authenticates after a rejected session.  A response the executor
 * returns with a non-2xx status is turned into a {@link QbtClientException} by the
 * {@link ErrorClassifier}.  Bodies that cannot be decoded raise {@link TorrentAccessorException}.
 * <p>
 * Calls use a background context unless the accessor was bound to one with
 * {@link #withContext(CallContext)}.
 */
@Singleton
public class TorrentAccessor {

  private static final Logger log = LoggerFactory.getLogger(TorrentAccessor.class);

  private static final TypeReference<List<TorrentInfo>> TORRENT_LIST = new TypeReference<>() {
  };
  private static final TypeReference<List<TorrentFile>> FILE_LIST = new TypeReference<>() {
  };
  private static final TypeReference<List<TorrentTracker>> TRACKER_LIST = new TypeReference<>() {
  };
  private static final TypeReference<Map<String, Category>> CATEGORY_MAP = new TypeReference<>() {
  };
  private static final TypeReference<Map<String, RssFeed>> FEED_MAP = new TypeReference<>() {
  };
  private static final TypeReference<Map<String, Object>> PREFERENCES = new TypeReference<>() {
  };

  private final RetryExecutor retryExecutor;
  private final ObjectMapper objectMapper;
  private final ErrorClassifier classifier;
  private final CallContext boundContext;

  /**
   * Instantiates a new Torrent accessor.
   *
   * @param retryExecutor the retry executor
   * @param objectMapper  the object mapper
   * @param classifier    the classifier
   */
  @Inject
  public TorrentAccessor(final RetryExecutor retryExecutor,
                         final ObjectMapper objectMapper,
                         final ErrorClassifier classifier) {
    this(retryExecutor, objectMapper, classifier, null);
    log.info("TorrentAccessor()");
  }

  private TorrentAccessor(final RetryExecutor retryExecutor,
                          final ObjectMapper objectMapper,
                          final ErrorClassifier classifier,
                          final CallContext boundContext) {
    this.retryExecutor = retryExecutor;
    this.objectMapper = objectMapper;
    this.classifier = classifier;
    this.boundContext = boundContext;
  }

  /**
   * A copy of this accessor whose calls all run under the given context.
   *
   * @param context the context
   * @return the torrent accessor
   */
  public TorrentAccessor withContext(final CallContext context) {
    return new TorrentAccessor(retryExecutor, objectMapper, classifier, context);
  }

  // ── Torrents ──────────────────────────────────────────────────────────────

  /**
   * Lists torrents, optionally filtered by category.
   *
   * @param category the category, or null for all torrents
   * @return the torrents
   */
  public List<TorrentInfo> listTorrents(final String category) {
    log.debug("listTorrents(category={})", category);
    return read(get("/api/v2/torrents/info", FormBody.create().add("category", category)), TORRENT_LIST);
  }

  /**
   * Looks up one torrent by hash.
   *
   * @param hash the info hash
   * @return the torrent, empty if the service does not know it
   */
  public Optional<TorrentInfo> getTorrent(final String hash) {
    log.debug("getTorrent(hash={})", hash);
    final List<TorrentInfo> list =
        read(get("/api/v2/torrents/info", FormBody.create().add("hashes", hash)), TORRENT_LIST);
    return list.stream().findFirst();
  }

  /**
   * Adds a torrent by magnet link or URL.
   *
   * @param request the request
   */
  public void addTorrentLink(final AddTorrentRequest request) {
    log.debug("addTorrentLink(category={})", request.category());
    final TransportResponse response = post("/api/v2/torrents/add", FormBody.create()
        .add("urls", request.urls())
        .add("savepath", request.savePath())
        .add("category", request.category())
        .add("paused", request.paused())
        .add("stopped", request.paused())
        .add("skip_checking", request.skipChecking()));
    if (response.body().contains(ErrorClassifier.LOGIN_FAILURE_SENTINEL)) {
      throw new TorrentAccessorException("The service refused to add the torrent", null);
    }
  }

  public void startTorrents(final String hash) {
    log.debug("startTorrents(hash={})", hash);
    post("/api/v2/torrents/start", FormBody.create().add("hashes", hash));
  }

  public void stopTorrents(final String hash) {
    log.debug("stopTorrents(hash={})", hash);
    post("/api/v2/torrents/stop", FormBody.create().add("hashes", hash));
  }

  /**
   * Removes torrents.
   *
   * @param hash        hashes separated by {@code |}, or {@code all}
   * @param deleteFiles also delete the downloaded data
   */
  public void deleteTorrents(final String hash, final boolean deleteFiles) {
    log.debug("deleteTorrents(hash={}, deleteFiles={})", hash, deleteFiles);
    post("/api/v2/torrents/delete", FormBody.create().add("hashes", hash).add("deleteFiles", deleteFiles));
  }

  public void addTags(final String hash, final Collection<String> tags) {
    log.debug("addTags(hash={}, tags={})", hash, tags);
    post("/api/v2/torrents/addTags", FormBody.create().add("hashes", hash).add("tags", String.join(",", tags)));
  }

  public void removeTags(final String hash, final Collection<String> tags) {
    log.debug("removeTags(hash={}, tags={})", hash, tags);
    post("/api/v2/torrents/removeTags", FormBody.create().add("hashes", hash).add("tags", String.join(",", tags)));
  }

  public List<TorrentFile> listTorrentFiles(final String hash) {
    log.debug("listTorrentFiles(hash={})", hash);
    return read(get("/api/v2/torrents/files", FormBody.create().add("hash", hash)), FILE_LIST);
  }

  /**
   * Generic properties of one torrent.  The service answers 404 for an unknown hash, which
   * surfaces as a {@link QbtClientException} carrying that status.
   *
   * @param hash the info hash
   * @return the properties
   */
  public TorrentProperties getTorrentProperties(final String hash) {
    log.debug("getTorrentProperties(hash={})", hash);
    return read(get("/api/v2/torrents/properties", FormBody.create().add("hash", hash)), TorrentProperties.class);
  }

  public List<TorrentTracker> getTorrentTrackers(final String hash) {
    log.debug("getTorrentTrackers(hash={})", hash);
    return read(get("/api/v2/torrents/trackers", FormBody.create().add("hash", hash)), TRACKER_LIST);
  }

  // ── Categories ────────────────────────────────────────────────────────────

  public void setCategory(final String hash, final String category) {
    log.debug("setCategory(hash={}, category={})", hash, category);
    post("/api/v2/torrents/setCategory", FormBody.create().add("hashes", hash).add("category", category));
  }

  public Map<String, Category> getCategories() {
    log.debug("getCategories()");
    return read(get("/api/v2/torrents/categories", FormBody.create()), CATEGORY_MAP);
  }

  public void createCategory(final String name, final String savePath) {
    log.debug("createCategory(name={})", name);
    post("/api/v2/torrents/createCategory", FormBody.create().add("category", name).add("savePath", savePath));
  }

  public void deleteCategory(final String name) {
    log.debug("deleteCategory(name={})", name);
    post("/api/v2/torrents/removeCategories", FormBody.create().add("categories", name));
  }

  // ── Transfer ──────────────────────────────────────────────────────────────

  public TransferInfo getTransferInfo() {
    log.debug("getTransferInfo()");
    return read(get("/api/v2/transfer/info", FormBody.create()), TransferInfo.class);
  }

  /**
   * Sets the global download limit.
   *
   * @param bytesPerSecond the limit, 0 for unlimited
   */
  public void setDownloadLimit(final long bytesPerSecond) {
    log.debug("setDownloadLimit({})", bytesPerSecond);
    post("/api/v2/transfer/setDownloadLimit", FormBody.create().add("limit", bytesPerSecond));
  }

  /**
   * Sets the global upload limit.
   *
   * @param bytesPerSecond the limit, 0 for unlimited
   */
  public void setUploadLimit(final long bytesPerSecond) {
    log.debug("setUploadLimit({})", bytesPerSecond);
    post("/api/v2/transfer/setUploadLimit", FormBody.create().add("limit", bytesPerSecond));
  }

  // ── Application ───────────────────────────────────────────────────────────

  public String getAppVersion() {
    log.debug("getAppVersion()");
    return get("/api/v2/app/version", FormBody.create()).body().trim();
  }

  public String getApiVersion() {
    log.debug("getApiVersion()");
    return get("/api/v2/app/webapiVersion", FormBody.create()).body().trim();
  }

  public Map<String, Object> getPreferences() {
    log.debug("getPreferences()");
    return read(get("/api/v2/app/preferences", FormBody.create()), PREFERENCES);
  }

  /**
   * Changes the given preferences; keys not present are left alone by the service.
   *
   * @param preferences preference keys as the service names them
   */
  public void setPreferences(final Map<String, ?> preferences) {
    log.debug("setPreferences(keys={})", preferences.keySet());
    final String json;
    try {
      json = objectMapper.writeValueAsString(preferences);
    } catch (JsonProcessingException e) {
      throw new TorrentAccessorException("Failed to serialize preferences", e);
    }
    post("/api/v2/app/setPreferences", FormBody.create().add("json", json));
  }

  /**
   * Sets the queueing limits in one call.
   *
   * @param maxDownloads maximum active downloads
   * @param maxUploads   maximum active uploads
   * @param maxTorrents  maximum active torrents
   * @param maxChecking  maximum torrents checking at once
   */
  public void setMaxActiveTorrentLimits(final int maxDownloads,
                                        final int maxUploads,
                                        final int maxTorrents,
                                        final int maxChecking) {
    final Map<String, Object> limits = new LinkedHashMap<>();
    limits.put("max_active_downloads", maxDownloads);
    limits.put("max_active_uploads", maxUploads);
    limits.put("max_active_torrents", maxTorrents);
    limits.put("max_active_checking_torrents", maxChecking);
    setPreferences(limits);
  }

  // ── RSS ───────────────────────────────────────────────────────────────────

  public Map<String, RssFeed> getRssFeeds(final boolean withData) {
    log.debug("getRssFeeds(withData={})", withData);
    return read(get("/api/v2/rss/items", FormBody.create().add("withData", withData)), FEED_MAP);
  }

  public void addRssFeed(final String url, final String path) {
    log.debug("addRssFeed(url={}, path={})", url, path);
    post("/api/v2/rss/addFeed", FormBody.create().add("url", url).add("path", path));
  }

  public void removeRssFeed(final String path) {
    log.debug("removeRssFeed(path={})", path);
    post("/api/v2/rss/removeItem", FormBody.create().add("path", path));
  }

  // ── Plumbing ──────────────────────────────────────────────────────────────

  private TransportResponse get(String path, FormBody query) {
    return call(TransportRequest.get(path, query));
  }

  private TransportResponse post(String path, FormBody form) {
    return call(TransportRequest.postForm(path, form));
  }

  private TransportResponse call(TransportRequest request) {
    final String label = request.describe();
    final CallContext context = boundContext == null ? CallContext.background() : boundContext;
    final TransportResponse response = retryExecutor.execute(label, context, request);
    if (!response.isSuccess()) {
      throw classifier.classifyStatus(response.statusCode(), response.body());
    }
    return response;
  }

  private <T> T read(TransportResponse response, TypeReference<T> type) {
    try {
      return objectMapper.readValue(response.body(), type);
    } catch (JsonProcessingException e) {
      throw new TorrentAccessorException("Failed to decode response", e);
    }
  }

  private <T> T read(TransportResponse response, Class<T> type) {
    try {
      return objectMapper.readValue(response.body(), type);
    } catch (JsonProcessingException e) {
      throw new TorrentAccessorException("Failed to decode response", e);
    }
  }
}
