package com.codeheadsystems.qbt.model.torrent;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Wire model for a single entry of {@code GET /api/v2/torrents/info}.
 * <p>
 * Only the subset of fields the client uses is mapped; everything else the server sends is
 * ignored.  Sizes and byte counters are in bytes, speeds in bytes per second, and timestamps
 * in seconds since the epoch.
 *
 * @param hash          the torrent's info hash (v1 or hybrid)
 * @param name          display name
 * @param category      category name, empty when uncategorised
 * @param tags          comma-separated tag list as the server reports it
 * @param state         the server's state string (e.g. {@code downloading}, {@code stoppedUP})
 * @param savePath      absolute save path on the server
 * @param magnetUri     the magnet URI the server derives for the torrent
 * @param size          selected size in bytes
 * @param progress      completion in the range 0.0 to 1.0
 * @param downloadSpeed current download speed
 * @param uploadSpeed   current upload speed
 * @param downloaded    bytes downloaded
 * @param uploaded      bytes uploaded
 * @param ratio         share ratio
 * @param eta           estimated seconds to completion
 * @param priority      queue position, or a non-positive value when not queued
 * @param numSeeds      connected seeds
 * @param numLeechs     connected leechers
 * @param addedOn       time the torrent was added
 * @param completionOn  time the torrent completed, negative when incomplete
 * @param forceStart    whether force start is enabled
 * @param superSeeding  whether super seeding is enabled
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TorrentInfo(
    @JsonProperty("hash") String hash,
    @JsonProperty("name") String name,
    @JsonProperty("category") String category,
    @JsonProperty("tags") String tags,
    @JsonProperty("state") String state,
    @JsonProperty("save_path") String savePath,
    @JsonProperty("magnet_uri") String magnetUri,
    @JsonProperty("size") long size,
    @JsonProperty("progress") double progress,
    @JsonProperty("dlspeed") long downloadSpeed,
    @JsonProperty("upspeed") long uploadSpeed,
    @JsonProperty("downloaded") long downloaded,
    @JsonProperty("uploaded") long uploaded,
    @JsonProperty("ratio") double ratio,
    @JsonProperty("eta") long eta,
    @JsonProperty("priority") int priority,
    @JsonProperty("num_seeds") int numSeeds,
    @JsonProperty("num_leechs") int numLeechs,
    @JsonProperty("added_on") long addedOn,
    @JsonProperty("completion_on") long completionOn,
    @JsonProperty("force_start") boolean forceStart,
    @JsonProperty("super_seeding") boolean superSeeding) {

  /**
   * Splits the server's comma-separated tag string.
   *
   * @return the tags, empty when none are set
   */
  @JsonIgnore
  public List<String> tagList() {
    if (tags == null || tags.isBlank()) {
      return List.of();
    }
    return Arrays.stream(tags.split(","))
        .map(String::trim)
        .filter(tag -> !tag.isEmpty())
        .toList();
  }

  /**
   * Parses {@link #magnetUri()}.
   *
   * @return the parsed magnet link, or empty if the server did not report a usable magnet URI
   */
  @JsonIgnore
  public Optional<MagnetLink> magnetLink() {
    if (magnetUri == null || !magnetUri.startsWith(MagnetLink.PREFIX)) {
      return Optional.empty();
    }
    return Optional.of(MagnetLink.parse(magnetUri));
  }
}
