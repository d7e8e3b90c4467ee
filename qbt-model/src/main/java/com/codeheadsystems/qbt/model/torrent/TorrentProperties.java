package com.codeheadsystems.qbt.model.torrent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic properties of one torrent, from {@code GET /api/v2/torrents/properties}.  Dates are
 * unix seconds, -1 when unknown; speeds are bytes per second.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TorrentProperties(
    @JsonProperty("save_path") String savePath,
    @JsonProperty("creation_date") long creationDate,
    @JsonProperty("piece_size") long pieceSize,
    @JsonProperty("comment") String comment,
    @JsonProperty("total_wasted") long totalWasted,
    @JsonProperty("total_uploaded") long totalUploaded,
    @JsonProperty("total_downloaded") long totalDownloaded,
    @JsonProperty("up_limit") long upLimit,
    @JsonProperty("dl_limit") long dlLimit,
    @JsonProperty("time_elapsed") long timeElapsed,
    @JsonProperty("seeding_time") long seedingTime,
    @JsonProperty("nb_connections") int nbConnections,
    @JsonProperty("nb_connections_limit") int nbConnectionsLimit,
    @JsonProperty("share_ratio") double shareRatio,
    @JsonProperty("addition_date") long additionDate,
    @JsonProperty("completion_date") long completionDate,
    @JsonProperty("created_by") String createdBy,
    @JsonProperty("dl_speed_avg") long dlSpeedAvg,
    @JsonProperty("dl_speed") long dlSpeed,
    @JsonProperty("eta") long eta,
    @JsonProperty("last_seen") long lastSeen,
    @JsonProperty("peers") int peers,
    @JsonProperty("peers_total") int peersTotal,
    @JsonProperty("pieces_have") int piecesHave,
    @JsonProperty("pieces_num") int piecesNum,
    @JsonProperty("reannounce") long reannounce,
    @JsonProperty("seeds") int seeds,
    @JsonProperty("seeds_total") int seedsTotal,
    @JsonProperty("up_speed_avg") long upSpeedAvg,
    @JsonProperty("up_speed") long upSpeed) {

  /**
   * Whether the torrent has finished downloading.
   *
   * @return true once a completion date is set
   */
  public boolean isComplete() {
    return completionDate > 0;
  }
}
