package com.codeheadsystems.qbt.model.torrent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One tracker entry of {@code GET /api/v2/torrents/trackers}.  The service also lists the DHT,
 * PeX and LSD pseudo-trackers, whose URLs start with {@code **}.
 *
 * @param url           the announce URL
 * @param status        0 disabled, 1 not contacted, 2 working, 3 updating, 4 not working
 * @param tier          the tier, negative for the pseudo-trackers
 * @param numPeers      peers reported by the tracker
 * @param numSeeds      seeds reported by the tracker
 * @param numLeeches    leechers reported by the tracker
 * @param numDownloaded completed downloads reported by the tracker
 * @param msg           the last tracker message
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TorrentTracker(
    @JsonProperty("url") String url,
    @JsonProperty("status") int status,
    @JsonProperty("tier") int tier,
    @JsonProperty("num_peers") int numPeers,
    @JsonProperty("num_seeds") int numSeeds,
    @JsonProperty("num_leeches") int numLeeches,
    @JsonProperty("num_downloaded") int numDownloaded,
    @JsonProperty("msg") String msg) {

  public static final int STATUS_WORKING = 2;

  public boolean isWorking() {
    return status == STATUS_WORKING;
  }

  public boolean isPseudoTracker() {
    return url != null && url.startsWith("**");
  }
}
