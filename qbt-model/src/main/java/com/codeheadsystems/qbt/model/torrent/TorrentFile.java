package com.codeheadsystems.qbt.model.torrent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for one file of {@code GET /api/v2/torrents/files}.
 *
 * @param index        file index within the torrent
 * @param name         path of the file relative to the torrent root
 * @param size         file size in bytes
 * @param progress     completion in the range 0.0 to 1.0
 * @param priority     download priority (0 means do not download)
 * @param seed         whether the file is complete and seeding
 * @param pieceRange   first and last piece index covering the file
 * @param availability availability in the swarm, 0.0 to 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TorrentFile(
    @JsonProperty("index") int index,
    @JsonProperty("name") String name,
    @JsonProperty("size") long size,
    @JsonProperty("progress") double progress,
    @JsonProperty("priority") int priority,
    @JsonProperty("is_seed") boolean seed,
    @JsonProperty("piece_range") List<Integer> pieceRange,
    @JsonProperty("availability") double availability) {
}
