package com.codeheadsystems.qbt.model.torrent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a category of {@code GET /api/v2/torrents/categories}.
 *
 * @param name     category name
 * @param savePath default save path for torrents in the category, empty for the global default
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Category(
    @JsonProperty("name") String name,
    @JsonProperty("savePath") String savePath) {
}
