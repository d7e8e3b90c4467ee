package com.codeheadsystems.qbt.model.rss;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for one article of an {@link RssFeed}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RssArticle(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("link") String link,
    @JsonProperty("torrentURL") String torrentUrl,
    @JsonProperty("date") String date,
    @JsonProperty("isRead") boolean read) {
}
