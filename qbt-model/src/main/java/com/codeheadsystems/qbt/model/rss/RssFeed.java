package com.codeheadsystems.qbt.model.rss;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for a feed of {@code GET /api/v2/rss/items}.  Articles are only present when the
 * items were requested with data.
 *
 * @param uid       server-assigned feed identifier
 * @param url       feed URL
 * @param title     feed title
 * @param lastBuild last build date as reported by the feed
 * @param loading   whether the server is currently refreshing the feed
 * @param error     whether the last refresh failed
 * @param articles  the feed's articles, empty when fetched without data
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RssFeed(
    @JsonProperty("uid") String uid,
    @JsonProperty("url") String url,
    @JsonProperty("title") String title,
    @JsonProperty("lastBuildDate") String lastBuild,
    @JsonProperty("isLoading") boolean loading,
    @JsonProperty("hasError") boolean error,
    @JsonProperty("articles") List<RssArticle> articles) {

  public RssFeed {
    articles = articles == null ? List.of() : List.copyOf(articles);
  }
}
