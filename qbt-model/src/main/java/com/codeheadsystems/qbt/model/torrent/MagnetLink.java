package com.codeheadsystems.qbt.model.torrent;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fields of a {@code magnet:?} URI that the torrent service understands.
 *
 * @param hash             info hash from {@code xt}, without the {@code urn:btih:} prefix
 * @param displayName      display name ({@code dn})
 * @param trackers         tracker URLs ({@code tr}), in URI order
 * @param exactLength      exact length ({@code xl})
 * @param exactSource      exact source ({@code xs})
 * @param keywords         keywords ({@code kt})
 * @param acceptableSource acceptable source ({@code as})
 */
public record MagnetLink(String hash,
                         String displayName,
                         List<String> trackers,
                         String exactLength,
                         String exactSource,
                         String keywords,
                         String acceptableSource) {

  /**
   * The scheme and query marker every magnet URI starts with.
   */
  public static final String PREFIX = "magnet:?";

  private static final String BTIH_URN = "urn:btih:";

  public MagnetLink {
    trackers = trackers == null ? List.of() : List.copyOf(trackers);
  }

  /**
   * Parses a magnet URI.
   *
   * @param magnetUri the URI, starting with {@code magnet:?}
   * @return the parsed link; parameters absent from the URI are empty strings
   * @throws IllegalArgumentException if the URI is not a magnet URI or its query is malformed
   */
  public static MagnetLink parse(final String magnetUri) {
    if (magnetUri == null || !magnetUri.startsWith(PREFIX)) {
      throw new IllegalArgumentException("Invalid magnet link format: " + magnetUri);
    }
    final Map<String, List<String>> params = parseQuery(magnetUri.substring(PREFIX.length()));
    String hash = first(params, "xt");
    if (hash.startsWith(BTIH_URN)) {
      hash = hash.substring(BTIH_URN.length());
    }
    return new MagnetLink(
        hash,
        first(params, "dn"),
        params.getOrDefault("tr", List.of()),
        first(params, "xl"),
        first(params, "xs"),
        first(params, "kt"),
        first(params, "as"));
  }

  private static Map<String, List<String>> parseQuery(String query) {
    final Map<String, List<String>> params = new LinkedHashMap<>();
    if (query.isEmpty()) {
      return params;
    }
    for (String pair : query.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = eq < 0 ? pair : pair.substring(0, eq);
      String value = eq < 0 ? "" : pair.substring(eq + 1);
      try {
        params.computeIfAbsent(decode(key), k -> new ArrayList<>()).add(decode(value));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Failed to parse magnet link query: " + pair, e);
      }
    }
    return params;
  }

  private static String decode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }

  private static String first(Map<String, List<String>> params, String key) {
    List<String> values = params.get(key);
    return values == null || values.isEmpty() ? "" : values.get(0);
  }
}
