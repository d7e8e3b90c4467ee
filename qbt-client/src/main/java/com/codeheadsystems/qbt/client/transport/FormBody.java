package com.codeheadsystems.qbt.client.transport;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;

/**
 * Builds an {@code application/x-www-form-urlencoded} body or query string.
 */
public final class FormBody {

  public static final String CONTENT_TYPE = "application/x-www-form-urlencoded";

  private final StringJoiner joiner = new StringJoiner("&");

  public static FormBody create() {
    return new FormBody();
  }

  /**
   * Adds a field.  Null values are skipped.
   *
   * @param name  the name
   * @param value the value
   * @return this form body
   */
  public FormBody add(final String name, final Object value) {
    if (value != null) {
      joiner.add(encode(name) + "=" + encode(String.valueOf(value)));
    }
    return this;
  }

  public boolean isEmpty() {
    return joiner.length() == 0;
  }

  public String encoded() {
    return joiner.toString();
  }

  private static String encode(String s) {
    return URLEncoder.encode(s, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return encoded();
  }
}
