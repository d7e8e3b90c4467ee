package com.codeheadsystems.qbt.client.classifier;

import com.codeheadsystems.qbt.client.exceptions.ErrorCode;
import java.util.Locale;
import java.util.Objects;

/**
 * One row of the free-text fallback table: if an error message contains {@code phrase}
 * (case-insensitively) the error is classified as {@code code} with {@code description}.
 *
 * @param phrase      lower-case substring to look for
 * @param code        the resulting error code
 * @param description the detail given to the classified error
 */
public record MessagePattern(String phrase, ErrorCode code, String description) {

  public MessagePattern {
    Objects.requireNonNull(phrase, "phrase");
    Objects.requireNonNull(code, "code");
    phrase = phrase.toLowerCase(Locale.ROOT);
  }

  /**
   * Checks the pattern against a lower-cased message.
   *
   * @param lowerCaseMessage the message, already lower-cased
   * @return true if the phrase occurs in the message
   */
  public boolean matches(final String lowerCaseMessage) {
    return lowerCaseMessage.contains(phrase);
  }
}
