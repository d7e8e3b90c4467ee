package com.codeheadsystems.qbt.client.exceptions;

/**
 * The type Torrent accessor exception.  Raised when a successful response cannot be decoded.
 */
public class TorrentAccessorException extends RuntimeException {
  /**
   * Instantiates a new Torrent accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TorrentAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
