package com.codeheadsystems.qbt.model.torrent;

/**
 * Parameters for adding a torrent by URL or magnet link.
 *
 * @param urls         one or more magnet links or HTTP URLs, newline separated
 * @param savePath     where to save the data, or {@code null} for the server default
 * @param category     category to assign, or {@code null}
 * @param paused       add the torrent in the stopped state
 * @param skipChecking skip hash checking of existing data
 */
public record AddTorrentRequest(String urls,
                                String savePath,
                                String category,
                                boolean paused,
                                boolean skipChecking) {

  /**
   * Adds a single magnet link with server defaults.
   *
   * @param magnetUri the magnet uri
   * @return the add torrent request
   */
  public static AddTorrentRequest ofMagnet(String magnetUri) {
    return new AddTorrentRequest(magnetUri, null, null, false, false);
  }
}
