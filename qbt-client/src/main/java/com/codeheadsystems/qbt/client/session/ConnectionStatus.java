package com.codeheadsystems.qbt.client.session;

import com.codeheadsystems.qbt.client.exceptions.ErrorCode;
import com.codeheadsystems.qbt.client.exceptions.QbtClientException;
import java.util.Optional;

/**
 * Snapshot of the session status and the last observed error, for display.
 *
 * @param status    the status
 * @param errorCode the last error's code, null when there is none
 * @param message   the last error's message, null when there is none
 * @param permanent whether the last error needs user intervention
 */
public record ConnectionStatus(SessionStatus status, ErrorCode errorCode, String message, boolean permanent) {

  public static ConnectionStatus of(final SessionStatus status, final Optional<QbtClientException> lastError) {
    return lastError
        .map(e -> new ConnectionStatus(status, e.code(), e.detail(), e.isPermanent()))
        .orElseGet(() -> new ConnectionStatus(status, null, null, false));
  }

  public boolean hasError() {
    return errorCode != null;
  }
}
