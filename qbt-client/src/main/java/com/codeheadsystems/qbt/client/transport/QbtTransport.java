package com.codeheadsystems.qbt.client.transport;

import java.io.IOException;

/**
 * Performs one HTTP exchange with the service.  Implementations attach
 * {@link TransportRequest#sessionArtifacts()} as cookies and, when
 * {@link TransportRequest#captureSession()} is set, return received cookies.
 * <p>
 * Any HTTP status is a normal return; only transport failures throw.
 */
public interface QbtTransport {

  /**
   * Perform the request.
   *
   * @param request the request
   * @param context the call context; cancelling it aborts the exchange
   * @return the transport response
   * @throws IOException on connection, TLS or timeout failures
   */
  TransportResponse perform(TransportRequest request, CallContext context) throws IOException;
}
