package com.codeheadsystems.qbt.client.retry;

import com.codeheadsystems.qbt.client.transport.CallContext;
import java.io.IOException;

/**
 * A remote call that runs with an authenticated session.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface RemoteOperation<T> {

  T call(CallContext context) throws IOException;
}
