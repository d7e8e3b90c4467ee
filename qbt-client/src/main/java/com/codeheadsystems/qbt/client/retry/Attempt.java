package com.codeheadsystems.qbt.client.retry;

import java.io.IOException;

/**
 * One try of a retried operation.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface Attempt<T> {

  /**
   * Run the attempt.
   *
   * @param attempt zero-based attempt number
   * @return the result
   * @throws IOException on transport failure; classified by the loop
   */
  T run(int attempt) throws IOException;
}
