package com.quantori.crp.api.indigo;

import com.epam.indigo.Indigo;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.SneakyThrows;

/**
 * Thread safe access to a bounded set of Indigo sessions.
 */
public class IndigoProvider {

  private final SessionPool<Indigo> pool;

  /**
   * How long to wait for a session before giving up, in seconds.
   */
  private final int timeout;

  public IndigoProvider(int poolSize, int timeoutInSeconds) {
    this.pool = new SessionPool<>(poolSize, IndigoFactory::createIndigo);
    this.timeout = timeoutInSeconds;
  }

  /**
   * Takes a session out of the pool, blocking until one is available or the timeout expires.
   */
  @SneakyThrows(InterruptedException.class)
  public Indigo take() {
    return pool.lease(timeout, TimeUnit.SECONDS);
  }

  public void offer(Indigo indigo) {
    pool.release(indigo);
  }

  /**
   * Runs the function with a pooled session and returns the session afterwards.
   */
  public <T> T withIndigo(Function<Indigo, T> function) {
    Indigo indigo = take();
    try {
      return function.apply(indigo);
    } finally {
      offer(indigo);
    }
  }

  public int available() {
    return pool.available();
  }

  public int size() {
    return pool.capacity();
  }
}
