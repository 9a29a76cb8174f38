package com.quantori.crp.api.indigo;

import java.util.Deque;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded pool of toolkit sessions that are not safe to share between threads. Sessions are opened on first demand,
 * up to the capacity, and the most recently returned session is handed out first.
 */
@Slf4j
class SessionPool<S> {

  private final Supplier<S> opener;
  private final int capacity;
  private final Semaphore permits;
  private final Deque<S> idle = new ConcurrentLinkedDeque<>();
  private final Set<S> leased = ConcurrentHashMap.newKeySet();

  SessionPool(int capacity, Supplier<S> opener) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Pool capacity must be positive, got " + capacity);
    }
    this.capacity = capacity;
    this.opener = opener;
    this.permits = new Semaphore(capacity, true);
  }

  /**
   * @throws InterruptedException if interrupted while waiting for a permit
   * @throws IndigoPoolException  if every session stays leased for longer than the timeout
   */
  S lease(long timeout, TimeUnit unit) throws InterruptedException {
    if (!permits.tryAcquire(timeout, unit)) {
      throw new IndigoPoolException("All " + capacity + " sessions stayed busy for " + timeout + " " + unit);
    }
    S session = idle.pollFirst();
    if (session == null) {
      try {
        session = opener.get();
      } catch (RuntimeException e) {
        permits.release();
        throw e;
      }
      log.debug("Opened session {} of at most {}", capacity - permits.availablePermits(), capacity);
    }
    leased.add(session);
    return session;
  }

  /**
   * @throws IndigoPoolException if the session is not currently leased from this pool
   */
  void release(S session) {
    if (!leased.remove(session)) {
      throw new IndigoPoolException("Session was not leased from this pool or was already returned");
    }
    idle.offerFirst(session);
    permits.release();
  }

  /**
   * Sessions that can be leased without waiting, whether already open or not.
   */
  int available() {
    return permits.availablePermits();
  }

  int capacity() {
    return capacity;
  }
}
