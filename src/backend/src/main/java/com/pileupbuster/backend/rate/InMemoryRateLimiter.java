package com.pileupbuster.backend.rate;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory sliding-window rate limiter keyed by client address.
 */
@Component
public class InMemoryRateLimiter {
  private final Map<String, Deque<Long>> eventsByClient = new ConcurrentHashMap<>();

  /**
   * Records one attempt for {@code clientKey} when the window still has room.
   *
   * @param clientKey caller identity key (IP or forwarded IP)
   * @param windowSeconds window size in seconds
   * @param maxRequests maximum requests allowed in the window
   * @return {@code true} when the request can proceed
   */
  public boolean allow(String clientKey, int windowSeconds, int maxRequests) {
    return allow(clientKey, windowSeconds, maxRequests, Instant.now().getEpochSecond());
  }

  boolean allow(String clientKey, int windowSeconds, int maxRequests, long nowEpochSecond) {
    long cutoff = nowEpochSecond - Math.max(1, windowSeconds);

    Deque<Long> deque = eventsByClient.computeIfAbsent(clientKey, ignored -> new ArrayDeque<>());
    synchronized (deque) {
      while (!deque.isEmpty() && deque.peekFirst() <= cutoff) {
        deque.pollFirst();
      }
      if (deque.size() >= Math.max(1, maxRequests)) {
        return false;
      }
      deque.addLast(nowEpochSecond);
      return true;
    }
  }

  /**
   * Seconds until the oldest attempt leaves the window for {@code clientKey}.
   *
   * @return retry hint, zero when the client has no recorded attempts
   */
  public long retryAfterSeconds(String clientKey, int windowSeconds) {
    Deque<Long> deque = eventsByClient.get(clientKey);
    if (deque == null) {
      return 0L;
    }
    synchronized (deque) {
      Long oldest = deque.peekFirst();
      if (oldest == null) {
        return 0L;
      }
      return Math.max(0L, oldest + Math.max(1, windowSeconds) - Instant.now().getEpochSecond());
    }
  }
}
