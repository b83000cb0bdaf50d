package com.lendkeeper.http;

import java.time.Clock;
import java.time.Duration;

/**
 * Spaces requests at least {@code minInterval} apart. Callers block until their slot opens.
 */
public final class MinIntervalRateLimiter implements RequestRateLimiter {

  private final long minIntervalMillis;
  private final Clock clock;
  private long nextSlotMillis;

  public MinIntervalRateLimiter(Duration minInterval, Clock clock) {
    this.minIntervalMillis = Math.max(0, minInterval.toMillis());
    this.clock = clock;
  }

  @Override
  public void acquire() {
    long waitMillis;
    synchronized (this) {
      long now = clock.millis();
      long slot = Math.max(now, nextSlotMillis);
      nextSlotMillis = slot + minIntervalMillis;
      waitMillis = slot - now;
    }
    if (waitMillis <= 0) {
      return;
    }
    try {
      Thread.sleep(waitMillis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HttpTransportException("interrupted while waiting for rate limiter", e);
    }
  }
}
