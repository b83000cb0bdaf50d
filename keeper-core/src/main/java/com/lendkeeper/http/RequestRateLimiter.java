package com.lendkeeper.http;

import java.time.Clock;
import java.time.Duration;

/**
 * Gate in front of an upstream API with a request budget. {@link #acquire()} blocks until the caller may send.
 */
public interface RequestRateLimiter {

  void acquire();

  static RequestRateLimiter noop() {
    return () -> {
    };
  }

  /**
   * A limiter spacing requests {@code minInterval} apart, or {@link #noop()} for a zero interval.
   */
  static RequestRateLimiter minInterval(Duration minInterval, Clock clock) {
    if (minInterval.isZero() || minInterval.isNegative()) {
      return noop();
    }
    return new MinIntervalRateLimiter(minInterval, clock);
  }
}
