package com.lendkeeper.ledger;

import com.lendkeeper.domain.PoolSnapshot;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-TTL coalescing layer in front of a {@link LedgerQueryService}. Concurrent callers asking for the same
 * stale pool share one upstream fetch.
 */
@Slf4j
public class PoolSnapshotCache implements LedgerQueryService {

  private final LedgerQueryService delegate;
  private final Duration ttl;
  private final Clock clock;

  private final Map<String, Entry> cache = new ConcurrentHashMap<>();
  private final Map<String, Object> fetchLocks = new ConcurrentHashMap<>();

  public PoolSnapshotCache(@NonNull LedgerQueryService delegate, @NonNull Duration ttl, @NonNull Clock clock) {
    this.delegate = delegate;
    this.ttl = ttl;
    this.clock = clock;
  }

  @Override
  public PoolSnapshot snapshot(String poolAddress) {
    String key = poolAddress.toLowerCase(Locale.ROOT);
    Entry fresh = freshEntry(key);
    if (fresh != null) {
      return fresh.snapshot();
    }
    Object lock = fetchLocks.computeIfAbsent(key, k -> new Object());
    synchronized (lock) {
      fresh = freshEntry(key);
      if (fresh != null) {
        return fresh.snapshot();
      }
      PoolSnapshot snapshot = delegate.snapshot(key);
      cache.put(key, new Entry(snapshot, clock.instant().plus(ttl)));
      return snapshot;
    }
  }

  private Entry freshEntry(String key) {
    Entry e = cache.get(key);
    if (e == null || !clock.instant().isBefore(e.expiresAt())) {
      return null;
    }
    return e;
  }

  private record Entry(PoolSnapshot snapshot, Instant expiresAt) {
  }
}
