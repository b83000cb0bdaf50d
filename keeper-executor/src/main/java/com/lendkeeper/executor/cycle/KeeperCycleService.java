package com.lendkeeper.executor.cycle;

import com.lendkeeper.config.KeeperProperties;
import com.lendkeeper.config.PoolConfig;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every configured pool once, on a worker pool bounded by {@code keeper.cycle.pool-concurrency}.
 * Only one pass runs at a time; a trigger that arrives mid-pass is refused.
 */
@Service
@Slf4j
public class KeeperCycleService {

  private final KeeperProperties properties;
  private final PoolCycleRunner runner;
  private final Clock clock;
  private final ExecutorService workers;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final Map<String, PoolCycleReport> lastReports = new ConcurrentHashMap<>();
  private volatile CycleRunResult lastRun;

  public KeeperCycleService(@NonNull KeeperProperties properties, @NonNull PoolCycleRunner runner, @NonNull Clock clock) {
    this.properties = properties;
    this.runner = runner;
    this.clock = clock;
    AtomicInteger threadIds = new AtomicInteger();
    this.workers = Executors.newFixedThreadPool(properties.cycle().poolConcurrency(), r -> {
      Thread t = new Thread(r, "keeper-pool-" + threadIds.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  public CycleRunResult runOnce() {
    if (!running.compareAndSet(false, true)) {
      log.info("keeper cycle already running, trigger ignored");
      return CycleRunResult.alreadyRunning(properties.dryRun(), clock.instant());
    }
    try {
      return runAllPools();
    } finally {
      running.set(false);
    }
  }

  private CycleRunResult runAllPools() {
    Instant startedAt = clock.instant();
    List<PoolConfig> pools = properties.pools();
    if (pools.isEmpty()) {
      return record(new CycleRunResult("no-pools", properties.dryRun(), startedAt, clock.instant(), List.of()));
    }

    Map<PoolConfig, Future<PoolCycleReport>> futures = new LinkedHashMap<>();
    for (PoolConfig pool : pools) {
      futures.put(pool, workers.submit(() -> runner.run(pool)));
    }

    List<PoolCycleReport> reports = new ArrayList<>();
    String status = "ok";
    for (Map.Entry<PoolConfig, Future<PoolCycleReport>> entry : futures.entrySet()) {
      PoolConfig pool = entry.getKey();
      try {
        PoolCycleReport report = entry.getValue().get();
        reports.add(report);
        lastReports.put(pool.name(), report);
        if (!report.ok()) {
          status = "partial";
        }
      } catch (ExecutionException e) {
        log.error("pool={} cycle aborted", pool.name(), e.getCause());
        status = "partial";
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        futures.values().forEach(f -> f.cancel(true));
        status = "interrupted";
        break;
      }
    }
    CycleRunResult result = new CycleRunResult(status, properties.dryRun(), startedAt, clock.instant(), reports);
    log.info("keeper cycle status={} dryRun={} pools={} actions={}", result.status(), result.dryRun(),
        reports.size(), reports.stream().mapToInt(r -> r.outcomes().size()).sum());
    return record(result);
  }

  private CycleRunResult record(CycleRunResult result) {
    lastRun = result;
    return result;
  }

  public boolean running() {
    return running.get();
  }

  public CycleRunResult lastRun() {
    return lastRun;
  }

  public Map<String, PoolCycleReport> lastReports() {
    return Collections.unmodifiableMap(lastReports);
  }

  @PreDestroy
  void shutdown() throws InterruptedException {
    workers.shutdownNow();
    if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
      log.warn("keeper pool workers did not stop within 10s");
    }
  }
}
