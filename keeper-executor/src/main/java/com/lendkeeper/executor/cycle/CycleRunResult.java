package com.lendkeeper.executor.cycle;

import java.time.Instant;
import java.util.List;

public record CycleRunResult(
    String status,
    boolean dryRun,
    Instant startedAt,
    Instant finishedAt,
    List<PoolCycleReport> pools
) {

  public static CycleRunResult alreadyRunning(boolean dryRun, Instant now) {
    return new CycleRunResult("already-running", dryRun, now, now, List.of());
  }

  public boolean ok() {
    return "ok".equals(status);
  }
}
