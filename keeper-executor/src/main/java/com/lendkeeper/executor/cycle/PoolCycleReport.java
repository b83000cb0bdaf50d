package com.lendkeeper.executor.cycle;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * What one pass over one pool did. {@code failures} lists phases that ended in an unexpected error.
 */
public record PoolCycleReport(
    String pool,
    Instant startedAt,
    Instant finishedAt,
    List<ActionOutcome> outcomes,
    List<PhaseFailure> failures
) {

  public PoolCycleReport {
    outcomes = List.copyOf(outcomes);
    failures = List.copyOf(failures);
  }

  public Duration elapsed() {
    return Duration.between(startedAt, finishedAt);
  }

  public boolean ok() {
    return failures.isEmpty();
  }

  public record PhaseFailure(String phase, String error) {
  }
}
