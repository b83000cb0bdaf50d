package com.lendkeeper.executor.metrics;

import com.lendkeeper.executor.cycle.ActionOutcome;
import com.lendkeeper.executor.chain.TxOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class KeeperMetrics {

  private final MeterRegistry registry;

  public KeeperMetrics(@NonNull MeterRegistry registry) {
    this.registry = registry;
  }

  public void recordTransaction(String label, TxOutcome.Status status) {
    Counter.builder("keeper.tx")
        .description("Writes submitted, by label and outcome")
        .tag("label", label)
        .tag("status", status.name())
        .register(registry)
        .increment();
  }

  public void recordAction(String pool, ActionOutcome outcome) {
    Counter.builder("keeper.actions")
        .description("Engine decisions, by action and status")
        .tag("pool", pool)
        .tag("action", outcome.action().name())
        .tag("status", outcome.status().name())
        .register(registry)
        .increment();
  }

  public void recordCycleFailure(String pool, String phase) {
    Counter.builder("keeper.cycle.failures")
        .description("Pool cycle phases that ended in an unexpected exception")
        .tag("pool", pool)
        .tag("phase", phase)
        .register(registry)
        .increment();
  }

  public void recordCycle(String pool, Duration elapsed) {
    Timer.builder("keeper.cycle.duration")
        .tag("pool", pool)
        .register(registry)
        .record(elapsed);
  }
}
