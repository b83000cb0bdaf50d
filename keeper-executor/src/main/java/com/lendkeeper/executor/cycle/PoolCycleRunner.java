package com.lendkeeper.executor.cycle;

import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.domain.PoolSnapshot;
import com.lendkeeper.executor.auction.TakeSettlementEngine;
import com.lendkeeper.executor.kick.KickEngine;
import com.lendkeeper.executor.metrics.KeeperMetrics;
import com.lendkeeper.executor.pool.PoolInterestUpdater;
import com.lendkeeper.executor.reward.BondCollector;
import com.lendkeeper.executor.reward.LpCollector;
import com.lendkeeper.executor.reward.RewardActionService;
import com.lendkeeper.ledger.LedgerQueryService;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One pass over one pool: interest, kicks, takes, settlement, bonds, LP rewards, reward tokens. LP reward
 * tracking is advanced before the kicks so bucket takes made in this pass are counted. A phase that throws is recorded
 * and the pass moves on to the next phase; the kick, take and settlement phases need a snapshot and are skipped
 * when it cannot be fetched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PoolCycleRunner {

  private final @NonNull LedgerQueryService ledger;
  private final @NonNull PoolInterestUpdater interestUpdater;
  private final @NonNull KickEngine kickEngine;
  private final @NonNull TakeSettlementEngine takeSettlementEngine;
  private final @NonNull BondCollector bondCollector;
  private final @NonNull LpCollector lpCollector;
  private final @NonNull RewardActionService rewardActionService;
  private final @NonNull KeeperMetrics metrics;
  private final @NonNull Clock clock;

  public PoolCycleReport run(@NonNull PoolConfig pool) throws InterruptedException {
    Instant startedAt = clock.instant();
    List<ActionOutcome> outcomes = new ArrayList<>();
    List<PoolCycleReport.PhaseFailure> failures = new ArrayList<>();

    if (pool.updateInterest()) {
      phase(pool, "interest", failures, () -> outcomes.add(interestUpdater.updateIfStale(pool)));
    }

    if (pool.collectLpEnabled()) {
      phase(pool, "lp-tracking", failures, () -> lpCollector.track(pool));
    }

    PoolSnapshot snapshot = null;
    try {
      snapshot = ledger.snapshot(pool.address());
    } catch (RuntimeException e) {
      log.warn("pool={} snapshot unavailable, skipping kicks, takes and settlement: {}", pool.name(), e.getMessage());
      failures.add(new PoolCycleReport.PhaseFailure("snapshot", e.getMessage()));
      metrics.recordCycleFailure(pool.name(), "snapshot");
    }
    if (snapshot != null) {
      PoolSnapshot current = snapshot;
      log.debug("pool={} snapshot loans={} auctions={} lup={} hpb={}", pool.name(), current.loans().size(),
          current.auctions().size(), current.lup(), current.hpb());
      if (pool.kickEnabled()) {
        phase(pool, "kick", failures, () -> outcomes.addAll(kickEngine.handleKicks(pool, current)));
      }
      if (pool.takeEnabled()) {
        phase(pool, "take", failures, () -> outcomes.addAll(takeSettlementEngine.handleTakes(pool, current)));
      }
      if (pool.settlementEnabled()) {
        phase(pool, "settlement", failures,
            () -> outcomes.addAll(takeSettlementEngine.handleSettlements(pool, current)));
      }
    }
    phase(pool, "bonds", failures, () -> bondCollector.collect(pool).ifPresent(outcomes::add));
    if (pool.collectLpEnabled()) {
      phase(pool, "lp", failures, () -> outcomes.addAll(lpCollector.collect(pool)));
    }
    if (!pool.rewards().isEmpty()) {
      phase(pool, "rewards", failures, () -> outcomes.addAll(rewardActionService.handleRewards(pool)));
    }

    PoolCycleReport report = new PoolCycleReport(pool.name(), startedAt, clock.instant(), outcomes, failures);
    outcomes.forEach(o -> metrics.recordAction(pool.name(), o));
    metrics.recordCycle(pool.name(), report.elapsed());
    return report;
  }

  private void phase(PoolConfig pool, String name, List<PoolCycleReport.PhaseFailure> failures, Phase body)
      throws InterruptedException {
    try {
      body.run();
    } catch (InterruptedException e) {
      throw e;
    } catch (Exception e) {
      log.error("pool={} phase={} failed", pool.name(), name, e);
      failures.add(new PoolCycleReport.PhaseFailure(name, e.toString()));
      metrics.recordCycleFailure(pool.name(), name);
    }
  }

  @FunctionalInterface
  private interface Phase {
    void run() throws Exception;
  }
}
