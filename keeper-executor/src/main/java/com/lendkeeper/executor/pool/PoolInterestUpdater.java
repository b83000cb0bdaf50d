package com.lendkeeper.executor.pool;

import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.executor.chain.TransactionSubmitter;
import com.lendkeeper.executor.cycle.ActionOutcome;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Accrues pool interest when nobody has touched the pool for a week, so thresholds and LUP are not stale.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PoolInterestUpdater {

  static final Duration STALE_AFTER = Duration.ofDays(7);

  private final @NonNull AjnaPoolReader poolReader;
  private final @NonNull TransactionSubmitter submitter;
  private final @NonNull Clock clock;

  public ActionOutcome updateIfStale(@NonNull PoolConfig pool) {
    InflatorInfo info;
    try {
      info = poolReader.inflatorInfo(pool.address());
    } catch (IOException e) {
      log.warn("pool={} inflatorInfo read failed: {}", pool.name(), e.toString());
      return ActionOutcome.failed(ActionOutcome.Action.UPDATE_INTEREST, pool.address(), e.getMessage());
    }
    Duration staleness = Duration.between(info.lastUpdate(), clock.instant());
    log.debug("pool={} last interest update {} ago", pool.name(), staleness);
    if (staleness.compareTo(STALE_AFTER) < 0) {
      return ActionOutcome.skipped(ActionOutcome.Action.UPDATE_INTEREST, pool.address(), "fresh");
    }
    log.info("pool={} interest stale for {} days, updating", pool.name(), staleness.toDays());
    return ActionOutcome.of(ActionOutcome.Action.UPDATE_INTEREST, pool.address(),
        submitter.submit("updateInterest", pool.address(), AjnaPoolCallEncoder.encodeUpdateInterest()));
  }
}
