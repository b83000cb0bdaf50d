package com.lendkeeper.executor.reward;

import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.domain.Wad;
import com.lendkeeper.executor.chain.SignerContext;
import com.lendkeeper.executor.cycle.ActionOutcome;
import com.lendkeeper.executor.pool.AjnaPoolReader;
import com.lendkeeper.executor.pool.KickerInfo;
import com.lendkeeper.executor.pool.PoolWriter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Withdraws kicker bonds that the pool has released back to this account.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BondCollector {

  private final @NonNull AjnaPoolReader poolReader;
  private final @NonNull PoolWriter poolWriter;
  private final @NonNull SignerContext signerContext;

  public Optional<ActionOutcome> collect(@NonNull PoolConfig pool) {
    if (!pool.collectBond()) {
      return Optional.empty();
    }
    Optional<String> self = signerContext.address();
    if (self.isEmpty()) {
      log.debug("pool={} bond collection skipped: no keeper credentials", pool.name());
      return Optional.of(ActionOutcome.skipped(ActionOutcome.Action.WITHDRAW_BONDS, pool.address(), "no credentials"));
    }
    KickerInfo info;
    try {
      info = poolReader.kickerInfo(pool.address(), self.get());
    } catch (IOException e) {
      log.warn("pool={} kickerInfo read failed: {}", pool.name(), e.toString());
      return Optional.of(ActionOutcome.failed(ActionOutcome.Action.WITHDRAW_BONDS, pool.address(), e.getMessage()));
    }
    if (info.claimable().signum() <= 0) {
      log.debug("pool={} no claimable bond (locked={})", pool.name(), Wad.toDecimal(info.locked()));
      return Optional.empty();
    }
    log.info("pool={} withdrawing claimable bond {}", pool.name(), Wad.toDecimal(info.claimable()));
    return Optional.of(ActionOutcome.of(ActionOutcome.Action.WITHDRAW_BONDS, pool.address(),
        poolWriter.withdrawBonds(pool.address(), self.get(), info.claimable())));
  }
}
