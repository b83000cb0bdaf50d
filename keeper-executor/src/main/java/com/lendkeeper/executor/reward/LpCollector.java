package com.lendkeeper.executor.reward;

import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.config.PoolConfig.CollectLpReward.TokenToCollect;
import com.lendkeeper.domain.Wad;
import com.lendkeeper.executor.chain.SignerContext;
import com.lendkeeper.executor.chain.TxOutcome;
import com.lendkeeper.executor.cycle.ActionOutcome;
import com.lendkeeper.executor.cycle.ActionPacer;
import com.lendkeeper.executor.pool.AjnaPoolReader;
import com.lendkeeper.executor.pool.BucketInfo;
import com.lendkeeper.executor.pool.PoolWriter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Redeems tracked bucket-take LP for quote token or collateral, in the order the pool's
 * {@code collectLpReward.redeemFirst} names. Redeemed tokens end up in the keeper account, where the reward
 * actions pick them up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LpCollector {

  private final @NonNull LpRewardTracker tracker;
  private final @NonNull AjnaPoolReader poolReader;
  private final @NonNull PoolWriter poolWriter;
  private final @NonNull SignerContext signerContext;
  private final @NonNull ActionPacer pacer;

  /**
   * Starts or advances reward tracking without redeeming anything.
   */
  public void track(@NonNull PoolConfig pool) throws IOException {
    if (!pool.collectLpEnabled()) {
      return;
    }
    Optional<String> self = signerContext.address();
    if (self.isPresent()) {
      tracker.refresh(pool.address(), self.get());
    }
  }

  public List<ActionOutcome> collect(@NonNull PoolConfig pool) throws InterruptedException {
    if (!pool.collectLpEnabled()) {
      return List.of();
    }
    Optional<String> self = signerContext.address();
    if (self.isEmpty()) {
      return List.of(ActionOutcome.skipped(ActionOutcome.Action.COLLECT_LP, pool.address(), "no credentials"));
    }
    Map<Integer, BigInteger> owed;
    try {
      owed = tracker.refresh(pool.address(), self.get());
    } catch (IOException e) {
      log.warn("pool={} LP reward scan failed: {}", pool.name(), e.toString());
      return List.of(ActionOutcome.failed(ActionOutcome.Action.COLLECT_LP, pool.address(), e.getMessage()));
    }

    List<ActionOutcome> outcomes = new ArrayList<>();
    for (Map.Entry<Integer, BigInteger> entry : owed.entrySet()) {
      List<ActionOutcome> bucketOutcomes = collectBucket(pool, self.get(), entry.getKey(), entry.getValue());
      outcomes.addAll(bucketOutcomes);
      if (bucketOutcomes.stream().anyMatch(o -> o.status() != ActionOutcome.Status.SKIPPED)) {
        pacer.pause();
      }
    }
    return outcomes;
  }

  private List<ActionOutcome> collectBucket(PoolConfig pool, String self, int index, BigInteger trackedLp) {
    String subject = "bucket " + index;
    BigInteger rewardLp;
    BucketInfo bucket;
    try {
      rewardLp = trackedLp.min(poolReader.lpBalance(pool.address(), index, self));
      if (rewardLp.signum() <= 0) {
        log.info("pool={} no LP left in bucket {}, forgetting tracked reward", pool.name(), index);
        tracker.update(pool.address(), index, BigInteger.ZERO);
        return List.of();
      }
      bucket = poolReader.bucketInfo(pool.address(), index);
    } catch (IOException e) {
      log.warn("pool={} bucket {} read failed: {}", pool.name(), index, e.toString());
      return List.of(ActionOutcome.failed(ActionOutcome.Action.COLLECT_LP, subject, e.getMessage()));
    }
    if (bucket.exchangeRate().signum() <= 0) {
      tracker.update(pool.address(), index, BigInteger.ZERO);
      return List.of(ActionOutcome.skipped(ActionOutcome.Action.COLLECT_LP, subject, "bucket is bankrupt"));
    }

    PoolConfig.CollectLpReward config = pool.collectLpReward();
    List<TokenToCollect> order = config.redeemFirst() == TokenToCollect.COLLATERAL
        ? List.of(TokenToCollect.COLLATERAL, TokenToCollect.QUOTE)
        : List.of(TokenToCollect.QUOTE, TokenToCollect.COLLATERAL);

    List<ActionOutcome> outcomes = new ArrayList<>();
    BigInteger remaining = rewardLp;
    for (TokenToCollect token : order) {
      if (remaining.signum() <= 0) {
        break;
      }
      Redemption redemption = token == TokenToCollect.QUOTE
          ? redeemQuote(pool, bucket, remaining, subject)
          : redeemCollateral(pool, bucket, remaining, subject);
      outcomes.add(redemption.outcome());
      remaining = redemption.remainingLp();
      ActionOutcome.Status status = redemption.outcome().status();
      if (status == ActionOutcome.Status.FAILED || status == ActionOutcome.Status.DRY_RUN) {
        break;
      }
    }
    if (!remaining.equals(rewardLp) || !rewardLp.equals(trackedLp)) {
      tracker.update(pool.address(), index, remaining);
    }
    return outcomes;
  }

  private Redemption redeemQuote(PoolConfig pool, BucketInfo bucket, BigInteger lp, String subject) {
    BigInteger amount = Wad.mul(lp, bucket.exchangeRate()).min(bucket.quoteTokens());
    if (Wad.toDecimal(amount).compareTo(pool.collectLpReward().minAmountQuote()) <= 0) {
      log.debug("pool={} {} quote redemption {} at or below minimum", pool.name(), subject, Wad.toDecimal(amount));
      return new Redemption(lp,
          ActionOutcome.skipped(ActionOutcome.Action.COLLECT_LP, subject, "quote amount below minimum"));
    }
    log.info("pool={} removing {} quote token from {} for reward LP", pool.name(), Wad.toDecimal(amount), subject);
    TxOutcome tx = poolWriter.removeQuoteToken(pool.address(), amount, bucket.index());
    BigInteger remaining = tx.confirmed()
        ? lp.subtract(Wad.div(amount, bucket.exchangeRate())).max(BigInteger.ZERO)
        : lp;
    return new Redemption(remaining, ActionOutcome.of(ActionOutcome.Action.COLLECT_LP, subject, tx));
  }

  private Redemption redeemCollateral(PoolConfig pool, BucketInfo bucket, BigInteger lp, String subject) {
    BigInteger amount = Wad.div(Wad.mul(lp, bucket.exchangeRate()), bucket.price()).min(bucket.collateral());
    if (Wad.toDecimal(amount).compareTo(pool.collectLpReward().minAmountCollateral()) <= 0) {
      log.debug("pool={} {} collateral redemption {} at or below minimum", pool.name(), subject,
          Wad.toDecimal(amount));
      return new Redemption(lp,
          ActionOutcome.skipped(ActionOutcome.Action.COLLECT_LP, subject, "collateral amount below minimum"));
    }
    log.info("pool={} removing {} collateral from {} for reward LP", pool.name(), Wad.toDecimal(amount), subject);
    TxOutcome tx = poolWriter.removeCollateral(pool.address(), amount, bucket.index());
    BigInteger remaining = tx.confirmed()
        ? lp.subtract(Wad.div(Wad.mul(amount, bucket.price()), bucket.exchangeRate())).max(BigInteger.ZERO)
        : lp;
    return new Redemption(remaining, ActionOutcome.of(ActionOutcome.Action.COLLECT_LP, subject, tx));
  }

  private record Redemption(BigInteger remainingLp, ActionOutcome outcome) {
  }
}
