package com.lendkeeper.executor.kick;

import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.domain.Loan;
import com.lendkeeper.domain.PoolSnapshot;
import com.lendkeeper.domain.Wad;
import com.lendkeeper.executor.chain.SignerContext;
import com.lendkeeper.executor.chain.TransactionSubmitter;
import com.lendkeeper.executor.chain.TxOutcome;
import com.lendkeeper.executor.cycle.ActionOutcome;
import com.lendkeeper.executor.cycle.ActionPacer;
import com.lendkeeper.executor.erc20.Erc20Service;
import com.lendkeeper.executor.pool.AjnaPoolReader;
import com.lendkeeper.executor.pool.BucketMath;
import com.lendkeeper.executor.pool.PoolWriter;
import com.lendkeeper.price.PriceContext;
import com.lendkeeper.price.PriceOutcome;
import com.lendkeeper.price.PriceResolver;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Finds loans worth liquidating and kicks them.
 * <p>
 * Loans are ranked by liquidation bond, largest first. One allowance is sized to cover the current bond
 * and every bond ranked after it, so a run of kicks needs a single approval; the allowance is returned to
 * zero once the batch is over.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KickEngine {

  static final BigDecimal BOND_MARGIN = new BigDecimal("0.01");

  private final @NonNull PriceResolver priceResolver;
  private final @NonNull AjnaPoolReader poolReader;
  private final @NonNull PoolWriter poolWriter;
  private final @NonNull Erc20Service erc20;
  private final @NonNull SignerContext signerContext;
  private final @NonNull TransactionSubmitter submitter;
  private final @NonNull ActionPacer pacer;

  /**
   * Lazily yields kickable loans. The pool price is resolved once, on the first loan that needs it; if it
   * cannot be resolved the stream ends.
   */
  public Stream<KickCandidate> scan(@NonNull PoolSnapshot snapshot, @NonNull PoolConfig pool) {
    if (!pool.kickEnabled()) {
      return Stream.empty();
    }
    List<Loan> ranked = snapshot.loans().stream()
        .sorted(Comparator.comparing(Loan::liquidationBond).reversed())
        .toList();
    // remainingBonds[i] = bond of loan i plus every bond ranked after it
    BigInteger[] remainingBonds = new BigInteger[ranked.size() + 1];
    remainingBonds[ranked.size()] = BigInteger.ZERO;
    for (int i = ranked.size() - 1; i >= 0; i--) {
      remainingBonds[i] = remainingBonds[i + 1].add(ranked.get(i).liquidationBond());
    }

    LazyPrice price = new LazyPrice(pool, snapshot);
    return IntStream.range(0, ranked.size())
        .mapToObj(i -> evaluate(pool, snapshot, ranked.get(i), remainingBonds[i], price))
        .takeWhile(v -> !v.stop())
        .filter(v -> v.candidate() != null)
        .map(Verdict::candidate);
  }

  /**
   * Scans and kicks every candidate, then clears the quote token allowance granted to the pool.
   */
  public List<ActionOutcome> handleKicks(@NonNull PoolConfig pool, @NonNull PoolSnapshot snapshot)
      throws InterruptedException {
    List<ActionOutcome> outcomes = new ArrayList<>();
    Iterator<KickCandidate> candidates = scan(snapshot, pool).iterator();
    if (!candidates.hasNext()) {
      return outcomes;
    }
    if (submitter.dryRun()) {
      while (candidates.hasNext()) {
        KickCandidate c = candidates.next();
        log.info("dry run - would kick pool={} borrower={} bond={}", pool.name(), c.borrower(),
            Wad.toDecimal(c.liquidationBond()));
        outcomes.add(new ActionOutcome(ActionOutcome.Action.KICK, c.borrower(), ActionOutcome.Status.DRY_RUN, null, null));
      }
      return outcomes;
    }

    String quoteToken;
    String owner;
    try {
      quoteToken = poolReader.quoteToken(pool.address());
      owner = signerContext.requireCredentials().getAddress();
    } catch (IOException | IllegalStateException e) {
      log.warn("pool={} kicks skipped: {}", pool.name(), e.getMessage());
      outcomes.add(ActionOutcome.failed(ActionOutcome.Action.KICK, pool.address(), e.getMessage()));
      return outcomes;
    }

    ReentrantLock lock = erc20.allowanceLock(quoteToken, pool.address());
    lock.lockInterruptibly();
    try {
      while (candidates.hasNext()) {
        outcomes.addAll(execute(candidates.next()));
        pacer.pause();
      }
    } finally {
      try {
        erc20.resetAllowance(quoteToken, owner, pool.address())
            .ifPresent(tx -> outcomes.add(ActionOutcome.of(ActionOutcome.Action.APPROVE, quoteToken, tx)));
      } finally {
        lock.unlock();
      }
    }
    return outcomes;
  }

  /**
   * Checks balance, tops up the allowance if needed, then kicks. A candidate that cannot be funded is skipped
   * before any kick nonce is used.
   */
  public List<ActionOutcome> execute(@NonNull KickCandidate candidate) {
    List<ActionOutcome> outcomes = new ArrayList<>();
    String borrower = candidate.borrower();
    String poolAddress = candidate.poolAddress();
    try {
      String quoteToken = poolReader.quoteToken(poolAddress);
      String owner = signerContext.requireCredentials().getAddress();
      int decimals = erc20.decimals(quoteToken);

      BigInteger balance = Wad.fromTokenAmount(erc20.balanceOf(quoteToken, owner), decimals);
      if (balance.compareTo(candidate.liquidationBond()) < 0) {
        log.info("pool={} borrower={} not kicked: balance {} below bond {}", candidate.poolName(), borrower,
            Wad.toDecimal(balance), Wad.toDecimal(candidate.liquidationBond()));
        outcomes.add(ActionOutcome.skipped(ActionOutcome.Action.KICK, borrower, "insufficient balance for bond"));
        return outcomes;
      }

      BigInteger allowance = Wad.fromTokenAmount(erc20.allowance(quoteToken, owner, poolAddress), decimals);
      if (allowance.compareTo(candidate.liquidationBond()) < 0) {
        BigInteger amount = approvalAmount(candidate.estimatedRemainingBond(), balance);
        TxOutcome approval = erc20.approve(quoteToken, poolAddress, Wad.toTokenAmount(amount, decimals));
        outcomes.add(ActionOutcome.of(ActionOutcome.Action.APPROVE, borrower, approval));
        if (!approval.confirmed()) {
          log.warn("pool={} borrower={} not kicked: bond approval failed ({})", candidate.poolName(), borrower,
              approval.error());
          outcomes.add(ActionOutcome.skipped(ActionOutcome.Action.KICK, borrower, "bond approval failed"));
          return outcomes;
        }
      }
    } catch (IOException | IllegalStateException e) {
      log.warn("pool={} borrower={} not kicked: {}", candidate.poolName(), borrower, e.getMessage());
      outcomes.add(ActionOutcome.failed(ActionOutcome.Action.KICK, borrower, e.getMessage()));
      return outcomes;
    }

    int limitIndex = BucketMath.indexOf(candidate.limitPrice());
    TxOutcome kick = poolWriter.kick(poolAddress, borrower, limitIndex);
    if (kick.confirmed()) {
      log.info("pool={} borrower={} kicked (hash={})", candidate.poolName(), borrower, kick.txHash());
    }
    outcomes.add(ActionOutcome.of(ActionOutcome.Action.KICK, borrower, kick));
    return outcomes;
  }

  /**
   * {@code min(estimatedRemainingBond, balance)} plus the safety margin.
   */
  static BigInteger approvalAmount(BigInteger estimatedRemainingBond, BigInteger balance) {
    BigInteger base = estimatedRemainingBond.min(balance);
    return base.add(Wad.multiply(base, BOND_MARGIN));
  }

  private Verdict evaluate(PoolConfig pool, PoolSnapshot snapshot, Loan loan, BigInteger remainingBond, LazyPrice price) {
    if (loan.thresholdPrice().compareTo(snapshot.lup()) < 0) {
      log.debug("pool={} borrower={} not kickable: TP {} below LUP {}", pool.name(), loan.borrower(),
          Wad.toDecimal(loan.thresholdPrice()), Wad.toDecimal(snapshot.lup()));
      return Verdict.REJECTED;
    }
    if (Wad.toDecimal(loan.debt()).compareTo(pool.kick().minDebt()) < 0) {
      log.debug("pool={} borrower={} not kicked: debt {} below minimum {}", pool.name(), loan.borrower(),
          Wad.toDecimal(loan.debt()), pool.kick().minDebt());
      return Verdict.REJECTED;
    }
    PriceOutcome outcome = price.get();
    if (!(outcome instanceof PriceOutcome.Resolved resolved)) {
      log.warn("pool={} kick scan stopped: price unavailable", pool.name());
      return Verdict.STOP;
    }
    BigDecimal limit = Wad.toDecimal(loan.neutralPrice()).multiply(pool.kick().priceFactor());
    if (limit.compareTo(resolved.value()) < 0) {
      log.debug("pool={} borrower={} not kicked: NP * factor {} below price {}", pool.name(), loan.borrower(),
          limit, resolved.value());
      return Verdict.REJECTED;
    }
    return new Verdict(new KickCandidate(
        pool.name(),
        pool.address(),
        loan.borrower(),
        loan.liquidationBond(),
        remainingBond,
        resolved.value()
    ), false);
  }

  private record Verdict(KickCandidate candidate, boolean stop) {
    static final Verdict REJECTED = new Verdict(null, false);
    static final Verdict STOP = new Verdict(null, true);
  }

  private final class LazyPrice {
    private final PoolConfig pool;
    private final PoolSnapshot snapshot;
    private PriceOutcome outcome;

    private LazyPrice(PoolConfig pool, PoolSnapshot snapshot) {
      this.pool = pool;
      this.snapshot = snapshot;
    }

    PriceOutcome get() {
      if (outcome == null) {
        outcome = priceResolver.resolve(pool.price(), PriceContext.of(pool.name(), snapshot));
      }
      return outcome;
    }
  }
}
