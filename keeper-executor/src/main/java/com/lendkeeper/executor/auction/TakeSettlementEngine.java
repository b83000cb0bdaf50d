package com.lendkeeper.executor.auction;

import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.domain.Auction;
import com.lendkeeper.domain.PoolSnapshot;
import com.lendkeeper.domain.Wad;
import com.lendkeeper.executor.chain.ChainProperties;
import com.lendkeeper.executor.chain.SignerContext;
import com.lendkeeper.executor.chain.TransactionSubmitter;
import com.lendkeeper.executor.chain.TxOutcome;
import com.lendkeeper.executor.cycle.ActionOutcome;
import com.lendkeeper.executor.cycle.ActionPacer;
import com.lendkeeper.executor.erc20.Erc20Service;
import com.lendkeeper.executor.liquidity.DexProperties;
import com.lendkeeper.executor.liquidity.LiquidityRouter;
import com.lendkeeper.executor.liquidity.LiquidityRouterRegistry;
import com.lendkeeper.executor.liquidity.Quote;
import com.lendkeeper.executor.liquidity.QuoteOutcome;
import com.lendkeeper.executor.liquidity.Slippage;
import com.lendkeeper.executor.liquidity.SwapInstruction;
import com.lendkeeper.executor.pool.AjnaPoolReader;
import com.lendkeeper.executor.pool.AuctionInfo;
import com.lendkeeper.executor.pool.AuctionStatus;
import com.lendkeeper.executor.pool.PoolWriter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Closes auctions. Takes go either through external liquidity (the taker contract swaps the collateral
 * atomically) or into the highest priced bucket; auctions left with bad debt are settled.
 * <p>
 * An auction eligible for both takes gets the external take first. The arb take is still sent, and a revert
 * of it is treated as having lost the race for the remaining collateral.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TakeSettlementEngine {

  private final @NonNull AjnaPoolReader poolReader;
  private final @NonNull PoolWriter poolWriter;
  private final @NonNull Erc20Service erc20;
  private final @NonNull LiquidityRouterRegistry routers;
  private final @NonNull TransactionSubmitter submitter;
  private final @NonNull SignerContext signerContext;
  private final @NonNull ChainProperties chainProperties;
  private final @NonNull DexProperties dexProperties;
  private final @NonNull ActionPacer pacer;
  private final @NonNull Clock clock;

  public List<ActionOutcome> handleTakes(@NonNull PoolConfig pool, @NonNull PoolSnapshot snapshot)
      throws InterruptedException {
    List<ActionOutcome> outcomes = new ArrayList<>();
    if (!pool.takeEnabled()) {
      return outcomes;
    }
    PoolConfig.Take take = pool.take();
    for (Auction auction : snapshot.auctions()) {
      if (auction.settled() || auction.collateralExhausted()) {
        continue;
      }
      if (!AuctionEvaluator.worthTaking(Wad.toDecimal(auction.collateralRemaining()), take)) {
        log.debug("pool={} borrower={} not taken: collateral {} at or below minimum {}", pool.name(),
            auction.borrower(), Wad.toDecimal(auction.collateralRemaining()), take.minCollateral());
        continue;
      }
      outcomes.addAll(takeAuction(pool, snapshot, auction));
    }
    return outcomes;
  }

  private List<ActionOutcome> takeAuction(PoolConfig pool, PoolSnapshot snapshot, Auction auction)
      throws InterruptedException {
    List<ActionOutcome> outcomes = new ArrayList<>();
    String borrower = auction.borrower();
    PoolConfig.Take take = pool.take();

    AuctionStatus status;
    try {
      status = poolReader.auctionStatus(pool.address(), borrower);
    } catch (IOException e) {
      log.warn("pool={} borrower={} auction status read failed: {}", pool.name(), borrower, e.toString());
      outcomes.add(ActionOutcome.failed(ActionOutcome.Action.EXTERNAL_TAKE, borrower, e.getMessage()));
      return outcomes;
    }
    if (!status.active() || status.collateral().signum() == 0) {
      log.debug("pool={} borrower={} auction no longer takeable on chain", pool.name(), borrower);
      return outcomes;
    }
    BigDecimal auctionPrice = Wad.toDecimal(status.price());

    MarketQuote market = take.externalTakeEnabled() ? quoteMarket(pool, borrower, status) : null;
    Set<AuctionPhase> phases = AuctionEvaluator.phases(auction, pool, auctionPrice,
        market == null ? null : market.price(), Wad.toDecimal(snapshot.hpb()), clock.instant());
    log.debug("pool={} borrower={} auction price={} phases={}", pool.name(), borrower, auctionPrice, phases);

    boolean externalTaken = false;
    if (market != null) {
      ActionOutcome external;
      if (market.blocked() != null) {
        external = market.blocked();
      } else if (phases.contains(AuctionPhase.EXTERNAL_TAKE_ELIGIBLE)) {
        external = submitExternalTake(pool, borrower, status, auctionPrice, market);
      } else {
        log.debug("pool={} borrower={} not taken externally: price {} above market {} * {}", pool.name(), borrower,
            auctionPrice, market.price(), take.marketPriceFactor());
        external = ActionOutcome.skipped(ActionOutcome.Action.EXTERNAL_TAKE, borrower, "auction price above market");
      }
      outcomes.add(external);
      externalTaken = external.executed();
      if (external.status() != ActionOutcome.Status.SKIPPED) {
        pacer.pause();
      }
    }

    if (phases.contains(AuctionPhase.ARB_TAKE_ELIGIBLE)) {
      TxOutcome tx = poolWriter.bucketTake(pool.address(), borrower, snapshot.hpbIndex());
      if (tx.reverted() && externalTaken) {
        log.info("pool={} borrower={} arb take lost the race to our external take (hash={})",
            pool.name(), borrower, tx.txHash());
        outcomes.add(new ActionOutcome(ActionOutcome.Action.ARB_TAKE, borrower, ActionOutcome.Status.SKIPPED,
            "lost race", tx.txHash()));
      } else {
        outcomes.add(ActionOutcome.of(ActionOutcome.Action.ARB_TAKE, borrower, tx));
      }
      pacer.pause();
    } else if (take.arbTakeEnabled()) {
      log.debug("pool={} borrower={} not arb-taken: price {} above hpb {} * {}", pool.name(), borrower,
          auctionPrice, Wad.toDecimal(snapshot.hpb()), take.hpbPriceFactor());
    }
    return outcomes;
  }

  /**
   * Quotes the auction's remaining collateral on the configured router. The market price is quote out per
   * collateral in. A result with {@code blocked} set carries the reason no external take is possible.
   */
  private MarketQuote quoteMarket(PoolConfig pool, String borrower, AuctionStatus status) {
    PoolConfig.Take take = pool.take();
    LiquidityRouter router = routers.router(take.liquiditySource()).orElse(null);
    if (router == null) {
      return MarketQuote.blocked(skip(ActionOutcome.Action.EXTERNAL_TAKE, pool, borrower,
          "no router for " + take.liquiditySource()));
    }
    if (!chainProperties.hasTaker()) {
      return MarketQuote.blocked(skip(ActionOutcome.Action.EXTERNAL_TAKE, pool, borrower,
          "no taker contract configured"));
    }
    try {
      String collateralToken = poolReader.collateralToken(pool.address());
      String quoteToken = poolReader.quoteToken(pool.address());
      BigInteger amountIn = Wad.toTokenAmount(status.collateral(), erc20.decimals(collateralToken));
      QuoteOutcome outcome = router.getQuote(amountIn, collateralToken, quoteToken, take.poolVariant());
      if (outcome instanceof QuoteOutcome.NoLiquidity none) {
        return MarketQuote.blocked(skip(ActionOutcome.Action.EXTERNAL_TAKE, pool, borrower, none.reason()));
      }
      Quote quote = outcome.quoteIfPresent().orElseThrow();
      BigInteger amountOutWad = Wad.fromTokenAmount(quote.amountOut(), erc20.decimals(quoteToken));
      BigDecimal price = new BigDecimal(amountOutWad).divide(new BigDecimal(status.collateral()), MathContext.DECIMAL128);
      return new MarketQuote(router, quote, price, null);
    } catch (IOException e) {
      log.warn("pool={} borrower={} external take aborted: {}", pool.name(), borrower, e.toString());
      return MarketQuote.blocked(ActionOutcome.failed(ActionOutcome.Action.EXTERNAL_TAKE, borrower, e.getMessage()));
    }
  }

  private ActionOutcome submitExternalTake(
      PoolConfig pool,
      String borrower,
      AuctionStatus status,
      BigDecimal auctionPrice,
      MarketQuote market
  ) {
    PoolConfig.Take take = pool.take();
    SwapInstruction swap;
    try {
      BigInteger minOut = Slippage.minOut(market.quote().amountOut(), take.slippageBps());
      Instant deadline = clock.instant().plusSeconds(dexProperties.swapDeadlineSeconds());
      swap = market.router().buildSwapInstruction(market.quote(), minOut, deadline, chainProperties.takerAddress());
    } catch (RuntimeException e) {
      log.warn("pool={} borrower={} swap instruction failed: {}", pool.name(), borrower, e.getMessage());
      return ActionOutcome.failed(ActionOutcome.Action.EXTERNAL_TAKE, borrower, e.getMessage());
    }

    log.info("pool={} borrower={} external take via {} collateral={} price={} market={}", pool.name(), borrower,
        market.router().source(), Wad.toDecimal(status.collateral()), auctionPrice, market.price());
    String calldata = TakerCallEncoder.encodeTakeWithAtomicSwap(
        pool.address(), borrower, status.price(), status.collateral(), swap.router(), swap.calldata());
    TxOutcome tx = submitter.submit("takeWithAtomicSwap", chainProperties.takerAddress(), calldata);
    return ActionOutcome.of(ActionOutcome.Action.EXTERNAL_TAKE, borrower, tx);
  }

  /**
   * Settles auctions whose collateral is gone but whose debt remains, once they are old enough. Each auction
   * gets at most {@code maxIterations} settle calls per cycle.
   */
  public List<ActionOutcome> handleSettlements(@NonNull PoolConfig pool, @NonNull PoolSnapshot snapshot)
      throws InterruptedException {
    List<ActionOutcome> outcomes = new ArrayList<>();
    if (!pool.settlementEnabled()) {
      return outcomes;
    }
    Instant now = clock.instant();
    for (Auction auction : snapshot.auctions()) {
      if (!AuctionEvaluator.phases(auction, pool, null, null, null, now).contains(AuctionPhase.SETTLEMENT_PENDING)) {
        continue;
      }
      outcomes.addAll(settle(pool, auction));
    }
    return outcomes;
  }

  private List<ActionOutcome> settle(PoolConfig pool, Auction auction) throws InterruptedException {
    List<ActionOutcome> outcomes = new ArrayList<>();
    PoolConfig.Settlement settlement = pool.settlement();
    String borrower = auction.borrower();

    AuctionInfo info;
    try {
      info = poolReader.auctionInfo(pool.address(), borrower);
    } catch (IOException e) {
      log.warn("pool={} borrower={} auctionInfo read failed: {}", pool.name(), borrower, e.toString());
      outcomes.add(ActionOutcome.failed(ActionOutcome.Action.SETTLE, borrower, e.getMessage()));
      return outcomes;
    }
    if (!info.active()) {
      log.info("pool={} borrower={} already settled on chain, ledger is behind", pool.name(), borrower);
      return outcomes;
    }
    if (settlement.checkBotIncentive()) {
      String self = signerContext.address().orElse(null);
      if (self == null) {
        outcomes.add(skip(ActionOutcome.Action.SETTLE, pool, borrower, "incentive check needs keeper credentials"));
        return outcomes;
      }
      if (!info.kicker().equalsIgnoreCase(self) || info.bondSize().signum() == 0) {
        outcomes.add(skip(ActionOutcome.Action.SETTLE, pool, borrower, "no bond of ours at stake"));
        return outcomes;
      }
    }

    for (int i = 1; i <= settlement.maxIterations(); i++) {
      log.info("pool={} borrower={} settling (call {}/{}, depth {})", pool.name(), borrower, i,
          settlement.maxIterations(), settlement.maxBucketDepth());
      TxOutcome tx = poolWriter.settle(pool.address(), borrower, settlement.maxBucketDepth());
      outcomes.add(ActionOutcome.of(ActionOutcome.Action.SETTLE, borrower, tx));
      if (!tx.confirmed()) {
        return outcomes;
      }
      pacer.pause();
      try {
        if (!poolReader.auctionInfo(pool.address(), borrower).active()) {
          log.info("pool={} borrower={} settled after {} call(s)", pool.name(), borrower, i);
          return outcomes;
        }
      } catch (IOException e) {
        log.warn("pool={} borrower={} auctionInfo re-read failed after settle: {}", pool.name(), borrower, e.toString());
        return outcomes;
      }
    }
    log.warn("pool={} borrower={} still unsettled after {} settle calls", pool.name(), borrower,
        settlement.maxIterations());
    return outcomes;
  }

  private record MarketQuote(LiquidityRouter router, Quote quote, BigDecimal price, ActionOutcome blocked) {

    static MarketQuote blocked(ActionOutcome outcome) {
      return new MarketQuote(null, null, null, outcome);
    }
  }

  private static ActionOutcome skip(ActionOutcome.Action action, PoolConfig pool, String borrower, String reason) {
    log.info("pool={} borrower={} {} skipped: {}", pool.name(), borrower, action, reason);
    return ActionOutcome.skipped(action, borrower, reason);
  }
}
